package com.codeheadsystems.guardian.core.orchestrator;

import com.codeheadsystems.guardian.common.SecretBytes;
import com.codeheadsystems.guardian.core.audit.Redactor;
import com.codeheadsystems.guardian.core.delivery.ArtifactPayloadWriter;
import com.codeheadsystems.guardian.core.delivery.SecretNames;
import com.codeheadsystems.guardian.core.exceptions.CollaboratorUnavailableException;
import com.codeheadsystems.guardian.core.exceptions.DeliveryException;
import com.codeheadsystems.guardian.core.exceptions.KeyFetchException;
import com.codeheadsystems.guardian.core.exceptions.TargetExtractionException;
import com.codeheadsystems.guardian.core.extraction.CookieNameScorer;
import com.codeheadsystems.guardian.core.lifecycle.GuardHandle;
import com.codeheadsystems.guardian.core.model.Artifact;
import com.codeheadsystems.guardian.core.model.AuditRecord;
import com.codeheadsystems.guardian.core.model.Credentials;
import com.codeheadsystems.guardian.core.model.Decision;
import com.codeheadsystems.guardian.core.model.ExtractionOutcome;
import com.codeheadsystems.guardian.core.model.RunReport;
import com.codeheadsystems.guardian.core.model.RunState;
import com.codeheadsystems.guardian.core.model.Target;
import com.codeheadsystems.guardian.core.model.TargetOutcome;
import com.codeheadsystems.guardian.core.model.TargetReport;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one run through discovery, per-target extraction, 2FA gating, sealed delivery and
 * cleanup.
 * <p>
 * <strong>Run:</strong>
 * <ol>
 *   <li>Idle → Discovering: list targets, keep this shard's, sort by relevance.</li>
 *   <li>Per target: Extracting → (replay validation) → (Injecting) → Cleanup. See
 *   {@link #processTarget}.</li>
 *   <li>Completed, then the final pass: release everything the guard still tracks, sweep
 *   temporary files, back to Idle. The final pass sits in a {@code finally} block and runs on
 *   every exit, including fatal collaborator failures and cancellation.</li>
 * </ol>
 * Discovery and advisor failures are fatal ({@link CollaboratorUnavailableException}).
 * Extraction and delivery failures only end their target. Identity rotation failures never end
 * anything.
 * <p>
 * The orchestrator itself is stateless; all run state lives in the {@link RunContext}.
 */
@Singleton
public class LifecycleOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(LifecycleOrchestrator.class);

  private final ArtifactPayloadWriter payloadWriter;

  /**
   * Instantiates a new Lifecycle orchestrator.
   *
   * @param payloadWriter the payload writer
   */
  @Inject
  public LifecycleOrchestrator(final ArtifactPayloadWriter payloadWriter) {
    log.info("LifecycleOrchestrator()");
    this.payloadWriter = payloadWriter;
  }

  /**
   * Runs every target of the context to completion.
   *
   * @param context a fresh context for this run
   * @return per-target reports
   * @throws CollaboratorUnavailableException if discovery or the advisor fails
   * @throws CancellationException            if the thread is interrupted between targets
   */
  public RunReport run(final RunContext context) {
    final List<TargetReport> reports = new ArrayList<>();
    try {
      transition(context, RunState.DISCOVERING);
      final List<Target> targets = discover(context);
      log.info("Processing {} target(s)", targets.size());
      for (Target target : targets) {
        if (Thread.currentThread().isInterrupted()) {
          throw new CancellationException("Run interrupted after " + reports.size() + " target(s)");
        }
        reports.add(processTarget(context, target));
      }
      transition(context, RunState.COMPLETED);
      final RunReport report = new RunReport(reports);
      context.auditSink().record(new AuditRecord(AuditRecord.RUN_COMPLETE, null, null, "completed",
          "targets=" + reports.size() + " delivered=" + report.count(TargetOutcome.DELIVERED)));
      return report;
    } catch (RuntimeException e) {
      log.error("Run aborted in state {}: {}", context.state(), Redactor.describe(e));
      context.auditSink().record(new AuditRecord(AuditRecord.RUN_FAILED, null, null, "failed",
          Redactor.describe(e)));
      throw e;
    } finally {
      finalPass(context);
    }
  }

  /**
   * Processes one target. Cleanup of the target's values runs in a {@code finally} block, and the
   * outcome is recorded only after that cleanup.
   *
   * @param context the context
   * @param target  the target
   * @return the target report
   */
  TargetReport processTarget(final RunContext context, final Target target) {
    transition(context, RunState.EXTRACTING);
    rotateIdentity(context);

    final Decision decision = advise(context, target);
    if (!decision.proceed()) {
      log.info("Skipping {}: advisor said '{}'", target.identifier(), decision.action());
      final TargetReport report = new TargetReport(target, TargetOutcome.SKIPPED_DECISION, 0, 0.0, null,
          Redactor.redact(decision.reason()));
      record(context, report);
      return report;
    }

    TargetReport report;
    try {
      final ExtractionOutcome outcome = extract(context, target);
      final int count = outcome.artifacts().size();
      final double score = CookieNameScorer.score(
          outcome.artifacts().stream().map(Artifact::name).collect(Collectors.toList()));
      if (outcome.twoFactorDetected()) {
        log.info("Two-factor authentication detected for {}; not injecting", target.identifier());
        report = new TargetReport(target, TargetOutcome.SKIPPED_TWO_FACTOR, count, score, null, null);
      } else if (!outcome.succeeded()) {
        log.warn("Extraction failed for {}: {}", target.identifier(), Redactor.redact(outcome.errorDetail()));
        report = new TargetReport(target, TargetOutcome.EXTRACTION_FAILED, count, score, null,
            Redactor.redact(outcome.errorDetail()));
      } else {
        final Optional<String> rejection = validate(context, target, outcome.artifacts());
        if (rejection.isPresent()) {
          log.warn("Validation failed for {}: {}", target.identifier(), rejection.get());
          report = new TargetReport(target, TargetOutcome.EXTRACTION_FAILED, count, score, null, rejection.get());
        } else {
          transition(context, RunState.INJECTING);
          report = inject(context, target, outcome.artifacts(), score);
        }
      }
    } finally {
      cleanup(context);
    }
    record(context, report);
    return report;
  }

  /**
   * Moves the context to the next state: validates the move, persists the state name and emits
   * the transition event before returning.
   *
   * @param context the context
   * @param next    the next state
   */
  void transition(final RunContext context, final RunState next) {
    final RunState current = context.state();
    if (!current.canTransitionTo(next)) {
      throw new IllegalStateException("Illegal run state transition " + current + " -> " + next);
    }
    context.stateStore().save(next.name());
    context.state(next);
    context.auditSink().record(AuditRecord.stateTransition(next));
    log.debug("transition({} -> {})", current, next);
  }

  private List<Target> discover(final RunContext context) {
    try {
      final List<Target> discovered = context.discovery().discover();
      if (discovered == null) {
        return List.of();
      }
      return discovered.stream()
          .filter(Objects::nonNull)
          .filter(context.settings()::owns)
          .sorted(Comparator.comparingDouble(Target::relevanceScore).reversed())
          .collect(Collectors.toList());
    } catch (RuntimeException e) {
      throw new CollaboratorUnavailableException("Target discovery failed", e);
    }
  }

  private void rotateIdentity(final RunContext context) {
    try {
      context.identityRotator().rotate();
      context.resetRotationFailures();
    } catch (RuntimeException e) {
      final int failures = context.recordRotationFailure();
      if (failures >= context.settings().rotationEscalationThreshold()) {
        log.error("Network identity rotation failed {} times in a row, continuing: {}", failures,
            Redactor.describe(e));
      } else {
        log.warn("Network identity rotation failed, continuing: {}", Redactor.describe(e));
      }
    }
  }

  private Decision advise(final RunContext context, final Target target) {
    final Decision decision;
    try {
      decision = context.advisor().decide(promptFor(target));
    } catch (RuntimeException e) {
      throw new CollaboratorUnavailableException("Decision advisor failed for " + target.identifier(), e);
    }
    if (decision == null) {
      throw new CollaboratorUnavailableException("Decision advisor returned nothing for " + target.identifier(), null);
    }
    log.debug("advise({}): action={} reason={}", target.identifier(), decision.action(), decision.reason());
    return decision;
  }

  private ExtractionOutcome extract(final RunContext context, final Target target) {
    final Optional<Credentials> credentials = context.credentialsProvider().credentialsFor(target.platform());
    credentials.ifPresent(c -> context.guard().track(c, "credentials:" + target.platform()));

    final ExtractionOutcome outcome;
    try {
      outcome = context.extractor().extract(target.locator(), credentials);
    } catch (TargetExtractionException e) {
      return ExtractionOutcome.failure(Redactor.describe(e));
    } catch (RuntimeException e) {
      log.warn("Unexpected extractor failure for {}", target.identifier(), e);
      return ExtractionOutcome.failure(Redactor.describe(e));
    }
    if (outcome == null) {
      return ExtractionOutcome.failure("Extractor returned no outcome");
    }
    for (Artifact artifact : outcome.artifacts()) {
      context.guard().track(artifact, "artifact:" + artifact.name());
    }
    return outcome;
  }

  private Optional<String> validate(final RunContext context, final Target target, final List<Artifact> artifacts) {
    try {
      if (context.extractor().validate(target.locator(), artifacts)) {
        return Optional.empty();
      }
      return Optional.of(Redactor.redact("Artifacts rejected on replay at " + target.locator()));
    } catch (RuntimeException e) {
      return Optional.of(Redactor.describe(e));
    }
  }

  private TargetReport inject(final RunContext context,
                              final Target target,
                              final List<Artifact> artifacts,
                              final double score) {
    final String secretName = SecretNames.fromTargetIdentifier(target.identifier());
    GuardHandle payloadHandle = null;
    try {
      final SecretBytes payload = payloadWriter.write(artifacts);
      payloadHandle = context.guard().track(payload, "payload:" + secretName);
      context.delivery().deliver(target.identifier(), secretName, payload.view());
      return new TargetReport(target, TargetOutcome.DELIVERED, artifacts.size(), score, secretName, null);
    } catch (KeyFetchException | DeliveryException e) {
      log.error("Delivery of {} to {} failed: {}", secretName, target.identifier(), Redactor.describe(e));
      return new TargetReport(target, TargetOutcome.DELIVERY_FAILED, artifacts.size(), score, secretName,
          Redactor.describe(e));
    } catch (RuntimeException e) {
      log.error("Injection of {} into {} failed", secretName, target.identifier(), e);
      return new TargetReport(target, TargetOutcome.DELIVERY_FAILED, artifacts.size(), score, secretName,
          Redactor.describe(e));
    } finally {
      if (payloadHandle != null) {
        context.guard().release(payloadHandle);
      }
    }
  }

  private void cleanup(final RunContext context) {
    transition(context, RunState.CLEANUP);
    final int released = context.guard().releaseAll();
    log.debug("cleanup(): released {} value(s)", released);
  }

  private void record(final RunContext context, final TargetReport report) {
    final Target target = report.target();
    final String message = "artifacts=" + report.artifactCount()
        + String.format(Locale.ROOT, " cookieScore=%.2f", report.cookieScore())
        + report.error().map(e -> " error=" + e).orElse("");
    context.auditSink().record(new AuditRecord(AuditRecord.TARGET_PROCESSED, target.identifier(),
        target.platform(), report.outcome().status(), Redactor.redact(message)));
  }

  private void finalPass(final RunContext context) {
    try {
      final int released = context.guard().releaseAll();
      if (released > 0) {
        log.warn("Final pass released {} value(s) left behind", released);
      }
    } finally {
      if (context.state() != RunState.IDLE) {
        transition(context, RunState.IDLE);
      }
    }
  }

  static String promptFor(final Target target) {
    return "Analyze repository: " + target.identifier() + "\n"
        + "Location: " + target.locator() + "\n\n"
        + "Does this repository likely require authentication cookies for external services?\n"
        + "Consider: API integrations, data scraping, automated testing, etc.\n\n"
        + "Respond with JSON:\n"
        + "{\"action\": \"extract\" or \"skip\", \"reason\": \"brief explanation\"}";
  }
}
