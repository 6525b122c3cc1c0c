package com.codeheadsystems.guardian.core.extraction;

import com.codeheadsystems.guardian.common.RandomProvider;
import com.codeheadsystems.guardian.core.collaborator.ArtifactExtractor;
import com.codeheadsystems.guardian.core.collaborator.BrowserSession;
import com.codeheadsystems.guardian.core.collaborator.BrowserSessionFactory;
import com.codeheadsystems.guardian.core.exceptions.TargetExtractionException;
import com.codeheadsystems.guardian.core.model.Artifact;
import com.codeheadsystems.guardian.core.model.Credentials;
import com.codeheadsystems.guardian.core.model.ExtractionOutcome;
import com.codeheadsystems.guardian.core.twofactor.TwoFactorClassifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extraction boundary backed by a {@link BrowserSession}.
 * <p>
 * Opens the locator, logs in when credentials are given, collects the context cookies and runs
 * the {@link TwoFactorClassifier} on the resulting page straight away. When a second factor is
 * detected every acquired artifact is wiped before the outcome is returned, so nothing usable
 * leaves this class. Browser failures wipe whatever was acquired and surface as
 * {@link TargetExtractionException}.
 * <p>
 * {@link #validate} replays the artifacts in a second, clean session and trusts only a
 * successful page load.
 */
@Singleton
public class SessionArtifactExtractor implements ArtifactExtractor {

  private static final Logger log = LoggerFactory.getLogger(SessionArtifactExtractor.class);

  private final BrowserSessionFactory sessionFactory;
  private final TwoFactorClassifier classifier;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Session artifact extractor.
   *
   * @param sessionFactory the session factory
   * @param classifier     the classifier
   * @param randomProvider the random provider used when wiping
   */
  @Inject
  public SessionArtifactExtractor(final BrowserSessionFactory sessionFactory,
                                  final TwoFactorClassifier classifier,
                                  final RandomProvider randomProvider) {
    log.info("SessionArtifactExtractor()");
    this.sessionFactory = sessionFactory;
    this.classifier = classifier;
    this.randomProvider = randomProvider;
  }

  @Override
  public ExtractionOutcome extract(final String locator, final Optional<Credentials> credentials) {
    log.debug("extract(locator={}, credentials={})", locator, credentials.isPresent());
    final List<Artifact> acquired = new ArrayList<>();
    try (BrowserSession session = sessionFactory.newSession()) {
      session.open(locator);
      credentials.ifPresent(session::login);
      acquired.addAll(session.cookies());

      boolean twoFactor = classifier.detect(session.pageContent(), session::hasMatch, session.pageTitle());
      if (twoFactor) {
        log.info("Second factor required at {}; discarding {} artifact(s)", locator, acquired.size());
        wipe(acquired);
        return ExtractionOutcome.twoFactor(acquired);
      }
      if (acquired.isEmpty()) {
        return ExtractionOutcome.failure("No cookies acquired from " + locator);
      }
      return ExtractionOutcome.success(acquired);
    } catch (RuntimeException e) {
      wipe(acquired);
      throw new TargetExtractionException("Browser extraction failed for " + locator, e);
    }
  }

  @Override
  public boolean validate(final String locator, final List<Artifact> artifacts) {
    log.debug("validate(locator={}, artifacts={})", locator, artifacts.size());
    try (BrowserSession session = sessionFactory.newSession()) {
      final boolean valid = session.validate(locator, artifacts);
      if (!valid) {
        log.info("Replayed artifacts were rejected at {}", locator);
      }
      return valid;
    } catch (RuntimeException e) {
      throw new TargetExtractionException("Artifact validation failed for " + locator, e);
    }
  }

  private void wipe(final List<Artifact> artifacts) {
    artifacts.forEach(a -> a.wipe(randomProvider));
  }
}
