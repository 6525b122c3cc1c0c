package com.codeheadsystems.guardian.core.orchestrator;

import com.codeheadsystems.guardian.core.audit.LoggingAuditSink;
import com.codeheadsystems.guardian.core.collaborator.ArtifactExtractor;
import com.codeheadsystems.guardian.core.collaborator.AuditSink;
import com.codeheadsystems.guardian.core.collaborator.CredentialsProvider;
import com.codeheadsystems.guardian.core.collaborator.DecisionAdvisor;
import com.codeheadsystems.guardian.core.collaborator.IdentityRotator;
import com.codeheadsystems.guardian.core.collaborator.RunStateStore;
import com.codeheadsystems.guardian.core.collaborator.TargetDiscovery;
import com.codeheadsystems.guardian.core.delivery.SecretDelivery;
import com.codeheadsystems.guardian.core.lifecycle.SecureLifecycleGuard;
import com.codeheadsystems.guardian.core.model.RunState;
import com.codeheadsystems.guardian.core.store.InMemoryRunStateStore;
import java.util.Objects;

/**
 * Everything one run needs: its state, its own lifecycle guard, and the collaborators.
 * <p>
 * Build one per run and never share it. The state starts at {@link RunState#IDLE}, is persisted
 * to the state store on construction, and is only changed by {@link LifecycleOrchestrator}.
 */
public class RunContext {

  private final TargetDiscovery discovery;
  private final DecisionAdvisor advisor;
  private final ArtifactExtractor extractor;
  private final SecretDelivery delivery;
  private final IdentityRotator identityRotator;
  private final CredentialsProvider credentialsProvider;
  private final AuditSink auditSink;
  private final RunStateStore stateStore;
  private final SecureLifecycleGuard guard;
  private final RunSettings settings;

  private volatile RunState state = RunState.IDLE;
  private int consecutiveRotationFailures;

  private RunContext(final Builder builder, final SecureLifecycleGuard guard) {
    this.discovery = Objects.requireNonNull(builder.discovery, "discovery");
    this.advisor = Objects.requireNonNull(builder.advisor, "advisor");
    this.extractor = Objects.requireNonNull(builder.extractor, "extractor");
    this.delivery = Objects.requireNonNull(builder.delivery, "delivery");
    this.identityRotator = builder.identityRotator;
    this.credentialsProvider = builder.credentialsProvider;
    this.auditSink = builder.auditSink;
    this.stateStore = builder.stateStore;
    this.guard = guard;
    this.settings = builder.settings;
    stateStore.save(state.name());
  }

  public static Builder builder() {
    return new Builder();
  }

  public RunState state() {
    return state;
  }

  void state(final RunState next) {
    this.state = next;
  }

  int recordRotationFailure() {
    return ++consecutiveRotationFailures;
  }

  void resetRotationFailures() {
    consecutiveRotationFailures = 0;
  }

  public TargetDiscovery discovery() {
    return discovery;
  }

  public DecisionAdvisor advisor() {
    return advisor;
  }

  public ArtifactExtractor extractor() {
    return extractor;
  }

  public SecretDelivery delivery() {
    return delivery;
  }

  public IdentityRotator identityRotator() {
    return identityRotator;
  }

  public CredentialsProvider credentialsProvider() {
    return credentialsProvider;
  }

  public AuditSink auditSink() {
    return auditSink;
  }

  public RunStateStore stateStore() {
    return stateStore;
  }

  public SecureLifecycleGuard guard() {
    return guard;
  }

  public RunSettings settings() {
    return settings;
  }

  /**
   * Builder for {@link RunContext}. Discovery, advisor, extractor and delivery are required;
   * everything else has a default.
   */
  public static class Builder {

    private TargetDiscovery discovery;
    private DecisionAdvisor advisor;
    private ArtifactExtractor extractor;
    private SecretDelivery delivery;
    private IdentityRotator identityRotator = IdentityRotator.NONE;
    private CredentialsProvider credentialsProvider = CredentialsProvider.NONE;
    private AuditSink auditSink = new LoggingAuditSink();
    private RunStateStore stateStore = new InMemoryRunStateStore();
    private SecureLifecycleGuard guard;
    private RunSettings settings = RunSettings.DEFAULT;

    public Builder withDiscovery(final TargetDiscovery discovery) {
      this.discovery = discovery;
      return this;
    }

    public Builder withAdvisor(final DecisionAdvisor advisor) {
      this.advisor = advisor;
      return this;
    }

    public Builder withExtractor(final ArtifactExtractor extractor) {
      this.extractor = extractor;
      return this;
    }

    public Builder withDelivery(final SecretDelivery delivery) {
      this.delivery = delivery;
      return this;
    }

    public Builder withIdentityRotator(final IdentityRotator identityRotator) {
      this.identityRotator = identityRotator;
      return this;
    }

    public Builder withCredentialsProvider(final CredentialsProvider credentialsProvider) {
      this.credentialsProvider = credentialsProvider;
      return this;
    }

    public Builder withAuditSink(final AuditSink auditSink) {
      this.auditSink = auditSink;
      return this;
    }

    public Builder withStateStore(final RunStateStore stateStore) {
      this.stateStore = stateStore;
      return this;
    }

    /**
     * Uses the given guard. It must not be shared with any other run.
     *
     * @param guard the guard
     * @return the builder
     */
    public Builder withGuard(final SecureLifecycleGuard guard) {
      this.guard = guard;
      return this;
    }

    public Builder withSettings(final RunSettings settings) {
      this.settings = settings;
      return this;
    }

    public RunContext build() {
      return new RunContext(this, guard != null ? guard : new SecureLifecycleGuard());
    }
  }
}
