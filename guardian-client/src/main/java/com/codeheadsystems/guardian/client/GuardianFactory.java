package com.codeheadsystems.guardian.client;

import com.codeheadsystems.guardian.client.accessor.GitHubAccessor;
import com.codeheadsystems.guardian.client.accessor.GlmAccessor;
import com.codeheadsystems.guardian.client.config.GuardianConfiguration;
import com.codeheadsystems.guardian.client.manager.EnvironmentCredentialsProvider;
import com.codeheadsystems.guardian.client.manager.GitHubSecretStore;
import com.codeheadsystems.guardian.client.manager.GitHubTargetDiscovery;
import com.codeheadsystems.guardian.client.manager.GlmDecisionAdvisor;
import com.codeheadsystems.guardian.client.warp.WarpIdentityRotator;
import com.codeheadsystems.guardian.common.RandomProvider;
import com.codeheadsystems.guardian.core.audit.LoggingAuditSink;
import com.codeheadsystems.guardian.core.collaborator.BrowserSessionFactory;
import com.codeheadsystems.guardian.core.collaborator.IdentityRotator;
import com.codeheadsystems.guardian.core.collaborator.RunStateStore;
import com.codeheadsystems.guardian.core.delivery.ArtifactPayloadWriter;
import com.codeheadsystems.guardian.core.delivery.SealedDeliveryManager;
import com.codeheadsystems.guardian.core.extraction.SessionArtifactExtractor;
import com.codeheadsystems.guardian.core.lifecycle.SecureLifecycleGuard;
import com.codeheadsystems.guardian.core.orchestrator.LifecycleOrchestrator;
import com.codeheadsystems.guardian.core.orchestrator.RunContext;
import com.codeheadsystems.guardian.core.orchestrator.RunSettings;
import com.codeheadsystems.guardian.core.store.FileRunStateStore;
import com.codeheadsystems.guardian.core.store.InMemoryRunStateStore;
import com.codeheadsystems.guardian.core.twofactor.TwoFactorClassifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the production bindings from a {@link GuardianConfiguration}.
 * <p>
 * Process-wide pieces (HTTP client, decision cache, recipient-key cache, orchestrator) are built
 * once per factory. {@link #newRunContext(BrowserSessionFactory)} builds a fresh context with its
 * own guard for every run. The browser itself is supplied by the caller.
 */
public class GuardianFactory {

  private static final Logger log = LoggerFactory.getLogger(GuardianFactory.class);

  private final GuardianConfiguration configuration;
  private final RandomProvider randomProvider;
  private final GitHubAccessor gitHubAccessor;
  private final GlmDecisionAdvisor advisor;
  private final SealedDeliveryManager deliveryManager;
  private final EnvironmentCredentialsProvider credentialsProvider;
  private final LifecycleOrchestrator orchestrator;

  /**
   * Factory over the process environment.
   *
   * @param configuration the configuration
   */
  public GuardianFactory(final GuardianConfiguration configuration) {
    this(configuration, System::getenv, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
  }

  GuardianFactory(final GuardianConfiguration configuration,
                  final Function<String, String> environment,
                  final HttpClient httpClient) {
    log.info("GuardianFactory({})", configuration.app().name());
    this.configuration = configuration;
    this.randomProvider = new RandomProvider();
    final ObjectMapper objectMapper = new ObjectMapper();

    final String token = environment.apply(configuration.github().tokenEnv());
    if (token == null || token.isBlank()) {
      throw new IllegalStateException("GitHub token variable " + configuration.github().tokenEnv() + " is not set");
    }
    this.gitHubAccessor = new GitHubAccessor(httpClient, objectMapper, URI.create(configuration.github().apiUrl()), token);
    this.advisor = new GlmDecisionAdvisor(
        new GlmAccessor(httpClient, objectMapper, configuration.advisor()),
        objectMapper,
        environment.apply(configuration.advisor().apiKeyEnv()),
        configuration.advisor().model(),
        configuration.advisor().defaultAction());
    this.deliveryManager = new SealedDeliveryManager(new GitHubSecretStore(gitHubAccessor), randomProvider);
    this.credentialsProvider = new EnvironmentCredentialsProvider(objectMapper, configuration.credentials().prefix(),
        environment);
    this.orchestrator = new LifecycleOrchestrator(new ArtifactPayloadWriter());
  }

  /**
   * A fresh context for one run.
   *
   * @param browserSessionFactory opens browser sessions
   * @return the run context
   */
  public RunContext newRunContext(final BrowserSessionFactory browserSessionFactory) {
    return RunContext.builder()
        .withDiscovery(new GitHubTargetDiscovery(gitHubAccessor, configuration.github()))
        .withAdvisor(advisor)
        .withExtractor(new SessionArtifactExtractor(browserSessionFactory, new TwoFactorClassifier(), randomProvider))
        .withDelivery(deliveryManager)
        .withIdentityRotator(identityRotator())
        .withCredentialsProvider(credentialsProvider)
        .withAuditSink(new LoggingAuditSink())
        .withStateStore(stateStore())
        .withGuard(new SecureLifecycleGuard(randomProvider,
            Paths.get(System.getProperty("java.io.tmpdir")),
            configuration.cleanup().tempFilePattern()))
        .withSettings(new RunSettings(configuration.app().shardId(), configuration.app().shardTotal(), 3))
        .build();
  }

  public LifecycleOrchestrator orchestrator() {
    return orchestrator;
  }

  public SealedDeliveryManager deliveryManager() {
    return deliveryManager;
  }

  IdentityRotator identityRotator() {
    if (!configuration.warp().enabled()) {
      return IdentityRotator.NONE;
    }
    return new WarpIdentityRotator(Duration.ofSeconds(configuration.warp().connectTimeoutSec()));
  }

  RunStateStore stateStore() {
    String path = configuration.state().path();
    if (path.isBlank()) {
      return new InMemoryRunStateStore();
    }
    return new FileRunStateStore(Path.of(path));
  }
}
