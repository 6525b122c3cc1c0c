package com.codeheadsystems.guardian.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.guardian.client.config.GuardianConfiguration;
import com.codeheadsystems.guardian.client.warp.WarpIdentityRotator;
import com.codeheadsystems.guardian.core.collaborator.BrowserSessionFactory;
import com.codeheadsystems.guardian.core.collaborator.IdentityRotator;
import com.codeheadsystems.guardian.core.model.RunState;
import com.codeheadsystems.guardian.core.orchestrator.RunContext;
import com.codeheadsystems.guardian.core.store.FileRunStateStore;
import com.codeheadsystems.guardian.core.store.InMemoryRunStateStore;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GuardianFactoryTest {

  private static final Map<String, String> ENV = Map.of("GITHUB_TOKEN", "ghp_test");

  @Mock private HttpClient httpClient;
  @Mock private BrowserSessionFactory browserSessionFactory;

  @TempDir Path tempDir;

  @Test
  void newRunContext_defaults_wireInMemoryStateAndNoRotation() {
    GuardianFactory factory = new GuardianFactory(GuardianConfiguration.defaults(), ENV::get, httpClient);

    RunContext context = factory.newRunContext(browserSessionFactory);

    assertThat(context.state()).isEqualTo(RunState.IDLE);
    assertThat(context.stateStore()).isInstanceOf(InMemoryRunStateStore.class);
    assertThat(context.identityRotator()).isSameAs(IdentityRotator.NONE);
    assertThat(context.settings().shardTotal()).isEqualTo(1);
    assertThat(context.delivery()).isSameAs(factory.deliveryManager());
  }

  @Test
  void newRunContext_eachRunGetsItsOwnGuard() {
    GuardianFactory factory = new GuardianFactory(GuardianConfiguration.defaults(), ENV::get, httpClient);

    assertThat(factory.newRunContext(browserSessionFactory).guard())
        .isNotSameAs(factory.newRunContext(browserSessionFactory).guard());
  }

  @Test
  void newRunContext_configuredStateAndWarp() {
    GuardianConfiguration configuration = new GuardianConfiguration(
        new GuardianConfiguration.App("guardian", 1, 2),
        null, null,
        new GuardianConfiguration.Warp(true, 5),
        null,
        new GuardianConfiguration.State(tempDir.resolve("run.state").toString()),
        null);
    GuardianFactory factory = new GuardianFactory(configuration, ENV::get, httpClient);

    RunContext context = factory.newRunContext(browserSessionFactory);

    assertThat(context.stateStore()).isInstanceOf(FileRunStateStore.class);
    assertThat(context.stateStore().load()).contains("IDLE");
    assertThat(context.identityRotator()).isInstanceOf(WarpIdentityRotator.class);
    assertThat(context.settings().shardId()).isEqualTo(1);
  }

  @Test
  void constructor_missingToken_throwsIllegalState() {
    assertThatThrownBy(() -> new GuardianFactory(GuardianConfiguration.defaults(), name -> null, httpClient))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("GITHUB_TOKEN");
  }
}
