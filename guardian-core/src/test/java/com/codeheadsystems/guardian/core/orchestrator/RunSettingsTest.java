package com.codeheadsystems.guardian.core.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.guardian.core.model.Target;
import org.junit.jupiter.api.Test;

class RunSettingsTest {

  @Test
  void owns_singleShard_ownsEverything() {
    assertThat(RunSettings.DEFAULT.owns(new Target("anything", "https://x.y", 0))).isTrue();
  }

  @Test
  void owns_everyTargetBelongsToExactlyOneShard() {
    for (int i = 0; i < 200; i++) {
      Target target = new Target("org/repo-" + i, "https://github.com/org/repo-" + i, 0.5);
      int owners = 0;
      for (int shard = 0; shard < 4; shard++) {
        if (new RunSettings(shard, 4, 3).owns(target)) {
          owners++;
        }
      }
      assertThat(owners).isEqualTo(1);
    }
  }

  @Test
  void constructor_shardOutOfRange_throws() {
    assertThatThrownBy(() -> new RunSettings(2, 2, 3)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RunSettings(0, 0, 3)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RunSettings(-1, 2, 3)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void builder_withoutRequiredCollaborator_throws() {
    assertThatThrownBy(() -> RunContext.builder().build()).isInstanceOf(NullPointerException.class)
        .hasMessage("discovery");
  }
}
