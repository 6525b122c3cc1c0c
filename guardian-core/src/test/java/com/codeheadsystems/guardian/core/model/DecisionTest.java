package com.codeheadsystems.guardian.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DecisionTest {

  @ParameterizedTest
  @ValueSource(strings = {"extract", "EXTRACT", " Yes ", "true"})
  void proceed_affirmativeActions(String action) {
    assertThat(new Decision(action, "r").proceed()).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"skip", "no", "", "extract later"})
  void proceed_otherActions(String action) {
    assertThat(new Decision(action, "r").proceed()).isFalse();
  }

  @Test
  void proceed_nullAction_isFalse() {
    assertThat(new Decision(null, null).proceed()).isFalse();
  }
}
