package com.codeheadsystems.guardian.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TargetTest {

  @ParameterizedTest
  @CsvSource({
      "https://github.com/acme/widgets, github",
      "https://www.gitlab.com/acme, gitlab",
      "https://APP.Example.org/login, app",
      "http://localhost:8080/x, localhost",
      "not a url, unknown",
      "/relative/path, unknown"})
  void platform_derivedFromHost(String locator, String expected) {
    assertThat(new Target("acme/widgets", locator, 0.5).platform()).isEqualTo(expected);
  }

  @Test
  void platform_nullLocator_isUnknown() {
    assertThat(new Target("acme/widgets", null, 0.5).platform()).isEqualTo("unknown");
  }

  @Test
  void constructor_blankIdentifier_throws() {
    assertThatThrownBy(() -> new Target(" ", "https://github.com", 0.1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
