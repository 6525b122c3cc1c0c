package com.codeheadsystems.guardian.core.audit;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RedactorTest {

  @Test
  void redact_jsonValueFields() {
    String redacted = Redactor.redact("{\"name\":\"sid\",\"value\":\"abc123\",\"token\":\"t0k\"}");

    assertThat(redacted).contains("\"name\":\"sid\"").doesNotContain("abc123").doesNotContain("t0k");
  }

  @Test
  void redact_headers() {
    assertThat(Redactor.redact("Cookie: sid=abc123; pref=dark")).doesNotContain("abc123");
    assertThat(Redactor.redact("Authorization: Bearer ghp_secret")).isEqualTo("Authorization: [REDACTED]");
  }

  @Test
  void redact_assignments() {
    assertThat(Redactor.redact("login failed password=hunter2, retrying"))
        .isEqualTo("login failed password=[REDACTED], retrying");
    assertThat(Redactor.redact("api_key: sk-123")).doesNotContain("sk-123");
  }

  @Test
  void redact_plainText_unchanged() {
    assertThat(Redactor.redact("Discovered 3 targets")).isEqualTo("Discovered 3 targets");
    assertThat(Redactor.redact(null)).isNull();
  }

  @Test
  void describe_includesCauseAndRedacts() {
    Exception e = new IllegalStateException("upload failed", new RuntimeException("token=abc"));

    assertThat(Redactor.describe(e))
        .startsWith("IllegalStateException: upload failed")
        .contains("caused by RuntimeException")
        .doesNotContain("abc");
  }
}
