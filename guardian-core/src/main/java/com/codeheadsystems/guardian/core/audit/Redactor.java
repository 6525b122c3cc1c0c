package com.codeheadsystems.guardian.core.audit;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips anything that looks like a credential from free text before it is logged or audited.
 */
public class Redactor {

  /** Replacement for a redacted value. */
  public static final String REDACTED = "[REDACTED]";

  private static final List<Rule> RULES = List.of(
      new Rule(Pattern.compile("\"(value|cookie|password|token|secret)\"\\s*:\\s*\"[^\"]*\"", Pattern.CASE_INSENSITIVE),
          "\"$1\":\"" + REDACTED + "\""),
      new Rule(Pattern.compile("(Set-Cookie|Cookie):\\s*\\S+", Pattern.CASE_INSENSITIVE), "$1: " + REDACTED),
      new Rule(Pattern.compile("Authorization:\\s*(Bearer\\s+)?\\S+", Pattern.CASE_INSENSITIVE),
          "Authorization: " + REDACTED),
      new Rule(Pattern.compile("(password|token|secret|api[_-]?key)\\s*[=:]\\s*[^\\s,&]+", Pattern.CASE_INSENSITIVE),
          "$1=" + REDACTED));

  private Redactor() {
  }

  /**
   * Redacts the message. Null stays null.
   *
   * @param message the message
   * @return the string
   */
  public static String redact(final String message) {
    if (message == null) {
      return null;
    }
    String result = message;
    for (Rule rule : RULES) {
      result = rule.pattern().matcher(result).replaceAll(rule.replacement());
    }
    return result;
  }

  /**
   * Redacted summary of a failure: exception type and message, and the cause's when present.
   *
   * @param throwable the throwable
   * @return the string
   */
  public static String describe(final Throwable throwable) {
    if (throwable == null) {
      return null;
    }
    StringBuilder sb = new StringBuilder(throwable.getClass().getSimpleName());
    if (throwable.getMessage() != null) {
      sb.append(": ").append(throwable.getMessage());
    }
    Throwable cause = throwable.getCause();
    if (cause != null && cause != throwable) {
      sb.append(" (caused by ").append(cause.getClass().getSimpleName());
      if (cause.getMessage() != null) {
        sb.append(": ").append(cause.getMessage());
      }
      sb.append(')');
    }
    return redact(sb.toString());
  }

  private record Rule(Pattern pattern, String replacement) {
  }
}
