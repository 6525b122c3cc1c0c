package com.codeheadsystems.guardian.core.twofactor;

import java.util.List;
import java.util.Locale;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides from page signals whether a login flow is asking for a second authentication factor.
 * <p>
 * Signals are checked in a fixed order and the first hit wins: phrase markers in the page text,
 * then multi-factor input selectors, then phrase markers in the title. The check is total. A
 * selector that fails to evaluate counts as "no match" and the remaining signals are still
 * checked.
 */
@Singleton
public class TwoFactorClassifier {

  /** Lower-case phrases that indicate a second-factor prompt. */
  public static final List<String> PHRASE_MARKERS = List.of(
      "two-factor",
      "two factor",
      "2fa",
      "two-step",
      "verification code",
      "authenticator",
      "backup code",
      "sms code",
      "one-time code",
      "one-time password",
      "security code",
      "multi-factor",
      "mfa code",
      "enter the code");

  /** Selectors for inputs that only appear on second-factor forms. */
  public static final List<String> INPUT_SELECTORS = List.of(
      "input[autocomplete='one-time-code']",
      "input[name*='otp']",
      "input[id*='otp']",
      "input[name*='totp']",
      "input[name*='2fa']",
      "input[id*='2fa']",
      "input[name*='mfa']",
      "input[name*='two_factor']",
      "input[name*='verification_code']",
      "input[name*='app_otp']");

  private static final Logger log = LoggerFactory.getLogger(TwoFactorClassifier.class);

  /**
   * Classifies the page.
   *
   * @param pageContent full page text, lower-cased here if the caller did not
   * @param probe       selector probe for the same page
   * @param pageTitle   page title, lower-cased here if the caller did not
   * @return true when any signal points at a second factor
   */
  public boolean detect(final String pageContent, final SelectorProbe probe, final String pageTitle) {
    final String content = normalize(pageContent);
    for (String marker : PHRASE_MARKERS) {
      if (content.contains(marker)) {
        log.debug("detect(): content marker '{}'", marker);
        return true;
      }
    }
    if (probe != null) {
      for (String selector : INPUT_SELECTORS) {
        if (matches(probe, selector)) {
          log.debug("detect(): selector '{}'", selector);
          return true;
        }
      }
    }
    final String title = normalize(pageTitle);
    for (String marker : PHRASE_MARKERS) {
      if (title.contains(marker)) {
        log.debug("detect(): title marker '{}'", marker);
        return true;
      }
    }
    return false;
  }

  private boolean matches(final SelectorProbe probe, final String selector) {
    try {
      return probe.hasMatch(selector);
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.debug("Selector '{}' could not be evaluated, treating as no match: {}", selector, e.toString());
      return false;
    }
  }

  private static String normalize(final String text) {
    return text == null ? "" : text.toLowerCase(Locale.ROOT);
  }
}
