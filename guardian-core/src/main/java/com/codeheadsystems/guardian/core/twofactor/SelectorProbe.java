package com.codeheadsystems.guardian.core.twofactor;

/**
 * Answers whether a CSS selector matches at least one element on the current page.
 */
@FunctionalInterface
public interface SelectorProbe {

  /**
   * Whether the selector matches.
   *
   * @param selector the selector
   * @return the boolean
   * @throws Exception when the page cannot evaluate the selector
   */
  boolean hasMatch(String selector) throws Exception;
}
