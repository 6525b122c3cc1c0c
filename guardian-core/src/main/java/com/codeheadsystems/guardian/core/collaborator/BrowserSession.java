package com.codeheadsystems.guardian.core.collaborator;

import com.codeheadsystems.guardian.core.model.Artifact;
import com.codeheadsystems.guardian.core.model.Credentials;
import java.util.List;

/**
 * One browser context driven by an automation tool. How the browser is driven is up to the
 * implementation; this is all the extractor needs from it.
 */
public interface BrowserSession extends AutoCloseable {

  /**
   * Navigates to the locator and waits for the page to settle.
   *
   * @param locator the locator
   */
  void open(String locator);

  /**
   * Fills and submits the login form on the current page.
   *
   * @param credentials the credentials
   */
  void login(Credentials credentials);

  /**
   * Visible text of the current page.
   *
   * @return the string
   */
  String pageContent();

  /**
   * Title of the current page.
   *
   * @return the string
   */
  String pageTitle();

  /**
   * Whether the selector matches an element on the current page.
   *
   * @param selector the selector
   * @return the boolean
   * @throws Exception when the selector cannot be evaluated
   */
  boolean hasMatch(String selector) throws Exception;

  /**
   * Cookies of the browser context, each value already in its own buffer.
   *
   * @return the list
   */
  List<Artifact> cookies();

  /**
   * Adds the artifacts to this context as cookies, navigates to the locator and reports whether
   * the response came back successful. Only ever called on a fresh session.
   *
   * @param locator   the locator
   * @param artifacts the artifacts to replay; read, never wiped
   * @return true if the page loaded with a success status
   */
  boolean validate(String locator, List<Artifact> artifacts);

  @Override
  void close();
}
