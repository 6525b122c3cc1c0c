package com.codeheadsystems.guardian.core.collaborator;

/**
 * Opens a fresh, isolated browser session per extraction.
 */
@FunctionalInterface
public interface BrowserSessionFactory {

  BrowserSession newSession();
}
