package com.codeheadsystems.guardian.core.model;

import com.codeheadsystems.guardian.common.RandomProvider;
import com.codeheadsystems.guardian.common.SecretBytes;
import com.codeheadsystems.guardian.common.Wipeable;
import java.util.Objects;

/**
 * Login credentials for one platform. The password is tracked and wiped like any artifact.
 */
public final class Credentials implements Wipeable {

  private final String username;
  private final SecretBytes password;

  public Credentials(final String username, final SecretBytes password) {
    this.username = Objects.requireNonNull(username, "username");
    this.password = Objects.requireNonNull(password, "password");
  }

  public String username() {
    return username;
  }

  public SecretBytes password() {
    return password;
  }

  @Override
  public void wipe(final RandomProvider randomProvider) {
    password.wipe(randomProvider);
  }

  @Override
  public boolean isWiped() {
    return password.isWiped();
  }

  @Override
  public int length() {
    return password.length();
  }

  @Override
  public String toString() {
    return "Credentials[username=" + username + ", password=" + password + "]";
  }
}
