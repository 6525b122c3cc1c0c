package com.codeheadsystems.guardian.core.model;

import com.codeheadsystems.guardian.common.RandomProvider;
import com.codeheadsystems.guardian.common.SecretBytes;
import com.codeheadsystems.guardian.common.Wipeable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One extracted cookie-like value plus its attributes.
 * <p>
 * The value lives in a {@link SecretBytes} buffer from the moment the artifact is built: the
 * constructor takes ownership of the buffer without copying it, and the caller must not keep its
 * own reference. Wiping the artifact zero-fills that buffer in place, keeping its length, so a
 * released artifact can never again be read as the original plaintext.
 */
public final class Artifact implements Wipeable {

  private final String name;
  private final SecretBytes value;
  private final String domain;
  private final Instant expiresAt;
  private final boolean secure;
  private final boolean httpOnly;

  /**
   * Instantiates a new Artifact.
   *
   * @param name      the cookie name
   * @param value     the sensitive value, owned by this artifact from now on
   * @param domain    the cookie domain
   * @param expiresAt expiry, or null for a session cookie
   * @param secure    the secure flag
   * @param httpOnly  the http only flag
   */
  public Artifact(final String name,
                  final SecretBytes value,
                  final String domain,
                  final Instant expiresAt,
                  final boolean secure,
                  final boolean httpOnly) {
    this.name = Objects.requireNonNull(name, "name");
    this.value = Objects.requireNonNull(value, "value");
    this.domain = domain == null ? "" : domain;
    this.expiresAt = expiresAt;
    this.secure = secure;
    this.httpOnly = httpOnly;
  }

  public String name() {
    return name;
  }

  /**
   * The value buffer. Read it only to serialize it into another tracked buffer.
   *
   * @return the secret bytes
   */
  public SecretBytes value() {
    return value;
  }

  public String domain() {
    return domain;
  }

  public Optional<Instant> expiresAt() {
    return Optional.ofNullable(expiresAt);
  }

  public boolean secure() {
    return secure;
  }

  public boolean httpOnly() {
    return httpOnly;
  }

  @Override
  public void wipe(final RandomProvider randomProvider) {
    value.wipe(randomProvider);
  }

  @Override
  public boolean isWiped() {
    return value.isWiped();
  }

  @Override
  public int length() {
    return value.length();
  }

  @Override
  public String toString() {
    return "Artifact[name=" + name + ", domain=" + domain + ", value=" + value + "]";
  }
}
