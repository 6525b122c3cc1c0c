package com.codeheadsystems.guardian.core.model;

/**
 * A recipient's current sealed-box public key.
 *
 * @param keyIdentifier  identifier the secret store expects next to the ciphertext
 * @param publicKeyBytes 32-byte X25519 public key
 */
public record RecipientKey(String keyIdentifier, byte[] publicKeyBytes) {

  @Override
  public String toString() {
    return "RecipientKey[keyIdentifier=" + keyIdentifier + "]";
  }
}
