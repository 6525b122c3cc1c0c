package com.codeheadsystems.guardian.core.delivery;

/**
 * Delivers a plaintext secret to a recipient without the plaintext leaving the process.
 */
public interface SecretDelivery {

  /**
   * Seals and uploads the plaintext. The caller keeps ownership of {@code plaintext} and is
   * responsible for scrubbing it.
   *
   * @param recipientId the recipient id
   * @param secretName  the secret name
   * @param plaintext   the plaintext
   * @throws com.codeheadsystems.guardian.core.exceptions.KeyFetchException when the key cannot be fetched
   * @throws com.codeheadsystems.guardian.core.exceptions.DeliveryException when the upload fails
   */
  void deliver(String recipientId, String secretName, byte[] plaintext);
}
