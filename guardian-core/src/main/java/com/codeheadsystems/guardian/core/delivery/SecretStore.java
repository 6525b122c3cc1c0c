package com.codeheadsystems.guardian.core.delivery;

import com.codeheadsystems.guardian.core.model.RecipientKey;
import com.codeheadsystems.guardian.core.model.SealedSecret;

/**
 * Remote store that accepts sealed secrets. Only ciphertext ever crosses this interface.
 */
public interface SecretStore {

  /**
   * Fetches the recipient's current public key.
   *
   * @param recipientId the recipient id
   * @return the recipient key
   */
  RecipientKey fetchPublicKey(String recipientId);

  /**
   * Creates or replaces a secret.
   *
   * @param recipientId  the recipient id
   * @param secretName   the secret name
   * @param sealedSecret the sealed secret
   */
  void putSecret(String recipientId, String secretName, SealedSecret sealedSecret);
}
