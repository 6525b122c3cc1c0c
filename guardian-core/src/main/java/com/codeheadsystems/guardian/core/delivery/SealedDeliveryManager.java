package com.codeheadsystems.guardian.core.delivery;

import com.codeheadsystems.guardian.common.RandomProvider;
import com.codeheadsystems.guardian.core.exceptions.DeliveryException;
import com.codeheadsystems.guardian.core.exceptions.KeyFetchException;
import com.codeheadsystems.guardian.core.model.RecipientKey;
import com.codeheadsystems.guardian.core.model.SealedSecret;
import com.codeheadsystems.guardian.crypto.SealedBox;
import java.util.Base64;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sealed-secret delivery: public-key fetch with a per-recipient cache, anonymous sealed-box
 * encryption, upload.
 * <p>
 * The cache is the only state shared between runs in one process. Entries never expire: a new
 * key means a new recipient, not a rotation. Two runs missing on the same recipient at once may
 * both fetch; the first stored key wins and both see the same entry afterwards. A failed upload
 * leaves the cache alone.
 */
@Singleton
public class SealedDeliveryManager implements SecretDelivery {

  private static final Logger log = LoggerFactory.getLogger(SealedDeliveryManager.class);

  private final SecretStore secretStore;
  private final RandomProvider randomProvider;
  private final ConcurrentHashMap<String, RecipientKey> keyCache = new ConcurrentHashMap<>();

  /**
   * Instantiates a new Sealed delivery manager.
   *
   * @param secretStore    the secret store
   * @param randomProvider source of ephemeral sealing keys
   */
  @Inject
  public SealedDeliveryManager(final SecretStore secretStore, final RandomProvider randomProvider) {
    log.info("SealedDeliveryManager({})", secretStore);
    this.secretStore = secretStore;
    this.randomProvider = randomProvider;
  }

  /**
   * Returns the cached key for the recipient, fetching it on a miss.
   *
   * @param recipientId the recipient id
   * @return the recipient key
   * @throws KeyFetchException on a failed fetch or a malformed key
   */
  public RecipientKey fetchRecipientKey(final String recipientId) {
    RecipientKey cached = keyCache.get(recipientId);
    if (cached != null) {
      return cached;
    }
    log.debug("fetchRecipientKey(recipientId={}): cache miss", recipientId);
    final RecipientKey fetched;
    try {
      fetched = secretStore.fetchPublicKey(recipientId);
    } catch (KeyFetchException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new KeyFetchException("Public key fetch failed for recipient: " + recipientId, e);
    }
    validate(recipientId, fetched);
    RecipientKey existing = keyCache.putIfAbsent(recipientId, fetched);
    return existing != null ? existing : fetched;
  }

  /**
   * Seals the plaintext to the key. Two calls with the same inputs give different output.
   *
   * @param key       the key
   * @param plaintext the plaintext
   * @return the sealed box
   */
  public byte[] sealPayload(final RecipientKey key, final byte[] plaintext) {
    return SealedBox.seal(key.publicKeyBytes(), plaintext, randomProvider);
  }

  @Override
  public void deliver(final String recipientId, final String secretName, final byte[] plaintext) {
    log.debug("deliver(recipientId={}, secretName={})", recipientId, secretName);
    final RecipientKey key = fetchRecipientKey(recipientId);
    final byte[] sealed = sealPayload(key, plaintext);
    final SealedSecret sealedSecret =
        new SealedSecret(key.keyIdentifier(), Base64.getEncoder().encodeToString(sealed));
    try {
      secretStore.putSecret(recipientId, secretName, sealedSecret);
    } catch (DeliveryException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DeliveryException("Upload of secret " + secretName + " failed for recipient: " + recipientId, e);
    }
    log.info("Delivered secret {} to {} (keyId={})", secretName, recipientId, key.keyIdentifier());
  }

  /**
   * Whether a key for the recipient is cached.
   *
   * @param recipientId the recipient id
   * @return the boolean
   */
  public boolean isCached(final String recipientId) {
    return keyCache.containsKey(recipientId);
  }

  private static void validate(final String recipientId, final RecipientKey key) {
    if (key == null || key.keyIdentifier() == null || key.keyIdentifier().isBlank()) {
      throw new KeyFetchException("Malformed public key payload for recipient: " + recipientId, null);
    }
    if (key.publicKeyBytes() == null || key.publicKeyBytes().length != SealedBox.PUBLIC_KEY_BYTES) {
      throw new KeyFetchException("Public key for recipient " + recipientId + " is not "
          + SealedBox.PUBLIC_KEY_BYTES + " bytes", null);
    }
  }
}
