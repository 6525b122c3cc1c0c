package com.codeheadsystems.guardian.client.manager;

import com.codeheadsystems.guardian.client.accessor.GitHubAccessor;
import com.codeheadsystems.guardian.client.model.PublicKeyResponse;
import com.codeheadsystems.guardian.client.model.SecretUploadRequest;
import com.codeheadsystems.guardian.core.delivery.SecretStore;
import com.codeheadsystems.guardian.core.exceptions.KeyFetchException;
import com.codeheadsystems.guardian.core.model.RecipientKey;
import com.codeheadsystems.guardian.core.model.SealedSecret;
import java.util.Base64;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SecretStore} backed by repository Actions secrets. The recipient id is the repository's
 * {@code owner/name}.
 */
@Singleton
public class GitHubSecretStore implements SecretStore {

  private static final Logger log = LoggerFactory.getLogger(GitHubSecretStore.class);

  private final GitHubAccessor accessor;

  @Inject
  public GitHubSecretStore(final GitHubAccessor accessor) {
    log.info("GitHubSecretStore()");
    this.accessor = accessor;
  }

  @Override
  public RecipientKey fetchPublicKey(final String recipientId) {
    PublicKeyResponse response = accessor.getPublicKey(recipientId);
    if (response == null || response.key() == null) {
      throw new KeyFetchException("Public key response without a key for recipient: " + recipientId, null);
    }
    try {
      return new RecipientKey(response.keyId(), Base64.getDecoder().decode(response.key()));
    } catch (IllegalArgumentException e) {
      throw new KeyFetchException("Public key for recipient " + recipientId + " is not valid base64", e);
    }
  }

  @Override
  public void putSecret(final String recipientId, final String secretName, final SealedSecret sealedSecret) {
    accessor.putSecret(recipientId, secretName,
        new SecretUploadRequest(sealedSecret.encryptedValue(), sealedSecret.keyIdentifier()));
  }

  @Override
  public String toString() {
    return "GitHubSecretStore";
  }
}
