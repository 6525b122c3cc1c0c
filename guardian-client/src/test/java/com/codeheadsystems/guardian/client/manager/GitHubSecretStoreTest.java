package com.codeheadsystems.guardian.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.guardian.client.accessor.GitHubAccessor;
import com.codeheadsystems.guardian.client.model.PublicKeyResponse;
import com.codeheadsystems.guardian.client.model.SecretUploadRequest;
import com.codeheadsystems.guardian.common.RandomProvider;
import com.codeheadsystems.guardian.core.exceptions.KeyFetchException;
import com.codeheadsystems.guardian.core.model.RecipientKey;
import com.codeheadsystems.guardian.core.model.SealedSecret;
import com.codeheadsystems.guardian.crypto.SealedBoxKeyPair;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GitHubSecretStoreTest {

  private static final String REPO = "acme/widgets";

  @Mock private GitHubAccessor accessor;

  private GitHubSecretStore store;

  @BeforeEach
  void setUp() {
    store = new GitHubSecretStore(accessor);
  }

  @Test
  void fetchPublicKey_decodesBase64Key() {
    byte[] publicKey = SealedBoxKeyPair.generate(new RandomProvider()).publicKey();
    when(accessor.getPublicKey(REPO))
        .thenReturn(new PublicKeyResponse("kid-1", Base64.getEncoder().encodeToString(publicKey)));

    RecipientKey key = store.fetchPublicKey(REPO);

    assertThat(key.keyIdentifier()).isEqualTo("kid-1");
    assertThat(key.publicKeyBytes()).isEqualTo(publicKey);
  }

  @Test
  void fetchPublicKey_invalidBase64_throwsKeyFetchException() {
    when(accessor.getPublicKey(REPO)).thenReturn(new PublicKeyResponse("kid-1", "not*base64"));

    assertThatThrownBy(() -> store.fetchPublicKey(REPO))
        .isInstanceOf(KeyFetchException.class)
        .hasMessageContaining(REPO);
  }

  @Test
  void fetchPublicKey_missingKey_throwsKeyFetchException() {
    when(accessor.getPublicKey(REPO)).thenReturn(new PublicKeyResponse("kid-1", null));

    assertThatThrownBy(() -> store.fetchPublicKey(REPO)).isInstanceOf(KeyFetchException.class);
  }

  @Test
  void putSecret_mapsSealedSecretToUploadBody() {
    store.putSecret(REPO, "ACMEWIDGETS", new SealedSecret("kid-1", "c2VhbGVk"));

    verify(accessor).putSecret(REPO, "ACMEWIDGETS", new SecretUploadRequest("c2VhbGVk", "kid-1"));
  }
}
