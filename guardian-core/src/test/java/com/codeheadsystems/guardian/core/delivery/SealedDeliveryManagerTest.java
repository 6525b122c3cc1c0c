package com.codeheadsystems.guardian.core.delivery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.guardian.common.RandomProvider;
import com.codeheadsystems.guardian.core.exceptions.DeliveryException;
import com.codeheadsystems.guardian.core.exceptions.KeyFetchException;
import com.codeheadsystems.guardian.core.model.RecipientKey;
import com.codeheadsystems.guardian.core.model.SealedSecret;
import com.codeheadsystems.guardian.crypto.SealedBox;
import com.codeheadsystems.guardian.crypto.SealedBoxKeyPair;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SealedDeliveryManagerTest {

  private static final String RECIPIENT = "acme/widgets";
  private static final String OTHER_RECIPIENT = "acme/gadgets";
  private static final String SECRET_NAME = "ACMEWIDGETS";
  private static final byte[] PLAINTEXT = "[{\"name\":\"sid\",\"value\":\"abc\"}]".getBytes(StandardCharsets.UTF_8);

  @Mock private SecretStore secretStore;

  private final RandomProvider randomProvider = new RandomProvider();
  private SealedBoxKeyPair keyPair;
  private SealedDeliveryManager manager;

  @BeforeEach
  void setUp() {
    keyPair = SealedBoxKeyPair.generate(randomProvider);
    manager = new SealedDeliveryManager(secretStore, randomProvider);
  }

  @Test
  void deliver_sealsToRecipientKeyAndUploads() {
    when(secretStore.fetchPublicKey(RECIPIENT)).thenReturn(new RecipientKey("kid-1", keyPair.publicKey()));

    manager.deliver(RECIPIENT, SECRET_NAME, PLAINTEXT);

    ArgumentCaptor<SealedSecret> captor = ArgumentCaptor.forClass(SealedSecret.class);
    verify(secretStore).putSecret(eq(RECIPIENT), eq(SECRET_NAME), captor.capture());
    SealedSecret uploaded = captor.getValue();
    assertThat(uploaded.keyIdentifier()).isEqualTo("kid-1");
    byte[] sealed = Base64.getDecoder().decode(uploaded.encryptedValue());
    assertThat(sealed).hasSize(PLAINTEXT.length + SealedBox.SEAL_OVERHEAD);
    assertThat(SealedBox.open(keyPair, sealed)).isEqualTo(PLAINTEXT);
  }

  @Test
  void deliver_twice_fetchesKeyOnce() {
    when(secretStore.fetchPublicKey(RECIPIENT)).thenReturn(new RecipientKey("kid-1", keyPair.publicKey()));

    manager.deliver(RECIPIENT, SECRET_NAME, PLAINTEXT);
    manager.deliver(RECIPIENT, "ANOTHER", PLAINTEXT);

    verify(secretStore, times(1)).fetchPublicKey(RECIPIENT);
    verify(secretStore, times(2)).putSecret(eq(RECIPIENT), anyString(), any(SealedSecret.class));
  }

  @Test
  void sealPayload_sameInput_givesDifferentCiphertext() {
    RecipientKey key = new RecipientKey("kid-1", keyPair.publicKey());

    assertThat(manager.sealPayload(key, PLAINTEXT)).isNotEqualTo(manager.sealPayload(key, PLAINTEXT));
  }

  @Test
  void fetchRecipientKey_failure_throwsKeyFetchExceptionAndLeavesOtherEntriesUsable() {
    when(secretStore.fetchPublicKey(OTHER_RECIPIENT)).thenReturn(new RecipientKey("kid-2", keyPair.publicKey()));
    when(secretStore.fetchPublicKey(RECIPIENT)).thenThrow(new IllegalStateException("404"));
    manager.fetchRecipientKey(OTHER_RECIPIENT);

    assertThatThrownBy(() -> manager.deliver(RECIPIENT, SECRET_NAME, PLAINTEXT))
        .isInstanceOf(KeyFetchException.class)
        .hasMessageContaining(RECIPIENT)
        .hasCauseInstanceOf(IllegalStateException.class);

    assertThat(manager.isCached(RECIPIENT)).isFalse();
    assertThat(manager.isCached(OTHER_RECIPIENT)).isTrue();
    manager.deliver(OTHER_RECIPIENT, "GADGETS", PLAINTEXT);
    verify(secretStore).putSecret(eq(OTHER_RECIPIENT), eq("GADGETS"), any(SealedSecret.class));
    verify(secretStore, never()).putSecret(eq(RECIPIENT), anyString(), any(SealedSecret.class));
  }

  @Test
  void fetchRecipientKey_keyFetchExceptionFromStore_isRethrownAsIs() {
    KeyFetchException original = new KeyFetchException("bad key", null);
    when(secretStore.fetchPublicKey(RECIPIENT)).thenThrow(original);

    assertThatThrownBy(() -> manager.fetchRecipientKey(RECIPIENT)).isSameAs(original);
  }

  @Test
  void fetchRecipientKey_wrongKeyLength_throwsKeyFetchException() {
    when(secretStore.fetchPublicKey(RECIPIENT)).thenReturn(new RecipientKey("kid-1", new byte[31]));

    assertThatThrownBy(() -> manager.fetchRecipientKey(RECIPIENT))
        .isInstanceOf(KeyFetchException.class)
        .hasMessageContaining("32 bytes");
    assertThat(manager.isCached(RECIPIENT)).isFalse();
  }

  @Test
  void fetchRecipientKey_blankKeyId_throwsKeyFetchException() {
    when(secretStore.fetchPublicKey(RECIPIENT)).thenReturn(new RecipientKey(" ", keyPair.publicKey()));

    assertThatThrownBy(() -> manager.fetchRecipientKey(RECIPIENT))
        .isInstanceOf(KeyFetchException.class)
        .hasMessageContaining("Malformed");
  }

  @Test
  void deliver_uploadFailure_throwsDeliveryExceptionAndKeepsCache() {
    when(secretStore.fetchPublicKey(RECIPIENT)).thenReturn(new RecipientKey("kid-1", keyPair.publicKey()));
    doThrow(new IllegalStateException("503")).when(secretStore)
        .putSecret(eq(RECIPIENT), eq(SECRET_NAME), any(SealedSecret.class));

    assertThatThrownBy(() -> manager.deliver(RECIPIENT, SECRET_NAME, PLAINTEXT))
        .isInstanceOf(DeliveryException.class)
        .hasMessageContaining(SECRET_NAME)
        .hasMessageContaining(RECIPIENT);
    assertThat(manager.isCached(RECIPIENT)).isTrue();
  }
}
