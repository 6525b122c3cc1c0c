package com.codeheadsystems.guardian.crypto;

import com.codeheadsystems.guardian.common.Bytes;
import com.codeheadsystems.guardian.common.RandomProvider;
import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

/**
 * Anonymous public-key encryption compatible with libsodium {@code crypto_box_seal}.
 * <p>
 * Sealing:
 * <ol>
 *   <li>Generate an ephemeral X25519 key pair {@code (epk, esk)}.</li>
 *   <li>{@code nonce = BLAKE2b-192(epk || recipientPk)}.</li>
 *   <li>{@code k = HSalsa20(X25519(esk, recipientPk), 0^16)}.</li>
 *   <li>Output {@code epk || XSalsa20-Poly1305(k, nonce, message)}.</li>
 * </ol>
 * The ephemeral secret is discarded after sealing, so only the holder of the recipient private key
 * can open the box and the sender has no identity. A fresh ephemeral key on every call makes two
 * seals of the same plaintext differ.
 */
public class SealedBox {

  /** X25519 public key length. */
  public static final int PUBLIC_KEY_BYTES = 32;
  /** Bytes added to the plaintext by sealing. */
  public static final int SEAL_OVERHEAD = PUBLIC_KEY_BYTES + XSalsa20Poly1305.MAC_BYTES;

  private SealedBox() {
  }

  /**
   * Seals the message to the recipient public key.
   *
   * @param recipientPublicKey 32-byte X25519 public key
   * @param message            the plaintext; not modified
   * @param randomProvider     source of the ephemeral key pair
   * @return epk || tag || ciphertext
   */
  public static byte[] seal(byte[] recipientPublicKey, byte[] message, RandomProvider randomProvider) {
    if (recipientPublicKey == null || recipientPublicKey.length != PUBLIC_KEY_BYTES) {
      throw new IllegalArgumentException("Recipient public key must be " + PUBLIC_KEY_BYTES + " bytes");
    }
    X25519PrivateKeyParameters ephemeral = new X25519PrivateKeyParameters(randomProvider.random());
    byte[] ephemeralPublicKey = ephemeral.generatePublicKey().getEncoded();
    byte[] nonce = nonce(ephemeralPublicKey, recipientPublicKey);
    byte[] key = boxKey(ephemeral, recipientPublicKey);
    try {
      return Bytes.concat(ephemeralPublicKey, XSalsa20Poly1305.seal(key, nonce, message));
    } finally {
      Bytes.zero(key);
    }
  }

  /**
   * Opens a sealed box with the recipient key pair.
   *
   * @param recipient the recipient key pair
   * @param sealed    epk || tag || ciphertext
   * @return the plaintext
   * @throws SecurityException if the box is truncated, tampered with, or sealed to another key
   */
  public static byte[] open(SealedBoxKeyPair recipient, byte[] sealed) {
    if (sealed.length < SEAL_OVERHEAD) {
      throw new SecurityException("Sealed box too short: " + sealed.length);
    }
    byte[] ephemeralPublicKey = Bytes.slice(sealed, 0, PUBLIC_KEY_BYTES);
    byte[] nonce = nonce(ephemeralPublicKey, recipient.publicKey());
    byte[] key = boxKey(new X25519PrivateKeyParameters(recipient.privateKey(), 0), ephemeralPublicKey);
    try {
      return XSalsa20Poly1305.open(key, nonce,
          Bytes.slice(sealed, PUBLIC_KEY_BYTES, sealed.length - PUBLIC_KEY_BYTES));
    } finally {
      Bytes.zero(key);
    }
  }

  private static byte[] nonce(byte[] ephemeralPublicKey, byte[] recipientPublicKey) {
    Blake2bDigest digest = new Blake2bDigest(null, XSalsa20Poly1305.NONCE_BYTES, null, null);
    digest.update(ephemeralPublicKey, 0, ephemeralPublicKey.length);
    digest.update(recipientPublicKey, 0, recipientPublicKey.length);
    byte[] nonce = new byte[XSalsa20Poly1305.NONCE_BYTES];
    digest.doFinal(nonce, 0);
    return nonce;
  }

  // crypto_box_beforenm
  private static byte[] boxKey(X25519PrivateKeyParameters privateKey, byte[] publicKey) {
    X25519Agreement agreement = new X25519Agreement();
    agreement.init(privateKey);
    byte[] shared = new byte[agreement.getAgreementSize()];
    try {
      agreement.calculateAgreement(new X25519PublicKeyParameters(publicKey, 0), shared, 0);
    } catch (IllegalStateException e) {
      throw new SecurityException("X25519 agreement produced the identity point", e);
    }
    try {
      return XSalsa20Poly1305.hsalsa20(shared, new byte[16]);
    } finally {
      Bytes.zero(shared);
    }
  }
}
