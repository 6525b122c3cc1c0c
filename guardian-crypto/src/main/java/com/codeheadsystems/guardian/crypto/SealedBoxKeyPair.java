package com.codeheadsystems.guardian.crypto;

import com.codeheadsystems.guardian.common.RandomProvider;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;

/**
 * An X25519 key pair for the recipient side of a sealed box.
 *
 * @param publicKey  32-byte X25519 public key
 * @param privateKey 32-byte X25519 private key
 */
public record SealedBoxKeyPair(byte[] publicKey, byte[] privateKey) {

  /**
   * Generates a fresh key pair.
   *
   * @param randomProvider the random provider
   * @return the sealed box key pair
   */
  public static SealedBoxKeyPair generate(RandomProvider randomProvider) {
    X25519PrivateKeyParameters sk = new X25519PrivateKeyParameters(randomProvider.random());
    return new SealedBoxKeyPair(sk.generatePublicKey().getEncoded(), sk.getEncoded());
  }

  /**
   * Rebuilds the key pair from a stored private key.
   *
   * @param privateKey the private key
   * @return the sealed box key pair
   */
  public static SealedBoxKeyPair fromPrivateKey(byte[] privateKey) {
    X25519PrivateKeyParameters sk = new X25519PrivateKeyParameters(privateKey, 0);
    return new SealedBoxKeyPair(sk.generatePublicKey().getEncoded(), sk.getEncoded());
  }

  @Override
  public String toString() {
    return "SealedBoxKeyPair[publicKey=" + publicKey.length + " bytes]";
  }
}
