package com.codeheadsystems.guardian.crypto;

import com.codeheadsystems.guardian.common.Bytes;
import org.bouncycastle.crypto.engines.Salsa20Engine;
import org.bouncycastle.crypto.engines.XSalsa20Engine;
import org.bouncycastle.crypto.macs.Poly1305;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.Pack;

/**
 * NaCl {@code crypto_secretbox} (XSalsa20 stream cipher with a Poly1305 authenticator) and the
 * HSalsa20 key derivation used by {@code crypto_box_beforenm}.
 * <p>
 * Box layout is {@code tag(16) || ciphertext}. The Poly1305 one-time key is the first 32 bytes
 * of the XSalsa20 keystream and the message is encrypted with the keystream that follows.
 */
public class XSalsa20Poly1305 {

  /** Key length in bytes. */
  public static final int KEY_BYTES = 32;
  /** Nonce length in bytes. */
  public static final int NONCE_BYTES = 24;
  /** Authenticator length in bytes. */
  public static final int MAC_BYTES = 16;

  private static final int[] SIGMA = {0x61707865, 0x3320646e, 0x79622d32, 0x6b206574};

  private XSalsa20Poly1305() {
  }

  /**
   * Encrypts and authenticates the message.
   *
   * @param key     32-byte key
   * @param nonce   24-byte nonce
   * @param message the plaintext
   * @return tag || ciphertext
   */
  public static byte[] seal(byte[] key, byte[] nonce, byte[] message) {
    checkLengths(key, nonce);
    XSalsa20Engine cipher = cipher(key, nonce);
    byte[] polyKey = new byte[KEY_BYTES];
    cipher.processBytes(new byte[KEY_BYTES], 0, KEY_BYTES, polyKey, 0);
    try {
      byte[] out = new byte[MAC_BYTES + message.length];
      cipher.processBytes(message, 0, message.length, out, MAC_BYTES);
      Poly1305 mac = new Poly1305();
      mac.init(new KeyParameter(polyKey));
      mac.update(out, MAC_BYTES, message.length);
      mac.doFinal(out, 0);
      return out;
    } finally {
      Bytes.zero(polyKey);
    }
  }

  /**
   * Verifies the authenticator and decrypts.
   *
   * @param key   32-byte key
   * @param nonce 24-byte nonce
   * @param box   tag || ciphertext
   * @return the plaintext
   * @throws SecurityException if the box is truncated or the authenticator does not verify
   */
  public static byte[] open(byte[] key, byte[] nonce, byte[] box) {
    checkLengths(key, nonce);
    if (box.length < MAC_BYTES) {
      throw new SecurityException("Box shorter than authenticator: " + box.length);
    }
    XSalsa20Engine cipher = cipher(key, nonce);
    byte[] polyKey = new byte[KEY_BYTES];
    cipher.processBytes(new byte[KEY_BYTES], 0, KEY_BYTES, polyKey, 0);
    try {
      int length = box.length - MAC_BYTES;
      Poly1305 mac = new Poly1305();
      mac.init(new KeyParameter(polyKey));
      mac.update(box, MAC_BYTES, length);
      byte[] expected = new byte[MAC_BYTES];
      mac.doFinal(expected, 0);
      if (!Arrays.constantTimeAreEqual(expected, Bytes.slice(box, 0, MAC_BYTES))) {
        throw new SecurityException("Box authenticator mismatch");
      }
      byte[] out = new byte[length];
      cipher.processBytes(box, MAC_BYTES, length, out, 0);
      return out;
    } finally {
      Bytes.zero(polyKey);
    }
  }

  /**
   * HSalsa20(key, input): the Salsa20/20 core without the final feed-forward, emitting words
   * 0, 5, 10, 15, 6, 7, 8, 9.
   *
   * @param key   32-byte key
   * @param input 16-byte input
   * @return 32-byte derived key
   */
  public static byte[] hsalsa20(byte[] key, byte[] input) {
    if (key.length != KEY_BYTES || input.length != 16) {
      throw new IllegalArgumentException("HSalsa20 requires a 32-byte key and 16-byte input");
    }
    int[] state = new int[16];
    state[0] = SIGMA[0];
    state[5] = SIGMA[1];
    state[10] = SIGMA[2];
    state[15] = SIGMA[3];
    Pack.littleEndianToInt(key, 0, state, 1, 4);
    Pack.littleEndianToInt(key, 16, state, 11, 4);
    Pack.littleEndianToInt(input, 0, state, 6, 4);

    // salsaCore adds the input back in; subtract it to recover the raw double-round output
    int[] x = new int[16];
    Salsa20Engine.salsaCore(20, state, x);
    int[] words = {
        x[0] - state[0], x[5] - state[5], x[10] - state[10], x[15] - state[15],
        x[6] - state[6], x[7] - state[7], x[8] - state[8], x[9] - state[9]
    };
    byte[] out = new byte[KEY_BYTES];
    Pack.intToLittleEndian(words, out, 0);
    java.util.Arrays.fill(state, 0);
    java.util.Arrays.fill(x, 0);
    java.util.Arrays.fill(words, 0);
    return out;
  }

  private static XSalsa20Engine cipher(byte[] key, byte[] nonce) {
    XSalsa20Engine cipher = new XSalsa20Engine();
    cipher.init(true, new ParametersWithIV(new KeyParameter(key), nonce));
    return cipher;
  }

  private static void checkLengths(byte[] key, byte[] nonce) {
    if (key.length != KEY_BYTES) {
      throw new IllegalArgumentException("Key must be " + KEY_BYTES + " bytes: " + key.length);
    }
    if (nonce.length != NONCE_BYTES) {
      throw new IllegalArgumentException("Nonce must be " + NONCE_BYTES + " bytes: " + nonce.length);
    }
  }
}
