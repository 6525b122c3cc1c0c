package com.codeheadsystems.guardian.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;

class XSalsa20Poly1305Test {

  private static final HexFormat HEX = HexFormat.of();

  /**
   * NaCl core1 vector: HSalsa20 of the RFC 7748 Alice/Bob shared secret is the
   * crypto_box_beforenm key.
   */
  @Test
  void hsalsa20_naclBeforenmVector() {
    byte[] shared = HEX.parseHex("4a5d9d5ba4ce2de1728e3bf480350f25e07e21c947d19e3376f09b3c1e161742");
    byte[] expected = HEX.parseHex("1b27556473e985d462cd51197a9a46c76009549eac6474f206c4ee0844f68389");

    assertThat(XSalsa20Poly1305.hsalsa20(shared, new byte[16])).isEqualTo(expected);
  }

  /**
   * NaCl crypto_box vector: Alice's secret key, Bob's public key and the fixed nonce give the
   * published 147-byte box (tag then ciphertext) over the 131-byte message.
   */
  @Test
  void seal_naclBoxVector() {
    byte[] aliceSecret = HEX.parseHex("77076d0a7318a57d3c16c17251b26645df4c2f87ebc0992ab177fba51db92c2a");
    byte[] bobPublic = HEX.parseHex("de9edb7d7b7dc1b4d35b61c2ece435373f8343c85b78674dadfc7e146f882b4f");
    byte[] nonce = HEX.parseHex("69696ee955b62b73cd62bda875fc73d68219e0036b7a0b37");
    byte[] message = HEX.parseHex(
        "be075fc53c81f2d5cf141316ebeb0c7b5228c52a4c62cbd44b66849b64244ffc"
            + "e5ecbaaf33bd751a1ac728d45e6c61296cdc3c01233561f41db66cce314adb31"
            + "0e3be8250c46f06dceea3a7fa1348057e2f6556ad6b1318a024a838f21af1fde"
            + "048977eb48f59ffd4924ca1c60902e52f0a089bc76897040e082f93776384864"
            + "5e0705");
    byte[] expected = HEX.parseHex(
        "f3ffc7703f9400e52a7dfb4b3d3305d98e993b9f48681273c29650ba32fc76ce"
            + "48332ea7164d96a4476fb8c531a1186ac0dfc17c98dce87b4da7f011ec48c972"
            + "71d2c20f9b928fe2270d6fb863d51738b48eeee314a7cc8ab932164548e526ae"
            + "90224368517acfeabd6bb3732bc0e9da99832b61ca01b6de56244a9e88d5f9b3"
            + "7973f622a43d14a6599b1f654cb45a74e355a5");

    X25519Agreement agreement = new X25519Agreement();
    agreement.init(new X25519PrivateKeyParameters(aliceSecret, 0));
    byte[] shared = new byte[agreement.getAgreementSize()];
    agreement.calculateAgreement(new X25519PublicKeyParameters(bobPublic, 0), shared, 0);
    byte[] key = XSalsa20Poly1305.hsalsa20(shared, new byte[16]);

    byte[] box = XSalsa20Poly1305.seal(key, nonce, message);

    assertThat(message).hasSize(131);
    assertThat(box).isEqualTo(expected);
    assertThat(XSalsa20Poly1305.open(key, nonce, expected)).isEqualTo(message);
  }

  @Test
  void sealThenOpen_roundTrip() {
    byte[] key = new byte[32];
    byte[] nonce = new byte[24];
    key[0] = 7;
    nonce[23] = 9;
    byte[] message = "cookie".getBytes(StandardCharsets.UTF_8);

    byte[] box = XSalsa20Poly1305.seal(key, nonce, message);

    assertThat(box).hasSize(message.length + XSalsa20Poly1305.MAC_BYTES);
    assertThat(XSalsa20Poly1305.open(key, nonce, box)).isEqualTo(message);
  }

  @Test
  void open_flippedTag_throwsSecurityException() {
    byte[] key = new byte[32];
    byte[] nonce = new byte[24];
    byte[] box = XSalsa20Poly1305.seal(key, nonce, new byte[]{1, 2, 3});
    box[0] ^= 0x40;

    assertThatThrownBy(() -> XSalsa20Poly1305.open(key, nonce, box))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("mismatch");
  }

  @Test
  void seal_badNonceLength_throwsIllegalArgument() {
    assertThatThrownBy(() -> XSalsa20Poly1305.seal(new byte[32], new byte[12], new byte[1]))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Nonce");
  }
}
