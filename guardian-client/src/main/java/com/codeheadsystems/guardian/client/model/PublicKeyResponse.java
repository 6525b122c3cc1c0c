package com.codeheadsystems.guardian.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Repository Actions public key.
 *
 * @param keyId the key id to quote on upload
 * @param key   base64 X25519 public key
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PublicKeyResponse(@JsonProperty("key_id") String keyId,
                                @JsonProperty("key") String key) {
}
