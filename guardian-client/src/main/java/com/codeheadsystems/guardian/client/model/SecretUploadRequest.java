package com.codeheadsystems.guardian.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a create-or-update repository secret call.
 *
 * @param encryptedValue base64 sealed box
 * @param keyId          id of the key the value was sealed to
 */
public record SecretUploadRequest(@JsonProperty("encrypted_value") String encryptedValue,
                                  @JsonProperty("key_id") String keyId) {
}
