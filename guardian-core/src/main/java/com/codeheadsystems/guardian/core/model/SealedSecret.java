package com.codeheadsystems.guardian.core.model;

/**
 * Upload body for one secret: the base64 sealed box and the key it was sealed to.
 *
 * @param keyIdentifier  the recipient key identifier
 * @param encryptedValue base64 of the sealed box
 */
public record SealedSecret(String keyIdentifier, String encryptedValue) {
}
