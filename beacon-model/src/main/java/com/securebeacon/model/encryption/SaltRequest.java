package com.securebeacon.model.encryption;

/**
 * Body of {@code POST /api/encryption/salt}.
 *
 * @param salt base64-encoded 16-byte salt
 */
public record SaltRequest(String salt) {
}
