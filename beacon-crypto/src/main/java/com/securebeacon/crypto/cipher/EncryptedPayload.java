package com.securebeacon.crypto.cipher;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;

/**
 * Wire form of one AES-GCM encryption: the ciphertext (with the authentication tag appended) and
 * the nonce it was produced with.
 * <p>
 * Both fields are base64-encoded because they are raw byte arrays. The nonce is carried under the
 * JSON key {@code iv}, the name used by records already stored on the backend.
 *
 * @param ciphertextBase64 base64-encoded ciphertext including the GCM tag
 * @param nonceBase64      base64-encoded 12-byte nonce
 */
public record EncryptedPayload(
    @JsonProperty("ciphertext") String ciphertextBase64,
    @JsonProperty("iv") String nonceBase64) {

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  /**
   * Instantiates a new payload from raw bytes.
   *
   * @param ciphertext the ciphertext
   * @param nonce      the nonce
   */
  public EncryptedPayload(byte[] ciphertext, byte[] nonce) {
    this(B64.encodeToString(ciphertext), B64.encodeToString(nonce));
  }

  private static byte[] decode(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: " + fieldName, e);
    }
  }

  /**
   * Decoded ciphertext bytes.
   *
   * @return the ciphertext
   */
  public byte[] ciphertext() {
    return decode(ciphertextBase64, "ciphertext");
  }

  /**
   * Decoded nonce bytes.
   *
   * @return the nonce
   */
  public byte[] nonce() {
    return decode(nonceBase64, "iv");
  }
}
