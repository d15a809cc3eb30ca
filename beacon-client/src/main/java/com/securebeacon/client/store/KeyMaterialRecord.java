package com.securebeacon.client.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * Per-user device-local record of encryption key material.
 * <p>
 * A blank {@code encryptedVerificationBlob} means the blob was cleared on lock while the salt was
 * kept. Timestamps are ISO-8601 strings.
 *
 * @param userId                    the user identity
 * @param encryptedVerificationBlob opaque encrypted verification payload, empty when cleared
 * @param salt                      base64-encoded salt, null when not cached locally
 * @param createdAt                 when the record was first written
 * @param updatedAt                 when the record was last written
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyMaterialRecord(String userId,
                                String encryptedVerificationBlob,
                                String salt,
                                String createdAt,
                                String updatedAt) {

  /**
   * A fresh record with neither blob nor salt.
   *
   * @param userId the user id
   * @param now    creation time
   * @return the record
   */
  public static KeyMaterialRecord empty(String userId, Instant now) {
    return new KeyMaterialRecord(userId, "", null, now.toString(), now.toString());
  }

  /**
   * Whether a usable verification blob is present.
   *
   * @return true if the blob is non-blank
   */
  public boolean hasVerificationBlob() {
    return encryptedVerificationBlob != null && !encryptedVerificationBlob.isBlank();
  }

  /**
   * Copy with a new blob; salt and creation time are kept.
   *
   * @param blob the blob
   * @param now  update time
   * @return the record
   */
  public KeyMaterialRecord withVerificationBlob(String blob, Instant now) {
    return new KeyMaterialRecord(userId, blob, salt, createdAt, now.toString());
  }

  /**
   * Copy with a new salt; blob and creation time are kept.
   *
   * @param newSalt the salt
   * @param now     update time
   * @return the record
   */
  public KeyMaterialRecord withSalt(String newSalt, Instant now) {
    return new KeyMaterialRecord(userId, encryptedVerificationBlob, newSalt, createdAt, now.toString());
  }
}
