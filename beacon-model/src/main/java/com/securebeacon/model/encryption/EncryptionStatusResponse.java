package com.securebeacon.model.encryption;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Backend view of a user's encryption setup ({@code GET /api/encryption/status}).
 *
 * @param hasSalt     whether a salt has been saved for the user
 * @param hasAnalyses whether the user has any stored analyses
 * @param salt        base64-encoded salt, null when none was saved
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EncryptionStatusResponse(boolean hasSalt, boolean hasAnalyses, String salt) {

  /**
   * Status reported for a user with nothing stored.
   *
   * @return the empty status
   */
  public static EncryptionStatusResponse empty() {
    return new EncryptionStatusResponse(false, false, null);
  }
}
