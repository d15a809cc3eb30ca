package com.securebeacon.client.store;

import java.util.Optional;

/**
 * Device-local storage of each user's verification blob and cached salt.
 * <p>
 * Implementations must be thread-safe. Writers for different users never conflict; concurrent
 * writers for the same user resolve last-write-wins. Nothing here is synchronized across devices.
 */
public interface KeyMaterialStore {

  /**
   * Stores or replaces the verification blob, keeping any cached salt.
   *
   * @param userId the user identity
   * @param blob   opaque encrypted verification payload
   */
  void store(String userId, String blob);

  /**
   * Returns the verification blob.
   *
   * @param userId the user identity
   * @return the blob, or empty if none was stored or it was cleared
   */
  Optional<String> get(String userId);

  /**
   * Blanks the verification blob while keeping the record and its salt. No-op when the user has
   * no record.
   *
   * @param userId the user identity
   */
  void clear(String userId);

  /**
   * Whether a verification blob is stored for the user.
   *
   * @param userId the user identity
   * @return true if {@link #get(String)} would return a value
   */
  default boolean has(String userId) {
    return get(userId).isPresent();
  }

  /**
   * Caches the user's salt locally, keeping any blob.
   *
   * @param userId     the user identity
   * @param saltBase64 base64-encoded salt
   */
  void storeSalt(String userId, String saltBase64);

  /**
   * Returns the locally cached salt.
   *
   * @param userId the user identity
   * @return the base64-encoded salt, or empty
   */
  Optional<String> getSalt(String userId);
}
