package com.securebeacon.client.lockout;

import java.util.Optional;

/**
 * Device-local cache of lockout entries, shared by every tracker on the device. Last write wins.
 */
public interface LockoutCache {

  /**
   * Returns the user's cached entry.
   *
   * @param userId the user identity
   * @return the entry, or empty
   */
  Optional<LockoutCacheEntry> get(String userId);

  /**
   * Stores or replaces the user's entry.
   *
   * @param userId the user identity
   * @param entry  the entry
   */
  void put(String userId, LockoutCacheEntry entry);

  /**
   * Removes the user's entry if present.
   *
   * @param userId the user identity
   */
  void remove(String userId);
}
