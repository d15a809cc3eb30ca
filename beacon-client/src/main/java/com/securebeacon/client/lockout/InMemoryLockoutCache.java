package com.securebeacon.client.lockout;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link LockoutCache}. Trackers sharing one instance see each other's writes.
 */
public class InMemoryLockoutCache implements LockoutCache {

  private final ConcurrentHashMap<String, LockoutCacheEntry> entries = new ConcurrentHashMap<>();

  @Override
  public Optional<LockoutCacheEntry> get(String userId) {
    return Optional.ofNullable(entries.get(userId));
  }

  @Override
  public void put(String userId, LockoutCacheEntry entry) {
    entries.put(userId, entry);
  }

  @Override
  public void remove(String userId) {
    entries.remove(userId);
  }
}
