package com.securebeacon.client.lockout;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

/**
 * Locally cached copy of the backend's unlock-attempt counter.
 *
 * @param lockedUntil lockout end in epoch millis, or null
 * @param attempts    failed attempts
 * @param timestamp   epoch millis when the entry was written
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LockoutCacheEntry(Long lockedUntil, int attempts, long timestamp) {

  /**
   * An entry is expired once its lockout has ended or it is older than {@code ttl}. Expired
   * entries are re-read from the backend.
   *
   * @param nowMillis the current time in epoch millis
   * @param ttl       maximum age of an entry
   * @return true if the entry should not be used
   */
  public boolean isExpired(long nowMillis, Duration ttl) {
    if (lockedUntil != null && nowMillis >= lockedUntil) {
      return true;
    }
    return nowMillis - timestamp >= ttl.toMillis();
  }
}
