package com.securebeacon.client.lockout;

/**
 * Point-in-time view of a user's unlock lockout, suitable for a countdown display.
 *
 * @param locked           whether unlocking is currently suspended
 * @param remainingSeconds whole seconds until the lockout ends, rounded up; 0 when not locked
 * @param attempts         failed attempts counted by the backend
 * @param lockedUntil      epoch millis when the lockout ends, or null
 */
public record LockoutStatus(boolean locked, long remainingSeconds, int attempts, Long lockedUntil) {

  private static final LockoutStatus UNLOCKED = new LockoutStatus(false, 0, 0, null);

  /**
   * The default status: not locked, no attempts.
   *
   * @return the unlocked status
   */
  public static LockoutStatus unlocked() {
    return UNLOCKED;
  }

  /**
   * Computes the status at {@code nowMillis}.
   *
   * @param attempts    failed attempts
   * @param lockedUntil lockout end in epoch millis, or null
   * @param nowMillis   the current time in epoch millis
   * @return the status
   */
  public static LockoutStatus of(int attempts, Long lockedUntil, long nowMillis) {
    long remainingMillis = lockedUntil == null ? 0 : Math.max(0, lockedUntil - nowMillis);
    long remainingSeconds = (remainingMillis + 999) / 1000;
    return new LockoutStatus(remainingMillis > 0, remainingSeconds, attempts, lockedUntil);
  }
}
