package com.securebeacon.client.config;

import com.securebeacon.crypto.kdf.PassphraseKeyDeriver;
import java.time.Duration;

/**
 * Client-side configuration for the encryption session and lockout tracker.
 * <p>
 * The PBKDF2 iteration count must match the count used when the user's encryption was set up,
 * or every unlock derives a different key and fails verification. Use {@link #DEFAULT} in
 * production; {@link #forTesting()} lowers the iteration count so tests stay fast.
 *
 * @param pbkdf2Iterations     PBKDF2 iteration count for key derivation
 * @param verificationPageSize number of remote records fetched when verifying on a new device
 * @param lockoutThrottle      minimum interval between two lockout refreshes for the same user
 * @param lockoutCacheTtl      age after which a cached lockout entry is re-read from the backend
 */
public record EncryptionClientConfig(int pbkdf2Iterations,
                                     int verificationPageSize,
                                     Duration lockoutThrottle,
                                     Duration lockoutCacheTtl) {

  /**
   * Production defaults: 100 000 PBKDF2 iterations, one-record verification page, one-second
   * refresh throttle, fifteen-minute lockout cache.
   */
  public static final EncryptionClientConfig DEFAULT = new EncryptionClientConfig(
      PassphraseKeyDeriver.DEFAULT_ITERATIONS, 1, Duration.ofSeconds(1), Duration.ofMinutes(15));

  /**
   * Validates the configuration.
   */
  public EncryptionClientConfig {
    if (pbkdf2Iterations <= 0) {
      throw new IllegalArgumentException("pbkdf2Iterations must be positive");
    }
    if (verificationPageSize <= 0) {
      throw new IllegalArgumentException("verificationPageSize must be positive");
    }
    if (lockoutThrottle == null || lockoutThrottle.isNegative()) {
      throw new IllegalArgumentException("lockoutThrottle must not be negative");
    }
    if (lockoutCacheTtl == null || lockoutCacheTtl.isNegative() || lockoutCacheTtl.isZero()) {
      throw new IllegalArgumentException("lockoutCacheTtl must be positive");
    }
  }

  /**
   * Creates a test-only config with a low iteration count. Do not use in production.
   *
   * @return the encryption client config
   */
  public static EncryptionClientConfig forTesting() {
    return new EncryptionClientConfig(1_000, 1, Duration.ofSeconds(1), Duration.ofMinutes(15));
  }

  /**
   * Returns a copy with a different iteration count.
   *
   * @param iterations the iterations
   * @return the encryption client config
   */
  public EncryptionClientConfig withPbkdf2Iterations(int iterations) {
    return new EncryptionClientConfig(iterations, verificationPageSize, lockoutThrottle, lockoutCacheTtl);
  }
}
