package com.securebeacon.crypto.kdf;

import com.securebeacon.crypto.common.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * PBKDF2-HMAC-SHA256 key derivation from a passphrase and a per-user salt.
 * <p>
 * Derivation is deterministic: the same passphrase, salt and iteration count always produce the
 * same key. The default iteration count keeps a single derivation interactive while making
 * offline guessing expensive.
 */
public class PassphraseKeyDeriver {

  /**
   * Default PBKDF2 iteration count.
   */
  public static final int DEFAULT_ITERATIONS = 100_000;

  /**
   * Salt length in bytes.
   */
  public static final int SALT_LENGTH = 16;

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new deriver using a default {@link RandomProvider} for salts.
   */
  public PassphraseKeyDeriver() {
    this(new RandomProvider());
  }

  /**
   * Instantiates a new deriver.
   *
   * @param randomProvider source of salt bytes
   */
  public PassphraseKeyDeriver(final RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * Generates a fresh random salt.
   *
   * @return {@link #SALT_LENGTH} random bytes
   */
  public byte[] generateSalt() {
    return randomProvider.randomBytes(SALT_LENGTH);
  }

  /**
   * Derives a key with the default iteration count.
   *
   * @param passphrase the passphrase
   * @param salt       the salt
   * @return the derived key
   */
  public EncryptionKey derive(final String passphrase, final byte[] salt) {
    return derive(passphrase, salt, DEFAULT_ITERATIONS);
  }

  /**
   * Derives a 256-bit key.
   *
   * @param passphrase non-empty passphrase, encoded as UTF-8
   * @param salt       exactly {@link #SALT_LENGTH} bytes
   * @param iterations PBKDF2 iteration count, positive
   * @return the derived key
   * @throws IllegalArgumentException on invalid input
   */
  public EncryptionKey derive(final String passphrase, final byte[] salt, final int iterations) {
    if (passphrase == null || passphrase.isEmpty()) {
      throw new IllegalArgumentException("Passphrase must not be empty");
    }
    if (salt == null || salt.length != SALT_LENGTH) {
      throw new IllegalArgumentException("Salt must be " + SALT_LENGTH + " bytes");
    }
    if (iterations <= 0) {
      throw new IllegalArgumentException("Iterations must be positive: " + iterations);
    }
    byte[] password = passphrase.getBytes(StandardCharsets.UTF_8);
    PBEParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
    generator.init(password, salt, iterations);
    KeyParameter keyParameter = (KeyParameter) generator.generateDerivedParameters(EncryptionKey.LENGTH * 8);
    byte[] keyBytes = keyParameter.getKey();
    try {
      return new EncryptionKey(keyBytes);
    } finally {
      Arrays.fill(password, (byte) 0);
      Arrays.fill(keyBytes, (byte) 0);
    }
  }
}
