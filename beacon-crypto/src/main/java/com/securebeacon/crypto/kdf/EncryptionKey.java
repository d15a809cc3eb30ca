package com.securebeacon.crypto.kdf;

import java.util.Arrays;
import javax.security.auth.Destroyable;

/**
 * A 256-bit symmetric key derived from a passphrase.
 * <p>
 * Instances live only in process memory. The class is deliberately not {@link java.io.Serializable},
 * {@link #toString()} never reveals the key bytes, and {@link #destroy()} zeroes the material so a
 * locked session holds no usable key.
 */
public final class EncryptionKey implements Destroyable {

  /**
   * Key length in bytes.
   */
  public static final int LENGTH = 32;

  private final byte[] material;
  private volatile boolean destroyed;

  /**
   * Wraps a copy of the given key bytes.
   *
   * @param material exactly {@link #LENGTH} bytes
   */
  public EncryptionKey(final byte[] material) {
    if (material == null || material.length != LENGTH) {
      throw new IllegalArgumentException("Key must be " + LENGTH + " bytes");
    }
    this.material = material.clone();
  }

  /**
   * Returns a copy of the key bytes. Callers should wipe the copy once used.
   *
   * @return the key bytes
   * @throws IllegalStateException if the key was destroyed
   */
  public byte[] bytes() {
    if (destroyed) {
      throw new IllegalStateException("Key has been destroyed");
    }
    return material.clone();
  }

  @Override
  public void destroy() {
    Arrays.fill(material, (byte) 0);
    destroyed = true;
  }

  @Override
  public boolean isDestroyed() {
    return destroyed;
  }

  @Override
  public String toString() {
    return "EncryptionKey[" + (destroyed ? "destroyed" : "redacted") + "]";
  }
}
