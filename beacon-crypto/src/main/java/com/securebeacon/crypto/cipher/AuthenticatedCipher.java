package com.securebeacon.crypto.cipher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.securebeacon.crypto.common.RandomProvider;
import com.securebeacon.crypto.kdf.EncryptionKey;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AES-256-GCM authenticated encryption.
 * <p>
 * Every call to {@link #encrypt} draws a fresh 12-byte nonce from the {@link RandomProvider}; a
 * nonce is never reused under the same key. {@link #decrypt} fails with
 * {@link CipherAuthenticationException} whenever the tag does not verify, so a wrong key can never
 * yield plausible plaintext.
 * <p>
 * This class also owns the text encoding of a ciphertext ({@link #encryptText}/{@link #decryptText}):
 * the JSON form of an {@link EncryptedPayload}. Callers treat that text as opaque.
 */
public class AuthenticatedCipher {

  private static final Logger log = LoggerFactory.getLogger(AuthenticatedCipher.class);

  /**
   * Nonce length in bytes (96 bits, the GCM recommendation).
   */
  public static final int NONCE_LENGTH = 12;

  /**
   * Authentication tag length in bits.
   */
  public static final int TAG_LENGTH_BITS = 128;

  private final RandomProvider randomProvider;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new cipher with default randomness and JSON mapping.
   */
  public AuthenticatedCipher() {
    this(new RandomProvider(), new ObjectMapper());
  }

  /**
   * Instantiates a new cipher.
   *
   * @param randomProvider nonce source
   * @param objectMapper   mapper for the payload text encoding
   */
  public AuthenticatedCipher(final RandomProvider randomProvider, final ObjectMapper objectMapper) {
    this.randomProvider = randomProvider;
    this.objectMapper = objectMapper;
  }

  /**
   * Encrypts bytes under the key with a fresh nonce.
   *
   * @param plaintext the plaintext
   * @param key       the key
   * @return the ciphertext and nonce
   */
  public EncryptedPayload encrypt(final byte[] plaintext, final EncryptionKey key) {
    byte[] nonce = randomProvider.randomBytes(NONCE_LENGTH);
    GCMModeCipher gcm = newCipher(true, key, nonce);
    byte[] out = new byte[gcm.getOutputSize(plaintext.length)];
    int len = gcm.processBytes(plaintext, 0, plaintext.length, out, 0);
    try {
      len += gcm.doFinal(out, len);
    } catch (InvalidCipherTextException e) {
      // Only reachable on decryption; encryption never verifies a tag.
      throw new IllegalStateException("GCM encryption failed", e);
    }
    return new EncryptedPayload(Arrays.copyOf(out, len), nonce);
  }

  /**
   * Decrypts and authenticates a payload.
   *
   * @param payload the ciphertext and nonce
   * @param key     the key
   * @return the plaintext
   * @throws CipherAuthenticationException if the payload does not authenticate under the key
   */
  public byte[] decrypt(final EncryptedPayload payload, final EncryptionKey key) {
    byte[] ciphertext;
    byte[] nonce;
    try {
      ciphertext = payload.ciphertext();
      nonce = payload.nonce();
    } catch (IllegalArgumentException e) {
      throw new CipherAuthenticationException("Malformed encrypted payload", e);
    }
    if (nonce.length != NONCE_LENGTH) {
      throw new CipherAuthenticationException("Unexpected nonce length: " + nonce.length, null);
    }
    GCMModeCipher gcm = newCipher(false, key, nonce);
    byte[] out = new byte[gcm.getOutputSize(ciphertext.length)];
    int len = gcm.processBytes(ciphertext, 0, ciphertext.length, out, 0);
    try {
      len += gcm.doFinal(out, len);
    } catch (InvalidCipherTextException e) {
      log.debug("decrypt: authentication tag mismatch");
      Arrays.fill(out, (byte) 0);
      throw new CipherAuthenticationException("Ciphertext failed authentication", e);
    }
    return Arrays.copyOf(out, len);
  }

  /**
   * Encrypts a UTF-8 string and returns the opaque text form of the result.
   *
   * @param plaintext the plaintext
   * @param key       the key
   * @return JSON text of the {@link EncryptedPayload}
   */
  public String encryptText(final String plaintext, final EncryptionKey key) {
    EncryptedPayload payload = encrypt(plaintext.getBytes(StandardCharsets.UTF_8), key);
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to encode encrypted payload", e);
    }
  }

  /**
   * Parses the opaque text form produced by {@link #encryptText} and decrypts it.
   *
   * @param encoded JSON text of an {@link EncryptedPayload}
   * @param key     the key
   * @return the plaintext string
   * @throws CipherAuthenticationException if the text is malformed or does not authenticate
   */
  public String decryptText(final String encoded, final EncryptionKey key) {
    EncryptedPayload payload;
    try {
      payload = objectMapper.readValue(encoded, EncryptedPayload.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new CipherAuthenticationException("Malformed encrypted payload", e);
    }
    if (payload == null) {
      throw new CipherAuthenticationException("Empty encrypted payload", null);
    }
    return new String(decrypt(payload, key), StandardCharsets.UTF_8);
  }

  private GCMModeCipher newCipher(boolean forEncryption, EncryptionKey key, byte[] nonce) {
    byte[] keyBytes = key.bytes();
    try {
      GCMModeCipher gcm = GCMBlockCipher.newInstance(AESEngine.newInstance());
      gcm.init(forEncryption, new AEADParameters(new KeyParameter(keyBytes), TAG_LENGTH_BITS, nonce));
      return gcm;
    } finally {
      Arrays.fill(keyBytes, (byte) 0);
    }
  }
}
