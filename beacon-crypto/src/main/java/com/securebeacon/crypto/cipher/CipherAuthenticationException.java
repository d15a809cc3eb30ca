package com.securebeacon.crypto.cipher;

/**
 * Thrown when a ciphertext does not authenticate under the supplied key: the key is wrong, the
 * ciphertext or nonce was altered, or the payload could not be parsed at all.
 */
public class CipherAuthenticationException extends SecurityException {

  /**
   * Instantiates a new Cipher authentication exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CipherAuthenticationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
