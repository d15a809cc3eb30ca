package com.securebeacon.client.exceptions;

/**
 * The passphrase could not be checked because the backend was unreachable. Transient; must not
 * be presented as a wrong passphrase.
 */
public class VerificationUnavailableException extends EncryptionException {

  /**
   * Instantiates a new Verification unavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public VerificationUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
