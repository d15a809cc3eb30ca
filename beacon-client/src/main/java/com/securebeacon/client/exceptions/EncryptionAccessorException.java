package com.securebeacon.client.exceptions;

/**
 * The type Encryption accessor exception: transport or server failure talking to the backend.
 */
public class EncryptionAccessorException extends EncryptionException {

  /**
   * Instantiates a new Encryption accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public EncryptionAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
