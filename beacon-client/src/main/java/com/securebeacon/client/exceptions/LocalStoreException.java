package com.securebeacon.client.exceptions;

/**
 * Reading or writing device-local key material or lockout cache failed.
 */
public class LocalStoreException extends EncryptionException {

  /**
   * Instantiates a new Local store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public LocalStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
