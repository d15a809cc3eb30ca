package com.securebeacon.client.exceptions;

/**
 * Remote encryption data is inconsistent (for example, encrypted records exist but no salt was
 * ever saved). Encryption stays disabled until the data is repaired outside this client.
 */
public class DataInconsistencyException extends EncryptionException {

  /**
   * Instantiates a new Data inconsistency exception.
   *
   * @param message the message
   */
  public DataInconsistencyException(final String message) {
    super(message);
  }
}
