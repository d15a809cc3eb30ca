package com.securebeacon.client.exceptions;

/**
 * The passphrase did not produce a key that opens the user's verification material.
 * User-correctable.
 */
public class InvalidPassphraseException extends EncryptionException {

  /**
   * Instantiates a new Invalid passphrase exception.
   */
  public InvalidPassphraseException() {
    super("Invalid passphrase. Please try again.");
  }
}
