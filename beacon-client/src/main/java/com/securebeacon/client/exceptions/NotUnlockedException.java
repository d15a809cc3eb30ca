package com.securebeacon.client.exceptions;

/**
 * A record operation was attempted while the session holds no key.
 */
public class NotUnlockedException extends EncryptionException {

  /**
   * Instantiates a new Not unlocked exception.
   */
  public NotUnlockedException() {
    super("Encryption not unlocked");
  }
}
