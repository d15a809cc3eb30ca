package com.securebeacon.client.exceptions;

/**
 * The backend reports an active unlock lockout for the user.
 */
public class LockedOutException extends EncryptionException {

  private final long remainingSeconds;

  /**
   * Instantiates a new Locked out exception.
   *
   * @param remainingSeconds seconds until unlocking is allowed again
   */
  public LockedOutException(final long remainingSeconds) {
    super("Too many failed unlock attempts. Try again in " + remainingSeconds + " seconds.");
    this.remainingSeconds = remainingSeconds;
  }

  /**
   * Remaining seconds of the lockout.
   *
   * @return the remaining seconds
   */
  public long remainingSeconds() {
    return remainingSeconds;
  }
}
