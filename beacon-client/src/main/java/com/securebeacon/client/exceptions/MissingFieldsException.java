package com.securebeacon.client.exceptions;

import java.util.List;

/**
 * A record lacks fields that must be present before it can be encrypted.
 */
public class MissingFieldsException extends EncryptionException {

  private final List<String> missingFields;

  /**
   * Instantiates a new Missing fields exception.
   *
   * @param missingFields names of the absent fields
   */
  public MissingFieldsException(final List<String> missingFields) {
    super("Missing required fields for encryption: " + String.join(", ", missingFields));
    this.missingFields = List.copyOf(missingFields);
  }

  /**
   * Missing fields list.
   *
   * @return the names of the absent fields
   */
  public List<String> missingFields() {
    return missingFields;
  }
}
