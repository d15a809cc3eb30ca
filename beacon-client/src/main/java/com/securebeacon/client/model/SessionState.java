package com.securebeacon.client.model;

/**
 * States of an encryption session.
 */
public enum SessionState {
  /** No user bound yet, or setup has not been evaluated. */
  UNINITIALIZED,
  /** The user has never set up encryption. */
  NOT_SETUP,
  /** Encryption is set up; no key in memory. */
  LOCKED,
  /** Key derived and verified; records can be encrypted and decrypted. */
  UNLOCKED,
  /** Remote data is inconsistent (records exist without a salt); encryption is disabled. */
  ERROR
}
