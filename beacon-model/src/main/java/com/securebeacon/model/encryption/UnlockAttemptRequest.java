package com.securebeacon.model.encryption;

/**
 * Body of {@code POST /api/encryption/unlock-attempts}: the outcome of one unlock attempt.
 *
 * @param success true when the passphrase was accepted
 */
public record UnlockAttemptRequest(boolean success) {
}
