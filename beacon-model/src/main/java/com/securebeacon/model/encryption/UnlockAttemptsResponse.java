package com.securebeacon.model.encryption;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Authoritative failed-unlock counter kept by the backend.
 *
 * @param attempts    failed attempts in the current window
 * @param lockedUntil epoch milliseconds until which unlocking is refused, null when not locked
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UnlockAttemptsResponse(int attempts, Long lockedUntil) {
}
