package com.securebeacon.client.lockout;

/**
 * Notification that a user's cached lockout entry was written or removed.
 *
 * @param userId   the user whose entry changed
 * @param sourceId id of the tracker that made the change
 */
public record LockoutChange(String userId, String sourceId) {
}
