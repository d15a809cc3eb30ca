package com.securebeacon.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Plaintext sealed inside a verification blob.
 *
 * @param timestamp epoch milliseconds at which the blob was created
 * @param userId    identity of the user the blob belongs to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VerificationPayload(
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("userSub") String userId) {
}
