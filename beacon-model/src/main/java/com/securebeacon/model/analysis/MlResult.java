package com.securebeacon.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of the phishing classifier for one analysed input.
 *
 * @param phishing            whether the input was classified as phishing
 * @param phishingProbability classifier confidence, from 0 to 1
 */
public record MlResult(
    @JsonProperty("is_phishing") boolean phishing,
    @JsonProperty("phishing_probability") double phishingProbability) {
}
