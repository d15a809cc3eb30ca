package com.securebeacon.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Stored form of an {@link AnalysisRecord}.
 * <p>
 * Each sensitive field holds the opaque text of one encrypted payload; {@code id},
 * {@code inputType} and the timestamps stay in the clear so the backend can list and sort
 * without decrypting.
 *
 * @param id              backend identifier
 * @param userEmail       encrypted user email
 * @param inputContent    encrypted input content
 * @param analysisContext encrypted analysis context (an encrypted empty string when absent)
 * @param mlResult        encrypted classifier output
 * @param inputType       kind of input, clear text
 * @param createdAt       creation timestamp, clear text
 * @param updatedAt       last update timestamp, clear text
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EncryptedAnalysisRecord(
    String id,
    String userEmail,
    String inputContent,
    String analysisContext,
    String mlResult,
    String inputType,
    String createdAt,
    String updatedAt) {
}
