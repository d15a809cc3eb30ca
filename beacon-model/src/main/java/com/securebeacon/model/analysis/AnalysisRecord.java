package com.securebeacon.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * Plaintext form of a stored analysis.
 * <p>
 * {@code userEmail}, {@code inputContent}, {@code analysisContext} and {@code mlResult} are
 * sensitive and only ever leave the client encrypted (see {@link EncryptedAnalysisRecord}).
 * The remaining fields are listing metadata. Timestamps are ISO-8601 strings as issued by the
 * backend.
 *
 * @param id              backend identifier, null before the record is first saved
 * @param userEmail       the submitting user's email
 * @param inputContent    the analysed email or header text
 * @param analysisContext optional free-form context, may be null
 * @param mlResult        the classifier output
 * @param inputType       kind of input (for example {@code header} or {@code file})
 * @param createdAt       creation timestamp
 * @param updatedAt       last update timestamp
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisRecord(
    String id,
    String userEmail,
    String inputContent,
    Map<String, Object> analysisContext,
    MlResult mlResult,
    String inputType,
    String createdAt,
    String updatedAt) {
}
