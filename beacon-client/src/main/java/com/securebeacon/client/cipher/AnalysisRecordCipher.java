package com.securebeacon.client.cipher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.securebeacon.client.exceptions.EncryptionException;
import com.securebeacon.client.exceptions.MissingFieldsException;
import com.securebeacon.crypto.cipher.AuthenticatedCipher;
import com.securebeacon.crypto.cipher.CipherAuthenticationException;
import com.securebeacon.crypto.kdf.EncryptionKey;
import com.securebeacon.model.analysis.AnalysisRecord;
import com.securebeacon.model.analysis.EncryptedAnalysisRecord;
import com.securebeacon.model.analysis.MlResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Field-level encryption of analysis records.
 * <p>
 * {@code userEmail}, {@code inputContent}, {@code analysisContext} and {@code mlResult} are each
 * encrypted separately with a fresh nonce; {@code analysisContext} and {@code mlResult} are
 * serialized to JSON first. An absent context is encrypted as the empty string so every stored
 * record has the same shape. {@code id}, {@code inputType} and the timestamps are copied through
 * unchanged.
 */
@Singleton
public class AnalysisRecordCipher {

  private static final TypeReference<Map<String, Object>> CONTEXT_TYPE = new TypeReference<>() {
  };

  private final AuthenticatedCipher cipher;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Analysis record cipher.
   *
   * @param cipher       the authenticated cipher
   * @param objectMapper mapper for the structured fields
   */
  @Inject
  public AnalysisRecordCipher(final AuthenticatedCipher cipher, final ObjectMapper objectMapper) {
    this.cipher = cipher;
    this.objectMapper = objectMapper;
  }

  /**
   * Encrypts the sensitive fields of a record.
   *
   * @param record the plaintext record
   * @param key    the key
   * @return the encrypted record
   * @throws MissingFieldsException if userEmail, inputContent or mlResult is absent
   */
  public EncryptedAnalysisRecord encrypt(final AnalysisRecord record, final EncryptionKey key) {
    requireFields(record);
    String context = record.analysisContext() == null ? "" : toJson(record.analysisContext());
    return new EncryptedAnalysisRecord(
        record.id(),
        cipher.encryptText(record.userEmail(), key),
        cipher.encryptText(record.inputContent(), key),
        cipher.encryptText(context, key),
        cipher.encryptText(toJson(record.mlResult()), key),
        record.inputType(),
        record.createdAt(),
        record.updatedAt());
  }

  /**
   * Decrypts the sensitive fields of a record.
   *
   * @param record the encrypted record
   * @param key    the key
   * @return the plaintext record
   * @throws CipherAuthenticationException if any field does not authenticate under the key
   * @throws EncryptionException           if a field authenticates but its content is malformed
   */
  public AnalysisRecord decrypt(final EncryptedAnalysisRecord record, final EncryptionKey key) {
    String userEmail = cipher.decryptText(record.userEmail(), key);
    String inputContent = cipher.decryptText(record.inputContent(), key);
    Map<String, Object> context = null;
    if (record.analysisContext() != null && !record.analysisContext().isBlank()) {
      String contextJson = cipher.decryptText(record.analysisContext(), key);
      if (!contextJson.isEmpty()) {
        context = fromJson(contextJson, CONTEXT_TYPE, "analysisContext");
      }
    }
    MlResult mlResult = fromJson(cipher.decryptText(record.mlResult(), key),
        new TypeReference<MlResult>() {
        }, "mlResult");
    return new AnalysisRecord(
        record.id(),
        userEmail,
        inputContent,
        context,
        mlResult,
        record.inputType(),
        record.createdAt(),
        record.updatedAt());
  }

  private static void requireFields(AnalysisRecord record) {
    List<String> missing = new ArrayList<>();
    if (record.userEmail() == null || record.userEmail().isEmpty()) {
      missing.add("userEmail");
    }
    if (record.inputContent() == null || record.inputContent().isEmpty()) {
      missing.add("inputContent");
    }
    if (record.mlResult() == null) {
      missing.add("mlResult");
    }
    if (!missing.isEmpty()) {
      throw new MissingFieldsException(missing);
    }
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new EncryptionException("Unable to serialize record field", e);
    }
  }

  private <T> T fromJson(String json, TypeReference<T> type, String fieldName) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      // The field authenticated, so the key is right; the stored content itself is corrupt.
      throw new EncryptionException("Decrypted field is malformed: " + fieldName, e);
    }
  }
}
