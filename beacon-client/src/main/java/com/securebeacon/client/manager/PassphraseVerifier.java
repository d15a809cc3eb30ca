package com.securebeacon.client.manager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.securebeacon.client.accessor.EncryptionAccessor;
import com.securebeacon.client.cipher.AnalysisRecordCipher;
import com.securebeacon.client.config.EncryptionClientConfig;
import com.securebeacon.client.exceptions.EncryptionAccessorException;
import com.securebeacon.client.exceptions.EncryptionException;
import com.securebeacon.client.exceptions.InvalidPassphraseException;
import com.securebeacon.client.exceptions.VerificationUnavailableException;
import com.securebeacon.client.model.VerificationPayload;
import com.securebeacon.client.store.KeyMaterialStore;
import com.securebeacon.crypto.cipher.AuthenticatedCipher;
import com.securebeacon.crypto.cipher.CipherAuthenticationException;
import com.securebeacon.crypto.kdf.EncryptionKey;
import com.securebeacon.model.analysis.AnalysisPage;
import java.time.Clock;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Proves a candidate key was derived from the user's real passphrase without asking the backend.
 * <p>
 * The only oracle is "can this key decrypt real ciphertext":
 * <ol>
 *   <li>With a local verification blob, the blob must decrypt under the key and name the same
 *       user.</li>
 *   <li>Without one (a new device), the most recent encrypted record is fetched and must
 *       decrypt under the key. A fresh blob is then written so step 1 applies next time.</li>
 *   <li>When the account has no records at all there is nothing to check against; the key is
 *       accepted and a blob is written.</li>
 * </ol>
 */
@Singleton
public class PassphraseVerifier {

  private static final Logger log = LoggerFactory.getLogger(PassphraseVerifier.class);

  private final AuthenticatedCipher cipher;
  private final AnalysisRecordCipher recordCipher;
  private final KeyMaterialStore keyMaterialStore;
  private final EncryptionAccessor accessor;
  private final ObjectMapper objectMapper;
  private final EncryptionClientConfig config;
  private final Clock clock;

  /**
   * Instantiates a new Passphrase verifier.
   *
   * @param cipher           the authenticated cipher
   * @param recordCipher     the record cipher used for the remote fallback
   * @param keyMaterialStore the local key material store
   * @param accessor         the backend accessor
   * @param objectMapper     the object mapper
   * @param config           the client config
   * @param clock            the clock used for blob timestamps
   */
  @Inject
  public PassphraseVerifier(final AuthenticatedCipher cipher,
                            final AnalysisRecordCipher recordCipher,
                            final KeyMaterialStore keyMaterialStore,
                            final EncryptionAccessor accessor,
                            final ObjectMapper objectMapper,
                            final EncryptionClientConfig config,
                            final Clock clock) {
    log.info("PassphraseVerifier()");
    this.cipher = cipher;
    this.recordCipher = recordCipher;
    this.keyMaterialStore = keyMaterialStore;
    this.accessor = accessor;
    this.objectMapper = objectMapper;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Verifies the candidate key for the user.
   *
   * @param userId    the user identity
   * @param candidate the key derived from the entered passphrase
   * @throws InvalidPassphraseException       if the key does not open the user's data
   * @throws VerificationUnavailableException if the backend could not be reached for the fallback
   */
  public void verify(final String userId, final EncryptionKey candidate) {
    Optional<String> blob = keyMaterialStore.get(userId);
    if (blob.isPresent()) {
      log.debug("verify: using local verification blob");
      verifyBlob(userId, blob.get(), candidate);
      return;
    }

    log.debug("verify: no local verification blob, checking remote records");
    AnalysisPage page;
    try {
      page = accessor.listAnalyses(config.verificationPageSize());
    } catch (EncryptionAccessorException e) {
      log.warn("verify: unable to fetch records for verification");
      throw new VerificationUnavailableException("Failed to verify passphrase. Please try again.", e);
    }

    if (page.items().isEmpty()) {
      log.info("verify: no records to verify against, accepting passphrase on first use");
    } else {
      try {
        recordCipher.decrypt(page.items().get(0), candidate);
      } catch (CipherAuthenticationException e) {
        throw new InvalidPassphraseException();
      }
    }
    keyMaterialStore.store(userId, createVerificationBlob(userId, candidate));
  }

  /**
   * Encrypts a fresh {@link VerificationPayload} for the user under the key.
   *
   * @param userId the user identity
   * @param key    the key
   * @return the opaque verification blob
   */
  public String createVerificationBlob(final String userId, final EncryptionKey key) {
    try {
      String payload = objectMapper.writeValueAsString(new VerificationPayload(clock.millis(), userId));
      return cipher.encryptText(payload, key);
    } catch (JsonProcessingException e) {
      throw new EncryptionException("Unable to build verification payload", e);
    }
  }

  private void verifyBlob(String userId, String blob, EncryptionKey candidate) {
    VerificationPayload payload;
    try {
      payload = objectMapper.readValue(cipher.decryptText(blob, candidate), VerificationPayload.class);
    } catch (CipherAuthenticationException | JsonProcessingException e) {
      throw new InvalidPassphraseException();
    }
    if (payload == null || !userId.equals(payload.userId())) {
      throw new InvalidPassphraseException();
    }
  }
}
