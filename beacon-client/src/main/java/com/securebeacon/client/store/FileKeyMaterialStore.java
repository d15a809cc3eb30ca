package com.securebeacon.client.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable {@link KeyMaterialStore} keeping one JSON document per user in a device-local directory.
 * <p>
 * Document layout: {@code {userId, encryptedVerificationBlob, salt, createdAt, updatedAt}}.
 */
@Singleton
public class FileKeyMaterialStore implements KeyMaterialStore {

  private static final Logger log = LoggerFactory.getLogger(FileKeyMaterialStore.class);

  private final JsonFileStore<KeyMaterialRecord> files;
  private final Clock clock;

  /**
   * Instantiates a new File key material store.
   *
   * @param directory    directory for the per-user documents
   * @param objectMapper the object mapper
   * @param clock        source of record timestamps
   */
  @Inject
  public FileKeyMaterialStore(final Path directory, final ObjectMapper objectMapper, final Clock clock) {
    log.info("FileKeyMaterialStore({})", directory);
    this.files = new JsonFileStore<>(directory, objectMapper, KeyMaterialRecord.class, ".keys.json");
    this.clock = clock;
  }

  @Override
  public void store(String userId, String blob) {
    files.update(userId, current -> Optional.of(
        current.orElseGet(() -> KeyMaterialRecord.empty(userId, clock.instant()))
            .withVerificationBlob(blob, clock.instant())));
    log.debug("Stored verification blob for user");
  }

  @Override
  public Optional<String> get(String userId) {
    return files.read(userId)
        .filter(KeyMaterialRecord::hasVerificationBlob)
        .map(KeyMaterialRecord::encryptedVerificationBlob);
  }

  @Override
  public void clear(String userId) {
    files.update(userId, current -> current.map(r -> r.withVerificationBlob("", clock.instant())));
    log.debug("Cleared verification blob for user");
  }

  @Override
  public void storeSalt(String userId, String saltBase64) {
    files.update(userId, current -> Optional.of(
        current.orElseGet(() -> KeyMaterialRecord.empty(userId, clock.instant()))
            .withSalt(saltBase64, clock.instant())));
  }

  @Override
  public Optional<String> getSalt(String userId) {
    return files.read(userId)
        .map(KeyMaterialRecord::salt)
        .filter(s -> !s.isBlank());
  }
}
