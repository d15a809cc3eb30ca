package com.securebeacon.client.lockout;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.securebeacon.client.exceptions.LocalStoreException;
import com.securebeacon.client.store.JsonFileStore;
import java.nio.file.Path;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LockoutCache} keeping one JSON document per user, so separate processes on the device
 * share lockout state. An unreadable entry is dropped and treated as absent.
 */
@Singleton
public class FileLockoutCache implements LockoutCache {

  private static final Logger log = LoggerFactory.getLogger(FileLockoutCache.class);

  private final JsonFileStore<LockoutCacheEntry> files;

  /**
   * Instantiates a new File lockout cache.
   *
   * @param directory    directory for the per-user entries
   * @param objectMapper the object mapper
   */
  @Inject
  public FileLockoutCache(final Path directory, final ObjectMapper objectMapper) {
    log.info("FileLockoutCache({})", directory);
    this.files = new JsonFileStore<>(directory, objectMapper, LockoutCacheEntry.class, ".lockout.json");
  }

  @Override
  public Optional<LockoutCacheEntry> get(String userId) {
    try {
      return files.read(userId);
    } catch (LocalStoreException e) {
      log.warn("Discarding unreadable lockout entry", e);
      files.delete(userId);
      return Optional.empty();
    }
  }

  @Override
  public void put(String userId, LockoutCacheEntry entry) {
    files.write(userId, entry);
  }

  @Override
  public void remove(String userId) {
    files.delete(userId);
  }
}
