package com.securebeacon.client.store;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link KeyMaterialStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All key material is lost when the process exits, so every start looks like a new device.
 * Suitable for development and testing only; use {@link FileKeyMaterialStore} otherwise.
 */
public class InMemoryKeyMaterialStore implements KeyMaterialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryKeyMaterialStore.class);

  private final ConcurrentHashMap<String, KeyMaterialRecord> records = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryKeyMaterialStore() {
    this(Clock.systemUTC());
  }

  public InMemoryKeyMaterialStore(final Clock clock) {
    log.warn("Using InMemoryKeyMaterialStore - key material will NOT survive restarts.");
    this.clock = clock;
  }

  @Override
  public void store(String userId, String blob) {
    records.compute(userId, (id, existing) ->
        (existing == null ? KeyMaterialRecord.empty(id, clock.instant()) : existing)
            .withVerificationBlob(blob, clock.instant()));
    log.debug("Stored verification blob for user");
  }

  @Override
  public Optional<String> get(String userId) {
    KeyMaterialRecord record = records.get(userId);
    if (record == null || !record.hasVerificationBlob()) {
      return Optional.empty();
    }
    return Optional.of(record.encryptedVerificationBlob());
  }

  @Override
  public void clear(String userId) {
    records.computeIfPresent(userId, (id, existing) -> existing.withVerificationBlob("", clock.instant()));
  }

  @Override
  public void storeSalt(String userId, String saltBase64) {
    records.compute(userId, (id, existing) ->
        (existing == null ? KeyMaterialRecord.empty(id, clock.instant()) : existing)
            .withSalt(saltBase64, clock.instant()));
  }

  @Override
  public Optional<String> getSalt(String userId) {
    KeyMaterialRecord record = records.get(userId);
    if (record == null || record.salt() == null || record.salt().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(record.salt());
  }
}
