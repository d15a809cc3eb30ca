package com.securebeacon.client.lockout;

import com.securebeacon.client.accessor.EncryptionAccessor;
import com.securebeacon.client.config.EncryptionClientConfig;
import com.securebeacon.client.exceptions.EncryptionAccessorException;
import com.securebeacon.model.encryption.UnlockAttemptRequest;
import com.securebeacon.model.encryption.UnlockAttemptsResponse;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks unlock lockout status for display.
 * <p>
 * Status comes from the shared {@link LockoutCache} while its entry is fresh, and from the
 * backend otherwise. Refreshes are throttled per user. Whenever this tracker writes or removes a
 * cache entry it publishes a {@link LockoutChange}; sibling trackers on the same channel then
 * re-derive from the cache without calling the backend.
 * <p>
 * A backend failure yields the unlocked default rather than an error. This status only drives
 * the countdown shown to the user; the backend enforces the actual limit and the session
 * manager consults it directly at unlock time.
 */
@Singleton
public class LockoutTracker implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(LockoutTracker.class);

  private final EncryptionAccessor accessor;
  private final LockoutCache cache;
  private final LockoutChannel channel;
  private final EncryptionClientConfig config;
  private final Clock clock;
  private final String instanceId = UUID.randomUUID().toString();
  private final ConcurrentHashMap<String, LockoutStatus> statuses = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Long> lastRefresh = new ConcurrentHashMap<>();
  private final List<Listener> listeners = new CopyOnWriteArrayList<>();
  private final LockoutChannel.Subscription subscription;

  /**
   * Instantiates a new Lockout tracker and subscribes it to the channel.
   *
   * @param accessor the backend accessor
   * @param cache    the shared lockout cache
   * @param channel  the change channel
   * @param config   the client config
   * @param clock    the clock
   */
  @Inject
  public LockoutTracker(final EncryptionAccessor accessor,
                        final LockoutCache cache,
                        final LockoutChannel channel,
                        final EncryptionClientConfig config,
                        final Clock clock) {
    log.info("LockoutTracker({})", instanceId);
    this.accessor = accessor;
    this.cache = cache;
    this.channel = channel;
    this.config = config;
    this.clock = clock;
    this.subscription = channel.subscribe(this::onChange);
  }

  /**
   * Current status, recomputed against the clock. The first call for a user triggers a refresh.
   *
   * @param userId the user identity
   * @return the status
   */
  public LockoutStatus status(final String userId) {
    if (!statuses.containsKey(userId)) {
      refresh(userId);
    }
    LockoutStatus known = statuses.getOrDefault(userId, LockoutStatus.unlocked());
    return LockoutStatus.of(known.attempts(), known.lockedUntil(), clock.millis());
  }

  /**
   * Re-reads the status from the cache or the backend. Does nothing when called again for the
   * same user within the configured throttle interval.
   *
   * @param userId the user identity
   */
  public void refresh(final String userId) {
    long now = clock.millis();
    long throttle = config.lockoutThrottle().toMillis();
    boolean[] due = {false};
    lastRefresh.compute(userId, (id, last) -> {
      if (last != null && now - last < throttle) {
        return last;
      }
      due[0] = true;
      return now;
    });
    if (!due[0]) {
      log.trace("refresh: throttled");
      return;
    }

    Optional<LockoutCacheEntry> cached = cache.get(userId);
    if (cached.isPresent() && !cached.get().isExpired(now, config.lockoutCacheTtl())) {
      LockoutCacheEntry entry = cached.get();
      apply(userId, LockoutStatus.of(entry.attempts(), entry.lockedUntil(), now));
      return;
    }

    UnlockAttemptsResponse response;
    try {
      response = accessor.getUnlockAttempts();
    } catch (EncryptionAccessorException | SecurityException e) {
      log.warn("refresh: unable to read unlock attempts, assuming not locked: {}", e.getMessage());
      apply(userId, LockoutStatus.unlocked());
      return;
    }
    applyRemote(userId, response, now);
  }

  /**
   * Reports a failed unlock to the backend and applies the returned status.
   *
   * @param userId the user identity
   * @return the updated status
   */
  public LockoutStatus recordFailedAttempt(final String userId) {
    return record(userId, false);
  }

  /**
   * Reports a successful unlock to the backend and applies the returned status.
   *
   * @param userId the user identity
   * @return the updated status
   */
  public LockoutStatus recordSuccessfulUnlock(final String userId) {
    return record(userId, true);
  }

  /**
   * Registers a listener for status changes.
   *
   * @param listener the listener
   */
  public void addListener(final Listener listener) {
    listeners.add(listener);
  }

  @Override
  public void close() {
    subscription.close();
    listeners.clear();
  }

  private LockoutStatus record(String userId, boolean success) {
    long now = clock.millis();
    try {
      applyRemote(userId, accessor.recordUnlockAttempt(new UnlockAttemptRequest(success)), now);
    } catch (EncryptionAccessorException | SecurityException e) {
      log.warn("record: unable to report unlock attempt: {}", e.getMessage());
    }
    return status(userId);
  }

  private void applyRemote(String userId, UnlockAttemptsResponse response, long now) {
    LockoutStatus status = LockoutStatus.of(response.attempts(), response.lockedUntil(), now);
    if (status.locked() || response.attempts() > 0) {
      cache.put(userId, new LockoutCacheEntry(response.lockedUntil(), response.attempts(), now));
    } else {
      cache.remove(userId);
    }
    channel.publish(new LockoutChange(userId, instanceId));
    apply(userId, status);
  }

  private void onChange(LockoutChange change) {
    if (instanceId.equals(change.sourceId())) {
      return;
    }
    long now = clock.millis();
    LockoutStatus status = cache.get(change.userId())
        .filter(entry -> !entry.isExpired(now, config.lockoutCacheTtl()))
        .map(entry -> LockoutStatus.of(entry.attempts(), entry.lockedUntil(), now))
        .orElse(LockoutStatus.unlocked());
    log.debug("onChange: re-derived status from cache after change by {}", change.sourceId());
    apply(change.userId(), status);
  }

  private void apply(String userId, LockoutStatus status) {
    LockoutStatus previous = statuses.put(userId, status);
    if (!status.equals(previous)) {
      for (Listener listener : listeners) {
        listener.onStatus(userId, status);
      }
    }
  }

  /**
   * Receives lockout status changes.
   */
  @FunctionalInterface
  public interface Listener {

    /**
     * Called after the tracked status for a user changed.
     *
     * @param userId the user identity
     * @param status the new status
     */
    void onStatus(String userId, LockoutStatus status);
  }
}
