package com.securebeacon.client.lockout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.securebeacon.client.accessor.EncryptionAccessor;
import com.securebeacon.client.config.EncryptionClientConfig;
import com.securebeacon.client.exceptions.EncryptionAccessorException;
import com.securebeacon.client.testing.MutableClock;
import com.securebeacon.model.encryption.UnlockAttemptRequest;
import com.securebeacon.model.encryption.UnlockAttemptsResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LockoutTrackerTest {

  private static final String USER = "auth0|alice";
  private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

  @Mock private EncryptionAccessor accessor;
  @Mock private EncryptionAccessor siblingAccessor;

  private MutableClock clock;
  private InMemoryLockoutCache cache;
  private InProcessLockoutChannel channel;
  private LockoutTracker tracker;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    cache = new InMemoryLockoutCache();
    channel = new InProcessLockoutChannel();
    tracker = new LockoutTracker(accessor, cache, channel, EncryptionClientConfig.forTesting(), clock);
  }

  @AfterEach
  void tearDown() {
    tracker.close();
  }

  @Test
  void status_lockedByBackend_countsDownThenClearsAfterRefresh() {
    long lockedUntil = START.toEpochMilli() + 30_500;
    when(accessor.getUnlockAttempts())
        .thenReturn(new UnlockAttemptsResponse(5, lockedUntil))
        .thenReturn(new UnlockAttemptsResponse(0, null));

    LockoutStatus status = tracker.status(USER);
    assertThat(status.locked()).isTrue();
    assertThat(status.remainingSeconds()).isEqualTo(31);
    assertThat(status.attempts()).isEqualTo(5);
    assertThat(cache.get(USER)).isPresent();

    clock.advance(Duration.ofSeconds(10));
    assertThat(tracker.status(USER).remainingSeconds()).isEqualTo(21);

    clock.set(Instant.ofEpochMilli(lockedUntil));
    tracker.refresh(USER);

    status = tracker.status(USER);
    assertThat(status).isEqualTo(LockoutStatus.unlocked());
    assertThat(cache.get(USER)).isEmpty();
    verify(accessor, times(2)).getUnlockAttempts();
  }

  @Test
  void refresh_withinThrottle_isNoOp() {
    when(accessor.getUnlockAttempts()).thenReturn(new UnlockAttemptsResponse(0, null));

    tracker.refresh(USER);
    clock.advance(Duration.ofMillis(500));
    tracker.refresh(USER);
    clock.advance(Duration.ofMillis(600));
    tracker.refresh(USER);

    verify(accessor, times(2)).getUnlockAttempts();
  }

  @Test
  void refresh_freshCacheEntry_skipsBackend() {
    cache.put(USER, new LockoutCacheEntry(START.toEpochMilli() + 60_000, 5, START.toEpochMilli()));

    tracker.refresh(USER);

    assertThat(tracker.status(USER).remainingSeconds()).isEqualTo(60);
    verifyNoInteractions(accessor);
  }

  @Test
  void refresh_staleCacheEntry_goesToBackend() {
    cache.put(USER, new LockoutCacheEntry(null, 2, START.toEpochMilli()));
    clock.advance(Duration.ofMinutes(16));
    when(accessor.getUnlockAttempts()).thenReturn(new UnlockAttemptsResponse(3, null));

    tracker.refresh(USER);

    LockoutStatus status = tracker.status(USER);
    assertThat(status.locked()).isFalse();
    assertThat(status.attempts()).isEqualTo(3);
  }

  @Test
  void refresh_backendFailure_resetsToDefault() {
    when(accessor.getUnlockAttempts()).thenThrow(new EncryptionAccessorException("down", null));

    assertThat(tracker.status(USER)).isEqualTo(LockoutStatus.unlocked());
  }

  @Test
  void refresh_backendChange_updatesSiblingWithoutItsBackend() {
    LockoutTracker sibling = new LockoutTracker(siblingAccessor, cache, channel,
        EncryptionClientConfig.forTesting(), clock);
    try {
      when(accessor.getUnlockAttempts())
          .thenReturn(new UnlockAttemptsResponse(5, START.toEpochMilli() + 10_000));

      tracker.refresh(USER);

      LockoutStatus siblingStatus = sibling.status(USER);
      assertThat(siblingStatus.locked()).isTrue();
      assertThat(siblingStatus.remainingSeconds()).isEqualTo(10);
      verifyNoInteractions(siblingAccessor);
    } finally {
      sibling.close();
    }
  }

  @Test
  void recordFailedAttempt_appliesReturnedStatusAndNotifiesListeners() {
    List<LockoutStatus> seen = new ArrayList<>();
    tracker.addListener((userId, status) -> seen.add(status));
    when(accessor.recordUnlockAttempt(any(UnlockAttemptRequest.class)))
        .thenReturn(new UnlockAttemptsResponse(5, START.toEpochMilli() + 5_000));

    LockoutStatus status = tracker.recordFailedAttempt(USER);

    assertThat(status.locked()).isTrue();
    assertThat(status.remainingSeconds()).isEqualTo(5);
    assertThat(seen).hasSize(1);
    verify(accessor).recordUnlockAttempt(new UnlockAttemptRequest(false));
  }

  @Test
  void recordSuccessfulUnlock_clearsCache() {
    cache.put(USER, new LockoutCacheEntry(null, 2, START.toEpochMilli()));
    when(accessor.recordUnlockAttempt(any(UnlockAttemptRequest.class)))
        .thenReturn(new UnlockAttemptsResponse(0, null));

    LockoutStatus status = tracker.recordSuccessfulUnlock(USER);

    assertThat(status).isEqualTo(LockoutStatus.unlocked());
    assertThat(cache.get(USER)).isEmpty();
    verify(accessor).recordUnlockAttempt(new UnlockAttemptRequest(true));
  }

  @Test
  void lockoutStatus_roundsRemainingSecondsUp() {
    assertThat(LockoutStatus.of(5, 10_001L, 0).remainingSeconds()).isEqualTo(11);
    assertThat(LockoutStatus.of(5, 10_000L, 0).remainingSeconds()).isEqualTo(10);
    assertThat(LockoutStatus.of(5, 10_000L, 10_000).locked()).isFalse();
    assertThat(LockoutStatus.of(0, null, 0)).isEqualTo(LockoutStatus.unlocked());
  }
}
