package com.securebeacon.client.manager;

import com.securebeacon.client.accessor.EncryptionAccessor;
import com.securebeacon.client.cipher.AnalysisRecordCipher;
import com.securebeacon.client.config.EncryptionClientConfig;
import com.securebeacon.client.exceptions.DataInconsistencyException;
import com.securebeacon.client.exceptions.EncryptionAccessorException;
import com.securebeacon.client.exceptions.InvalidPassphraseException;
import com.securebeacon.client.exceptions.LockedOutException;
import com.securebeacon.client.exceptions.NotUnlockedException;
import com.securebeacon.client.exceptions.VerificationUnavailableException;
import com.securebeacon.client.model.SessionState;
import com.securebeacon.client.store.KeyMaterialStore;
import com.securebeacon.crypto.kdf.EncryptionKey;
import com.securebeacon.crypto.kdf.PassphraseKeyDeriver;
import com.securebeacon.model.analysis.AnalysisRecord;
import com.securebeacon.model.analysis.EncryptedAnalysisRecord;
import com.securebeacon.model.encryption.EncryptionStatusResponse;
import com.securebeacon.model.encryption.SaltRequest;
import com.securebeacon.model.encryption.UnlockAttemptsResponse;
import java.time.Clock;
import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one user's encryption session: the state machine, the salt and the in-memory key.
 * <p>
 * Lifecycle: {@link #initialize(String)} on sign-in decides between {@link SessionState#NOT_SETUP},
 * {@link SessionState#LOCKED} and {@link SessionState#ERROR}. {@link #setup(String)} and
 * {@link #unlock(String)} produce {@link SessionState#UNLOCKED}; {@link #lock()} and
 * {@link #teardown()} discard the key.
 * <p>
 * {@code initialize}, {@code setup} and {@code unlock} are serialized by one operation lock, so
 * two unlocks never race on the verification outcome. {@code lock} only takes the short state
 * lock and is never blocked by an in-flight unlock; it advances an epoch, and an unlock that
 * finishes under an older epoch discards its key instead of committing it.
 */
@Singleton
public class EncryptionSessionManager {

  private static final Logger log = LoggerFactory.getLogger(EncryptionSessionManager.class);

  private final PassphraseKeyDeriver keyDeriver;
  private final AnalysisRecordCipher recordCipher;
  private final PassphraseVerifier verifier;
  private final KeyMaterialStore keyMaterialStore;
  private final EncryptionAccessor accessor;
  private final EncryptionClientConfig config;
  private final Clock clock;

  private final ReentrantLock operationLock = new ReentrantLock();
  private final Object stateLock = new Object();

  // Guarded by stateLock.
  private String userId;
  private SessionState state = SessionState.UNINITIALIZED;
  private EncryptionKey key;
  private String saltBase64;
  private boolean hasCheckedSetup;
  private long epoch;

  /**
   * Instantiates a new Encryption session manager.
   *
   * @param keyDeriver       the key deriver
   * @param recordCipher     the record cipher
   * @param verifier         the passphrase verifier
   * @param keyMaterialStore the local key material store
   * @param accessor         the backend accessor
   * @param config           the client config
   * @param clock            the clock
   */
  @Inject
  public EncryptionSessionManager(final PassphraseKeyDeriver keyDeriver,
                                  final AnalysisRecordCipher recordCipher,
                                  final PassphraseVerifier verifier,
                                  final KeyMaterialStore keyMaterialStore,
                                  final EncryptionAccessor accessor,
                                  final EncryptionClientConfig config,
                                  final Clock clock) {
    log.info("EncryptionSessionManager()");
    this.keyDeriver = keyDeriver;
    this.recordCipher = recordCipher;
    this.verifier = verifier;
    this.keyMaterialStore = keyMaterialStore;
    this.accessor = accessor;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Determines whether the user has encryption set up. A local verification blob means LOCKED
   * without asking the backend; otherwise the backend status decides. Calling this again for the
   * same user after a successful check returns the current state unchanged; calling it for a
   * different user tears the previous session down first.
   *
   * @param userId the signed-in user's identity
   * @return the resulting state
   * @throws VerificationUnavailableException if the backend status could not be read; the state
   *                                          stays {@link SessionState#UNINITIALIZED}
   */
  public SessionState initialize(final String userId) {
    if (userId == null || userId.isEmpty()) {
      throw new IllegalArgumentException("userId must not be empty");
    }
    operationLock.lock();
    try {
      synchronized (stateLock) {
        if (userId.equals(this.userId) && hasCheckedSetup) {
          return state;
        }
        if (this.userId != null && !userId.equals(this.userId)) {
          log.debug("initialize: switching user, discarding previous session");
          resetLocked();
        }
        this.userId = userId;
      }

      if (keyMaterialStore.has(userId)) {
        log.debug("initialize: local verification blob found");
        Optional<String> localSalt = keyMaterialStore.getSalt(userId);
        synchronized (stateLock) {
          localSalt.ifPresent(s -> saltBase64 = s);
          return commitCheck(SessionState.LOCKED);
        }
      }

      EncryptionStatusResponse status;
      try {
        status = accessor.getEncryptionStatus();
      } catch (EncryptionAccessorException e) {
        log.warn("initialize: unable to read encryption status");
        throw new VerificationUnavailableException("Unable to determine encryption status", e);
      }

      if (status.hasSalt() && status.salt() != null) {
        keyMaterialStore.storeSalt(userId, status.salt());
        synchronized (stateLock) {
          saltBase64 = status.salt();
          return commitCheck(SessionState.LOCKED);
        }
      }
      if (status.hasAnalyses()) {
        log.error("initialize: encrypted records exist but no salt is stored; encryption disabled");
        synchronized (stateLock) {
          return commitCheck(SessionState.ERROR);
        }
      }
      synchronized (stateLock) {
        return commitCheck(SessionState.NOT_SETUP);
      }
    } finally {
      operationLock.unlock();
    }
  }

  /**
   * First-time setup: generates a salt, derives the key, saves the salt to the backend and a
   * verification blob locally, then holds the key. The backend save happens first so a failure
   * leaves nothing behind locally.
   *
   * @param passphrase the new passphrase
   * @throws DataInconsistencyException   if the session is in {@link SessionState#ERROR}
   * @throws EncryptionAccessorException  if the salt could not be saved
   */
  public void setup(final String passphrase) {
    operationLock.lock();
    try {
      String currentUser;
      long startEpoch;
      synchronized (stateLock) {
        requireInitialized();
        if (state == SessionState.ERROR) {
          throw inconsistent();
        }
        if (state != SessionState.NOT_SETUP) {
          throw new IllegalStateException("Encryption is already set up");
        }
        currentUser = userId;
        startEpoch = epoch;
      }
      log.debug("setup: deriving key");

      byte[] salt = keyDeriver.generateSalt();
      String encodedSalt = Base64.getEncoder().encodeToString(salt);
      EncryptionKey newKey = keyDeriver.derive(passphrase, salt, config.pbkdf2Iterations());
      try {
        accessor.saveSalt(new SaltRequest(encodedSalt));
        keyMaterialStore.store(currentUser, verifier.createVerificationBlob(currentUser, newKey));
        keyMaterialStore.storeSalt(currentUser, encodedSalt);
      } catch (RuntimeException e) {
        newKey.destroy();
        throw e;
      }
      commitKey(newKey, encodedSalt, startEpoch);
      log.info("setup: encryption set up and unlocked");
    } finally {
      operationLock.unlock();
    }
  }

  /**
   * Unlocks with the passphrase. The backend's unlock-attempt status is checked first; an active
   * lockout fails without deriving. The salt comes from memory, the local store, or the backend
   * in that order.
   * <p>
   * A wrong passphrase always leaves the session LOCKED. This includes a session that was already
   * UNLOCKED: the key it held is destroyed, so a failed re-entry of the passphrase cannot be
   * followed by further use of the old key.
   *
   * @param passphrase the passphrase
   * @throws LockedOutException               if the backend reports an active lockout
   * @throws InvalidPassphraseException       if the passphrase does not open the user's data
   * @throws VerificationUnavailableException if the backend is needed but unreachable
   * @throws DataInconsistencyException       if no salt exists anywhere, or the session is in ERROR
   */
  public void unlock(final String passphrase) {
    operationLock.lock();
    try {
      String currentUser;
      String knownSalt;
      long startEpoch;
      synchronized (stateLock) {
        requireInitialized();
        if (state == SessionState.ERROR) {
          throw inconsistent();
        }
        if (state == SessionState.NOT_SETUP) {
          throw new IllegalStateException("Encryption is not set up");
        }
        currentUser = userId;
        knownSalt = saltBase64;
        startEpoch = epoch;
      }

      checkRemoteLockout();
      String encodedSalt = resolveSalt(currentUser, knownSalt);
      log.debug("unlock: deriving key");
      EncryptionKey candidate = keyDeriver.derive(passphrase, Base64.getDecoder().decode(encodedSalt),
          config.pbkdf2Iterations());
      try {
        verifier.verify(currentUser, candidate);
      } catch (InvalidPassphraseException e) {
        candidate.destroy();
        synchronized (stateLock) {
          if (epoch == startEpoch) {
            discardKey();
            state = SessionState.LOCKED;
          }
        }
        log.debug("unlock: passphrase rejected");
        throw e;
      } catch (RuntimeException e) {
        candidate.destroy();
        throw e;
      }
      commitKey(candidate, encodedSalt, startEpoch);
      log.info("unlock: session unlocked");
    } finally {
      operationLock.unlock();
    }
  }

  /**
   * Discards the key and returns an unlocked session to LOCKED. The local verification blob and
   * salt are kept, so the next unlock on this device is still checked against the blob, and the
   * next {@link #initialize(String)} re-evaluates setup from the local store. Any unlock still in
   * flight is invalidated.
   */
  public void lock() {
    synchronized (stateLock) {
      epoch++;
      discardKey();
      if (state == SessionState.UNLOCKED) {
        state = SessionState.LOCKED;
      }
      hasCheckedSetup = false;
    }
    log.debug("lock: session locked");
  }

  /**
   * Locks and additionally blanks this device's verification blob, keeping the cached salt. The
   * next unlock on this device has to be verified against the user's remote records again.
   */
  public void forgetDevice() {
    lock();
    String currentUser;
    synchronized (stateLock) {
      currentUser = userId;
    }
    if (currentUser != null) {
      keyMaterialStore.clear(currentUser);
      log.info("forgetDevice: local verification blob cleared");
    }
  }

  /**
   * Sign-out: locks and forgets the user, returning to {@link SessionState#UNINITIALIZED}.
   */
  public void teardown() {
    lock();
    synchronized (stateLock) {
      resetLocked();
    }
    log.debug("teardown: session reset");
  }

  /**
   * Encrypts a record with the session key.
   *
   * @param record the plaintext record
   * @return the encrypted record
   * @throws NotUnlockedException                                       if the session is not unlocked
   * @throws com.securebeacon.client.exceptions.MissingFieldsException if a mandatory field is absent
   */
  public EncryptedAnalysisRecord encryptData(final AnalysisRecord record) {
    synchronized (stateLock) {
      return recordCipher.encrypt(record, requireKey());
    }
  }

  /**
   * Decrypts a record with the session key.
   *
   * @param record the encrypted record
   * @return the plaintext record
   * @throws NotUnlockedException if the session is not unlocked
   */
  public AnalysisRecord decryptData(final EncryptedAnalysisRecord record) {
    synchronized (stateLock) {
      return recordCipher.decrypt(record, requireKey());
    }
  }

  /**
   * Reads the backend's encryption status for the current user and remembers any salt it reports.
   *
   * @return the encryption status
   */
  public EncryptionStatusResponse encryptionStatus() {
    EncryptionStatusResponse status = accessor.getEncryptionStatus();
    if (status.salt() != null) {
      synchronized (stateLock) {
        saltBase64 = status.salt();
      }
    }
    return status;
  }

  /**
   * Current state.
   *
   * @return the session state
   */
  public SessionState state() {
    synchronized (stateLock) {
      return state;
    }
  }

  public boolean isSetup() {
    SessionState current = state();
    return current == SessionState.LOCKED || current == SessionState.UNLOCKED;
  }

  public boolean isUnlocked() {
    return state() == SessionState.UNLOCKED;
  }

  /**
   * The salt known to this session.
   *
   * @return the base64-encoded salt, or empty if not yet known
   */
  public Optional<String> salt() {
    synchronized (stateLock) {
      return Optional.ofNullable(saltBase64);
    }
  }

  private void checkRemoteLockout() {
    UnlockAttemptsResponse attempts;
    try {
      attempts = accessor.getUnlockAttempts();
    } catch (EncryptionAccessorException e) {
      log.warn("unlock: unable to read unlock attempt status");
      throw new VerificationUnavailableException("Unable to check unlock attempts. Please try again.", e);
    }
    long now = clock.millis();
    if (attempts.lockedUntil() != null && attempts.lockedUntil() > now) {
      long remaining = (attempts.lockedUntil() - now + 999) / 1000;
      log.debug("unlock: locked out for {}s", remaining);
      throw new LockedOutException(remaining);
    }
  }

  private String resolveSalt(String currentUser, String knownSalt) {
    if (knownSalt != null) {
      return knownSalt;
    }
    Optional<String> local = keyMaterialStore.getSalt(currentUser);
    if (local.isPresent()) {
      return local.get();
    }
    EncryptionStatusResponse status;
    try {
      status = accessor.getEncryptionStatus();
    } catch (EncryptionAccessorException e) {
      log.warn("unlock: unable to fetch salt");
      throw new VerificationUnavailableException("Unable to fetch salt. Please try again.", e);
    }
    if (status.salt() == null || status.salt().isBlank()) {
      log.error("unlock: no salt found for a set-up session");
      throw new DataInconsistencyException("Salt not found. Please set up encryption first.");
    }
    keyMaterialStore.storeSalt(currentUser, status.salt());
    return status.salt();
  }

  private void commitKey(EncryptionKey newKey, String encodedSalt, long startEpoch) {
    synchronized (stateLock) {
      if (epoch != startEpoch) {
        newKey.destroy();
        throw new IllegalStateException("Session changed while the operation was in progress");
      }
      discardKey();
      key = newKey;
      saltBase64 = encodedSalt;
      state = SessionState.UNLOCKED;
      hasCheckedSetup = true;
    }
  }

  private SessionState commitCheck(SessionState next) {
    state = next;
    hasCheckedSetup = true;
    log.debug("initialize: state {}", next);
    return next;
  }

  private EncryptionKey requireKey() {
    if (state != SessionState.UNLOCKED || key == null) {
      throw new NotUnlockedException();
    }
    return key;
  }

  private void requireInitialized() {
    if (state == SessionState.UNINITIALIZED || userId == null) {
      throw new IllegalStateException("Session not initialized");
    }
  }

  private DataInconsistencyException inconsistent() {
    return new DataInconsistencyException(
        "Encrypted data exists but no salt was found. Encryption is disabled for this account.");
  }

  private void discardKey() {
    if (key != null) {
      key.destroy();
      key = null;
    }
  }

  private void resetLocked() {
    epoch++;
    discardKey();
    userId = null;
    saltBase64 = null;
    hasCheckedSetup = false;
    state = SessionState.UNINITIALIZED;
  }
}
