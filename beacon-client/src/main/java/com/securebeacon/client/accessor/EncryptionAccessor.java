package com.securebeacon.client.accessor;

import com.securebeacon.model.analysis.AnalysisPage;
import com.securebeacon.model.encryption.EncryptionStatusResponse;
import com.securebeacon.model.encryption.SaltRequest;
import com.securebeacon.model.encryption.UnlockAttemptRequest;
import com.securebeacon.model.encryption.UnlockAttemptsResponse;

/**
 * Backend operations consumed by the encryption client. Every call acts on behalf of the user
 * identified by the current bearer credential.
 * <p>
 * Implementations throw {@link com.securebeacon.client.exceptions.EncryptionAccessorException}
 * on transport or server errors and {@link SecurityException} when the credential is rejected.
 */
public interface EncryptionAccessor {

  /**
   * Whether a salt and any analyses exist for the user.
   *
   * @return the encryption status
   */
  EncryptionStatusResponse getEncryptionStatus();

  /**
   * Stores the user's salt for cross-device recovery.
   *
   * @param request the salt
   */
  void saveSalt(SaltRequest request);

  /**
   * Lists the user's most recent encrypted analyses.
   *
   * @param limit maximum number of records
   * @return the page of records
   */
  AnalysisPage listAnalyses(int limit);

  /**
   * Reads the authoritative failed-unlock counter.
   *
   * @return the unlock attempt status
   */
  UnlockAttemptsResponse getUnlockAttempts();

  /**
   * Reports the outcome of an unlock attempt and returns the updated counter.
   *
   * @param request the outcome
   * @return the unlock attempt status after recording
   */
  UnlockAttemptsResponse recordUnlockAttempt(UnlockAttemptRequest request);
}
