package com.securebeacon.model.encryption;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class EncryptionWireRecordsTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void statusResponse_missingFields_defaultToFalseAndNull() throws Exception {
    EncryptionStatusResponse status = mapper.readValue("{\"hasSalt\":true}", EncryptionStatusResponse.class);

    assertThat(status.hasSalt()).isTrue();
    assertThat(status.hasAnalyses()).isFalse();
    assertThat(status.salt()).isNull();
  }

  @Test
  void statusResponse_empty() {
    assertThat(EncryptionStatusResponse.empty()).isEqualTo(new EncryptionStatusResponse(false, false, null));
  }

  @Test
  void unlockAttempts_nullLockedUntil() throws Exception {
    UnlockAttemptsResponse response = mapper.readValue("{\"attempts\":2,\"lockedUntil\":null}",
        UnlockAttemptsResponse.class);

    assertThat(response.attempts()).isEqualTo(2);
    assertThat(response.lockedUntil()).isNull();
  }

  @Test
  void requests_serializeAsExpected() throws Exception {
    assertThat(mapper.writeValueAsString(new SaltRequest("c2FsdA=="))).isEqualTo("{\"salt\":\"c2FsdA==\"}");
    assertThat(mapper.writeValueAsString(new UnlockAttemptRequest(false))).isEqualTo("{\"success\":false}");
  }
}
