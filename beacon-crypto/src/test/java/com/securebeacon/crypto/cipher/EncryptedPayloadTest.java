package com.securebeacon.crypto.cipher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class EncryptedPayloadTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void jsonUsesCiphertextAndIvKeys() throws Exception {
    EncryptedPayload payload = new EncryptedPayload(new byte[]{1, 2, 3}, new byte[]{4, 5, 6});

    String json = mapper.writeValueAsString(payload);

    assertThat(json).isEqualTo("{\"ciphertext\":\"AQID\",\"iv\":\"BAUG\"}");
    EncryptedPayload restored = mapper.readValue(json, EncryptedPayload.class);
    assertThat(restored.ciphertext()).containsExactly(1, 2, 3);
    assertThat(restored.nonce()).containsExactly(4, 5, 6);
  }

  @Test
  void nullField_throwsIAE() {
    EncryptedPayload payload = new EncryptedPayload(null, "AQID");
    assertThatThrownBy(payload::ciphertext)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Missing required field");
  }

  @Test
  void invalidBase64_throwsIAE() {
    EncryptedPayload payload = new EncryptedPayload("AQID", "not base64!");
    assertThatThrownBy(payload::nonce)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid base64");
  }
}
