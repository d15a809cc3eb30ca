package com.securebeacon.model.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AnalysisRecordJsonTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void mlResult_usesSnakeCaseKeys() throws Exception {
    String json = mapper.writeValueAsString(new MlResult(true, 0.97));

    assertThat(json).isEqualTo("{\"is_phishing\":true,\"phishing_probability\":0.97}");
    assertThat(mapper.readValue(json, MlResult.class)).isEqualTo(new MlResult(true, 0.97));
  }

  @Test
  void analysisRecord_readsBackendJson() throws Exception {
    String json = "{\"id\":\"a1\",\"userEmail\":\"alice@example.com\",\"inputContent\":\"hello\","
        + "\"analysisContext\":{\"source\":\"upload\"},"
        + "\"mlResult\":{\"is_phishing\":false,\"phishing_probability\":0.1},"
        + "\"inputType\":\"header\",\"createdAt\":\"2026-01-01T00:00:00Z\","
        + "\"updatedAt\":\"2026-01-01T00:00:00Z\",\"userSub\":\"auth0|1\"}";

    AnalysisRecord record = mapper.readValue(json, AnalysisRecord.class);

    assertThat(record.id()).isEqualTo("a1");
    assertThat(record.analysisContext()).isEqualTo(Map.of("source", "upload"));
    assertThat(record.mlResult().phishing()).isFalse();
  }

  @Test
  void encryptedRecord_ignoresUnknownFields() throws Exception {
    String json = "{\"id\":\"a1\",\"userEmail\":\"x\",\"inputContent\":\"y\",\"analysisContext\":null,"
        + "\"mlResult\":\"z\",\"inputType\":\"file\",\"createdAt\":\"c\",\"updatedAt\":\"u\",\"userSub\":\"s\"}";

    EncryptedAnalysisRecord record = mapper.readValue(json, EncryptedAnalysisRecord.class);

    assertThat(record.inputType()).isEqualTo("file");
    assertThat(record.analysisContext()).isNull();
  }

  @Test
  void analysisPage_missingItems_isEmpty() throws Exception {
    assertThat(mapper.readValue("{}", AnalysisPage.class).items()).isEmpty();
    assertThat(mapper.readValue("{\"items\":null,\"total\":0}", AnalysisPage.class).items()).isEmpty();
  }
}
