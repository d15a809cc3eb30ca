package com.securebeacon.client.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.securebeacon.client.exceptions.LocalStoreException;
import com.securebeacon.client.testing.MutableClock;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileKeyMaterialStoreTest {

  private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

  @TempDir Path dir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private MutableClock clock;
  private FileKeyMaterialStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    store = new FileKeyMaterialStore(dir, objectMapper, clock);
  }

  @Test
  void store_survivesNewInstance() {
    store.store("auth0|abc/def", "blob-a");
    store.storeSalt("auth0|abc/def", "c2FsdA==");

    FileKeyMaterialStore reopened = new FileKeyMaterialStore(dir, objectMapper, clock);

    assertThat(reopened.get("auth0|abc/def")).contains("blob-a");
    assertThat(reopened.getSalt("auth0|abc/def")).contains("c2FsdA==");
  }

  @Test
  void store_writesDocumentWithTimestamps() throws IOException {
    store.store("user-1", "blob-a");
    clock.advance(Duration.ofMinutes(5));
    store.store("user-1", "blob-b");

    JsonNode document = objectMapper.readTree(singleFile().toFile());
    assertThat(document.get("userId").asText()).isEqualTo("user-1");
    assertThat(document.get("encryptedVerificationBlob").asText()).isEqualTo("blob-b");
    assertThat(document.get("createdAt").asText()).isEqualTo("2024-05-01T10:00:00Z");
    assertThat(document.get("updatedAt").asText()).isEqualTo("2024-05-01T10:05:00Z");
  }

  @Test
  void clear_keepsRecordAndSalt() {
    store.storeSalt("user-1", "c2FsdA==");
    store.store("user-1", "blob-a");

    store.clear("user-1");

    assertThat(store.has("user-1")).isFalse();
    assertThat(store.getSalt("user-1")).contains("c2FsdA==");
  }

  @Test
  void get_unknownUser_isEmpty() {
    assertThat(store.get("user-1")).isEmpty();
    assertThat(store.getSalt("user-1")).isEmpty();
  }

  @Test
  void get_corruptDocument_throwsLocalStoreException() throws IOException {
    store.store("user-1", "blob-a");
    Files.writeString(singleFile(), "{not json");

    assertThatThrownBy(() -> store.get("user-1"))
        .isInstanceOf(LocalStoreException.class);
  }

  @Test
  void store_leavesNoTemporaryFiles() throws IOException {
    store.store("user-1", "blob-a");
    store.store("user-2", "blob-b");

    try (Stream<Path> files = Files.list(dir)) {
      List<String> names = files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
      assertThat(names).hasSize(2).allMatch(n -> n.endsWith(".keys.json"));
    }
  }

  @Test
  void store_veryLongUserId_usesHashedFileName() throws IOException {
    String longId = "federated|" + "x".repeat(1_000);

    store.store(longId, "blob-a");

    assertThat(store.get(longId)).contains("blob-a");
    String name = singleFile().getFileName().toString();
    assertThat(name).startsWith("sha256-").endsWith(".keys.json");
    assertThat(name.length()).isLessThan(255);
  }

  @Test
  void fileNameFor_distinctLongIds_getDistinctNames() {
    String first = JsonFileStore.fileNameFor("a".repeat(500));
    String second = JsonFileStore.fileNameFor("b".repeat(500));

    assertThat(first).isNotEqualTo(second);
    assertThat(JsonFileStore.fileNameFor("user-1")).isEqualTo("dXNlci0x");
  }

  private Path singleFile() throws IOException {
    try (Stream<Path> files = Files.list(dir)) {
      return files.findFirst().orElseThrow();
    }
  }
}
