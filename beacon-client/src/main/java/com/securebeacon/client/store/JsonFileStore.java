package com.securebeacon.client.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.securebeacon.client.exceptions.LocalStoreException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One JSON document per user in a directory.
 * <p>
 * File names are the URL-safe base64 of the user id, so arbitrary identity strings map to safe
 * names; ids too long for that are named by their SHA-256 digest instead. Writes go to a temporary file that is then moved over the target, so a reader never sees
 * a half-written document. Read-modify-write cycles for one user are serialized within this
 * process; across processes the last write wins.
 *
 * @param <T> the document type
 */
public class JsonFileStore<T> {

  private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);
  private static final Base64.Encoder FILE_NAME_ENCODER = Base64.getUrlEncoder().withoutPadding();
  // Leaves room for the suffix and temp-file decoration within a 255-byte file name.
  static final int MAX_ENCODED_NAME_LENGTH = 200;
  private static final String HASHED_NAME_PREFIX = "sha256-";

  private final Path directory;
  private final ObjectMapper objectMapper;
  private final Class<T> type;
  private final String suffix;
  private final ConcurrentHashMap<String, Object> userLocks = new ConcurrentHashMap<>();

  /**
   * Instantiates a new Json file store, creating the directory if needed.
   *
   * @param directory    the directory holding the documents
   * @param objectMapper the object mapper
   * @param type         the document type
   * @param suffix       file name suffix, e.g. {@code .json}
   */
  public JsonFileStore(final Path directory, final ObjectMapper objectMapper,
                       final Class<T> type, final String suffix) {
    this.directory = directory;
    this.objectMapper = objectMapper;
    this.type = type;
    this.suffix = suffix;
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new LocalStoreException("Unable to create store directory " + directory, e);
    }
  }

  /**
   * Reads the user's document.
   *
   * @param userId the user id
   * @return the document, or empty if none exists
   */
  public Optional<T> read(String userId) {
    Path file = fileFor(userId);
    try {
      byte[] content = Files.readAllBytes(file);
      return Optional.of(objectMapper.readValue(content, type));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new LocalStoreException("Unable to read " + file.getFileName(), e);
    }
  }

  /**
   * Applies {@code update} to the current document and writes the result. A null result deletes
   * the document.
   *
   * @param userId the user id
   * @param update maps the current document (possibly empty) to the new one
   */
  public void update(String userId, UnaryOperator<Optional<T>> update) {
    synchronized (userLocks.computeIfAbsent(userId, k -> new Object())) {
      Optional<T> next = update.apply(read(userId));
      if (next == null || next.isEmpty()) {
        delete(userId);
      } else {
        write(userId, next.get());
      }
    }
  }

  /**
   * Writes the user's document, replacing any existing one.
   *
   * @param userId the user id
   * @param value  the document
   */
  public void write(String userId, T value) {
    Path file = fileFor(userId);
    Path temp = null;
    try {
      temp = Files.createTempFile(directory, ".tmp-", suffix);
      Files.writeString(temp, objectMapper.writeValueAsString(value), StandardCharsets.UTF_8);
      try {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
      log.trace("Wrote {}", file.getFileName());
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new LocalStoreException("Unable to write " + file.getFileName(), e);
    }
  }

  /**
   * Deletes the user's document if present.
   *
   * @param userId the user id
   */
  public void delete(String userId) {
    Path file = fileFor(userId);
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      throw new LocalStoreException("Unable to delete " + file.getFileName(), e);
    }
  }

  private Path fileFor(String userId) {
    if (userId == null || userId.isEmpty()) {
      throw new IllegalArgumentException("userId must not be empty");
    }
    return directory.resolve(fileNameFor(userId) + suffix);
  }

  /**
   * Base file name for a user id, without the suffix. Ids whose encoding would exceed
   * {@link #MAX_ENCODED_NAME_LENGTH} are replaced by {@code sha256-} and the hex digest of the id.
   *
   * @param userId the user id
   * @return the base file name
   */
  static String fileNameFor(String userId) {
    byte[] idBytes = userId.getBytes(StandardCharsets.UTF_8);
    String encoded = FILE_NAME_ENCODER.encodeToString(idBytes);
    if (encoded.length() <= MAX_ENCODED_NAME_LENGTH) {
      return encoded;
    }
    SHA256Digest digest = new SHA256Digest();
    digest.update(idBytes, 0, idBytes.length);
    byte[] hash = new byte[digest.getDigestSize()];
    digest.doFinal(hash, 0);
    return HASHED_NAME_PREFIX + Hex.toHexString(hash);
  }

  private void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Unable to remove temporary file {}", temp.getFileName(), e);
    }
  }
}
