package com.securebeacon.client.accessor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.securebeacon.client.exceptions.EncryptionAccessorException;
import com.securebeacon.client.model.ServerConnectionInfo;
import com.securebeacon.model.analysis.AnalysisPage;
import com.securebeacon.model.encryption.EncryptionStatusResponse;
import com.securebeacon.model.encryption.SaltRequest;
import com.securebeacon.model.encryption.UnlockAttemptRequest;
import com.securebeacon.model.encryption.UnlockAttemptsResponse;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the encryption endpoints of the SecureBeacon backend.
 * <p>
 * Handles request serialization, bearer authentication, HTTP dispatch, status-code checking, and
 * response deserialization. The {@code endpoint} in {@link ServerConnectionInfo} is the
 * <em>base URL</em> of the backend; API paths are appended per call.
 * <p>
 * A 401 response from any endpoint is surfaced as a {@link SecurityException}.
 * Other error statuses, I/O errors and interruptions are wrapped in
 * {@link EncryptionAccessorException}.
 */
@Singleton
public class HttpEncryptionAccessor implements EncryptionAccessor {

  private static final Logger log = LoggerFactory.getLogger(HttpEncryptionAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ServerConnectionInfo connectionInfo;
  private final AccessTokenProvider accessTokenProvider;

  /**
   * Instantiates a new Http encryption accessor.
   *
   * @param httpClient          the http client
   * @param objectMapper        the object mapper
   * @param connectionInfo      the backend connection info
   * @param accessTokenProvider source of the bearer credential
   */
  @Inject
  public HttpEncryptionAccessor(final HttpClient httpClient,
                                final ObjectMapper objectMapper,
                                final ServerConnectionInfo connectionInfo,
                                final AccessTokenProvider accessTokenProvider) {
    log.info("HttpEncryptionAccessor({})", connectionInfo.endpoint());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.connectionInfo = connectionInfo;
    this.accessTokenProvider = accessTokenProvider;
  }

  // ── Encryption setup ──────────────────────────────────────────────────────

  @Override
  public EncryptionStatusResponse getEncryptionStatus() {
    log.debug("getEncryptionStatus()");
    return get(resolve("/api/encryption/status"), EncryptionStatusResponse.class);
  }

  @Override
  public void saveSalt(final SaltRequest request) {
    log.debug("saveSalt()");
    post(resolve("/api/encryption/salt"), request, null);
  }

  // ── Records ───────────────────────────────────────────────────────────────

  @Override
  public AnalysisPage listAnalyses(final int limit) {
    log.debug("listAnalyses(limit={})", limit);
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive: " + limit);
    }
    return get(resolve("/api/analyses?limit=" + limit), AnalysisPage.class);
  }

  // ── Unlock attempts ───────────────────────────────────────────────────────

  @Override
  public UnlockAttemptsResponse getUnlockAttempts() {
    log.debug("getUnlockAttempts()");
    return get(resolve("/api/encryption/unlock-attempts"), UnlockAttemptsResponse.class);
  }

  @Override
  public UnlockAttemptsResponse recordUnlockAttempt(final UnlockAttemptRequest request) {
    log.debug("recordUnlockAttempt(success={})", request.success());
    return post(resolve("/api/encryption/unlock-attempts"), request, UnlockAttemptsResponse.class);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private URI resolve(String pathAndQuery) {
    URI base = connectionInfo.endpoint();
    String basePath = base.getPath() == null ? "" : base.getPath();
    if (basePath.endsWith("/")) {
      basePath = basePath.substring(0, basePath.length() - 1);
    }
    return base.resolve(basePath + pathAndQuery);
  }

  private HttpRequest.Builder authorized(URI uri) {
    return HttpRequest.newBuilder()
        .uri(uri)
        .timeout(connectionInfo.requestTimeout())
        .header("Accept", "application/json")
        .header("Authorization", "Bearer " + accessTokenProvider.accessToken());
  }

  private <T> T get(URI uri, Class<T> responseType) {
    return send(authorized(uri).GET().build(), responseType);
  }

  private <T> T post(URI uri, Object body, Class<T> responseType) {
    try {
      String requestBody = objectMapper.writeValueAsString(body);
      HttpRequest request = authorized(uri)
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(requestBody))
          .build();
      return send(request, responseType);
    } catch (IOException e) {
      throw new EncryptionAccessorException("Unable to serialize request for " + uri.getPath(), e);
    }
  }

  private <T> T send(HttpRequest request, Class<T> responseType) {
    String path = request.uri().getPath();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(path, response.statusCode());
      if (responseType == null) {
        return null;
      }
      return objectMapper.readValue(response.body(), responseType);
    } catch (IOException e) {
      throw new EncryptionAccessorException("HTTP request failed for " + path, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EncryptionAccessorException("HTTP request interrupted for " + path, e);
    }
  }

  private void checkStatus(String path, int statusCode) {
    if (statusCode == 401) {
      throw new SecurityException("Backend rejected credential (401) for " + path);
    }
    if (statusCode >= 400) {
      throw new EncryptionAccessorException("Backend returned HTTP " + statusCode + " for " + path, null);
    }
  }
}
