package com.securebeacon.client.model;

import java.net.URI;
import java.time.Duration;

/**
 * Network connection details for the SecureBeacon backend.
 *
 * @param endpoint       base URL of the backend (e.g. https://api.example.com); API paths are appended
 * @param requestTimeout per-request timeout
 */
public record ServerConnectionInfo(URI endpoint, Duration requestTimeout) {

  /**
   * Default per-request timeout.
   */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /**
   * Instantiates connection info with the default timeout.
   *
   * @param endpoint the endpoint
   */
  public ServerConnectionInfo(URI endpoint) {
    this(endpoint, DEFAULT_TIMEOUT);
  }
}
