package org.waabox.vecino.client.websocket;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for the WebSocket client transport.
 *
 * <p>Holds the server endpoint and an optional pre-built
 * {@link HttpClient}. When no client is given, the transport creates one
 * with the JDK defaults.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class WebSocketTransportConfig {

  /** The server endpoint, never null. */
  private final URI uri;

  /** The HTTP client opening the connections, may be null. */
  private final HttpClient httpClient;

  /** Creates a new config.
   *
   * @param theUri the endpoint, never null.
   * @param theHttpClient the client, may be null.
   */
  private WebSocketTransportConfig(final URI theUri,
      final HttpClient theHttpClient) {
    uri = theUri;
    httpClient = theHttpClient;
  }

  /**
   * Creates a config for the given endpoint.
   *
   * @param uri the server endpoint, for example
   *            {@code ws://localhost:3000/sync}, never null
   * @return a new config, never null
   *
   * @throws IllegalArgumentException if the scheme is not ws or wss
   */
  public static WebSocketTransportConfig create(final URI uri) {
    return create(uri, null);
  }

  /**
   * Creates a config for the given endpoint using the given client.
   *
   * @param uri the server endpoint, never null
   * @param httpClient the HTTP client, may be null for a default one
   * @return a new config, never null
   *
   * @throws IllegalArgumentException if the scheme is not ws or wss
   */
  public static WebSocketTransportConfig create(final URI uri,
      final HttpClient httpClient) {
    Objects.requireNonNull(uri, "uri must not be null");
    final String scheme = uri.getScheme();
    if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
      throw new IllegalArgumentException(
          "The endpoint must be a ws:// or wss:// URI: " + uri);
    }
    return new WebSocketTransportConfig(uri, httpClient);
  }

  /**
   * Returns the server endpoint.
   *
   * @return the endpoint, never null
   */
  public URI uri() {
    return uri;
  }

  /**
   * Returns the pre-built HTTP client.
   *
   * @return the client, or empty when the transport creates its own
   */
  public Optional<HttpClient> httpClient() {
    return Optional.ofNullable(httpClient);
  }
}
