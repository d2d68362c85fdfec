package org.waabox.vecino.client.websocket;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vecino.TransportException;
import org.waabox.vecino.channel.SyncChannel;
import org.waabox.vecino.client.SyncTransport;
import org.waabox.vecino.client.SyncTransportListener;

/**
 * A {@link SyncTransport} over WebSocket, built on the JDK
 * {@code java.net.http} client.
 *
 * <p>Every event travels as one text message holding its JSON frame. Each
 * {@link #connect(SyncTransportListener)} opens a new WebSocket; the client
 * agent calls it again after every disconnection.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class WebSocketSyncTransport implements SyncTransport {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      WebSocketSyncTransport.class);

  /** The server endpoint, never null. */
  private final URI uri;

  /** The HTTP client opening the connections, never null. */
  private final HttpClient httpClient;

  /**
   * Creates a new transport.
   *
   * @param config the transport configuration, never null
   */
  public WebSocketSyncTransport(final WebSocketTransportConfig config) {
    Objects.requireNonNull(config, "config must not be null");
    uri = config.uri();
    httpClient = config.httpClient().orElseGet(HttpClient::newHttpClient);
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<SyncChannel> connect(
      final SyncTransportListener listener) {
    Objects.requireNonNull(listener, "listener must not be null");

    log.debug("Opening WebSocket to {}", uri);

    final CompletableFuture<SyncChannel> result = new CompletableFuture<>();
    try {
      httpClient.newWebSocketBuilder()
          .buildAsync(uri, new FrameListener(listener))
          .whenComplete((webSocket, error) -> {
            if (error != null) {
              result.completeExceptionally(new TransportException(
                  "Failed to connect to " + uri, unwrap(error)));
            } else {
              final WebSocketSyncChannel channel =
                  new WebSocketSyncChannel(webSocket);
              if (result.complete(channel)) {
                log.info("Opened WebSocket {} to {}", channel.id(), uri);
              } else {
                log.info("Closing WebSocket {} to {}, nobody waits for it",
                    channel.id(), uri);
                channel.close();
              }
            }
          });
    } catch (final RuntimeException e) {
      result.completeExceptionally(new TransportException(
          "Failed to connect to " + uri, e));
    }
    return result;
  }

  /**
   * Returns the server endpoint.
   *
   * @return the endpoint, never null
   */
  public URI uri() {
    return uri;
  }

  /** Strips the completion wrapper of an async failure.
   *
   * @param error the failure, never null.
   * @return the underlying cause, never null.
   */
  static Throwable unwrap(final Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
