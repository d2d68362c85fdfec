package org.waabox.vecino.client.websocket;

import java.net.http.WebSocket;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vecino.TransportException;
import org.waabox.vecino.channel.SyncChannel;
import org.waabox.vecino.event.SyncEvent;
import org.waabox.vecino.event.SyncEventCodec;

/**
 * A client {@link SyncChannel} over a JDK {@link WebSocket}.
 *
 * <p>The JDK WebSocket accepts one outstanding text message at a time, so
 * each send waits for the previous one to complete. Sends are delivered in
 * call order.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class WebSocketSyncChannel implements SyncChannel {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      WebSocketSyncChannel.class);

  /** The channel id, never null. */
  private final String id = "ws-" + UUID.randomUUID();

  /** The underlying WebSocket, never null. */
  private final WebSocket webSocket;

  /** Completes when the last requested send is done, guarded by this. */
  private CompletableFuture<Void> lastSend =
      CompletableFuture.completedFuture(null);

  /** Creates a new channel.
   *
   * @param theWebSocket the open WebSocket, never null.
   */
  WebSocketSyncChannel(final WebSocket theWebSocket) {
    webSocket = Objects.requireNonNull(theWebSocket,
        "webSocket must not be null");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public CompletableFuture<Void> send(final SyncEvent event) {
    Objects.requireNonNull(event, "event must not be null");

    final String frame = SyncEventCodec.encode(event);
    final CompletableFuture<Void> sent = new CompletableFuture<>();
    synchronized (this) {
      if (!isOpen()) {
        return CompletableFuture.failedFuture(
            new TransportException("Channel " + id + " is closed"));
      }
      final CompletableFuture<Void> previous = lastSend;
      lastSend = sent;
      previous.whenComplete((ignored, error) -> sendText(frame, sent));
    }
    return sent;
  }

  @Override
  public boolean isOpen() {
    return !webSocket.isOutputClosed() && !webSocket.isInputClosed();
  }

  @Override
  public void close() {
    if (webSocket.isOutputClosed()) {
      return;
    }
    log.debug("Closing channel {}", id);
    try {
      webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "client closing")
          .whenComplete((ignored, error) -> {
            if (error != null) {
              webSocket.abort();
            }
          });
    } catch (final RuntimeException e) {
      log.debug("Aborting channel {}: {}", id, e.getMessage());
      webSocket.abort();
    }
  }

  /** Writes one text message and completes the given future.
   *
   * @param frame the message text.
   * @param sent the future to complete.
   */
  private void sendText(final String frame,
      final CompletableFuture<Void> sent) {
    try {
      webSocket.sendText(frame, true).whenComplete((ignored, error) -> {
        if (error != null) {
          sent.completeExceptionally(new TransportException(
              "Failed to send on channel " + id,
              WebSocketSyncTransport.unwrap(error)));
        } else {
          sent.complete(null);
        }
      });
    } catch (final RuntimeException e) {
      sent.completeExceptionally(new TransportException(
          "Failed to send on channel " + id, e));
    }
  }
}
