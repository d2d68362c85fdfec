package org.waabox.vecino.spring;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.waabox.vecino.TransportException;
import org.waabox.vecino.channel.SyncChannel;
import org.waabox.vecino.event.SyncEvent;
import org.waabox.vecino.event.SyncEventCodec;

/**
 * A server {@link SyncChannel} over a Spring {@link WebSocketSession}.
 *
 * <p>Sends go through a {@link ConcurrentWebSocketSessionDecorator}, so
 * any thread may send. A client that cannot keep up within the configured
 * time and buffer limits is disconnected.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class WebSocketSessionChannel implements SyncChannel {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      WebSocketSessionChannel.class);

  /** The thread-safe session, never null. */
  private final WebSocketSession session;

  /** Creates a new channel.
   *
   * @param theSession the raw session, never null.
   * @param sendTimeLimitMillis the longest a send may block.
   * @param bufferSizeLimit the most bytes buffered for a slow client.
   */
  WebSocketSessionChannel(final WebSocketSession theSession,
      final int sendTimeLimitMillis, final int bufferSizeLimit) {
    Objects.requireNonNull(theSession, "session must not be null");
    session = new ConcurrentWebSocketSessionDecorator(theSession,
        sendTimeLimitMillis, bufferSizeLimit);
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public CompletableFuture<Void> send(final SyncEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    if (!session.isOpen()) {
      return CompletableFuture.failedFuture(
          new TransportException("Session " + id() + " is closed"));
    }
    try {
      session.sendMessage(new TextMessage(SyncEventCodec.encode(event)));
      return CompletableFuture.completedFuture(null);
    } catch (final IOException | RuntimeException e) {
      return CompletableFuture.failedFuture(new TransportException(
          "Failed to send '" + event.name() + "' to session " + id(), e));
    }
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  @Override
  public void close() {
    try {
      session.close(CloseStatus.GOING_AWAY);
    } catch (final IOException e) {
      log.debug("Failed to close session {}: {}", id(), e.getMessage());
    }
  }
}
