package org.waabox.vecino.spring;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.waabox.vecino.event.SyncEvent;
import org.waabox.vecino.event.SyncEventCodec;
import org.waabox.vecino.server.SyncCoordinator;

/**
 * Connects WebSocket sessions to the {@link SyncCoordinator}.
 *
 * <p>Each session becomes one {@link WebSocketSessionChannel}. Text
 * messages are decoded into sync events; a message that does not decode
 * is logged and dropped without closing the session.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class SyncWebSocketHandler extends TextWebSocketHandler {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      SyncWebSocketHandler.class);

  /** The coordinator, never null. */
  private final SyncCoordinator coordinator;

  /** The server settings, never null. */
  private final VecinoProperties properties;

  /** The channel of every open session, by session id. */
  private final Map<String, WebSocketSessionChannel> channels =
      new ConcurrentHashMap<>();

  /**
   * Creates a new handler.
   *
   * @param theCoordinator the coordinator, never null
   * @param theProperties the server settings, never null
   */
  public SyncWebSocketHandler(final SyncCoordinator theCoordinator,
      final VecinoProperties theProperties) {
    Objects.requireNonNull(theCoordinator, "coordinator must not be null");
    Objects.requireNonNull(theProperties, "properties must not be null");
    coordinator = theCoordinator;
    properties = theProperties;
  }

  @Override
  public void afterConnectionEstablished(final WebSocketSession session) {
    session.setTextMessageSizeLimit(properties.getMaxTextMessageSize());
    final WebSocketSessionChannel channel = new WebSocketSessionChannel(
        session, (int) properties.getSendTimeLimit().toMillis(),
        properties.getSendBufferSizeLimit());
    channels.put(session.getId(), channel);
    log.debug("WebSocket session {} opened from {}", session.getId(),
        session.getRemoteAddress());
    coordinator.connect(channel);
  }

  @Override
  protected void handleTextMessage(final WebSocketSession session,
      final TextMessage message) {
    final WebSocketSessionChannel channel = channels.get(session.getId());
    if (channel == null) {
      log.debug("Ignoring message from unknown session {}", session.getId());
      return;
    }
    final SyncEvent event;
    try {
      event = SyncEventCodec.decode(message.getPayload());
    } catch (final IllegalArgumentException e) {
      log.warn("Dropping malformed message from session {}: {}",
          session.getId(), e.getMessage());
      return;
    }
    coordinator.handle(channel, event);
  }

  @Override
  public void handleTransportError(final WebSocketSession session,
      final Throwable exception) {
    log.debug("Transport error on session {}: {}", session.getId(),
        exception.getMessage());
  }

  @Override
  public void afterConnectionClosed(final WebSocketSession session,
      final CloseStatus status) {
    final WebSocketSessionChannel channel = channels.remove(session.getId());
    log.debug("WebSocket session {} closed: {}", session.getId(), status);
    if (channel != null) {
      coordinator.disconnect(channel);
    }
  }
}
