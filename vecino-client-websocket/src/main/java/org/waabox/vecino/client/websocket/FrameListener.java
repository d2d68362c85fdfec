package org.waabox.vecino.client.websocket;

import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vecino.client.SyncTransportListener;
import org.waabox.vecino.event.SyncEvent;
import org.waabox.vecino.event.SyncEventCodec;

/**
 * Decodes the text messages of one WebSocket into sync events.
 *
 * <p>A message may arrive split in several parts; the parts are joined
 * before decoding. Messages that do not decode are logged and dropped.
 * The listener requests one message at a time.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class FrameListener implements WebSocket.Listener {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      FrameListener.class);

  /** The receiver of the decoded events, never null. */
  private final SyncTransportListener listener;

  /** The parts of the message being received. */
  private final StringBuilder message = new StringBuilder();

  /** Creates a new frame listener.
   *
   * @param theListener the receiver of the decoded events, never null.
   */
  FrameListener(final SyncTransportListener theListener) {
    listener = theListener;
  }

  @Override
  public void onOpen(final WebSocket webSocket) {
    webSocket.request(1);
  }

  @Override
  public CompletionStage<?> onText(final WebSocket webSocket,
      final CharSequence data, final boolean last) {
    message.append(data);
    if (last) {
      final String frame = message.toString();
      message.setLength(0);
      dispatch(frame);
    }
    webSocket.request(1);
    return null;
  }

  @Override
  public CompletionStage<?> onBinary(final WebSocket webSocket,
      final ByteBuffer data, final boolean last) {
    log.warn("Dropping binary message of {} byte(s)", data.remaining());
    webSocket.request(1);
    return null;
  }

  @Override
  public CompletionStage<?> onClose(final WebSocket webSocket,
      final int statusCode, final String reason) {
    final String description = reason == null || reason.isEmpty()
        ? "closed with status " + statusCode
        : "closed with status " + statusCode + ": " + reason;
    log.debug("WebSocket {}", description);
    listener.onClosed(description);
    return null;
  }

  @Override
  public void onError(final WebSocket webSocket, final Throwable error) {
    log.debug("WebSocket failed: {}", error.getMessage());
    listener.onError(error);
  }

  /** Decodes a complete message and hands it to the listener.
   *
   * @param frame the message text.
   */
  private void dispatch(final String frame) {
    final SyncEvent event;
    try {
      event = SyncEventCodec.decode(frame);
    } catch (final IllegalArgumentException e) {
      log.warn("Dropping malformed message: {}", e.getMessage());
      return;
    }
    try {
      listener.onEvent(event);
    } catch (final RuntimeException e) {
      log.error("Listener failed handling '{}': {}", event.name(),
          e.getMessage(), e);
    }
  }
}
