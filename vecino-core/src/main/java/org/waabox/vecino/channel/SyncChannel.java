package org.waabox.vecino.channel;

import java.util.concurrent.CompletableFuture;

import org.waabox.vecino.event.SyncEvent;

/**
 * A bidirectional, ordered, per-connection message channel between one
 * client and the server.
 *
 * <p>On the server each connected client is one channel; on a client the
 * channel is its connection to the server. Implementations must be safe to
 * call from multiple threads and must deliver the events of consecutive
 * {@link #send(SyncEvent)} calls in call order.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SyncChannel {

  /**
   * Returns an identifier for this channel, used in log messages.
   *
   * @return the channel id, never null
   */
  String id();

  /**
   * Sends an event over the channel.
   *
   * <p>The returned future completes when the event has been handed to the
   * underlying connection, or completes exceptionally with a
   * {@link org.waabox.vecino.TransportException} when the channel is closed
   * or the send failed. This method never throws for transport failures.
   *
   * @param event the event to send, never null
   * @return a future completed once the event is sent, never null
   */
  CompletableFuture<Void> send(SyncEvent event);

  /**
   * Checks whether the channel can still send events.
   *
   * @return true if the channel is open
   */
  boolean isOpen();

  /**
   * Closes the channel. Closing an already closed channel has no effect.
   */
  void close();
}
