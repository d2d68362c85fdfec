package org.waabox.vecino.client;

import java.util.concurrent.CompletableFuture;

import org.waabox.vecino.channel.SyncChannel;

/**
 * Opens sync channels from a client to the server.
 *
 * <p>Implementations define the wire transport, for example WebSocket.
 * Each call to {@link #connect(SyncTransportListener)} opens one new
 * connection; the client agent calls it again after every disconnection.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SyncTransport {

  /**
   * Opens a new channel to the server.
   *
   * <p>Events received on the channel, its closing and its failures are
   * reported to the given listener, possibly before the returned future
   * completes.
   *
   * @param listener the receiver of channel callbacks, never null
   * @return a future with the open channel, or failed with a
   *         {@link org.waabox.vecino.TransportException} when the server
   *         cannot be reached, never null
   */
  CompletableFuture<SyncChannel> connect(SyncTransportListener listener);
}
