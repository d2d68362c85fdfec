package org.waabox.vecino.client;

import org.waabox.vecino.event.SyncEvent;

/**
 * Receives the callbacks of one client channel.
 *
 * <p>Transports invoke these methods from their own threads.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SyncTransportListener {

  /**
   * Called for every event decoded from the channel.
   *
   * @param event the received event, never null
   */
  void onEvent(SyncEvent event);

  /**
   * Called once when the channel is closed by either side.
   *
   * @param reason a description of the closing, never null
   */
  void onClosed(String reason);

  /**
   * Called once when the channel fails.
   *
   * @param error the failure, never null
   */
  void onError(Throwable error);
}
