package org.waabox.vecino.client;

/**
 * The connection state of a client agent.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ConnectionStatus {

  /** No channel and no connection attempt in progress. */
  DISCONNECTED,

  /** A connection attempt is in progress. */
  CONNECTING,

  /** The channel is open. */
  CONNECTED,

  /** The last connection attempt or the channel failed. */
  ERROR
}
