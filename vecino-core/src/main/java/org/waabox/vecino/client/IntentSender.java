package org.waabox.vecino.client;

import java.util.concurrent.CompletableFuture;

/**
 * Delivers one queued intent to the server.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface IntentSender {

  /**
   * Sends the event that replays the given intent.
   *
   * @param intent the intent to deliver, never null
   * @return a future completed once the event was sent, or failed if it
   *         could not be sent, never null
   */
  CompletableFuture<Void> send(MutationIntent intent);
}
