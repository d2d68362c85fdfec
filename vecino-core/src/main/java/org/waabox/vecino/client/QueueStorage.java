package org.waabox.vecino.client;

import java.util.List;

/**
 * Durable storage for the offline queue.
 *
 * <p>The queue calls {@link #store(List)} with its whole content after
 * every change. Implementations signal failures by throwing
 * {@link org.waabox.vecino.PersistenceException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface QueueStorage {

  /**
   * Loads the stored intents.
   *
   * @return the intents in queue order, never null, empty when nothing
   *         was stored
   */
  List<MutationIntent> load();

  /**
   * Replaces the stored intents.
   *
   * @param intents the whole queue content, never null
   */
  void store(List<MutationIntent> intents);
}
