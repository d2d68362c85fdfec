package org.waabox.vecino.client;

import java.util.List;
import java.util.Objects;

/**
 * A {@link QueueStorage} that keeps the queue in memory only.
 *
 * <p>Queued intents survive disconnections but not process restarts.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryQueueStorage implements QueueStorage {

  /** The last stored content. */
  private volatile List<MutationIntent> intents = List.of();

  /** {@inheritDoc} */
  @Override
  public List<MutationIntent> load() {
    return intents;
  }

  /** {@inheritDoc} */
  @Override
  public void store(final List<MutationIntent> theIntents) {
    Objects.requireNonNull(theIntents, "intents must not be null");
    intents = List.copyOf(theIntents);
  }
}
