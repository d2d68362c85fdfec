package org.waabox.vecino.server;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts the open client channels.
 *
 * <p>The count starts at zero and never goes below it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PresenceTracker {

  /** The number of open channels. */
  private final AtomicInteger count = new AtomicInteger();

  /**
   * Records a newly connected channel.
   *
   * @return the updated count
   */
  public int connected() {
    return count.incrementAndGet();
  }

  /**
   * Records a disconnected channel.
   *
   * @return the updated count, never negative
   */
  public int disconnected() {
    return count.updateAndGet(current -> Math.max(0, current - 1));
  }

  /**
   * Returns the current count.
   *
   * @return the number of open channels, never negative
   */
  public int count() {
    return count.get();
  }
}
