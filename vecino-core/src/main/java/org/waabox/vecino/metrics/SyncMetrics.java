package org.waabox.vecino.metrics;

/**
 * An abstraction for recording operational metrics of the synchronization
 * engine.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or Prometheus. Use {@link NoopSyncMetrics} when metrics
 * collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SyncMetrics {

  /**
   * Records a mutation applied to the authoritative replica.
   *
   * @param eventName the wire name of the mutating event, never null
   */
  void mutationApplied(String eventName);

  /**
   * Records a failed persistence operation.
   *
   * @param operation the failed operation ("save", "delete", "load"),
   *                  never null
   * @param cause     the throwable that caused the failure, never null
   */
  void persistenceFailed(String operation, Throwable cause);

  /**
   * Records a reconciliation round.
   *
   * @param mergedCount the number of listings the client contributed
   */
  void reconciliationMerged(int mergedCount);

  /**
   * Records an event broadcast to every connected channel.
   *
   * @param eventName    the wire name of the broadcast event, never null
   * @param channelCount the number of channels it was sent to
   */
  void broadcastSent(String eventName, int channelCount);

  /**
   * Records a mutation intent queued while offline.
   *
   * @param eventName the wire name of the queued event, never null
   */
  void intentQueued(String eventName);

  /**
   * Records the end of an offline queue drain.
   *
   * @param deliveredCount the number of intents delivered
   */
  void intentsDrained(int deliveredCount);

  /**
   * Records a scheduled reconnection attempt.
   *
   * @param attempt     the 1-based attempt number
   * @param delayMillis the delay before the attempt, in milliseconds
   */
  void reconnectScheduled(int attempt, long delayMillis);
}
