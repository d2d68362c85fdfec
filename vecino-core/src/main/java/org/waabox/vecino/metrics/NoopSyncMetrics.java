package org.waabox.vecino.metrics;

/**
 * A no-op implementation of {@link SyncMetrics} that silently discards all
 * recorded metrics.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NoopSyncMetrics implements SyncMetrics {

  /** {@inheritDoc} */
  @Override
  public void mutationApplied(final String eventName) {
  }

  /** {@inheritDoc} */
  @Override
  public void persistenceFailed(final String operation,
      final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void reconciliationMerged(final int mergedCount) {
  }

  /** {@inheritDoc} */
  @Override
  public void broadcastSent(final String eventName, final int channelCount) {
  }

  /** {@inheritDoc} */
  @Override
  public void intentQueued(final String eventName) {
  }

  /** {@inheritDoc} */
  @Override
  public void intentsDrained(final int deliveredCount) {
  }

  /** {@inheritDoc} */
  @Override
  public void reconnectScheduled(final int attempt, final long delayMillis) {
  }
}
