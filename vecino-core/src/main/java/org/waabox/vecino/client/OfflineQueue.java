package org.waabox.vecino.client;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vecino.metrics.NoopSyncMetrics;
import org.waabox.vecino.metrics.SyncMetrics;

/**
 * The ordered, durable list of mutations a client recorded while offline.
 *
 * <p>Every structural change is written through the {@link QueueStorage}
 * before the call returns. A storage failure is logged and the in-memory
 * queue keeps working.
 *
 * <p>{@link #drain(IntentSender)} replays a snapshot of the queue taken
 * when it starts. Each intent is removed only once its send succeeded; a
 * failed intent stays queued for the next drain. A drain requested while
 * another one is running does nothing.
 *
 * <p>This class is not thread-safe. The client agent confines it to its
 * event loop and passes that loop as the callback executor, so send
 * completions come back to the same thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class OfflineQueue {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      OfflineQueue.class);

  /** The durable storage, never null. */
  private final QueueStorage storage;

  /** Runs the send completions, never null. */
  private final Executor callbackExecutor;

  /** The metrics reporter, never null. */
  private final SyncMetrics metrics;

  /** The pending intents in queue order. */
  private final List<MutationIntent> intents = new ArrayList<>();

  /** Whether a drain is in progress. */
  private boolean draining = false;

  /**
   * Creates a queue that completes sends on the completing thread.
   *
   * @param theStorage the durable storage, never null
   */
  public OfflineQueue(final QueueStorage theStorage) {
    this(theStorage, Runnable::run, new NoopSyncMetrics());
  }

  /**
   * Creates a queue.
   *
   * @param theStorage the durable storage, never null
   * @param theCallbackExecutor runs send completions, never null
   * @param theMetrics the metrics reporter, never null
   */
  public OfflineQueue(final QueueStorage theStorage,
      final Executor theCallbackExecutor, final SyncMetrics theMetrics) {
    Objects.requireNonNull(theStorage, "storage must not be null");
    Objects.requireNonNull(theCallbackExecutor,
        "callbackExecutor must not be null");
    Objects.requireNonNull(theMetrics, "metrics must not be null");
    storage = theStorage;
    callbackExecutor = theCallbackExecutor;
    metrics = theMetrics;
  }

  /**
   * Replaces the in-memory queue with the stored one.
   *
   * <p>A storage failure is logged and leaves the queue empty.
   *
   * @return the number of restored intents
   */
  public int restore() {
    intents.clear();
    try {
      intents.addAll(storage.load());
    } catch (final RuntimeException e) {
      log.error("Failed to restore the offline queue, starting empty: {}",
          e.getMessage(), e);
    }
    if (!intents.isEmpty()) {
      log.info("Restored {} offline change(s)", intents.size());
    }
    return intents.size();
  }

  /**
   * Appends an intent and persists the queue.
   *
   * @param intent the intent to queue, never null
   * @return the queued intent, never null
   */
  public MutationIntent enqueue(final MutationIntent intent) {
    Objects.requireNonNull(intent, "intent must not be null");
    intents.add(intent);
    persist();
    metrics.intentQueued(intent.kind().eventName());
    log.info("Queued '{}' for listing '{}' while offline, {} pending",
        intent.kind().eventName(), intent.listingId(), intents.size());
    return intent;
  }

  /**
   * Replays the queued intents through the given sender.
   *
   * @param sender delivers each intent, never null
   * @return a future with the number of delivered intents, never null and
   *         never failed
   */
  public CompletableFuture<Integer> drain(final IntentSender sender) {
    Objects.requireNonNull(sender, "sender must not be null");
    if (draining) {
      log.debug("A drain is already in progress, skipping");
      return CompletableFuture.completedFuture(0);
    }
    if (intents.isEmpty()) {
      return CompletableFuture.completedFuture(0);
    }
    draining = true;
    final List<MutationIntent> snapshot = List.copyOf(intents);
    log.info("Replaying {} offline change(s)", snapshot.size());

    CompletableFuture<Integer> delivered = CompletableFuture.completedFuture(0);
    for (MutationIntent intent : snapshot) {
      delivered = delivered.thenCompose(count -> deliver(sender, intent)
          .thenApply(sent -> sent ? count + 1 : count));
    }
    return delivered.whenComplete((count, error) -> {
      draining = false;
      if (count != null) {
        metrics.intentsDrained(count);
        log.info("Replayed {} of {} offline change(s), {} pending", count,
            snapshot.size(), intents.size());
      }
    });
  }

  /**
   * Returns the number of pending intents.
   *
   * @return the queue size
   */
  public int size() {
    return intents.size();
  }

  /**
   * Checks whether the queue is empty.
   *
   * @return true if nothing is pending
   */
  public boolean isEmpty() {
    return intents.isEmpty();
  }

  /**
   * Checks whether a drain is in progress.
   *
   * @return true while draining
   */
  public boolean isDraining() {
    return draining;
  }

  /**
   * Returns a copy of the pending intents.
   *
   * @return the intents in queue order, never null
   */
  public List<MutationIntent> pending() {
    return List.copyOf(intents);
  }

  /** Sends one intent and removes it once the send succeeded.
   *
   * @param sender the sender.
   * @param intent the intent to deliver.
   * @return a future with true if delivered, never failed.
   */
  private CompletableFuture<Boolean> deliver(final IntentSender sender,
      final MutationIntent intent) {
    CompletableFuture<Void> sent;
    try {
      sent = Objects.requireNonNull(sender.send(intent),
          "sender returned no future");
    } catch (final RuntimeException e) {
      sent = CompletableFuture.failedFuture(e);
    }
    return sent.handleAsync((ignored, error) -> {
      if (error != null) {
        log.warn("Failed to replay '{}' for listing '{}', keeping it queued:"
            + " {}", intent.kind().eventName(), intent.listingId(),
            error.getMessage());
        return false;
      }
      remove(intent);
      return true;
    }, callbackExecutor);
  }

  /** Removes the given intent instance and persists the queue.
   *
   * @param intent the delivered intent.
   */
  private void remove(final MutationIntent intent) {
    final Iterator<MutationIntent> it = intents.iterator();
    while (it.hasNext()) {
      if (it.next() == intent) {
        it.remove();
        persist();
        return;
      }
    }
  }

  /** Writes the whole queue to the storage, logging failures. */
  private void persist() {
    try {
      storage.store(List.copyOf(intents));
    } catch (final RuntimeException e) {
      log.error("Failed to persist the offline queue: {}", e.getMessage(), e);
    }
  }
}
