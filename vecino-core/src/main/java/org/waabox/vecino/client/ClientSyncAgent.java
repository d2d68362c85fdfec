package org.waabox.vecino.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vecino.ReconnectPolicy;
import org.waabox.vecino.TransportException;
import org.waabox.vecino.channel.SyncChannel;
import org.waabox.vecino.event.ListingAdded;
import org.waabox.vecino.event.ListingDeleted;
import org.waabox.vecino.event.ListingUpdated;
import org.waabox.vecino.event.SyncAllListings;
import org.waabox.vecino.event.SyncEvent;
import org.waabox.vecino.event.SyncListings;
import org.waabox.vecino.event.UpdateListings;
import org.waabox.vecino.event.UsersCount;
import org.waabox.vecino.listing.Listing;
import org.waabox.vecino.listing.Replica;
import org.waabox.vecino.metrics.NoopSyncMetrics;
import org.waabox.vecino.metrics.SyncMetrics;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The client side of the synchronization engine.
 *
 * <p>The agent keeps a local replica of the listings, applies local
 * changes to it optimistically and sends them to the server. While there
 * is no open channel, changes are recorded in the {@link OfflineQueue}.
 *
 * <p>Every time a channel opens the agent:
 * <ol>
 *   <li>offers its whole replica with {@code sync-listings}, so that
 *       listings the server lost or never received are merged back,</li>
 *   <li>replays the offline queue as discrete mutation events,</li>
 *   <li>notifies {@link SyncListener#onSynced(int)} with the number of
 *       replayed changes.</li>
 * </ol>
 * The server pushes a full snapshot to every new channel, so the first
 * {@code sync-all-listings} of a channel is applied but only a later one
 * answers the reconciliation. If no answer arrives within the
 * reconciliation timeout, the channel is closed and the whole round is
 * retried on the next connection. Lost channels are reopened forever,
 * following the {@link ReconnectPolicy}.
 *
 * <p>All agent state lives on one single-threaded event loop. Public
 * operations are submitted to it and return futures; listeners are called
 * on it.
 *
 * <p>Instances are created through the fluent {@link Builder}:
 * <pre>{@code
 * ClientSyncAgent agent = ClientSyncAgent.builder()
 *     .transport(new WebSocketSyncTransport(config))
 *     .queueStorage(new FileSystemQueueStorage(Path.of("queue.json")))
 *     .listener(myListener)
 *     .build();
 * agent.start();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ClientSyncAgent {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ClientSyncAgent.class);

  /** The name of the event loop thread. */
  private static final String LOOP_THREAD_NAME = "vecino-client-loop";

  /** The default bound of a connection attempt. */
  private static final Duration DEFAULT_CONNECT_TIMEOUT =
      Duration.ofSeconds(10);

  /** The default wait for the answer to a reconciliation request. */
  private static final Duration DEFAULT_RECONCILIATION_TIMEOUT =
      Duration.ofSeconds(30);

  /** How long {@link #stop()} waits for the channel to close, in seconds. */
  private static final long STOP_TIMEOUT_SECONDS = 5;

  /** Opens the channels to the server, never null. */
  private final SyncTransport transport;

  /** The optional durable replica storage, may be null. */
  private final ReplicaStorage replicaStorage;

  /** The listings used when no stored replica exists, never null. */
  private final List<Listing> initialListings;

  /** Computes reconnection delays, never null. */
  private final ReconnectPolicy reconnectPolicy;

  /** The bound of a connection attempt, never null. */
  private final Duration connectTimeout;

  /** The wait for a reconciliation answer, never null. */
  private final Duration reconciliationTimeout;

  /** The optional periodic drain interval, may be null. */
  private final Duration drainInterval;

  /** The metrics reporter, never null. */
  private final SyncMetrics metrics;

  /** The registered listeners. */
  private final List<SyncListener> listeners = new CopyOnWriteArrayList<>();

  /** The event loop that owns every piece of mutable state. */
  private final ScheduledThreadPoolExecutor loop;

  /** The offline queue, confined to the loop. */
  private final OfflineQueue queue;

  /** The local replica, confined to the loop. */
  private final Replica replica = new Replica();

  /** Applies the events received from the server. */
  private final InboundApplier inbound = new InboundApplier();

  /** Events received before their channel was established. */
  private final List<SyncEvent> earlyEvents = new ArrayList<>();

  /** Whether {@link #start()} has been called. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether {@link #stop()} has been called. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /** The event loop thread, set when the loop creates it. */
  private volatile Thread loopThread;

  /** The connection status, written on the loop only. */
  private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;

  /** The last replica snapshot, for readers outside the loop. */
  private volatile List<Listing> listingsView = List.of();

  /** The queue size as of the last queue operation. */
  private volatile int pendingCount;

  /** The last users count announced by the server. */
  private volatile int usersCount;

  /** The connection attempt in progress or established, loop only. */
  private Attempt currentAttempt;

  /** The open channel, loop only. */
  private SyncChannel channel;

  /** Reconnection attempts since the last successful connection. */
  private int reconnectAttempts;

  /** Whether a reconciliation request is waiting for its answer. */
  private boolean awaitingReconciliation;

  /** Full snapshots received on the current channel, loop only. The first
   * one is the server's connect-time push, not the reconciliation answer. */
  private int snapshotsOnChannel;

  /** The scheduled reconnection, loop only. */
  private ScheduledFuture<?> reconnectFuture;

  /** The scheduled reconciliation timeout, loop only. */
  private ScheduledFuture<?> reconciliationTimeoutFuture;

  /** The periodic drain task, loop only. */
  private ScheduledFuture<?> drainFuture;

  /**
   * Creates a new agent.
   *
   * @param theTransport the transport, never null
   * @param theQueueStorage the offline queue storage, never null
   * @param theReplicaStorage the replica storage, may be null
   * @param theInitialListings the fallback replica, never null
   * @param theReconnectPolicy the reconnect policy, never null
   * @param theConnectTimeout the connect timeout, never null
   * @param theReconciliationTimeout the reconciliation timeout, never null
   * @param theDrainInterval the periodic drain interval, may be null
   * @param theMetrics the metrics reporter, never null
   * @param theListeners the initial listeners, never null
   */
  private ClientSyncAgent(final SyncTransport theTransport,
      final QueueStorage theQueueStorage,
      final ReplicaStorage theReplicaStorage,
      final List<Listing> theInitialListings,
      final ReconnectPolicy theReconnectPolicy,
      final Duration theConnectTimeout,
      final Duration theReconciliationTimeout,
      final Duration theDrainInterval,
      final SyncMetrics theMetrics,
      final List<SyncListener> theListeners) {
    transport = theTransport;
    replicaStorage = theReplicaStorage;
    initialListings = List.copyOf(theInitialListings);
    reconnectPolicy = theReconnectPolicy;
    connectTimeout = theConnectTimeout;
    reconciliationTimeout = theReconciliationTimeout;
    drainInterval = theDrainInterval;
    metrics = theMetrics;
    listeners.addAll(theListeners);

    loop = new ScheduledThreadPoolExecutor(1, r -> {
      final Thread thread = new Thread(r, LOOP_THREAD_NAME);
      thread.setDaemon(true);
      loopThread = thread;
      return thread;
    });
    loop.setRemoveOnCancelPolicy(true);
    loop.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

    queue = new OfflineQueue(theQueueStorage, loop, metrics);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Restores the local replica and the offline queue, then starts
   * connecting to the server.
   *
   * <p>When this method returns the restored replica is readable through
   * {@link #listings()}; the connection proceeds in the background.
   *
   * @throws IllegalStateException if the agent was already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException(
          "ClientSyncAgent has already been started");
    }
    onLoop(() -> {
      restoreLocalState();
      connect();
      schedulePeriodicDrain();
      return null;
    }).join();
  }

  /**
   * Closes the channel and stops the event loop. Queued intents stay in
   * their storage for the next run.
   */
  public void stop() {
    if (!started.get() || !stopped.compareAndSet(false, true)) {
      return;
    }
    if (isLoopThread()) {
      shutdownChannel();
    } else {
      try {
        onLoop(() -> {
          shutdownChannel();
          return null;
        }).get(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (final ExecutionException | TimeoutException e) {
        log.warn("Failed to close the sync channel cleanly: {}",
            e.getMessage());
      }
    }
    loop.shutdown();
    log.info("Client sync agent stopped");
  }

  /**
   * Creates a listing with a fresh id.
   *
   * <p>The listing is added to the local replica right away, then sent to
   * the server or queued when offline.
   *
   * @param fields the listing payload, never null
   * @return a future with the created listing, never null
   */
  public CompletableFuture<Listing> create(final ObjectNode fields) {
    Objects.requireNonNull(fields, "fields must not be null");
    return whenRunning(() -> {
      final Listing listing = Listing.create(fields);
      replica.insertIfAbsent(listing);
      replicaChanged();
      dispatch(MutationIntent.created(listing));
      return listing;
    });
  }

  /**
   * Replaces a listing with a new full value, inserting it when absent.
   *
   * @param listing the new value, never null
   * @return a future with the stored value, never null
   */
  public CompletableFuture<Listing> update(final Listing listing) {
    Objects.requireNonNull(listing, "listing must not be null");
    return whenRunning(() -> {
      replica.upsert(listing);
      replicaChanged();
      dispatch(MutationIntent.updated(listing));
      return listing;
    });
  }

  /**
   * Deletes a listing.
   *
   * <p>The deletion is sent even when the listing is not in the local
   * replica, so that the server removes it as well.
   *
   * @param listingId the listing id, never null
   * @return a future with true if the listing was in the local replica,
   *         never null
   */
  public CompletableFuture<Boolean> delete(final String listingId) {
    Objects.requireNonNull(listingId, "listingId must not be null");
    return whenRunning(() -> {
      final boolean removed = replica.remove(listingId);
      if (removed) {
        replicaChanged();
      }
      dispatch(MutationIntent.deleted(listingId));
      return removed;
    });
  }

  /**
   * Replays the offline queue now if a channel is open.
   *
   * @return a future with the number of delivered intents, never null
   */
  public CompletableFuture<Integer> drainNow() {
    return whenRunning(() -> {
      final SyncChannel open = openChannel();
      if (open == null) {
        return CompletableFuture.completedFuture(0);
      }
      return drainQueue(open);
    }).thenCompose(drained -> drained);
  }

  /**
   * Registers a listener.
   *
   * @param listener the listener, never null
   */
  public void addListener(final SyncListener listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    listeners.add(listener);
  }

  /**
   * Returns the connection status.
   *
   * @return the status, never null
   */
  public ConnectionStatus status() {
    return status;
  }

  /**
   * Returns the local replica as of the last change.
   *
   * @return the listings in insertion order, never null
   */
  public List<Listing> listings() {
    return listingsView;
  }

  /**
   * Returns the listing with the given id from the local replica.
   *
   * @param listingId the listing id, never null
   * @return the listing, or empty if absent
   */
  public Optional<Listing> listing(final String listingId) {
    Objects.requireNonNull(listingId, "listingId must not be null");
    return listingsView.stream()
        .filter(listing -> listing.id().equals(listingId))
        .findFirst();
  }

  /**
   * Returns the number of queued changes as of the last queue operation.
   *
   * @return the pending intents count
   */
  public int pendingIntents() {
    return pendingCount;
  }

  /**
   * Returns the last users count announced by the server.
   *
   * @return the users count
   */
  public int usersCount() {
    return usersCount;
  }

  /** Loads the stored replica and queue. Runs on the loop. */
  private void restoreLocalState() {
    queue.restore();
    pendingCount = queue.size();

    List<Listing> restored = List.of();
    if (replicaStorage != null) {
      try {
        restored = replicaStorage.load();
      } catch (final RuntimeException e) {
        log.error("Failed to restore the local replica: {}", e.getMessage(),
            e);
      }
    }
    replica.replaceAll(restored.isEmpty() ? initialListings : restored);
    listingsView = replica.snapshot();
    log.info("Restored {} listing(s) and {} offline change(s)",
        replica.size(), pendingCount);
  }

  /** Opens a new channel. Runs on the loop. */
  private void connect() {
    reconnectFuture = null;
    if (stopped.get()) {
      return;
    }
    final Attempt attempt = new Attempt();
    currentAttempt = attempt;
    earlyEvents.clear();
    changeStatus(ConnectionStatus.CONNECTING);

    CompletableFuture<SyncChannel> connecting;
    try {
      connecting = Objects.requireNonNull(transport.connect(attempt),
          "transport returned no future");
    } catch (final RuntimeException e) {
      connecting = CompletableFuture.failedFuture(e);
    }
    connecting.thenAccept(attempt::opened);
    // The timeout goes on a copy so a late channel still reaches the attempt.
    connecting.copy()
        .orTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete((opened, error) -> runOnLoop(() -> {
          if (error != null) {
            loseChannel(attempt, ConnectionStatus.ERROR,
                "connection failed: " + describe(error));
          } else {
            onConnected(attempt, opened);
          }
        }, attempt::abandon));
  }

  /** Starts a sync round on a newly opened channel. Runs on the loop.
   *
   * @param attempt the attempt that opened the channel.
   * @param opened the open channel.
   */
  private void onConnected(final Attempt attempt, final SyncChannel opened) {
    if (attempt != currentAttempt || stopped.get()) {
      attempt.abandon();
      return;
    }
    channel = opened;
    snapshotsOnChannel = 0;
    reconnectAttempts = 0;
    changeStatus(ConnectionStatus.CONNECTED);
    log.info("Connected to the sync server over channel '{}'", opened.id());

    requestReconciliation(opened);

    final List<SyncEvent> early = List.copyOf(earlyEvents);
    earlyEvents.clear();
    early.forEach(event -> event.accept(inbound));

    drainQueue(opened).thenAccept(drained ->
        notifyListeners(listener -> listener.onSynced(drained)));
  }

  /** Offers the local replica to the server. Runs on the loop.
   *
   * @param open the open channel.
   */
  private void requestReconciliation(final SyncChannel open) {
    awaitingReconciliation = true;
    send(open, new SyncListings(replica.snapshot()))
        .whenComplete((ignored, error) -> {
          if (error != null) {
            log.warn("Failed to send the reconciliation request: {}",
                describe(error));
          }
        });
    cancel(reconciliationTimeoutFuture);
    reconciliationTimeoutFuture = loop.schedule(
        () -> onReconciliationTimeout(open),
        reconciliationTimeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Drops a channel that never answered the reconciliation. Runs on the
   * loop.
   *
   * @param open the channel the request was sent on.
   */
  private void onReconciliationTimeout(final SyncChannel open) {
    if (channel != open || !awaitingReconciliation) {
      return;
    }
    log.warn("No reconciliation answer within {} ms, reconnecting",
        reconciliationTimeout.toMillis());
    loseChannel(currentAttempt, ConnectionStatus.DISCONNECTED,
        "reconciliation timed out");
  }

  /** Forgets the channel of the given attempt and schedules a reconnection.
   * Runs on the loop. Stale attempts are ignored.
   *
   * @param attempt the attempt whose channel was lost.
   * @param newStatus the status to report.
   * @param reason a description for the log.
   */
  private void loseChannel(final Attempt attempt,
      final ConnectionStatus newStatus, final String reason) {
    if (attempt == null || attempt != currentAttempt) {
      return;
    }
    currentAttempt = null;
    attempt.abandon();
    channel = null;
    awaitingReconciliation = false;
    snapshotsOnChannel = 0;
    cancel(reconciliationTimeoutFuture);
    reconciliationTimeoutFuture = null;
    earlyEvents.clear();
    log.info("Sync channel lost: {}", reason);
    changeStatus(newStatus);
    scheduleReconnect();
  }

  /** Schedules the next connection attempt. Runs on the loop. */
  private void scheduleReconnect() {
    if (stopped.get()) {
      return;
    }
    reconnectAttempts++;
    final Duration delay = reconnectPolicy.delayFor(reconnectAttempts);
    metrics.reconnectScheduled(reconnectAttempts, delay.toMillis());
    log.info("Reconnecting in {} ms (attempt {})", delay.toMillis(),
        reconnectAttempts);
    try {
      reconnectFuture = loop.schedule(this::connect, delay.toMillis(),
          TimeUnit.MILLISECONDS);
    } catch (final RejectedExecutionException e) {
      log.debug("Event loop is shut down, not reconnecting");
    }
  }

  /** Closes the channel and cancels every timer. Runs on the loop. */
  private void shutdownChannel() {
    cancel(reconnectFuture);
    cancel(reconciliationTimeoutFuture);
    cancel(drainFuture);
    final Attempt attempt = currentAttempt;
    currentAttempt = null;
    if (attempt != null) {
      attempt.abandon();
    }
    channel = null;
    changeStatus(ConnectionStatus.DISCONNECTED);
  }

  /** Sends an intent right away or queues it. Runs on the loop.
   *
   * @param intent the local mutation.
   */
  private void dispatch(final MutationIntent intent) {
    final SyncChannel open = openChannel();
    if (open == null) {
      queue.enqueue(intent);
      pendingCount = queue.size();
      return;
    }
    send(open, intent.toEvent()).whenComplete((ignored, error) -> {
      if (error != null) {
        log.warn("Failed to send '{}' for listing '{}', the next"
            + " reconciliation will repair it: {}",
            intent.kind().eventName(), intent.listingId(), describe(error));
      }
    });
  }

  /** Replays the offline queue over the given channel. Runs on the loop.
   *
   * @param open the open channel.
   * @return the number of delivered intents.
   */
  private CompletableFuture<Integer> drainQueue(final SyncChannel open) {
    return queue.drain(intent -> {
      if (!open.isOpen()) {
        return CompletableFuture.failedFuture(new TransportException(
            "Channel '" + open.id() + "' is closed"));
      }
      return send(open, intent.toEvent());
    }).whenComplete((drained, error) -> pendingCount = queue.size());
  }

  /** Schedules the optional periodic drain. Runs on the loop. */
  private void schedulePeriodicDrain() {
    if (drainInterval == null) {
      return;
    }
    final long interval = drainInterval.toMillis();
    drainFuture = loop.scheduleWithFixedDelay(() -> {
      try {
        final SyncChannel open = openChannel();
        if (open != null && !queue.isEmpty()) {
          drainQueue(open);
        }
      } catch (final RuntimeException e) {
        log.error("Periodic drain failed: {}", e.getMessage(), e);
      }
    }, interval, interval, TimeUnit.MILLISECONDS);
  }

  /** Returns the open channel, or null while not connected.
   *
   * @return the channel, may be null.
   */
  private SyncChannel openChannel() {
    if (status == ConnectionStatus.CONNECTED && channel != null
        && channel.isOpen()) {
      return channel;
    }
    return null;
  }

  /** Routes an event of the given attempt. Runs on the loop.
   *
   * @param attempt the attempt the event arrived on.
   * @param event the event.
   */
  private void receive(final Attempt attempt, final SyncEvent event) {
    if (attempt != currentAttempt) {
      log.debug("Dropping '{}' received on a stale channel", event.name());
      return;
    }
    if (channel == null) {
      earlyEvents.add(event);
      return;
    }
    event.accept(inbound);
  }

  /** Publishes and persists the replica after a change. Runs on the loop.
   */
  private void replicaChanged() {
    final List<Listing> snapshot = replica.snapshot();
    listingsView = snapshot;
    if (replicaStorage != null) {
      try {
        replicaStorage.store(snapshot);
      } catch (final RuntimeException e) {
        log.error("Failed to persist the local replica: {}", e.getMessage(),
            e);
      }
    }
    notifyListeners(listener -> listener.onReplicaChanged(snapshot));
  }

  /** Updates the status and notifies listeners. Runs on the loop.
   *
   * @param newStatus the new status.
   */
  private void changeStatus(final ConnectionStatus newStatus) {
    if (status == newStatus) {
      return;
    }
    log.debug("Connection status {} -> {}", status, newStatus);
    status = newStatus;
    notifyListeners(listener -> listener.onStatusChanged(newStatus));
  }

  /** Calls every listener, logging their failures.
   *
   * @param callback the call to make.
   */
  private void notifyListeners(final Consumer<SyncListener> callback) {
    for (SyncListener listener : listeners) {
      try {
        callback.accept(listener);
      } catch (final RuntimeException e) {
        log.error("Sync listener {} failed: {}", listener, e.getMessage(), e);
      }
    }
  }

  /** Runs a task on the loop and returns its result.
   *
   * @param <T> the result type.
   * @param task the task.
   * @return the result future, failed if the loop is shut down.
   */
  private <T> CompletableFuture<T> onLoop(final Supplier<T> task) {
    try {
      return CompletableFuture.supplyAsync(task, loop);
    } catch (final RejectedExecutionException e) {
      return CompletableFuture.failedFuture(
          new IllegalStateException("ClientSyncAgent is stopped", e));
    }
  }

  /** Runs a public operation on the loop once the agent is running.
   *
   * @param <T> the result type.
   * @param task the operation.
   * @return the result future.
   */
  private <T> CompletableFuture<T> whenRunning(final Supplier<T> task) {
    if (!started.get() || stopped.get()) {
      return CompletableFuture.failedFuture(new IllegalStateException(
          "ClientSyncAgent is not running"));
    }
    return onLoop(task);
  }

  /** Submits a task to the loop, running the fallback if it is shut down.
   *
   * @param task the task.
   * @param onRejected the fallback.
   */
  private void runOnLoop(final Runnable task, final Runnable onRejected) {
    try {
      loop.execute(task);
    } catch (final RejectedExecutionException e) {
      log.debug("Event loop is shut down, dropping a channel callback");
      onRejected.run();
    }
  }

  /** Checks whether the caller runs on the event loop.
   *
   * @return true on the loop thread.
   */
  private boolean isLoopThread() {
    return Thread.currentThread() == loopThread;
  }

  /** Sends an event, turning synchronous failures into failed futures.
   *
   * @param open the channel.
   * @param event the event.
   * @return the send future, never null.
   */
  private static CompletableFuture<Void> send(final SyncChannel open,
      final SyncEvent event) {
    try {
      return open.send(event);
    } catch (final RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /** Cancels a scheduled task if present.
   *
   * @param future the task, may be null.
   */
  private static void cancel(final ScheduledFuture<?> future) {
    if (future != null) {
      future.cancel(false);
    }
  }

  /** Describes an asynchronous failure for log messages.
   *
   * @param error the failure.
   * @return the description, never null.
   */
  private static String describe(final Throwable error) {
    Throwable cause = error;
    if (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause.getMessage() != null ? cause.getMessage() : cause.toString();
  }

  /**
   * One connection attempt and the channel it opens.
   *
   * <p>The transport calls back on its own threads; every callback is
   * moved to the event loop, where callbacks of a replaced attempt are
   * ignored.
   */
  private final class Attempt implements SyncTransportListener {

    /** The channel this attempt opened, if any. */
    private volatile SyncChannel openedChannel;

    /** Whether the agent gave up on this attempt. */
    private volatile boolean abandoned;

    @Override
    public void onEvent(final SyncEvent event) {
      runOnLoop(() -> receive(this, event), () -> { });
    }

    @Override
    public void onClosed(final String reason) {
      runOnLoop(() -> loseChannel(this, ConnectionStatus.DISCONNECTED,
          "closed: " + reason), () -> { });
    }

    @Override
    public void onError(final Throwable error) {
      runOnLoop(() -> loseChannel(this, ConnectionStatus.ERROR,
          "failed: " + describe(error)), () -> { });
    }

    /** Records the opened channel, closing it if already abandoned.
     *
     * @param opened the channel.
     */
    private void opened(final SyncChannel opened) {
      openedChannel = opened;
      if (abandoned) {
        opened.close();
      }
    }

    /** Gives up on this attempt, closing its channel if it opened one. */
    private void abandon() {
      abandoned = true;
      final SyncChannel opened = openedChannel;
      if (opened != null) {
        opened.close();
      }
    }
  }

  /** Applies server events to the local replica. Runs on the loop. */
  private final class InboundApplier implements SyncEvent.Visitor<Void> {

    @Override
    public Void visitUpdateListings(final UpdateListings event) {
      switch (event.action()) {
        case ADDED:
          if (replica.insertIfAbsent(event.listing())) {
            replicaChanged();
            notifyListeners(l -> l.onListingAdded(event.listing()));
          }
          break;
        case UPDATED:
          final Optional<Listing> previous = replica.upsert(event.listing());
          if (previous.isEmpty() || !previous.get().equals(event.listing())) {
            replicaChanged();
            notifyListeners(l -> l.onListingUpdated(event.listing()));
          }
          break;
        case DELETED:
          if (replica.remove(event.listingId())) {
            replicaChanged();
            notifyListeners(l -> l.onListingRemoved(event.listingId()));
          }
          break;
        default:
          log.warn("Ignoring unknown update action {}", event.action());
      }
      return null;
    }

    @Override
    public Void visitSyncAllListings(final SyncAllListings event) {
      snapshotsOnChannel++;
      if (snapshotsOnChannel > 1 && awaitingReconciliation) {
        awaitingReconciliation = false;
        cancel(reconciliationTimeoutFuture);
        reconciliationTimeoutFuture = null;
      }
      replica.replaceAll(event.listings());
      log.info("Local replica replaced with {} listing(s) from the server",
          replica.size());
      replicaChanged();
      return null;
    }

    @Override
    public Void visitUsersCount(final UsersCount event) {
      usersCount = event.count();
      notifyListeners(l -> l.onUsersCount(event.count()));
      return null;
    }

    @Override
    public Void visitListingAdded(final ListingAdded event) {
      return ignore(event);
    }

    @Override
    public Void visitListingUpdated(final ListingUpdated event) {
      return ignore(event);
    }

    @Override
    public Void visitListingDeleted(final ListingDeleted event) {
      return ignore(event);
    }

    @Override
    public Void visitSyncListings(final SyncListings event) {
      return ignore(event);
    }

    /** Logs a client-to-server event that the server sent.
     *
     * @param event the unexpected event.
     * @return always null.
     */
    private Void ignore(final SyncEvent event) {
      log.warn("Ignoring client-only event '{}' received from the server",
          event.name());
      return null;
    }
  }

  /**
   * Builder for {@link ClientSyncAgent}.
   *
   * <p>A {@link SyncTransport} is mandatory. Every other setting has a
   * default: an in-memory queue, no replica storage, the default
   * {@link ReconnectPolicy}, a 10 second connect timeout, a 30 second
   * reconciliation timeout and no periodic drain.
   */
  public static final class Builder {

    /** The transport. */
    private SyncTransport transport;

    /** The optional queue storage. */
    private QueueStorage queueStorage;

    /** The optional replica storage. */
    private ReplicaStorage replicaStorage;

    /** The fallback replica. */
    private List<Listing> initialListings = List.of();

    /** The optional reconnect policy. */
    private ReconnectPolicy reconnectPolicy;

    /** The optional connect timeout. */
    private Duration connectTimeout;

    /** The optional reconciliation timeout. */
    private Duration reconciliationTimeout;

    /** The optional periodic drain interval. */
    private Duration drainInterval;

    /** The optional metrics reporter. */
    private SyncMetrics metrics;

    /** The initial listeners. */
    private final List<SyncListener> listeners = new ArrayList<>();

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the transport that opens channels to the server.
     *
     * @param theTransport the transport, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder transport(final SyncTransport theTransport) {
      Objects.requireNonNull(theTransport, "transport must not be null");
      this.transport = theTransport;
      return this;
    }

    /**
     * Sets the storage of the offline queue.
     *
     * <p>If not set, the queue is kept in memory only.
     *
     * @param theQueueStorage the queue storage, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder queueStorage(final QueueStorage theQueueStorage) {
      Objects.requireNonNull(theQueueStorage,
          "queueStorage must not be null");
      this.queueStorage = theQueueStorage;
      return this;
    }

    /**
     * Sets the storage of the local replica.
     *
     * <p>If not set, the replica starts from the initial listings on every
     * run.
     *
     * @param theReplicaStorage the replica storage, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder replicaStorage(final ReplicaStorage theReplicaStorage) {
      Objects.requireNonNull(theReplicaStorage,
          "replicaStorage must not be null");
      this.replicaStorage = theReplicaStorage;
      return this;
    }

    /**
     * Sets the listings shown before the first sync when no stored replica
     * exists.
     *
     * @param theListings the initial listings, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder initialListings(final List<Listing> theListings) {
      Objects.requireNonNull(theListings, "initialListings must not be null");
      this.initialListings = List.copyOf(theListings);
      return this;
    }

    /**
     * Sets the reconnect policy.
     *
     * @param thePolicy the reconnect policy, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder reconnectPolicy(final ReconnectPolicy thePolicy) {
      Objects.requireNonNull(thePolicy, "reconnectPolicy must not be null");
      this.reconnectPolicy = thePolicy;
      return this;
    }

    /**
     * Sets the bound of each connection attempt.
     *
     * @param theTimeout the connect timeout, must be positive
     *
     * @return this builder for chaining, never null
     */
    public Builder connectTimeout(final Duration theTimeout) {
      this.connectTimeout = requirePositive(theTimeout, "connectTimeout");
      return this;
    }

    /**
     * Sets how long to wait for the answer to a reconciliation request
     * before reconnecting.
     *
     * @param theTimeout the reconciliation timeout, must be positive
     *
     * @return this builder for chaining, never null
     */
    public Builder reconciliationTimeout(final Duration theTimeout) {
      this.reconciliationTimeout = requirePositive(theTimeout,
          "reconciliationTimeout");
      return this;
    }

    /**
     * Enables a periodic replay of the offline queue while connected.
     *
     * @param theInterval the drain interval, must be positive
     *
     * @return this builder for chaining, never null
     */
    public Builder drainInterval(final Duration theInterval) {
      this.drainInterval = requirePositive(theInterval, "drainInterval");
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * <p>If not set, {@link NoopSyncMetrics} is used.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metrics(final SyncMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Adds a listener.
     *
     * @param theListener the listener, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder listener(final SyncListener theListener) {
      Objects.requireNonNull(theListener, "listener must not be null");
      this.listeners.add(theListener);
      return this;
    }

    /**
     * Builds the agent.
     *
     * @return a new, not yet started agent, never null
     *
     * @throws IllegalStateException if no transport was set
     */
    public ClientSyncAgent build() {
      if (transport == null) {
        throw new IllegalStateException("A sync transport is required");
      }
      final QueueStorage resolvedQueueStorage = queueStorage != null
          ? queueStorage : new InMemoryQueueStorage();
      final ReconnectPolicy resolvedPolicy = reconnectPolicy != null
          ? reconnectPolicy : ReconnectPolicy.defaultPolicy();
      final Duration resolvedConnectTimeout = connectTimeout != null
          ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
      final Duration resolvedReconciliationTimeout =
          reconciliationTimeout != null
              ? reconciliationTimeout : DEFAULT_RECONCILIATION_TIMEOUT;
      final SyncMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopSyncMetrics();

      return new ClientSyncAgent(transport, resolvedQueueStorage,
          replicaStorage, initialListings, resolvedPolicy,
          resolvedConnectTimeout, resolvedReconciliationTimeout,
          drainInterval, resolvedMetrics, listeners);
    }

    /** Validates a positive duration.
     *
     * @param duration the duration.
     * @param name the setting name.
     * @return the duration.
     */
    private static Duration requirePositive(final Duration duration,
        final String name) {
      Objects.requireNonNull(duration, name + " must not be null");
      if (duration.isZero() || duration.isNegative()) {
        throw new IllegalArgumentException(
            name + " must be positive, got: " + duration);
      }
      return duration;
    }
  }
}
