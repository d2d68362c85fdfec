package org.waabox.vecino.server;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
import org.waabox.vecino.store.ListingStore;

/**
 * The server side of the synchronization engine.
 *
 * <p>The coordinator owns the authoritative replica, the listing store,
 * the group of connected channels and the presence counter. It applies the
 * mutations clients send, persists them and broadcasts the result to every
 * connected channel, the sender included. Clients coming back online offer
 * their replica with {@code sync-listings}; the coordinator adds the
 * listings it does not know yet, never overwriting an existing one, and
 * broadcasts the full replica.
 *
 * <p>Every operation that reads or writes the replica runs under a single
 * lock, so persistence and broadcasts happen in processing order. The
 * sends themselves are asynchronous.
 *
 * <p>Instances are created through the fluent {@link Builder}:
 * <pre>{@code
 * SyncCoordinator coordinator = SyncCoordinator.builder()
 *     .store(new FileSystemListingStore(Path.of("listings.json")))
 *     .persistencePolicy(PersistencePolicy.BEST_EFFORT)
 *     .build();
 * coordinator.start();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SyncCoordinator {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      SyncCoordinator.class);

  /** The persistence backend, never null. */
  private final ListingStore store;

  /** What to do when persistence fails, never null. */
  private final PersistencePolicy persistencePolicy;

  /** The metrics reporter, never null. */
  private final SyncMetrics metrics;

  /** The clock used to stamp broadcast updates, never null. */
  private final Clock clock;

  /** The authoritative replica, guarded by the lock. */
  private final Replica replica = new Replica();

  /** The connected channels. */
  private final ChannelGroup channels = new ChannelGroup();

  /** The connected users counter. */
  private final PresenceTracker presence = new PresenceTracker();

  /** Serializes replica changes, persistence and broadcasts. */
  private final ReentrantLock lock = new ReentrantLock();

  /** Whether {@link #start()} has been called. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether {@link #stop()} has been called. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /**
   * Creates a new coordinator.
   *
   * @param theStore the listing store, never null
   * @param thePersistencePolicy the persistence policy, never null
   * @param theMetrics the metrics reporter, never null
   * @param theClock the clock, never null
   */
  private SyncCoordinator(final ListingStore theStore,
      final PersistencePolicy thePersistencePolicy,
      final SyncMetrics theMetrics, final Clock theClock) {
    store = theStore;
    persistencePolicy = thePersistencePolicy;
    metrics = theMetrics;
    clock = theClock;
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
   * Loads the stored listings into the authoritative replica.
   *
   * <p>A load failure is logged and the coordinator starts with an empty
   * replica.
   *
   * @throws IllegalStateException if the coordinator was already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException(
          "SyncCoordinator has already been started");
    }
    lock.lock();
    try {
      final List<Listing> loaded = store.loadAll();
      replica.replaceAll(loaded);
      log.info("Loaded {} listing(s) from the listing store",
          replica.size());
    } catch (final RuntimeException e) {
      log.error("Failed to load listings, starting empty: {}",
          e.getMessage(), e);
      metrics.persistenceFailed("load", e);
      replica.replaceAll(List.of());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes every connected channel and forgets its presence.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    lock.lock();
    try {
      final int closed = channels.closeAll();
      for (int i = 0; i < closed; i++) {
        presence.disconnected();
      }
      log.info("Sync coordinator stopped, closed {} channel(s)", closed);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Registers a newly connected channel.
   *
   * <p>Broadcasts the new users count to every channel and sends the full
   * authoritative replica to the new one. Registering the same channel
   * twice has no effect.
   *
   * @param channel the connected channel, never null
   */
  public void connect(final SyncChannel channel) {
    Objects.requireNonNull(channel, "channel must not be null");
    lock.lock();
    try {
      if (!channels.add(channel)) {
        log.debug("Channel '{}' is already connected", channel.id());
        return;
      }
      final int count = presence.connected();
      log.info("Channel '{}' connected, {} user(s) online", channel.id(),
          count);
      broadcast(new UsersCount(count));
      channels.send(channel, new SyncAllListings(replica.snapshot()));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Unregisters a disconnected channel and broadcasts the new users count.
   *
   * <p>Disconnecting an unknown channel has no effect.
   *
   * @param channel the disconnected channel, never null
   */
  public void disconnect(final SyncChannel channel) {
    Objects.requireNonNull(channel, "channel must not be null");
    lock.lock();
    try {
      if (!channels.remove(channel)) {
        log.debug("Ignoring disconnection of unknown channel '{}'",
            channel.id());
        return;
      }
      final int count = presence.disconnected();
      log.info("Channel '{}' disconnected, {} user(s) online",
          channel.id(), count);
      broadcast(new UsersCount(count));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Processes an event received from a channel.
   *
   * @param source the channel the event came from, never null
   * @param event the received event, never null
   */
  public void handle(final SyncChannel source, final SyncEvent event) {
    Objects.requireNonNull(source, "source must not be null");
    Objects.requireNonNull(event, "event must not be null");
    lock.lock();
    try {
      event.accept(new InboundHandler(source));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a copy of the authoritative replica.
   *
   * @return the listings in insertion order, never null
   */
  public List<Listing> listings() {
    lock.lock();
    try {
      return replica.snapshot();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of connected users.
   *
   * @return the users count, never negative
   */
  public int connectedUsers() {
    return presence.count();
  }

  /**
   * Returns the persistence policy in use.
   *
   * @return the policy, never null
   */
  public PersistencePolicy persistencePolicy() {
    return persistencePolicy;
  }

  /** Saves or replaces a listing and broadcasts the update.
   *
   * @param event the wire name of the mutating event.
   * @param update the update to broadcast once applied.
   */
  private void applyUpsert(final String event, final UpdateListings update) {
    final Listing listing = update.listing();
    if (!persist("save", listing.id(), () -> store.save(listing))) {
      return;
    }
    replica.upsert(listing);
    metrics.mutationApplied(event);
    log.debug("Applied '{}' for listing '{}'", event, listing.id());
    broadcast(update);
  }

  /** Runs a persistence operation under the persistence policy.
   *
   * @param operation the operation name.
   * @param listingId the affected listing.
   * @param action the store call.
   * @return true if the mutation must go on, false if it must be dropped.
   */
  private boolean persist(final String operation, final String listingId,
      final Runnable action) {
    try {
      action.run();
      return true;
    } catch (final RuntimeException e) {
      metrics.persistenceFailed(operation, e);
      if (persistencePolicy == PersistencePolicy.DURABLE) {
        log.error("Failed to {} listing '{}', dropping the mutation: {}",
            operation, listingId, e.getMessage(), e);
        return false;
      }
      log.error("Failed to {} listing '{}', propagating it anyway: {}",
          operation, listingId, e.getMessage(), e);
      return true;
    }
  }

  /** Sends an event to every connected channel.
   *
   * @param event the event to send.
   */
  private void broadcast(final SyncEvent event) {
    final int count = channels.broadcast(event);
    metrics.broadcastSent(event.name(), count);
  }

  /** Applies the events of one source channel. */
  private final class InboundHandler implements SyncEvent.Visitor<Void> {

    /** The channel the event came from. */
    private final SyncChannel source;

    /** Creates a handler.
     *
     * @param theSource the source channel.
     */
    private InboundHandler(final SyncChannel theSource) {
      source = theSource;
    }

    @Override
    public Void visitListingAdded(final ListingAdded event) {
      applyUpsert(event.name(),
          UpdateListings.added(event.listing(), clock.instant()));
      return null;
    }

    @Override
    public Void visitListingUpdated(final ListingUpdated event) {
      applyUpsert(event.name(),
          UpdateListings.updated(event.listing(), clock.instant()));
      return null;
    }

    @Override
    public Void visitListingDeleted(final ListingDeleted event) {
      final String id = event.listingId();
      if (!persist("delete", id, () -> store.delete(id))) {
        return null;
      }
      replica.remove(id);
      metrics.mutationApplied(event.name());
      log.debug("Applied '{}' for listing '{}'", event.name(), id);
      broadcast(UpdateListings.deleted(id, clock.instant()));
      return null;
    }

    @Override
    public Void visitSyncListings(final SyncListings event) {
      final Set<String> seen = new HashSet<>();
      int merged = 0;
      for (Listing candidate : event.listings()) {
        final String id = candidate.id();
        if (!seen.add(id) || replica.contains(id)) {
          continue;
        }
        if (!persist("save", id, () -> store.save(candidate))) {
          continue;
        }
        replica.insertIfAbsent(candidate);
        merged++;
      }
      if (merged > 0) {
        log.info("Merged {} listing(s) offered by channel '{}'", merged,
            source.id());
      }
      metrics.reconciliationMerged(merged);
      broadcast(new SyncAllListings(replica.snapshot()));
      return null;
    }

    @Override
    public Void visitUpdateListings(final UpdateListings event) {
      return ignore(event);
    }

    @Override
    public Void visitSyncAllListings(final SyncAllListings event) {
      return ignore(event);
    }

    @Override
    public Void visitUsersCount(final UsersCount event) {
      return ignore(event);
    }

    /** Logs a server-to-client event that a client sent back.
     *
     * @param event the unexpected event.
     * @return always null.
     */
    private Void ignore(final SyncEvent event) {
      log.warn("Ignoring server-only event '{}' received from channel '{}'",
          event.name(), source.id());
      return null;
    }
  }

  /**
   * Builder for {@link SyncCoordinator}.
   *
   * <p>A {@link ListingStore} is mandatory. The persistence policy
   * defaults to {@link PersistencePolicy#BEST_EFFORT}.
   */
  public static final class Builder {

    /** The listing store. */
    private ListingStore store;

    /** The optional persistence policy. */
    private PersistencePolicy persistencePolicy;

    /** The optional metrics reporter. */
    private SyncMetrics metrics;

    /** The optional clock. */
    private Clock clock;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the listing store that persists the authoritative replica.
     *
     * @param theStore the listing store, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder store(final ListingStore theStore) {
      Objects.requireNonNull(theStore, "store must not be null");
      this.store = theStore;
      return this;
    }

    /**
     * Sets what happens to a mutation whose persistence failed.
     *
     * @param thePolicy the persistence policy, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder persistencePolicy(final PersistencePolicy thePolicy) {
      Objects.requireNonNull(thePolicy, "persistencePolicy must not be null");
      this.persistencePolicy = thePolicy;
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
     * Sets the clock used to timestamp broadcast updates.
     *
     * <p>If not set, the system UTC clock is used.
     *
     * @param theClock the clock, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder clock(final Clock theClock) {
      Objects.requireNonNull(theClock, "clock must not be null");
      this.clock = theClock;
      return this;
    }

    /**
     * Builds the coordinator.
     *
     * @return a new, not yet started coordinator, never null
     *
     * @throws IllegalStateException if no listing store was set
     */
    public SyncCoordinator build() {
      if (store == null) {
        throw new IllegalStateException("A listing store is required");
      }
      final PersistencePolicy resolvedPolicy = persistencePolicy != null
          ? persistencePolicy : PersistencePolicy.BEST_EFFORT;
      final SyncMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopSyncMetrics();
      final Clock resolvedClock = clock != null
          ? clock : Clock.systemUTC();
      return new SyncCoordinator(store, resolvedPolicy, resolvedMetrics,
          resolvedClock);
    }
  }
}
