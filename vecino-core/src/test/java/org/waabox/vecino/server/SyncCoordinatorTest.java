package org.waabox.vecino.server;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.waabox.vecino.PersistenceException;
import org.waabox.vecino.channel.RecordingChannel;
import org.waabox.vecino.event.ListingAdded;
import org.waabox.vecino.event.ListingDeleted;
import org.waabox.vecino.event.ListingUpdated;
import org.waabox.vecino.event.SyncAllListings;
import org.waabox.vecino.event.SyncListings;
import org.waabox.vecino.event.UpdateListings;
import org.waabox.vecino.event.UsersCount;
import org.waabox.vecino.listing.Listing;
import org.waabox.vecino.listing.ListingFixtures;
import org.waabox.vecino.store.ListingStore;

/**
 * Tests for {@link SyncCoordinator}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SyncCoordinatorTest {

  /** The instant every broadcast update is stamped with. */
  private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

  /** A fixed clock at {@link #NOW}. */
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void whenStarting_givenStoredListings_shouldLoadThem() {
    final List<Listing> stored = List.of(
        ListingFixtures.listing("1", "A"),
        ListingFixtures.listing("2", "B"));
    final ListingStore store = createMock(ListingStore.class);
    expect(store.loadAll()).andReturn(stored);
    replay(store);

    final SyncCoordinator coordinator = coordinator(store);
    coordinator.start();

    assertEquals(stored, coordinator.listings());
    verify(store);
  }

  @Test
  void whenStarting_givenLoadFailure_shouldStartEmpty() {
    final ListingStore store = createMock(ListingStore.class);
    expect(store.loadAll()).andThrow(new PersistenceException("down"));
    replay(store);

    final SyncCoordinator coordinator = coordinator(store);
    coordinator.start();

    assertTrue(coordinator.listings().isEmpty());
    verify(store);
  }

  @Test
  void whenStarting_givenAlreadyStarted_shouldThrow() {
    final SyncCoordinator coordinator = startedCoordinator(List.of());

    assertThrows(IllegalStateException.class, coordinator::start);
  }

  @Test
  void whenConnecting_shouldBroadcastUsersCountAndSendReplicaToNewChannel() {
    final Listing listing = ListingFixtures.listing("1", "A");
    final SyncCoordinator coordinator = startedCoordinator(List.of(listing));
    final RecordingChannel first = new RecordingChannel("a");
    final RecordingChannel second = new RecordingChannel("b");

    coordinator.connect(first);
    coordinator.connect(second);

    assertEquals(List.of(
        new UsersCount(1),
        new SyncAllListings(List.of(listing)),
        new UsersCount(2)), first.sent());
    assertEquals(List.of(
        new UsersCount(2),
        new SyncAllListings(List.of(listing))), second.sent());
    assertEquals(2, coordinator.connectedUsers());
  }

  @Test
  void whenDisconnecting_shouldBroadcastDecrementedCountToRemaining() {
    final SyncCoordinator coordinator = startedCoordinator(List.of());
    final RecordingChannel first = new RecordingChannel("a");
    final RecordingChannel second = new RecordingChannel("b");
    coordinator.connect(first);
    coordinator.connect(second);
    first.clear();

    coordinator.disconnect(second);

    assertEquals(List.of(new UsersCount(1)), first.sent());
    assertEquals(1, coordinator.connectedUsers());
  }

  @Test
  void whenDisconnecting_givenUnknownChannel_shouldBeNoop() {
    final SyncCoordinator coordinator = startedCoordinator(List.of());
    final RecordingChannel connected = new RecordingChannel("a");
    coordinator.connect(connected);
    connected.clear();

    coordinator.disconnect(new RecordingChannel("ghost"));

    assertTrue(connected.sent().isEmpty());
    assertEquals(1, coordinator.connectedUsers());
  }

  @Test
  void whenHandlingAdded_shouldPersistAndBroadcastToEveryoneIncludingSender() {
    final Listing listing = ListingFixtures.listing("1", "A");
    final ListingStore store = createMock(ListingStore.class);
    expect(store.loadAll()).andReturn(List.of());
    store.save(listing);
    replay(store);
    final SyncCoordinator coordinator = coordinator(store);
    coordinator.start();
    final RecordingChannel sender = new RecordingChannel("a");
    final RecordingChannel second = new RecordingChannel("b");
    final RecordingChannel third = new RecordingChannel("c");
    coordinator.connect(sender);
    coordinator.connect(second);
    coordinator.connect(third);
    sender.clear();
    second.clear();
    third.clear();

    coordinator.handle(sender, new ListingAdded(listing));

    final UpdateListings expected = UpdateListings.added(listing, NOW);
    assertEquals(List.of(expected), sender.sent());
    assertEquals(List.of(expected), second.sent());
    assertEquals(List.of(expected), third.sent());
    assertEquals(List.of(listing), coordinator.listings());
    verify(store);
  }

  @Test
  void whenHandlingAdded_givenKnownId_shouldUpsertIdempotently() {
    final Listing listing = ListingFixtures.listing("1", "A");
    final SyncCoordinator coordinator = startedCoordinator(List.of());
    final RecordingChannel channel = new RecordingChannel("a");

    coordinator.handle(channel, new ListingAdded(listing));
    coordinator.handle(channel, new ListingAdded(listing));

    assertEquals(List.of(listing), coordinator.listings());
  }

  @Test
  void whenHandlingUpdated_givenUnknownId_shouldInsertAndBroadcast() {
    final Listing listing = ListingFixtures.listing("9", "New");
    final SyncCoordinator coordinator = startedCoordinator(List.of(
        ListingFixtures.listing("1", "A")));
    final RecordingChannel channel = new RecordingChannel("a");
    coordinator.connect(channel);
    channel.clear();

    coordinator.handle(channel, new ListingUpdated(listing));

    assertEquals(2, coordinator.listings().size());
    assertEquals(List.of(UpdateListings.updated(listing, NOW)),
        channel.sent());
  }

  @Test
  void whenHandlingUpdated_givenKnownId_shouldReplaceWholeValue() {
    final Listing replacement = ListingFixtures.listing("1", "A2");
    final SyncCoordinator coordinator = startedCoordinator(List.of(
        ListingFixtures.listing("1", "A"),
        ListingFixtures.listing("2", "B")));

    coordinator.handle(new RecordingChannel("a"),
        new ListingUpdated(replacement));

    assertEquals(List.of(replacement, ListingFixtures.listing("2", "B")),
        coordinator.listings());
  }

  @Test
  void whenHandlingDeleted_givenUnknownId_shouldAbsorbAndBroadcast() {
    final ListingStore store = createMock(ListingStore.class);
    expect(store.loadAll()).andReturn(List.of(
        ListingFixtures.listing("1", "A")));
    store.delete("x");
    replay(store);
    final SyncCoordinator coordinator = coordinator(store);
    coordinator.start();
    final RecordingChannel channel = new RecordingChannel("a");
    coordinator.connect(channel);
    channel.clear();

    coordinator.handle(channel, new ListingDeleted("x"));

    assertEquals(1, coordinator.listings().size());
    assertEquals(List.of(UpdateListings.deleted("x", NOW)), channel.sent());
    verify(store);
  }

  @Test
  void whenReconciling_givenClientReplica_shouldMergeOnlyUnknownIds() {
    final Listing serverCopy = ListingFixtures.listing("a", "server");
    final Listing clientCopy = ListingFixtures.listing("a", "client");
    final Listing unknown = ListingFixtures.listing("c", "offline");
    final Listing unknownDuplicate = ListingFixtures.listing("c", "dup");
    final ListingStore store = createMock(ListingStore.class);
    expect(store.loadAll()).andReturn(List.of(serverCopy));
    store.save(unknown);
    replay(store);
    final SyncCoordinator coordinator = coordinator(store);
    coordinator.start();
    final RecordingChannel sender = new RecordingChannel("s");
    final RecordingChannel other = new RecordingChannel("o");
    coordinator.connect(sender);
    coordinator.connect(other);
    sender.clear();
    other.clear();

    coordinator.handle(sender, new SyncListings(List.of(
        clientCopy, unknown, unknownDuplicate)));

    final List<Listing> expected = List.of(serverCopy, unknown);
    assertEquals(expected, coordinator.listings());
    assertEquals(List.of(new SyncAllListings(expected)), sender.sent());
    assertEquals(List.of(new SyncAllListings(expected)), other.sent());
    verify(store);
  }

  @Test
  void whenReconciling_givenEmptyClientReplica_shouldStillBroadcastReplica() {
    final Listing listing = ListingFixtures.listing("1", "A");
    final SyncCoordinator coordinator = startedCoordinator(List.of(listing));
    final RecordingChannel channel = new RecordingChannel("a");
    coordinator.connect(channel);
    channel.clear();

    coordinator.handle(channel, new SyncListings(List.of()));

    assertEquals(List.of(new SyncAllListings(List.of(listing))),
        channel.sent());
  }

  @Test
  void whenSaveFails_givenBestEffortPolicy_shouldStillApplyAndBroadcast() {
    final Listing listing = ListingFixtures.listing("1", "A");
    final ListingStore store = createMock(ListingStore.class);
    expect(store.loadAll()).andReturn(List.of());
    store.save(listing);
    expectLastCall().andThrow(new PersistenceException("down"));
    replay(store);
    final SyncCoordinator coordinator = coordinator(store);
    coordinator.start();
    final RecordingChannel channel = new RecordingChannel("a");
    coordinator.connect(channel);
    channel.clear();

    coordinator.handle(channel, new ListingAdded(listing));

    assertEquals(List.of(listing), coordinator.listings());
    assertEquals(List.of(UpdateListings.added(listing, NOW)), channel.sent());
    verify(store);
  }

  @Test
  void whenSaveFails_givenDurablePolicy_shouldDropTheMutation() {
    final Listing listing = ListingFixtures.listing("1", "A");
    final ListingStore store = createMock(ListingStore.class);
    expect(store.loadAll()).andReturn(List.of());
    store.save(listing);
    expectLastCall().andThrow(new PersistenceException("down"));
    store.delete("2");
    expectLastCall().andThrow(new PersistenceException("down"));
    replay(store);
    final SyncCoordinator coordinator = SyncCoordinator.builder()
        .store(store)
        .persistencePolicy(PersistencePolicy.DURABLE)
        .clock(CLOCK)
        .build();
    coordinator.start();
    final RecordingChannel channel = new RecordingChannel("a");
    coordinator.connect(channel);
    channel.clear();

    coordinator.handle(channel, new ListingAdded(listing));
    coordinator.handle(channel, new ListingDeleted("2"));

    assertTrue(coordinator.listings().isEmpty());
    assertTrue(channel.sent().isEmpty());
    verify(store);
  }

  @Test
  void whenHandling_givenServerOnlyEvents_shouldIgnoreThem() {
    final ListingStore store = createMock(ListingStore.class);
    expect(store.loadAll()).andReturn(List.of());
    replay(store);
    final SyncCoordinator coordinator = coordinator(store);
    coordinator.start();
    final RecordingChannel channel = new RecordingChannel("a");
    coordinator.connect(channel);
    channel.clear();

    coordinator.handle(channel, new UsersCount(40));
    coordinator.handle(channel, new SyncAllListings(List.of(
        ListingFixtures.listing("1", "A"))));
    coordinator.handle(channel, UpdateListings.deleted("1", NOW));

    assertTrue(channel.sent().isEmpty());
    assertTrue(coordinator.listings().isEmpty());
    verify(store);
  }

  @Test
  void whenClientCreatesOffline_givenReconnect_shouldEndWithBothListings() {
    final Listing existing = ListingFixtures.listing("L1", "Existing");
    final Listing offline = ListingFixtures.listing("x1", "Offline");
    final SyncCoordinator coordinator = startedCoordinator(List.of(existing));
    final RecordingChannel observer = new RecordingChannel("observer");
    final RecordingChannel returning = new RecordingChannel("returning");
    coordinator.connect(observer);
    coordinator.connect(returning);
    observer.clear();

    coordinator.handle(returning, new SyncListings(List.of(existing,
        offline)));
    coordinator.handle(returning, new ListingAdded(offline));

    assertEquals(List.of(existing, offline), coordinator.listings());
    assertEquals(List.of(
        new SyncAllListings(List.of(existing, offline)),
        UpdateListings.added(offline, NOW)), observer.sent());
  }

  @Test
  void whenStopping_shouldCloseEveryChannelAndResetPresence() {
    final SyncCoordinator coordinator = startedCoordinator(List.of());
    final RecordingChannel first = new RecordingChannel("a");
    final RecordingChannel second = new RecordingChannel("b");
    coordinator.connect(first);
    coordinator.connect(second);

    coordinator.stop();

    assertFalse(first.isOpen());
    assertFalse(second.isOpen());
    assertEquals(0, coordinator.connectedUsers());

    coordinator.disconnect(first);

    assertEquals(0, coordinator.connectedUsers());
  }

  @Test
  void whenBuilding_givenNoStore_shouldThrow() {
    assertThrows(IllegalStateException.class,
        () -> SyncCoordinator.builder().build());
  }

  /** Creates a best-effort coordinator on the fixed clock.
   *
   * @param store the listing store.
   * @return the coordinator, not started.
   */
  private static SyncCoordinator coordinator(final ListingStore store) {
    return SyncCoordinator.builder().store(store).clock(CLOCK).build();
  }

  /** Creates a started coordinator over an in-memory store.
   *
   * @param initial the stored listings.
   * @return the started coordinator.
   */
  private static SyncCoordinator startedCoordinator(
      final List<Listing> initial) {
    final SyncCoordinator coordinator = coordinator(
        new InMemoryListingStore(initial));
    coordinator.start();
    return coordinator;
  }
}
