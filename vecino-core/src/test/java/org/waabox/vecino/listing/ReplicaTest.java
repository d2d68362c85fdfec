package org.waabox.vecino.listing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Replica}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ReplicaTest {

  @Test
  void whenInserting_givenExistingId_shouldKeepFirstValue() {
    final Replica replica = new Replica();
    final Listing first = ListingFixtures.listing("1", "Loft");

    assertTrue(replica.insertIfAbsent(first));
    assertFalse(replica.insertIfAbsent(ListingFixtures.listing("1", "House")));

    assertEquals(List.of(first), replica.snapshot());
  }

  @Test
  void whenUpserting_givenExistingId_shouldReplaceInPlace() {
    final Replica replica = replicaOf(
        ListingFixtures.listing("1", "A"),
        ListingFixtures.listing("2", "B"));
    final Listing replacement = ListingFixtures.listing("1", "A2");

    final Optional<Listing> previous = replica.upsert(replacement);

    assertEquals(Optional.of(ListingFixtures.listing("1", "A")), previous);
    assertEquals(List.of(replacement, ListingFixtures.listing("2", "B")),
        replica.snapshot());
  }

  @Test
  void whenUpserting_givenUnknownId_shouldAppend() {
    final Replica replica = replicaOf(ListingFixtures.listing("1", "A"));

    assertTrue(replica.upsert(ListingFixtures.listing("2", "B")).isEmpty());

    assertEquals(2, replica.size());
    assertEquals("2", replica.snapshot().get(1).id());
  }

  @Test
  void whenRemoving_givenUnknownId_shouldBeNoop() {
    final Replica replica = replicaOf(ListingFixtures.listing("1", "A"));

    assertFalse(replica.remove("2"));
    assertTrue(replica.remove("1"));
    assertEquals(0, replica.size());
  }

  @Test
  void whenReplacingAll_givenDuplicates_shouldKeepOnePerId() {
    final Replica replica = replicaOf(ListingFixtures.listing("9", "old"));

    replica.replaceAll(List.of(
        ListingFixtures.listing("1", "A"),
        ListingFixtures.listing("2", "B"),
        ListingFixtures.listing("1", "A2")));

    assertFalse(replica.contains("9"));
    assertEquals(List.of(ListingFixtures.listing("1", "A2"),
        ListingFixtures.listing("2", "B")), replica.snapshot());
  }

  /** Creates a replica holding the given listings.
   *
   * @param listings the listings.
   * @return the replica.
   */
  private static Replica replicaOf(final Listing... listings) {
    final Replica replica = new Replica();
    replica.replaceAll(List.of(listings));
    return replica;
  }
}
