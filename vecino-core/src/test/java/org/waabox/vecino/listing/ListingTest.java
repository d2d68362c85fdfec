package org.waabox.vecino.listing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Tests for {@link Listing}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ListingTest {

  @Test
  void whenCreating_givenFieldsWithoutId_shouldAssignTimeBasedId() {
    final long before = System.currentTimeMillis();

    final Listing listing = Listing.create(ListingFixtures.fields("Loft"));

    final String[] parts = listing.id().split("-");
    assertEquals(2, parts.length);
    assertTrue(Long.parseLong(parts[0]) >= before);
    assertEquals(Optional.of("Loft"), listing.title());
    assertEquals(listing.id(), listing.document().get("id").asText());
  }

  @Test
  void whenCreating_givenFieldsWithId_shouldIgnoreTheGivenId() {
    final ObjectNode fields = ListingFixtures.fields("Loft");
    fields.put("id", "forged");

    final Listing listing = Listing.create(fields);

    assertNotEquals("forged", listing.id());
  }

  @Test
  void whenCreating_givenTwoListings_shouldAssignDistinctIds() {
    final Listing first = Listing.create(ListingFixtures.fields("A"));
    final Listing second = Listing.create(ListingFixtures.fields("B"));

    assertNotEquals(first.id(), second.id());
  }

  @Test
  void whenReadingDocument_givenListing_shouldNotExposeInternalState() {
    final Listing listing = ListingFixtures.listing("1", "Loft");

    listing.document().put("title", "Changed");

    assertEquals(Optional.of("Loft"), listing.title());
  }

  @Test
  void whenComparing_givenSameDocument_shouldBeEqual() {
    assertEquals(ListingFixtures.listing("1", "Loft"),
        ListingFixtures.listing("1", "Loft"));
    assertNotEquals(ListingFixtures.listing("1", "Loft"),
        ListingFixtures.listing("1", "House"));
  }

  @Test
  void whenReplacingFields_givenNewPayload_shouldKeepTheId() {
    final Listing listing = ListingFixtures.listing("1", "Loft");

    final Listing replaced = listing.withFields(
        ListingFixtures.fields("House"));

    assertEquals("1", replaced.id());
    assertEquals(Optional.of("House"), replaced.title());
    assertFalse(replaced.document().has("beds"));
  }

  @Test
  void whenParsing_givenMissingOrBlankId_shouldThrow() {
    final ObjectNode noId = JsonNodeFactory.instance.objectNode();
    noId.put("title", "Loft");
    final ObjectNode blankId = noId.deepCopy().put("id", " ");
    final ObjectNode numericId = noId.deepCopy().put("id", 7);

    assertThrows(IllegalArgumentException.class, () -> Listing.of(noId));
    assertThrows(IllegalArgumentException.class, () -> Listing.of(blankId));
    assertThrows(IllegalArgumentException.class,
        () -> Listing.of(numericId));
    assertThrows(IllegalArgumentException.class,
        () -> Listing.of(JsonNodeFactory.instance.textNode("1")));
  }
}
