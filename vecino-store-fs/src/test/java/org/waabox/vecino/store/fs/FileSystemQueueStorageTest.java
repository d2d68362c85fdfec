package org.waabox.vecino.store.fs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.vecino.PersistenceException;
import org.waabox.vecino.client.IntentKind;
import org.waabox.vecino.client.MutationIntent;
import org.waabox.vecino.client.OfflineQueue;
import org.waabox.vecino.listing.Listing;

/**
 * Tests for {@link FileSystemQueueStorage}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FileSystemQueueStorageTest {

  @Test
  void whenLoading_givenMissingFile_shouldReturnEmpty(
      @TempDir final Path tempDir) {

    final FileSystemQueueStorage storage =
        new FileSystemQueueStorage(tempDir.resolve("queue.json"));

    assertTrue(storage.load().isEmpty());
  }

  @Test
  void whenStoringAndLoading_givenMixedIntents_shouldKeepOrderAndKinds(
      @TempDir final Path tempDir) {

    final Path file = tempDir.resolve("queue.json");
    final Listing listing = listing("l-1", "Loft");

    new FileSystemQueueStorage(file).store(List.of(
        MutationIntent.created(listing),
        MutationIntent.deleted("l-2")));

    final List<MutationIntent> loaded =
        new FileSystemQueueStorage(file).load();

    assertEquals(2, loaded.size());
    assertEquals(IntentKind.CREATED, loaded.get(0).kind());
    assertEquals(listing, loaded.get(0).listing());
    assertEquals(IntentKind.DELETED, loaded.get(1).kind());
    assertEquals("l-2", loaded.get(1).listingId());
    assertNull(loaded.get(1).listing());
  }

  @Test
  void whenRestoringQueue_givenIntentsQueuedBeforeRestart_shouldRecoverThem(
      @TempDir final Path tempDir) {

    final Path file = tempDir.resolve("offline").resolve("queue.json");

    final OfflineQueue before = new OfflineQueue(
        new FileSystemQueueStorage(file));
    before.enqueue(MutationIntent.created(listing("l-1", "Loft")));
    before.enqueue(MutationIntent.updated(listing("l-1", "Loft, renovated")));

    final OfflineQueue after = new OfflineQueue(
        new FileSystemQueueStorage(file));

    assertEquals(2, after.restore());
    assertEquals(IntentKind.UPDATED, after.pending().get(1).kind());
  }

  @Test
  void whenLoading_givenCorruptFile_shouldThrowPersistenceException(
      @TempDir final Path tempDir) throws Exception {

    final Path file = tempDir.resolve("queue.json");
    Files.writeString(file, "[{\"action\":", StandardCharsets.UTF_8);

    final FileSystemQueueStorage storage = new FileSystemQueueStorage(file);

    assertThrows(PersistenceException.class, storage::load);
  }

  private static Listing listing(final String id, final String title) {
    final ObjectNode document = JsonNodeFactory.instance.objectNode();
    document.put("id", id);
    document.put("title", title);
    return Listing.of(document);
  }
}
