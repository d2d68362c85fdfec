package org.waabox.vecino.client;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

import org.waabox.vecino.event.ListingAdded;
import org.waabox.vecino.event.ListingDeleted;
import org.waabox.vecino.event.ListingUpdated;
import org.waabox.vecino.event.SyncEvent;
import org.waabox.vecino.listing.Listing;

/**
 * A local mutation recorded while the client was offline, waiting to be
 * replayed to the server.
 *
 * <p>Created and updated intents carry the full listing; deleted intents
 * carry only the listing id.
 *
 * @param id the locally unique intent id, never null
 * @param kind the kind of mutation, never null
 * @param listing the listing, null for deletions
 * @param listingId the target listing id, never null
 * @param queuedAt the local time the intent was recorded, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MutationIntent(String id, IntentKind kind, Listing listing,
    String listingId, Instant queuedAt) {

  /** Validates the intent. */
  public MutationIntent {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(queuedAt, "queuedAt must not be null");
    if (kind == IntentKind.DELETED) {
      Objects.requireNonNull(listingId, "listingId must not be null");
      if (listing != null) {
        throw new IllegalArgumentException(
            "A deleted intent carries no listing");
      }
    } else {
      Objects.requireNonNull(listing, "listing must not be null");
      listingId = listing.id();
    }
  }

  /**
   * Records a local creation.
   *
   * @param listing the created listing, never null
   * @return a new intent, never null
   */
  public static MutationIntent created(final Listing listing) {
    return new MutationIntent(nextId(), IntentKind.CREATED, listing, null,
        Instant.now());
  }

  /**
   * Records a local replacement.
   *
   * @param listing the new listing value, never null
   * @return a new intent, never null
   */
  public static MutationIntent updated(final Listing listing) {
    return new MutationIntent(nextId(), IntentKind.UPDATED, listing, null,
        Instant.now());
  }

  /**
   * Records a local deletion.
   *
   * @param listingId the deleted listing id, never null
   * @return a new intent, never null
   */
  public static MutationIntent deleted(final String listingId) {
    return new MutationIntent(nextId(), IntentKind.DELETED, null, listingId,
        Instant.now());
  }

  /**
   * Builds the event that replays this intent to the server.
   *
   * @return the mutation event, never null
   */
  public SyncEvent toEvent() {
    switch (kind) {
      case CREATED:
        return new ListingAdded(listing);
      case UPDATED:
        return new ListingUpdated(listing);
      case DELETED:
        return new ListingDeleted(listingId);
      default:
        throw new IllegalStateException("Unknown intent kind: " + kind);
    }
  }

  /** Generates a locally unique intent id: epoch millis plus jitter.
   *
   * @return the id, never null.
   */
  private static String nextId() {
    return System.currentTimeMillis() + "."
        + Long.toHexString(ThreadLocalRandom.current().nextLong() >>> 1);
  }
}
