package org.waabox.vecino.event;

import java.util.List;
import java.util.Objects;

import org.waabox.vecino.listing.Listing;

/**
 * The server pushes its whole authoritative replica. Clients replace their
 * replica with it.
 *
 * @param listings the authoritative replica, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SyncAllListings(List<Listing> listings) implements SyncEvent {

  /** The wire name of this event. */
  public static final String NAME = "sync-all-listings";

  /** Validates the event and freezes the listings. */
  public SyncAllListings {
    Objects.requireNonNull(listings, "listings must not be null");
    listings = List.copyOf(listings);
  }

  /** {@inheritDoc} */
  @Override
  public String name() {
    return NAME;
  }

  /** {@inheritDoc} */
  @Override
  public <R> R accept(final Visitor<R> visitor) {
    return visitor.visitSyncAllListings(this);
  }
}
