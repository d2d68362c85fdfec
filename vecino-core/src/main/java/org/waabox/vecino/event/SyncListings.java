package org.waabox.vecino.event;

import java.util.List;
import java.util.Objects;

import org.waabox.vecino.listing.Listing;

/**
 * A client offers its whole local replica for reconciliation.
 *
 * @param listings the client replica, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SyncListings(List<Listing> listings) implements SyncEvent {

  /** The wire name of this event. */
  public static final String NAME = "sync-listings";

  /** Validates the event and freezes the listings. */
  public SyncListings {
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
    return visitor.visitSyncListings(this);
  }
}
