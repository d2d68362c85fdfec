package org.waabox.vecino.event;

import java.util.Objects;

import org.waabox.vecino.listing.Listing;

/**
 * A client created a listing.
 *
 * @param listing the created listing, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ListingAdded(Listing listing) implements SyncEvent {

  /** The wire name of this event. */
  public static final String NAME = "listing-added";

  /** Validates the event. */
  public ListingAdded {
    Objects.requireNonNull(listing, "listing must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public String name() {
    return NAME;
  }

  /** {@inheritDoc} */
  @Override
  public <R> R accept(final Visitor<R> visitor) {
    return visitor.visitListingAdded(this);
  }
}
