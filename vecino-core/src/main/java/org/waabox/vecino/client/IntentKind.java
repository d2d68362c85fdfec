package org.waabox.vecino.client;

import org.waabox.vecino.event.ListingAdded;
import org.waabox.vecino.event.ListingDeleted;
import org.waabox.vecino.event.ListingUpdated;

/**
 * The kind of local mutation recorded by a {@link MutationIntent}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum IntentKind {

  /** A listing was created locally. */
  CREATED(ListingAdded.NAME),

  /** A listing was replaced locally. */
  UPDATED(ListingUpdated.NAME),

  /** A listing was deleted locally. */
  DELETED(ListingDeleted.NAME);

  /** The wire name of the event that replays the intent. */
  private final String eventName;

  /**
   * Creates a new kind.
   *
   * @param theEventName the event wire name, never null
   */
  IntentKind(final String theEventName) {
    eventName = theEventName;
  }

  /**
   * Returns the wire name of the event that replays this kind of intent.
   *
   * @return the event name, never null
   */
  public String eventName() {
    return eventName;
  }

  /**
   * Resolves a kind from the event wire name.
   *
   * @param eventName the event wire name, never null
   * @return the kind, never null
   * @throws IllegalArgumentException if the name is not a mutation event
   */
  public static IntentKind fromEventName(final String eventName) {
    for (IntentKind kind : values()) {
      if (kind.eventName.equals(eventName)) {
        return kind;
      }
    }
    throw new IllegalArgumentException(
        "Not a mutation event: " + eventName);
  }
}
