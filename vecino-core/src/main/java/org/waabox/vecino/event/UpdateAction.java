package org.waabox.vecino.event;

/**
 * The kind of change carried by an {@link UpdateListings} event.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum UpdateAction {

  /** A listing was created. */
  ADDED("added"),

  /** A listing was replaced. */
  UPDATED("updated"),

  /** A listing was removed. */
  DELETED("deleted");

  /** The wire value of the action. */
  private final String wireName;

  /**
   * Creates a new action.
   *
   * @param theWireName the wire value, never null
   */
  UpdateAction(final String theWireName) {
    wireName = theWireName;
  }

  /**
   * Returns the wire value of this action.
   *
   * @return the wire value, never null
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves an action from its wire value.
   *
   * @param wireName the wire value, never null
   * @return the action, never null
   * @throws IllegalArgumentException if the value is unknown
   */
  public static UpdateAction fromWireName(final String wireName) {
    for (UpdateAction action : values()) {
      if (action.wireName.equals(wireName)) {
        return action;
      }
    }
    throw new IllegalArgumentException("Unknown update action: " + wireName);
  }
}
