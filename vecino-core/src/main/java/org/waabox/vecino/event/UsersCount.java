package org.waabox.vecino.event;

/**
 * The server announces the number of connected clients.
 *
 * @param count the number of open channels, never negative
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record UsersCount(int count) implements SyncEvent {

  /** The wire name of this event. */
  public static final String NAME = "users-count";

  /** Validates the event. */
  public UsersCount {
    if (count < 0) {
      throw new IllegalArgumentException(
          "count must not be negative, got: " + count);
    }
  }

  /** {@inheritDoc} */
  @Override
  public String name() {
    return NAME;
  }

  /** {@inheritDoc} */
  @Override
  public <R> R accept(final Visitor<R> visitor) {
    return visitor.visitUsersCount(this);
  }
}
