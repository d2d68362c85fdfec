package org.waabox.vecino;

/**
 * Signals a failure of a persistence backend: the server listing store,
 * the durable offline queue or the local replica storage.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PersistenceException extends VecinoException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public PersistenceException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public PersistenceException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
