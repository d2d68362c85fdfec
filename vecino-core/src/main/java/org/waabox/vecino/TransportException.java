package org.waabox.vecino;

/**
 * Signals that a sync channel is closed or that a send over it failed.
 *
 * <p>Transport failures are recoverable: the client keeps the affected
 * intents queued and retries on the next connection.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TransportException extends VecinoException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public TransportException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public TransportException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
