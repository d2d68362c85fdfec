package org.waabox.vecino;

/**
 * Base exception for all Vecino-related errors.
 *
 * <p>This is an unchecked exception. The synchronization engine catches and
 * logs it at its boundaries; it is never fatal to the process.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class VecinoException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public VecinoException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public VecinoException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
