package org.waabox.vecino.listing;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates listing identifiers: the creation time in epoch millis followed
 * by a random base-36 suffix.
 *
 * <p>Identifiers sort roughly by creation time and do not need any
 * coordination between clients.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ListingIds {

  /** The number of random base-36 characters appended to the timestamp. */
  private static final int SUFFIX_LENGTH = 9;

  /** The radix used for the random suffix. */
  private static final int RADIX = 36;

  /** Private constructor to prevent instantiation. */
  private ListingIds() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Generates a new identifier.
   *
   * @return a new identifier, never null
   */
  public static String next() {
    final ThreadLocalRandom random = ThreadLocalRandom.current();
    final StringBuilder id = new StringBuilder();
    id.append(System.currentTimeMillis()).append('-');
    for (int i = 0; i < SUFFIX_LENGTH; i++) {
      id.append(Character.forDigit(random.nextInt(RADIX), RADIX));
    }
    return id.toString();
  }
}
