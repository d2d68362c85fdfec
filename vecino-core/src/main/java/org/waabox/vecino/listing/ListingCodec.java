package org.waabox.vecino.listing;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * Static utility class that converts listings to and from JSON.
 *
 * <p>Collections of listings are represented as JSON arrays of listing
 * documents. Byte serialization produces pretty-printed UTF-8 JSON so that
 * file-backed stores stay readable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ListingCodec {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ListingCodec.class);

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  /** Private constructor to prevent instantiation. */
  private ListingCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Converts listings into a JSON array, preserving their order.
   *
   * @param listings the listings, never null
   * @return the JSON array, never null
   */
  public static ArrayNode toArray(final Collection<Listing> listings) {
    Objects.requireNonNull(listings, "listings cannot be null");
    final ArrayNode array = MAPPER.createArrayNode();
    for (Listing listing : listings) {
      array.add(listing.document());
    }
    return array;
  }

  /**
   * Converts a JSON array into listings.
   *
   * @param array the JSON array, never null
   * @return the listings in array order, never null
   * @throws IllegalArgumentException if the node is not an array or any
   *                                  element is not a valid listing
   */
  public static List<Listing> fromArray(final JsonNode array) {
    requireArray(array);
    final List<Listing> listings = new ArrayList<>(array.size());
    for (JsonNode element : array) {
      listings.add(Listing.of(element));
    }
    return listings;
  }

  /**
   * Converts a JSON array into listings, skipping invalid elements.
   *
   * <p>Used for candidates coming from untrusted replicas, where one bad
   * element must not discard the valid ones.
   *
   * @param array the JSON array, never null
   * @return the valid listings in array order, never null
   * @throws IllegalArgumentException if the node is not an array
   */
  public static List<Listing> fromArrayLenient(final JsonNode array) {
    requireArray(array);
    final List<Listing> listings = new ArrayList<>(array.size());
    for (JsonNode element : array) {
      try {
        listings.add(Listing.of(element));
      } catch (final IllegalArgumentException e) {
        log.warn("Skipping invalid listing entry: {}", e.getMessage());
      }
    }
    return listings;
  }

  /**
   * Serializes listings into a pretty-printed JSON array.
   *
   * @param listings the listings, never null
   * @return the UTF-8 JSON bytes, never null
   */
  public static byte[] serialize(final Collection<Listing> listings) {
    return write(toArray(listings));
  }

  /**
   * Deserializes a JSON array of listings.
   *
   * @param data the UTF-8 JSON bytes, never null
   * @return the listings, never null
   * @throws IllegalArgumentException if the content is not a valid array
   *                                  of listings
   */
  public static List<Listing> deserialize(final byte[] data) {
    return fromArray(read(data));
  }

  /**
   * Serializes a single listing document.
   *
   * @param listing the listing, never null
   * @return the UTF-8 JSON bytes, never null
   */
  public static byte[] serializeOne(final Listing listing) {
    Objects.requireNonNull(listing, "listing cannot be null");
    return write(listing.document());
  }

  /**
   * Deserializes a single listing document.
   *
   * @param data the UTF-8 JSON bytes, never null
   * @return the listing, never null
   * @throws IllegalArgumentException if the content is not a valid listing
   */
  public static Listing deserializeOne(final byte[] data) {
    return Listing.of(read(data));
  }

  /** Writes the given node as pretty-printed bytes.
   *
   * @param node the node to write.
   * @return the bytes, never null.
   */
  private static byte[] write(final JsonNode node) {
    try {
      return MAPPER.writeValueAsBytes(node);
    } catch (final IOException e) {
      throw new IllegalArgumentException("Failed to serialize listings", e);
    }
  }

  /** Parses the given bytes into a tree.
   *
   * @param data the bytes to parse.
   * @return the root node, never null.
   */
  private static JsonNode read(final byte[] data) {
    Objects.requireNonNull(data, "data cannot be null");
    try {
      return MAPPER.readTree(data);
    } catch (final IOException e) {
      throw new IllegalArgumentException("Malformed listings JSON", e);
    }
  }

  /** Fails unless the node is a JSON array.
   *
   * @param node the node to check.
   */
  private static void requireArray(final JsonNode node) {
    Objects.requireNonNull(node, "array cannot be null");
    if (!node.isArray()) {
      throw new IllegalArgumentException(
          "Expected a JSON array of listings, got: " + node.getNodeType());
    }
  }
}
