package org.waabox.vecino.event;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

import org.waabox.vecino.listing.Listing;
import org.waabox.vecino.listing.ListingCodec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Static utility class that converts {@link SyncEvent} instances to and
 * from WebSocket text frames.
 *
 * <p>Every frame is a JSON object with two fields: {@code event}, the wire
 * name, and {@code data}, the event payload. {@link Instant} values are
 * written as ISO-8601 strings.
 *
 * <p>Sync candidates ({@code sync-listings}) are decoded leniently: entries
 * that are not valid listings are skipped. Every other malformed payload
 * fails the whole frame.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SyncEventCodec {

  /** The frame field holding the event name. */
  private static final String EVENT_FIELD = "event";

  /** The frame field holding the payload. */
  private static final String DATA_FIELD = "data";

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private SyncEventCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Encodes an event into a text frame.
   *
   * @param event the event to encode, never null.
   * @return the JSON frame, never null.
   */
  public static String encode(final SyncEvent event) {
    Objects.requireNonNull(event, "event cannot be null");

    final ObjectNode frame = MAPPER.createObjectNode();
    frame.put(EVENT_FIELD, event.name());
    frame.set(DATA_FIELD, event.accept(new PayloadWriter()));
    return frame.toString();
  }

  /**
   * Decodes a text frame into an event.
   *
   * @param frame the JSON frame to parse, never null.
   * @return the decoded event, never null.
   * @throws IllegalArgumentException if the frame is malformed, names an
   *     unknown event or carries an invalid payload.
   */
  public static SyncEvent decode(final String frame) {
    Objects.requireNonNull(frame, "frame cannot be null");

    final JsonNode root;
    try {
      root = MAPPER.readTree(frame);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed sync frame: " + frame, e);
    }
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException(
          "A sync frame must be a JSON object: " + frame);
    }
    final JsonNode nameNode = requireField(root, EVENT_FIELD);
    if (!nameNode.isTextual()) {
      throw new IllegalArgumentException("Event name must be a string: "
          + frame);
    }
    final String name = nameNode.asText();
    final JsonNode data = requireField(root, DATA_FIELD);

    switch (name) {
      case ListingAdded.NAME:
        return new ListingAdded(Listing.of(data));
      case ListingUpdated.NAME:
        return new ListingUpdated(Listing.of(data));
      case ListingDeleted.NAME:
        return new ListingDeleted(requireText(data, name));
      case SyncListings.NAME:
        return new SyncListings(ListingCodec.fromArrayLenient(data));
      case UpdateListings.NAME:
        return decodeUpdate(data);
      case SyncAllListings.NAME:
        return new SyncAllListings(ListingCodec.fromArray(data));
      case UsersCount.NAME:
        if (!data.canConvertToInt()) {
          throw new IllegalArgumentException(
              "users-count must be an integer: " + data);
        }
        return new UsersCount(data.asInt());
      default:
        throw new IllegalArgumentException("Unknown sync event: " + name);
    }
  }

  /** Decodes the payload of an update-listings event.
   *
   * @param data the payload node.
   * @return the event, never null.
   */
  private static UpdateListings decodeUpdate(final JsonNode data) {
    if (!data.isObject()) {
      throw new IllegalArgumentException(
          "update-listings payload must be an object: " + data);
    }
    final UpdateAction action = UpdateAction.fromWireName(
        requireText(requireField(data, "action"), "action"));

    Instant timestamp = Instant.now();
    final JsonNode timestampNode = data.get("timestamp");
    if (timestampNode != null && timestampNode.isTextual()) {
      try {
        timestamp = Instant.parse(timestampNode.asText());
      } catch (final DateTimeParseException e) {
        throw new IllegalArgumentException(
            "Invalid update timestamp: " + timestampNode, e);
      }
    }

    if (action == UpdateAction.DELETED) {
      final String listingId = requireText(
          requireField(data, "listingId"), "listingId");
      return UpdateListings.deleted(listingId, timestamp);
    }
    final Listing listing = Listing.of(requireField(data, "listing"));
    return new UpdateListings(action, listing, null, timestamp);
  }

  /** Returns the field node for the given key or throws if missing.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the field node, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException(
          "Missing field: " + field + " in JSON: " + node);
    }
    return value;
  }

  /** Returns the node text, failing when it is not a non-blank string.
   *
   * @param node the node.
   * @param what a description for the error message.
   * @return the text, never null.
   */
  private static String requireText(final JsonNode node, final String what) {
    if (!node.isTextual() || node.asText().isBlank()) {
      throw new IllegalArgumentException(
          what + " must be a non-blank string, got: " + node);
    }
    return node.asText();
  }

  /** Builds the {@code data} node of each event. */
  private static final class PayloadWriter
      implements SyncEvent.Visitor<JsonNode> {

    @Override
    public JsonNode visitListingAdded(final ListingAdded event) {
      return event.listing().document();
    }

    @Override
    public JsonNode visitListingUpdated(final ListingUpdated event) {
      return event.listing().document();
    }

    @Override
    public JsonNode visitListingDeleted(final ListingDeleted event) {
      return TextNode.valueOf(event.listingId());
    }

    @Override
    public JsonNode visitSyncListings(final SyncListings event) {
      return ListingCodec.toArray(event.listings());
    }

    @Override
    public JsonNode visitUpdateListings(final UpdateListings event) {
      final ObjectNode data = MAPPER.createObjectNode();
      data.put("action", event.action().wireName());
      if (event.action() == UpdateAction.DELETED) {
        data.put("listingId", event.listingId());
      } else {
        data.set("listing", event.listing().document());
      }
      data.put("timestamp", event.timestamp().toString());
      return data;
    }

    @Override
    public JsonNode visitSyncAllListings(final SyncAllListings event) {
      return ListingCodec.toArray(event.listings());
    }

    @Override
    public JsonNode visitUsersCount(final UsersCount event) {
      return IntNode.valueOf(event.count());
    }
  }
}
