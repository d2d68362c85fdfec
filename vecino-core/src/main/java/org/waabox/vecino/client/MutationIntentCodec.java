package org.waabox.vecino.client;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.waabox.vecino.listing.Listing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Static utility class for the durable form of the offline queue.
 *
 * <p>The queue is a JSON array of objects with four fields: {@code id},
 * {@code action} (the wire name of the replaying event), {@code data} (the
 * listing document, or the listing id for deletions) and
 * {@code timestamp} (ISO-8601).
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MutationIntentCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  /** Private constructor to prevent instantiation. */
  private MutationIntentCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes the queued intents, preserving their order.
   *
   * @param intents the intents, never null.
   * @return the UTF-8 JSON bytes, never null.
   */
  public static byte[] serialize(final List<MutationIntent> intents) {
    Objects.requireNonNull(intents, "intents cannot be null");

    final ArrayNode array = MAPPER.createArrayNode();
    for (MutationIntent intent : intents) {
      final ObjectNode node = array.addObject();
      node.put("id", intent.id());
      node.put("action", intent.kind().eventName());
      if (intent.kind() == IntentKind.DELETED) {
        node.put("data", intent.listingId());
      } else {
        node.set("data", intent.listing().document());
      }
      node.put("timestamp", intent.queuedAt().toString());
    }
    try {
      return MAPPER.writeValueAsBytes(array);
    } catch (final IOException e) {
      throw new IllegalArgumentException("Failed to serialize intents", e);
    }
  }

  /**
   * Deserializes queued intents.
   *
   * @param data the UTF-8 JSON bytes, never null.
   * @return the intents in queue order, never null.
   * @throws IllegalArgumentException if the content is malformed.
   */
  public static List<MutationIntent> deserialize(final byte[] data) {
    Objects.requireNonNull(data, "data cannot be null");

    try {
      final JsonNode root = MAPPER.readTree(data);
      if (root == null || !root.isArray()) {
        throw new IllegalArgumentException(
            "The offline queue must be a JSON array");
      }
      final List<MutationIntent> intents = new ArrayList<>(root.size());
      for (JsonNode node : root) {
        intents.add(readIntent(node));
      }
      return intents;
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to deserialize the offline queue", e);
    }
  }

  /** Reads one queued intent.
   *
   * @param node the intent node.
   * @return the intent, never null.
   */
  private static MutationIntent readIntent(final JsonNode node) {
    final String id = requireField(node, "id").asText();
    final IntentKind kind = IntentKind.fromEventName(
        requireField(node, "action").asText());
    final JsonNode payload = requireField(node, "data");
    final Instant queuedAt = Instant.parse(
        requireField(node, "timestamp").asText());

    if (kind == IntentKind.DELETED) {
      return new MutationIntent(id, kind, null, payload.asText(), queuedAt);
    }
    return new MutationIntent(id, kind, Listing.of(payload), null, queuedAt);
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
}
