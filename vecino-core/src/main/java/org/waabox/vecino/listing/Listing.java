package org.waabox.vecino.listing;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A listing: an opaque JSON document identified by its {@code id} field.
 *
 * <p>The synchronization engine never looks inside a listing beyond its
 * identifier. Writes replace the whole value; two listings are equal when
 * their documents are equal.
 *
 * <p>Instances are immutable. The backing document is copied on the way in
 * and on the way out.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Listing {

  /** The name of the identifier field inside the document. */
  public static final String ID_FIELD = "id";

  /** The name of the optional title field, used only for log messages. */
  private static final String TITLE_FIELD = "title";

  /** The listing identifier, never null or blank. */
  private final String id;

  /** The full listing document, including the id, never null. */
  private final ObjectNode document;

  /**
   * Creates a new listing.
   *
   * @param theId the identifier, never null
   * @param theDocument the document, never null
   */
  private Listing(final String theId, final ObjectNode theDocument) {
    id = theId;
    document = theDocument;
  }

  /**
   * Creates a listing from an existing document.
   *
   * @param document the JSON document, must be an object carrying a
   *                 non-blank textual {@code id}, never null
   * @return the listing, never null
   * @throws IllegalArgumentException if the document is not an object or
   *                                  lacks a valid id
   */
  public static Listing of(final JsonNode document) {
    Objects.requireNonNull(document, "document must not be null");
    if (!document.isObject()) {
      throw new IllegalArgumentException(
          "A listing must be a JSON object, got: " + document.getNodeType());
    }
    final JsonNode idNode = document.get(ID_FIELD);
    if (idNode == null || !idNode.isTextual() || idNode.asText().isBlank()) {
      throw new IllegalArgumentException(
          "A listing must carry a non-blank textual id: " + document);
    }
    return new Listing(idNode.asText(), ((ObjectNode) document).deepCopy());
  }

  /**
   * Creates a brand new listing with a freshly generated identifier.
   *
   * <p>Any {@code id} present in the given fields is ignored.
   *
   * @param fields the listing payload, never null
   * @return the new listing, never null
   */
  public static Listing create(final ObjectNode fields) {
    Objects.requireNonNull(fields, "fields must not be null");
    final String id = ListingIds.next();
    final ObjectNode document = JsonNodeFactory.instance.objectNode();
    document.put(ID_FIELD, id);
    final Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
    while (it.hasNext()) {
      final Map.Entry<String, JsonNode> field = it.next();
      if (!ID_FIELD.equals(field.getKey())) {
        document.set(field.getKey(), field.getValue().deepCopy());
      }
    }
    return new Listing(id, document);
  }

  /**
   * Returns a copy of this listing with the given payload, keeping the id.
   *
   * <p>Used to build the full replacement value of an update.
   *
   * @param fields the new payload, never null
   * @return the replacement listing, never null
   */
  public Listing withFields(final ObjectNode fields) {
    Objects.requireNonNull(fields, "fields must not be null");
    final ObjectNode replacement = fields.deepCopy();
    replacement.put(ID_FIELD, id);
    return new Listing(id, replacement);
  }

  /**
   * Returns the listing identifier.
   *
   * @return the id, never null or blank
   */
  public String id() {
    return id;
  }

  /**
   * Returns the listing title when the payload carries a textual one.
   *
   * @return the title, never null
   */
  public Optional<String> title() {
    final JsonNode title = document.get(TITLE_FIELD);
    if (title == null || !title.isTextual()) {
      return Optional.empty();
    }
    return Optional.of(title.asText());
  }

  /**
   * Returns a copy of the listing document.
   *
   * @return a mutable copy of the document, never null
   */
  public ObjectNode document() {
    return document.deepCopy();
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Listing)) {
      return false;
    }
    return document.equals(((Listing) other).document);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return document.hashCode();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "Listing[" + id + "]";
  }
}
