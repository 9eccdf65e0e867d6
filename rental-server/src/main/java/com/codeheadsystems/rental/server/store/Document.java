package com.codeheadsystems.rental.server.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A stored document: an immutable identifier, a version, a last-modified timestamp and a body
 * of named fields.
 * <p>
 * The three metadata values are owned by the {@link DocumentStore}. Documents handed to
 * {@code insert} or {@code replaceOne} only need a body; whatever metadata they carry is
 * ignored except for an explicit initial version on insert.
 *
 * @param id           store-assigned identifier, {@code null} before insert
 * @param version      1 after insert, incremented by exactly one per successful replace
 * @param lastModified time of the last write, {@code null} before insert
 * @param fields       document body, never containing the metadata keys
 */
public record Document(String id, int version, Instant lastModified, Map<String, Object> fields) {

  public static final String ID = "_id";
  public static final String VERSION = "version";
  public static final String LAST_MODIFIED = "lastModified";

  public Document {
    LinkedHashMap<String, Object> copy = new LinkedHashMap<>(fields == null ? Map.of() : fields);
    copy.remove(ID);
    copy.remove(VERSION);
    copy.remove(LAST_MODIFIED);
    fields = Collections.unmodifiableMap(copy);
  }

  /**
   * A new, not yet stored document with the given body.
   */
  public static Document of(Map<String, Object> fields) {
    return new Document(null, 0, null, fields);
  }

  /**
   * Reads a body field or one of the metadata keys.
   *
   * @param field field name
   * @return the value, or {@code null} when absent
   */
  public Object get(String field) {
    return switch (field) {
      case ID -> id;
      case VERSION -> version;
      case LAST_MODIFIED -> lastModified;
      default -> fields.get(field);
    };
  }

  /**
   * Reads a body field as a string.
   */
  public String getString(String field) {
    Object value = get(field);
    return value == null ? null : value.toString();
  }

  /**
   * Copy carrying the given store metadata.
   */
  public Document withMetadata(String newId, int newVersion, Instant newLastModified) {
    return new Document(newId, newVersion, newLastModified, fields);
  }
}
