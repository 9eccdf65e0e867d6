package com.codeheadsystems.rental.server.store;

import java.util.List;

/**
 * Generic CRUD over named collections with conflict-aware insert and conditional
 * replace/delete.
 * <p>
 * Implementations must be thread-safe. Operations may interleave arbitrarily across callers
 * and none of them retries.
 * <p>
 * <strong>Exception contract</strong> (route handlers map these to responses):
 * <ul>
 *   <li>{@link StoreException.Kind#NOT_FOUND} → HTTP 400</li>
 *   <li>{@link StoreException.Kind#CONFLICT}  → HTTP 409</li>
 *   <li>{@link StoreException.Kind#TRANSPORT} → HTTP 500</li>
 * </ul>
 * Successful operations map to 201 for {@code insert} and 200 otherwise.
 * <p>
 * <strong>Uniqueness:</strong> the insert pre-check is not guaranteed atomic against a
 * concurrent identical insert. Backends that support unique indexes should declare one and
 * report its violation as {@code CONFLICT}; the pre-check then only yields a better error.
 * <p>
 * <strong>Filters:</strong> a {@code null} filter on {@code query} means the whole collection.
 * {@code deleteOne} and {@code replaceOne} reject a {@code null} filter with a
 * {@link NullPointerException}; they never pick an arbitrary document.
 */
public interface DocumentStore {

  /**
   * Returns every document of the collection matching the filter, within the page.
   *
   * @param collection collection name
   * @param filter     constraints; {@code null} or {@link DocumentFilter#empty()} returns the
   *                   whole collection
   * @param page       skip/limit window
   * @return the matches, fully materialized
   */
  List<Document> query(String collection, DocumentFilter filter, Page page);

  default List<Document> query(String collection, DocumentFilter filter) {
    return query(collection, filter, Page.all());
  }

  /**
   * Inserts a document after checking that nothing matches the uniqueness filter.
   *
   * @param collection       collection name
   * @param uniquenessFilter filter that must match nothing, or {@code null} for no check
   * @param document         body to store; version defaults to 1
   * @return the new immutable identifier
   * @throws StoreException {@code CONFLICT} when the uniqueness filter matches
   */
  String insert(String collection, DocumentFilter uniquenessFilter, Document document);

  /**
   * Deletes at most one matching document.
   *
   * @throws NullPointerException when the filter is {@code null}
   * @throws StoreException {@code NOT_FOUND} when nothing matches
   */
  void deleteOne(String collection, DocumentFilter filter);

  /**
   * Replaces the body of the first matching document, keeping its identifier and
   * incrementing its version by one.
   *
   * @return the stored document after replacement
   * @throws NullPointerException when the filter is {@code null}
   * @throws StoreException {@code NOT_FOUND} when nothing matches, or when the new body is
   *                        identical to the stored one
   */
  Document replaceOne(String collection, DocumentFilter filter, Document document);

  /**
   * Checks the backend is reachable.
   *
   * @throws StoreException {@code TRANSPORT} when it is not
   */
  void ping();
}
