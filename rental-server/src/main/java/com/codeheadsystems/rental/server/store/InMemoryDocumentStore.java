package com.codeheadsystems.rental.server.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link DocumentStore}.
 * <p>
 * Each collection is an insertion-ordered map guarded by its own monitor, so within one
 * collection the uniqueness check and the write happen atomically. All data is lost on
 * restart. Suitable for development and testing only.
 */
public class InMemoryDocumentStore implements DocumentStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

  private final ConcurrentHashMap<String, Map<String, Document>> collections = new ConcurrentHashMap<>();

  public InMemoryDocumentStore() {
    log.warn("Using InMemoryDocumentStore. Documents will NOT survive restarts. "
        + "Configure a MongoDB backend for production.");
  }

  private Map<String, Document> collection(String name) {
    return collections.computeIfAbsent(name, k -> new LinkedHashMap<>());
  }

  @Override
  public List<Document> query(String collection, DocumentFilter filter, Page page) {
    DocumentFilter effective = filter == null ? DocumentFilter.empty() : filter;
    Map<String, Document> docs = collection(collection);
    List<Document> result = new ArrayList<>();
    synchronized (docs) {
      int skipped = 0;
      for (Document doc : docs.values()) {
        if (!effective.test(doc)) {
          continue;
        }
        if (skipped < page.skip()) {
          skipped++;
          continue;
        }
        result.add(doc);
        if (page.limit() > 0 && result.size() >= page.limit()) {
          break;
        }
      }
    }
    log.debug("Query on {} {} returned {} document(s)", collection, effective, result.size());
    return result;
  }

  @Override
  public String insert(String collection, DocumentFilter uniquenessFilter, Document document) {
    Map<String, Document> docs = collection(collection);
    synchronized (docs) {
      if (uniquenessFilter != null && docs.values().stream().anyMatch(uniquenessFilter::test)) {
        log.debug("Document already exists in {} for {}", collection, uniquenessFilter);
        throw StoreException.conflict("Document already exists in the collection");
      }
      String id = new ObjectId().toHexString();
      int version = document.version() > 0 ? document.version() : 1;
      docs.put(id, document.withMetadata(id, version, Instant.now()));
      log.debug("Inserted document {} into {}", id, collection);
      return id;
    }
  }

  @Override
  public void deleteOne(String collection, DocumentFilter filter) {
    Objects.requireNonNull(filter, "filter");
    Map<String, Document> docs = collection(collection);
    synchronized (docs) {
      Document match = firstMatch(docs, filter);
      if (match == null) {
        throw StoreException.notFound("Document not found, the identifier might be incorrect");
      }
      docs.remove(match.id());
      log.debug("Deleted document {} from {}", match.id(), collection);
    }
  }

  @Override
  public Document replaceOne(String collection, DocumentFilter filter, Document document) {
    Objects.requireNonNull(filter, "filter");
    Map<String, Document> docs = collection(collection);
    synchronized (docs) {
      Document match = firstMatch(docs, filter);
      if (match == null || match.fields().equals(document.fields())) {
        throw StoreException.notFound(
            "Document not found, the identifier might be incorrect or the document is unchanged");
      }
      Document replaced = new Document(match.id(), match.version() + 1, Instant.now(), document.fields());
      docs.put(match.id(), replaced);
      log.debug("Replaced document {} in {} (version {})", match.id(), collection, replaced.version());
      return replaced;
    }
  }

  @Override
  public void ping() {
    // always reachable
  }

  private static Document firstMatch(Map<String, Document> docs, DocumentFilter filter) {
    for (Document doc : docs.values()) {
      if (filter.test(doc)) {
        return doc;
      }
    }
    return null;
  }
}
