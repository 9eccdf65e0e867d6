package com.codeheadsystems.rental.server.store;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DocumentStore} backed by a MongoDB database.
 * <p>
 * Identifiers are {@link ObjectId}s exposed as hex strings. Replacements are conditional on
 * the version read just before, so a concurrent edit of the same document surfaces as
 * {@code NOT_FOUND} rather than silently overwriting. Duplicate-key violations from unique
 * indexes are reported as {@code CONFLICT}; every other driver failure is {@code TRANSPORT}.
 */
public class MongoDocumentStore implements DocumentStore {

  private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);

  private final MongoDatabase database;

  public MongoDocumentStore(MongoDatabase database) {
    this.database = database;
  }

  private MongoCollection<org.bson.Document> collection(String name) {
    return database.getCollection(name);
  }

  @Override
  public List<Document> query(String collection, DocumentFilter filter, Page page) {
    try {
      FindIterable<org.bson.Document> found = collection(collection)
          .find(toBson(filter == null ? DocumentFilter.empty() : filter));
      if (page.skip() > 0) {
        found = found.skip(page.skip());
      }
      if (page.limit() > 0) {
        found = found.limit(page.limit());
      }
      List<Document> result = new ArrayList<>();
      for (org.bson.Document raw : found.into(new ArrayList<>())) {
        result.add(fromBson(raw));
      }
      log.debug("Query on {} {} returned {} document(s)", collection, filter, result.size());
      return result;
    } catch (MongoException e) {
      log.error("Error querying {}: {}", collection, e.getMessage());
      throw StoreException.transport("Error querying the collection", e);
    }
  }

  @Override
  public String insert(String collection, DocumentFilter uniquenessFilter, Document document) {
    MongoCollection<org.bson.Document> target = collection(collection);
    try {
      if (uniquenessFilter != null && target.find(toBson(uniquenessFilter)).limit(1).first() != null) {
        log.debug("Document already exists in {} for {}", collection, uniquenessFilter);
        throw StoreException.conflict("Document already exists in the collection");
      }
      ObjectId id = new ObjectId();
      int version = document.version() > 0 ? document.version() : 1;
      target.insertOne(toBson(id, version, Instant.now(), document.fields()));
      log.debug("Inserted document {} into {}", id.toHexString(), collection);
      return id.toHexString();
    } catch (MongoWriteException e) {
      if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
        throw new StoreException(StoreException.Kind.CONFLICT, "Document already exists in the collection", e);
      }
      log.error("Error inserting into {}: {}", collection, e.getMessage());
      throw StoreException.transport("Error inserting the document", e);
    } catch (MongoException e) {
      log.error("Error inserting into {}: {}", collection, e.getMessage());
      throw StoreException.transport("Error inserting the document", e);
    }
  }

  @Override
  public void deleteOne(String collection, DocumentFilter filter) {
    Objects.requireNonNull(filter, "filter");
    DeleteResult result;
    try {
      result = collection(collection).deleteOne(toBson(filter));
    } catch (MongoException e) {
      log.error("Error deleting from {}: {}", collection, e.getMessage());
      throw StoreException.transport("Error deleting the document", e);
    }
    if (result.getDeletedCount() == 0) {
      log.debug("Nothing to delete in {} for {}", collection, filter);
      throw StoreException.notFound("Document not found, the identifier might be incorrect");
    }
  }

  @Override
  public Document replaceOne(String collection, DocumentFilter filter, Document document) {
    Objects.requireNonNull(filter, "filter");
    MongoCollection<org.bson.Document> target = collection(collection);
    try {
      org.bson.Document current = target.find(toBson(filter)).limit(1).first();
      if (current == null) {
        throw StoreException.notFound("Document not found, the identifier might be incorrect");
      }
      Document existing = fromBson(current);
      if (existing.fields().equals(document.fields())) {
        throw StoreException.notFound("Document is unchanged");
      }
      ObjectId id = current.getObjectId(Document.ID);
      Instant now = Instant.now();
      int nextVersion = existing.version() + 1;
      UpdateResult result = target.replaceOne(
          Filters.and(Filters.eq(Document.ID, id), Filters.eq(Document.VERSION, existing.version())),
          toBson(id, nextVersion, now, document.fields()));
      if (result.getModifiedCount() == 0) {
        throw StoreException.notFound("Document changed or vanished during the edit");
      }
      log.debug("Replaced document {} in {} (version {})", id.toHexString(), collection, nextVersion);
      return new Document(id.toHexString(), nextVersion, now, document.fields());
    } catch (MongoException e) {
      log.error("Error replacing in {}: {}", collection, e.getMessage());
      throw StoreException.transport("Error updating the document", e);
    }
  }

  @Override
  public void ping() {
    try {
      database.runCommand(new org.bson.Document("ping", 1));
    } catch (MongoException e) {
      throw StoreException.transport("MongoDB is unreachable", e);
    }
  }

  static Bson toBson(DocumentFilter filter) {
    Objects.requireNonNull(filter, "filter");
    if (filter.isEmpty()) {
      return Filters.empty();
    }
    List<Bson> clauses = new ArrayList<>();
    for (DocumentFilter.Constraint c : filter.constraints()) {
      if (c.pattern() != null) {
        clauses.add(Filters.regex(c.field(), c.pattern()));
      } else if (Document.ID.equals(c.field()) && c.value() instanceof String s && ObjectId.isValid(s)) {
        clauses.add(Filters.eq(Document.ID, new ObjectId(s)));
      } else if (Document.LAST_MODIFIED.equals(c.field()) && c.value() instanceof Instant i) {
        clauses.add(Filters.eq(Document.LAST_MODIFIED, Date.from(i)));
      } else {
        clauses.add(Filters.eq(c.field(), c.value()));
      }
    }
    return clauses.size() == 1 ? clauses.get(0) : Filters.and(clauses);
  }

  private static org.bson.Document toBson(ObjectId id, int version, Instant lastModified,
                                          Map<String, Object> fields) {
    org.bson.Document raw = new org.bson.Document(Document.ID, id);
    raw.putAll(fields);
    raw.put(Document.VERSION, version);
    raw.put(Document.LAST_MODIFIED, Date.from(lastModified));
    return raw;
  }

  static Document fromBson(org.bson.Document raw) {
    Object rawId = raw.get(Document.ID);
    String id = rawId instanceof ObjectId oid ? oid.toHexString() : String.valueOf(rawId);
    Object rawVersion = raw.get(Document.VERSION);
    int version = rawVersion instanceof Number n ? n.intValue() : 1;
    Object rawModified = raw.get(Document.LAST_MODIFIED);
    Instant lastModified = rawModified instanceof Date d ? d.toInstant() : null;
    return new Document(id, version, lastModified, new LinkedHashMap<>(raw));
  }
}
