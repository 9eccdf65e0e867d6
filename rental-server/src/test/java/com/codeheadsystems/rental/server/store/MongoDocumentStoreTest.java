package com.codeheadsystems.rental.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mongodb.MongoTimeoutException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import org.bson.BsonDocument;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MongoDocumentStoreTest {

  @Mock
  private MongoDatabase database;
  @Mock
  private MongoCollection<org.bson.Document> collection;
  @Mock
  private FindIterable<org.bson.Document> findIterable;

  private MongoDocumentStore store;

  @BeforeEach
  void setUp() {
    lenient().when(database.getCollection("items")).thenReturn(collection);
    store = new MongoDocumentStore(database);
  }

  @Test
  void insert_existingMatch_conflictsWithoutWriting() {
    when(collection.find(any(Bson.class))).thenReturn(findIterable);
    when(findIterable.limit(anyInt())).thenReturn(findIterable);
    when(findIterable.first()).thenReturn(new org.bson.Document("title", "Alien"));

    assertThatThrownBy(() -> store.insert("items", DocumentFilter.eq("title", "Alien"),
        Document.of(Map.of("title", "Alien"))))
        .isInstanceOf(StoreException.class)
        .satisfies(e -> assertThat(((StoreException) e).kind()).isEqualTo(StoreException.Kind.CONFLICT));
    verify(collection, never()).insertOne(any(org.bson.Document.class));
  }

  @Test
  void insert_writesMetadataAndReturnsHexId() {
    when(collection.find(any(Bson.class))).thenReturn(findIterable);
    when(findIterable.limit(anyInt())).thenReturn(findIterable);
    when(findIterable.first()).thenReturn(null);

    String id = store.insert("items", DocumentFilter.eq("title", "Alien"), Document.of(Map.of("title", "Alien")));

    ArgumentCaptor<org.bson.Document> captor = ArgumentCaptor.forClass(org.bson.Document.class);
    verify(collection).insertOne(captor.capture());
    org.bson.Document written = captor.getValue();
    assertThat(written.getObjectId("_id").toHexString()).isEqualTo(id);
    assertThat(written.getInteger("version")).isEqualTo(1);
    assertThat(written.get("lastModified")).isInstanceOf(Date.class);
    assertThat(written.getString("title")).isEqualTo("Alien");
  }

  @Test
  void deleteOne_nothingDeleted_isNotFound() {
    when(collection.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(0));

    assertThatThrownBy(() -> store.deleteOne("items", DocumentFilter.byId(new ObjectId().toHexString())))
        .isInstanceOf(StoreException.class)
        .satisfies(e -> assertThat(((StoreException) e).kind()).isEqualTo(StoreException.Kind.NOT_FOUND));
  }

  @Test
  void deleteOne_driverFailure_isTransport() {
    when(collection.deleteOne(any(Bson.class))).thenThrow(new MongoTimeoutException("timed out"));

    assertThatThrownBy(() -> store.deleteOne("items", DocumentFilter.eq("title", "Alien")))
        .isInstanceOf(StoreException.class)
        .satisfies(e -> assertThat(((StoreException) e).kind()).isEqualTo(StoreException.Kind.TRANSPORT));
  }

  @Test
  void replaceOne_bumpsVersionConditionally() {
    ObjectId id = new ObjectId();
    org.bson.Document current = new org.bson.Document("_id", id)
        .append("title", "Alien")
        .append("version", 3)
        .append("lastModified", new Date());
    when(collection.find(any(Bson.class))).thenReturn(findIterable);
    when(findIterable.limit(anyInt())).thenReturn(findIterable);
    when(findIterable.first()).thenReturn(current);
    when(collection.replaceOne(any(Bson.class), any(org.bson.Document.class)))
        .thenReturn(UpdateResult.acknowledged(1, 1L, null));

    Document replaced = store.replaceOne("items", DocumentFilter.byId(id.toHexString()),
        Document.of(Map.of("title", "Aliens")));

    assertThat(replaced.id()).isEqualTo(id.toHexString());
    assertThat(replaced.version()).isEqualTo(4);
    ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);
    verify(collection).replaceOne(filter.capture(), any(org.bson.Document.class));
    assertThat(filter.getValue().toBsonDocument().toJson())
        .isEqualTo(Filters.and(Filters.eq("_id", id), Filters.eq("version", 3)).toBsonDocument().toJson());
  }

  @Test
  void replaceOne_unchangedBody_isNotFound() {
    org.bson.Document current = new org.bson.Document("_id", new ObjectId())
        .append("title", "Alien")
        .append("version", 1);
    when(collection.find(any(Bson.class))).thenReturn(findIterable);
    when(findIterable.limit(anyInt())).thenReturn(findIterable);
    when(findIterable.first()).thenReturn(current);

    assertThatThrownBy(() -> store.replaceOne("items", DocumentFilter.eq("title", "Alien"),
        Document.of(Map.of("title", "Alien"))))
        .isInstanceOf(StoreException.class)
        .satisfies(e -> assertThat(((StoreException) e).kind()).isEqualTo(StoreException.Kind.NOT_FOUND));
    verify(collection, never()).replaceOne(any(Bson.class), any(org.bson.Document.class));
  }

  @Test
  void replaceOne_concurrentEdit_isNotFound() {
    org.bson.Document current = new org.bson.Document("_id", new ObjectId())
        .append("title", "Alien")
        .append("version", 1);
    when(collection.find(any(Bson.class))).thenReturn(findIterable);
    when(findIterable.limit(anyInt())).thenReturn(findIterable);
    when(findIterable.first()).thenReturn(current);
    when(collection.replaceOne(any(Bson.class), any(org.bson.Document.class)))
        .thenReturn(UpdateResult.acknowledged(0, 0L, null));

    assertThatThrownBy(() -> store.replaceOne("items", DocumentFilter.eq("title", "Alien"),
        Document.of(Map.of("title", "Aliens"))))
        .isInstanceOf(StoreException.class)
        .satisfies(e -> assertThat(((StoreException) e).kind()).isEqualTo(StoreException.Kind.NOT_FOUND));
  }

  @Test
  void query_nullFilter_matchesWholeCollection() {
    when(collection.find(any(Bson.class))).thenReturn(findIterable);
    when(findIterable.into(any())).thenAnswer(inv -> inv.getArgument(0));

    assertThat(store.query("items", null)).isEmpty();

    ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);
    verify(collection).find(filter.capture());
    assertThat(filter.getValue().toBsonDocument()).isEmpty();
  }

  @Test
  void deleteOne_nullFilter_isRejectedWithoutTouchingDriver() {
    assertThatThrownBy(() -> store.deleteOne("items", null)).isInstanceOf(NullPointerException.class);
    verify(collection, never()).deleteOne(any(Bson.class));
  }

  @Test
  void replaceOne_nullFilter_isRejectedWithoutTouchingDriver() {
    assertThatThrownBy(() -> store.replaceOne("items", null, Document.of(Map.of("title", "Aliens"))))
        .isInstanceOf(NullPointerException.class);
    verify(collection, never()).find(any(Bson.class));
    verify(collection, never()).replaceOne(any(Bson.class), any(org.bson.Document.class));
  }

  @Test
  void toBson_translatesIdsAndTimestamps() {
    ObjectId id = new ObjectId();
    Instant when = Instant.parse("2024-01-01T00:00:00Z");

    BsonDocument byId = MongoDocumentStore.toBson(DocumentFilter.byId(id.toHexString())).toBsonDocument();
    BsonDocument byTime = MongoDocumentStore.toBson(DocumentFilter.eq("lastModified", when)).toBsonDocument();

    assertThat(byId.getObjectId("_id").getValue()).isEqualTo(id);
    assertThat(byTime.getDateTime("lastModified").getValue()).isEqualTo(when.toEpochMilli());
    assertThat(MongoDocumentStore.toBson(DocumentFilter.empty()).toBsonDocument()).isEmpty();
  }

  @Test
  void fromBson_splitsMetadataFromBody() {
    ObjectId id = new ObjectId();
    Date modified = new Date();
    Document doc = MongoDocumentStore.fromBson(new org.bson.Document("_id", id)
        .append("title", "Alien")
        .append("version", 2)
        .append("lastModified", modified));

    assertThat(doc.id()).isEqualTo(id.toHexString());
    assertThat(doc.version()).isEqualTo(2);
    assertThat(doc.lastModified()).isEqualTo(modified.toInstant());
    assertThat(doc.fields()).containsOnlyKeys("title");
  }
}
