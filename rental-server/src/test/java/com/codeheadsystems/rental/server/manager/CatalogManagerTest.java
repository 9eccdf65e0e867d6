package com.codeheadsystems.rental.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.rental.model.catalog.CatalogItem;
import com.codeheadsystems.rental.model.realtime.MessageEnvelope;
import com.codeheadsystems.rental.server.realtime.BroadcastDispatcher;
import com.codeheadsystems.rental.server.realtime.ConnectionRegistry;
import com.codeheadsystems.rental.server.realtime.MessageCodec;
import com.codeheadsystems.rental.server.realtime.RealtimeConnection;
import com.codeheadsystems.rental.server.store.InMemoryDocumentStore;
import com.codeheadsystems.rental.server.store.Page;
import com.codeheadsystems.rental.server.store.StoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CatalogManagerTest {

  private ConnectionRegistry registry;
  private List<MessageEnvelope> aliceInbox;
  private List<MessageEnvelope> bobInbox;
  private CatalogManager catalogManager;

  @BeforeEach
  void setUp() {
    registry = new ConnectionRegistry(Duration.ZERO);
    aliceInbox = new CopyOnWriteArrayList<>();
    bobInbox = new CopyOnWriteArrayList<>();
    registry.admit(inbox("a1", aliceInbox), "alice");
    registry.admit(inbox("b1", bobInbox), "bob");
    catalogManager = new CatalogManager(new InMemoryDocumentStore(), new BroadcastDispatcher(registry),
        new MessageCodec(new ObjectMapper()));
  }

  @Test
  void add_assignsServerFieldsAndNotifiesOwner() {
    CatalogItem created = catalogManager.add("alice", item(null, "Alien", 8));

    assertThat(created.id()).isNotBlank();
    assertThat(created.owner()).isEqualTo("alice");
    assertThat(created.version()).isEqualTo(1);
    assertThat(created.date()).isNotBlank();
    assertThat(aliceInbox).singleElement().satisfies(envelope -> {
      assertThat(envelope.type()).isEqualTo("item-created");
      assertThat(envelope.sender()).isEqualTo("server");
      assertThat(envelope.payload().get("title").asText()).isEqualTo("Alien");
    });
    assertThat(bobInbox).isEmpty();
  }

  @Test
  void add_duplicateTitle_conflicts() {
    catalogManager.add("alice", item(null, "Alien", 8));

    assertThatThrownBy(() -> catalogManager.add("bob", item(null, "Alien", 5)))
        .isInstanceOf(StoreException.class)
        .satisfies(e -> assertThat(((StoreException) e).kind()).isEqualTo(StoreException.Kind.CONFLICT));
    assertThat(catalogManager.list(null, Page.all())).hasSize(1);
  }

  @Test
  void add_invalidRating_isRejected() {
    assertThatThrownBy(() -> catalogManager.add("alice", item(null, "Alien", 11)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void edit_bumpsVersionAndNotifies() {
    CatalogItem created = catalogManager.add("alice", item(null, "Alien", 8));

    CatalogItem updated = catalogManager.edit("alice", item(created.id(), "Alien", 9));

    assertThat(updated.id()).isEqualTo(created.id());
    assertThat(updated.version()).isEqualTo(2);
    assertThat(updated.rating()).isEqualTo(9);
    assertThat(aliceInbox).extracting(MessageEnvelope::type).containsExactly("item-created", "item-updated");
  }

  @Test
  void edit_unchangedItem_isNotFound() {
    CatalogItem created = catalogManager.add("alice", item(null, "Alien", 8));

    assertThatThrownBy(() -> catalogManager.edit("alice", item(created.id(), "Alien", 8)))
        .isInstanceOf(StoreException.class)
        .satisfies(e -> assertThat(((StoreException) e).kind()).isEqualTo(StoreException.Kind.NOT_FOUND));
  }

  @Test
  void edit_someoneElsesItem_isNotFound() {
    CatalogItem created = catalogManager.add("alice", item(null, "Alien", 8));

    assertThatThrownBy(() -> catalogManager.edit("bob", item(created.id(), "Alien", 2)))
        .isInstanceOf(StoreException.class);
    assertThat(catalogManager.get(created.id()).rating()).isEqualTo(8);
  }

  @Test
  void delete_removesAndNotifies() {
    CatalogItem created = catalogManager.add("alice", item(null, "Alien", 8));

    catalogManager.delete("alice", created.id());

    assertThat(catalogManager.list("alice", Page.all())).isEmpty();
    assertThat(aliceInbox).extracting(MessageEnvelope::type).containsExactly("item-created", "item-deleted");
    assertThatThrownBy(() -> catalogManager.get(created.id())).isInstanceOf(StoreException.class);
  }

  @Test
  void list_filtersByOwnerAndPages() {
    catalogManager.add("alice", item(null, "Alien", 8));
    catalogManager.add("alice", item(null, "Aliens", 7));
    catalogManager.add("bob", item(null, "Heat", 9));

    assertThat(catalogManager.list("alice", Page.all())).extracting(CatalogItem::title)
        .containsExactly("Alien", "Aliens");
    assertThat(catalogManager.list(null, Page.of(1, 1))).extracting(CatalogItem::title)
        .containsExactly("Aliens");
  }

  private static CatalogItem item(String id, String title, int rating) {
    return new CatalogItem(id, title, "1979", 2.5, rating, "sci-fi", null, null, 0);
  }

  private static RealtimeConnection inbox(String id, List<MessageEnvelope> received) {
    return new RealtimeConnection() {
      @Override
      public String id() {
        return id;
      }

      @Override
      public void send(MessageEnvelope envelope) {
        received.add(envelope);
      }

      @Override
      public void sendClose(int code, String reason) {
      }

      @Override
      public void close() {
      }
    };
  }
}
