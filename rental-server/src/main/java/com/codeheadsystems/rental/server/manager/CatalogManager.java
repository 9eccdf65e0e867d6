package com.codeheadsystems.rental.server.manager;

import com.codeheadsystems.rental.model.catalog.CatalogItem;
import com.codeheadsystems.rental.server.realtime.BroadcastDispatcher;
import com.codeheadsystems.rental.server.realtime.BroadcastPredicate;
import com.codeheadsystems.rental.server.realtime.MessageCodec;
import com.codeheadsystems.rental.server.realtime.MessageType;
import com.codeheadsystems.rental.server.store.Document;
import com.codeheadsystems.rental.server.store.DocumentFilter;
import com.codeheadsystems.rental.server.store.DocumentStore;
import com.codeheadsystems.rental.server.store.Page;
import com.codeheadsystems.rental.server.store.StoreException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rental catalog over the {@code items} collection.
 * <p>
 * Every successful write is pushed to the owner's real-time connections as an
 * {@code item-created}, {@code item-updated} or {@code item-deleted} event sent by
 * {@value MessageCodec#SERVER}.
 */
public class CatalogManager {

  private static final Logger log = LoggerFactory.getLogger(CatalogManager.class);

  public static final String ITEMS = "items";
  static final String TITLE = "title";
  static final String RELEASE_DATE = "release_date";
  static final String RENTAL_PRICE = "rental_price";
  static final String RATING = "rating";
  static final String CATEGORY = "category";
  static final String OWNER = "username";

  private final DocumentStore store;
  private final BroadcastDispatcher dispatcher;
  private final MessageCodec codec;

  public CatalogManager(DocumentStore store, BroadcastDispatcher dispatcher, MessageCodec codec) {
    this.store = store;
    this.dispatcher = dispatcher;
    this.codec = codec;
  }

  /**
   * Lists items, optionally only those of one owner.
   *
   * @param owner owner to filter on, or {@code null} for every item
   */
  public List<CatalogItem> list(String owner, Page page) {
    DocumentFilter filter = owner == null ? DocumentFilter.empty() : DocumentFilter.eq(OWNER, owner);
    return store.query(ITEMS, filter, page).stream().map(CatalogManager::toItem).toList();
  }

  /**
   * @throws StoreException {@code NOT_FOUND} when no item has the id
   */
  public CatalogItem get(String id) {
    List<Document> found = store.query(ITEMS, DocumentFilter.byId(id), Page.of(0, 1));
    if (found.isEmpty()) {
      throw StoreException.notFound("Item not found: " + id);
    }
    return toItem(found.get(0));
  }

  /**
   * Adds an item owned by {@code owner}. Titles are unique across the catalog.
   */
  public CatalogItem add(String owner, CatalogItem item) {
    validate(item);
    String id = store.insert(ITEMS, DocumentFilter.eq(TITLE, item.title()), Document.of(toFields(owner, item)));
    CatalogItem created = get(id);
    log.info("Item {} '{}' added by {}", id, created.title(), owner);
    notifyOwner(owner, MessageType.ITEM_CREATED, created);
    return created;
  }

  /**
   * Replaces the body of the caller's item. The item id selects the document.
   *
   * @throws StoreException {@code NOT_FOUND} when the id does not belong to the owner or
   *                        nothing changed
   */
  public CatalogItem edit(String owner, CatalogItem item) {
    validate(item);
    if (item.id() == null || item.id().isBlank()) {
      throw new IllegalArgumentException("_id is required");
    }
    Document replaced = store.replaceOne(ITEMS,
        DocumentFilter.byId(item.id()).andEq(OWNER, owner), Document.of(toFields(owner, item)));
    CatalogItem updated = toItem(replaced);
    log.info("Item {} updated by {} (version {})", updated.id(), owner, updated.version());
    notifyOwner(owner, MessageType.ITEM_UPDATED, updated);
    return updated;
  }

  /**
   * Deletes one of the caller's items.
   */
  public void delete(String owner, String id) {
    CatalogItem existing = get(id);
    store.deleteOne(ITEMS, DocumentFilter.byId(id).andEq(OWNER, owner));
    log.info("Item {} deleted by {}", id, owner);
    notifyOwner(owner, MessageType.ITEM_DELETED, existing);
  }

  private void notifyOwner(String owner, MessageType type, CatalogItem item) {
    int delivered = dispatcher.broadcast(BroadcastPredicate.ownedBy(owner), codec.itemEvent(type, item));
    log.debug("{} for {} delivered to {} connection(s)", type.wireName(), item.id(), delivered);
  }

  private static void validate(CatalogItem item) {
    if (item == null || item.title() == null || item.title().isBlank()) {
      throw new IllegalArgumentException("title is required");
    }
    if (item.rating() < 0 || item.rating() > 10) {
      throw new IllegalArgumentException("rating must be between 0 and 10");
    }
    if (item.rentalPrice() < 0) {
      throw new IllegalArgumentException("rental_price must not be negative");
    }
  }

  static Map<String, Object> toFields(String owner, CatalogItem item) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(TITLE, item.title());
    fields.put(RELEASE_DATE, item.releaseDate());
    fields.put(RENTAL_PRICE, item.rentalPrice());
    fields.put(RATING, item.rating());
    fields.put(CATEGORY, item.category());
    fields.put(OWNER, owner);
    return fields;
  }

  static CatalogItem toItem(Document document) {
    Object price = document.get(RENTAL_PRICE);
    Object rating = document.get(RATING);
    return new CatalogItem(
        document.id(),
        document.getString(TITLE),
        document.getString(RELEASE_DATE),
        price instanceof Number n ? n.doubleValue() : 0d,
        rating instanceof Number n ? n.intValue() : 0,
        document.getString(CATEGORY),
        document.getString(OWNER),
        document.lastModified() == null ? null : document.lastModified().toString(),
        document.version());
  }
}
