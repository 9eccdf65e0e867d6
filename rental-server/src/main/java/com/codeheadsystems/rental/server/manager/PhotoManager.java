package com.codeheadsystems.rental.server.manager;

import com.codeheadsystems.rental.model.photo.Photo;
import com.codeheadsystems.rental.server.store.Document;
import com.codeheadsystems.rental.server.store.DocumentFilter;
import com.codeheadsystems.rental.server.store.DocumentStore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Photo records over the {@code photos} collection. Photos are not unique; the file path is
 * the delete key.
 */
public class PhotoManager {

  private static final Logger log = LoggerFactory.getLogger(PhotoManager.class);

  public static final String PHOTOS = "photos";
  static final String USER_ID = "user_id";
  static final String FILEPATH = "filepath";
  static final String WEBVIEW_PATH = "webview_path";

  private final DocumentStore store;

  public PhotoManager(DocumentStore store) {
    this.store = store;
  }

  public List<Photo> listForUser(String userId) {
    return store.query(PHOTOS, DocumentFilter.eq(USER_ID, userId)).stream()
        .map(PhotoManager::toPhoto)
        .toList();
  }

  public Photo add(Photo photo) {
    if (photo == null || isBlank(photo.userId()) || isBlank(photo.filepath())) {
      throw new IllegalArgumentException("user_id and filepath are required");
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(USER_ID, photo.userId());
    fields.put(FILEPATH, photo.filepath());
    if (photo.webPath() != null) {
      fields.put(WEBVIEW_PATH, photo.webPath());
    }
    String id = store.insert(PHOTOS, null, Document.of(fields));
    log.debug("Photo {} added for user {}", id, photo.userId());
    return new Photo(id, photo.userId(), photo.filepath(), photo.webPath());
  }

  public void delete(String filepath) {
    if (isBlank(filepath)) {
      throw new IllegalArgumentException("filepath is required");
    }
    store.deleteOne(PHOTOS, DocumentFilter.eq(FILEPATH, filepath));
    log.debug("Photo {} deleted", filepath);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static Photo toPhoto(Document document) {
    return new Photo(document.id(), document.getString(USER_ID), document.getString(FILEPATH),
        document.getString(WEBVIEW_PATH));
  }
}
