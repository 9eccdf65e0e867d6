package com.codeheadsystems.rental.server.realtime;

import java.util.Optional;

/**
 * Every message kind the real-time channel understands, with its wire name.
 */
public enum MessageType {
  AUTHORIZATION("authorization"),
  NOTIFICATION("notification"),
  LOGOUT("logout"),
  ERROR("error"),
  CHAT("chat"),
  ITEM_CREATED("item-created"),
  ITEM_UPDATED("item-updated"),
  ITEM_DELETED("item-deleted");

  private final String wireName;

  MessageType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Looks up a kind by its wire name.
   */
  public static Optional<MessageType> fromWire(String wireName) {
    for (MessageType type : values()) {
      if (type.wireName.equals(wireName)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /**
   * True for kinds whose payload is free text.
   */
  public boolean isText() {
    return this == NOTIFICATION || this == ERROR || this == CHAT;
  }

  /**
   * True for kinds whose payload is a structured catalog object.
   */
  public boolean isItemEvent() {
    return this == ITEM_CREATED || this == ITEM_UPDATED || this == ITEM_DELETED;
  }
}
