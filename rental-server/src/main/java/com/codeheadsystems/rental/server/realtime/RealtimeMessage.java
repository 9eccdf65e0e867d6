package com.codeheadsystems.rental.server.realtime;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Decoded real-time message. Every inbound frame is turned into one of these variants at the
 * boundary by {@link MessageCodec}; nothing past the codec sees an untyped payload.
 */
public sealed interface RealtimeMessage {

  MessageType type();

  /**
   * First message of every connection.
   *
   * @param token bearer token to validate
   */
  record Authorization(String token) implements RealtimeMessage {
    @Override
    public MessageType type() {
      return MessageType.AUTHORIZATION;
    }
  }

  /**
   * Disconnects every connection of the sender's identity.
   */
  record Logout() implements RealtimeMessage {
    @Override
    public MessageType type() {
      return MessageType.LOGOUT;
    }
  }

  /**
   * Free-text kinds: notification, error and chat.
   */
  record Text(MessageType type, String text) implements RealtimeMessage {
    public Text {
      if (!type.isText()) {
        throw new IllegalArgumentException(type + " does not carry text");
      }
    }
  }

  /**
   * Catalog change kinds carrying the affected item.
   */
  record ItemEvent(MessageType type, ObjectNode item) implements RealtimeMessage {
    public ItemEvent {
      if (!type.isItemEvent()) {
        throw new IllegalArgumentException(type + " is not an item event");
      }
    }
  }
}
