package com.codeheadsystems.rental.server.realtime;

import com.codeheadsystems.rental.model.realtime.MessageEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Converts between JSON frames, {@link MessageEnvelope}s and {@link RealtimeMessage}s.
 */
public class MessageCodec {

  /**
   * Sender stamped on server-originated messages.
   */
  public static final String SERVER = "server";

  private final ObjectMapper objectMapper;

  public MessageCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses and validates an inbound frame. A client-supplied {@code sender} is discarded.
   *
   * @param raw frame text
   * @return the decoded message
   * @throws ProtocolException {@code MALFORMED_MESSAGE} for invalid JSON, an unknown type or a
   *                           payload of the wrong shape
   */
  public RealtimeMessage decode(String raw) {
    MessageEnvelope envelope;
    try {
      envelope = objectMapper.readValue(raw, MessageEnvelope.class);
    } catch (JsonProcessingException e) {
      throw new ProtocolException(ProtocolException.Kind.MALFORMED_MESSAGE, "Invalid message format", e);
    }
    if (envelope == null || envelope.type() == null) {
      throw new ProtocolException(ProtocolException.Kind.MALFORMED_MESSAGE, "Message has no type");
    }
    MessageType type = MessageType.fromWire(envelope.type())
        .orElseThrow(() -> new ProtocolException(ProtocolException.Kind.MALFORMED_MESSAGE,
            "Unknown message type: " + envelope.type()));
    JsonNode payload = envelope.payload();
    if (type == MessageType.LOGOUT) {
      return new RealtimeMessage.Logout();
    }
    if (type == MessageType.AUTHORIZATION) {
      return new RealtimeMessage.Authorization(requireText(type, payload));
    }
    if (type.isText()) {
      return new RealtimeMessage.Text(type, requireText(type, payload));
    }
    if (payload == null || !payload.isObject()) {
      throw new ProtocolException(ProtocolException.Kind.MALFORMED_MESSAGE,
          type.wireName() + " requires an object payload");
    }
    return new RealtimeMessage.ItemEvent(type, (ObjectNode) payload);
  }

  private static String requireText(MessageType type, JsonNode payload) {
    if (payload == null || !payload.isTextual()) {
      throw new ProtocolException(ProtocolException.Kind.MALFORMED_MESSAGE,
          type.wireName() + " requires a text payload");
    }
    return payload.asText();
  }

  /**
   * Builds the outbound envelope for a message.
   *
   * @param message decoded message
   * @param sender  identity to stamp
   * @return the envelope
   */
  public MessageEnvelope encode(RealtimeMessage message, String sender) {
    JsonNode payload = null;
    if (message instanceof RealtimeMessage.Authorization auth) {
      payload = TextNode.valueOf(auth.token());
    } else if (message instanceof RealtimeMessage.Text text) {
      payload = TextNode.valueOf(text.text());
    } else if (message instanceof RealtimeMessage.ItemEvent event) {
      payload = event.item();
    }
    return new MessageEnvelope(message.type().wireName(), payload, sender);
  }

  /**
   * Builds a server-originated item event from any Jackson-serializable object.
   */
  public MessageEnvelope itemEvent(MessageType type, Object item) {
    JsonNode node = objectMapper.valueToTree(item);
    if (!node.isObject()) {
      throw new IllegalArgumentException("Item events carry an object, got " + node.getNodeType());
    }
    return encode(new RealtimeMessage.ItemEvent(type, (ObjectNode) node), SERVER);
  }

  public MessageEnvelope notification(String text) {
    return encode(new RealtimeMessage.Text(MessageType.NOTIFICATION, text), SERVER);
  }

  public MessageEnvelope error(String text) {
    return encode(new RealtimeMessage.Text(MessageType.ERROR, text), SERVER);
  }

  /**
   * Serializes an envelope to frame text.
   */
  public String write(MessageEnvelope envelope) {
    try {
      return objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize " + envelope.type() + " message", e);
    }
  }
}
