package com.codeheadsystems.rental.springboot.websocket;

import com.codeheadsystems.rental.server.realtime.GatewaySession;
import com.codeheadsystems.rental.server.realtime.MessageCodec;
import com.codeheadsystems.rental.server.realtime.RealtimeGateway;
import com.codeheadsystems.rental.springboot.config.RentalProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Adapts Spring WebSocket callbacks to the {@link RealtimeGateway}. The gateway session is kept
 * in the WebSocket session attributes.
 */
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

  private static final Logger log = LoggerFactory.getLogger(RealtimeWebSocketHandler.class);
  private static final String GATEWAY_SESSION = RealtimeWebSocketHandler.class.getName() + ".session";

  private final RealtimeGateway gateway;
  private final MessageCodec codec;
  private final RentalProperties props;

  public RealtimeWebSocketHandler(RealtimeGateway gateway, MessageCodec codec, RentalProperties props) {
    this.gateway = gateway;
    this.codec = codec;
    this.props = props;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    WebSocketSessionConnection connection = new WebSocketSessionConnection(session, codec,
        props.getSendTimeLimitMillis(), props.getSendBufferSizeLimit());
    session.getAttributes().put(GATEWAY_SESSION, gateway.accept(connection));
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    GatewaySession gatewaySession = gatewaySession(session);
    if (gatewaySession != null) {
      gateway.onMessage(gatewaySession, message.getPayload());
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.warn("Transport error on {}: {}", session.getId(), exception.getMessage());
    GatewaySession gatewaySession = gatewaySession(session);
    if (gatewaySession != null) {
      gateway.onDisconnect(gatewaySession);
    }
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    log.debug("Connection {} closed: {}", session.getId(), status);
    GatewaySession gatewaySession = gatewaySession(session);
    if (gatewaySession != null) {
      gateway.onDisconnect(gatewaySession);
    }
  }

  private static GatewaySession gatewaySession(WebSocketSession session) {
    return (GatewaySession) session.getAttributes().get(GATEWAY_SESSION);
  }
}
