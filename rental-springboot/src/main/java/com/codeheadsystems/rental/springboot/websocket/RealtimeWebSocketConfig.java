package com.codeheadsystems.rental.springboot.websocket;

import com.codeheadsystems.rental.server.realtime.MessageCodec;
import com.codeheadsystems.rental.server.realtime.RealtimeGateway;
import com.codeheadsystems.rental.springboot.config.RentalProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Serves the real-time channel at {@code /ws}. Authentication happens inside the channel
 * through the first {@code authorization} message, so the upgrade itself is open.
 */
@Configuration
@EnableWebSocket
public class RealtimeWebSocketConfig implements WebSocketConfigurer {

  private final RealtimeGateway gateway;
  private final MessageCodec codec;
  private final RentalProperties props;

  public RealtimeWebSocketConfig(RealtimeGateway gateway, MessageCodec codec, RentalProperties props) {
    this.gateway = gateway;
    this.codec = codec;
    this.props = props;
  }

  @Bean
  public RealtimeWebSocketHandler realtimeWebSocketHandler() {
    return new RealtimeWebSocketHandler(gateway, codec, props);
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry.addHandler(realtimeWebSocketHandler(), "/ws").setAllowedOrigins("*");
  }
}
