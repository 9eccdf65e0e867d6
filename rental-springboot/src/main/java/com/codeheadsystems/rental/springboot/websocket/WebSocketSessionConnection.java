package com.codeheadsystems.rental.springboot.websocket;

import com.codeheadsystems.rental.model.realtime.MessageEnvelope;
import com.codeheadsystems.rental.server.realtime.MessageCodec;
import com.codeheadsystems.rental.server.realtime.RealtimeConnection;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * {@link RealtimeConnection} over a Spring {@link WebSocketSession}.
 * <p>
 * Writes go through a {@link ConcurrentWebSocketSessionDecorator}, which serializes concurrent
 * senders and bounds each write by a send-time and buffer limit. A limit violation is reported
 * as an {@link IOException} like any other failed write.
 */
public class WebSocketSessionConnection implements RealtimeConnection {

  private static final Logger log = LoggerFactory.getLogger(WebSocketSessionConnection.class);

  private final WebSocketSession session;
  private final MessageCodec codec;
  private final AtomicBoolean closed = new AtomicBoolean();

  public WebSocketSessionConnection(WebSocketSession session, MessageCodec codec,
                                    int sendTimeLimitMillis, int bufferSizeLimit) {
    this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, bufferSizeLimit);
    this.codec = codec;
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public void send(MessageEnvelope envelope) throws IOException {
    if (closed.get() || !session.isOpen()) {
      throw new IOException("Connection " + id() + " is closed");
    }
    try {
      session.sendMessage(new TextMessage(codec.write(envelope)));
    } catch (IOException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new IOException("Write to " + id() + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void sendClose(int code, String reason) throws IOException {
    if (closed.compareAndSet(false, true)) {
      session.close(new CloseStatus(code, reason));
    }
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      try {
        session.close(CloseStatus.NORMAL);
      } catch (IOException e) {
        log.debug("Error closing {}: {}", id(), e.getMessage());
      }
    }
  }
}
