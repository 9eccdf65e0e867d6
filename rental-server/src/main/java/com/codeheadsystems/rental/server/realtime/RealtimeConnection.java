package com.codeheadsystems.rental.server.realtime;

import com.codeheadsystems.rental.model.realtime.MessageEnvelope;
import java.io.IOException;

/**
 * One live bidirectional real-time transport session.
 * <p>
 * Implementations must allow {@link #send} from several threads at once (broadcasts and the
 * periodic notifier write concurrently) and must bound each write with a transport timeout.
 * Identity equality is expected: the registry keys on the instance.
 */
public interface RealtimeConnection {

  /**
   * Transport-level identifier, for logs.
   */
  String id();

  /**
   * Writes one envelope.
   *
   * @throws IOException when the peer is gone or the write failed or timed out
   */
  void send(MessageEnvelope envelope) throws IOException;

  /**
   * Sends a protocol-level close frame without releasing the transport.
   *
   * @param code   close status code
   * @param reason close reason
   * @throws IOException when the frame could not be written
   */
  void sendClose(int code, String reason) throws IOException;

  /**
   * Releases the transport. Must be idempotent.
   */
  void close();
}
