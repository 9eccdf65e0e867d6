package com.codeheadsystems.rental.server.realtime;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.rental.model.realtime.MessageEnvelope;
import com.fasterxml.jackson.databind.node.TextNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BroadcastDispatcherTest {

  private static final MessageEnvelope CHAT = new MessageEnvelope("chat", TextNode.valueOf("hi"), "alice");

  private ConnectionRegistry registry;
  private BroadcastDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    registry = new ConnectionRegistry(Duration.ZERO);
    dispatcher = new BroadcastDispatcher(registry);
  }

  @Test
  void broadcast_failingConnection_isRetiredAndOthersStillReceive() {
    List<FakeConnection> connections = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      FakeConnection connection = i == 2 ? new FakeConnection("c" + i).failingWrites() : new FakeConnection("c" + i);
      connections.add(connection);
      registry.admit(connection, "alice");
    }

    int delivered = dispatcher.broadcast(BroadcastPredicate.all(), CHAT);

    assertThat(delivered).isEqualTo(4);
    assertThat(registry.size()).isEqualTo(4);
    assertThat(registry.identityOf(connections.get(2))).isEmpty();
    assertThat(connections.get(2).closeCount()).isEqualTo(1);
    for (int i = 0; i < 5; i++) {
      if (i != 2) {
        assertThat(connections.get(i).sent()).containsExactly(CHAT);
      }
    }
  }

  @Test
  void broadcast_respectsPredicate() {
    FakeConnection alice = new FakeConnection("a1");
    FakeConnection bob = new FakeConnection("b1");
    registry.admit(alice, "alice");
    registry.admit(bob, "bob");

    assertThat(dispatcher.broadcast(BroadcastPredicate.ownedBy("alice"), CHAT)).isEqualTo(1);

    assertThat(alice.sent()).containsExactly(CHAT);
    assertThat(bob.sent()).isEmpty();
  }

  @Test
  void broadcast_noTargets_deliversNothing() {
    assertThat(dispatcher.broadcast(BroadcastPredicate.all(), CHAT)).isZero();
  }
}
