package com.codeheadsystems.rental.server.realtime;

/**
 * Selection rule over registered connections.
 */
@FunctionalInterface
public interface BroadcastPredicate {

  boolean test(RealtimeConnection connection, String identity);

  static BroadcastPredicate all() {
    return (connection, identity) -> true;
  }

  static BroadcastPredicate ownedBy(String owner) {
    return (connection, identity) -> owner.equals(identity);
  }
}
