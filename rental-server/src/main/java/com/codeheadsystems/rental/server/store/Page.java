package com.codeheadsystems.rental.server.store;

/**
 * Skip/limit window applied to a query. A limit of zero means no limit.
 *
 * @param skip  number of leading matches to drop
 * @param limit maximum number of matches to return
 */
public record Page(int skip, int limit) {

  private static final Page ALL = new Page(0, 0);

  public Page {
    if (skip < 0 || limit < 0) {
      throw new IllegalArgumentException("skip and limit must be non-negative");
    }
  }

  public static Page all() {
    return ALL;
  }

  public static Page of(int skip, int limit) {
    return new Page(skip, limit);
  }
}
