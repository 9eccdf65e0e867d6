package com.codeheadsystems.rental.server.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Conjunction of field constraints. Each constraint is either an equality on a field value or
 * a regular-expression search over its string form. The empty filter matches everything.
 */
public final class DocumentFilter {

  private static final DocumentFilter EMPTY = new DocumentFilter(List.of());

  /**
   * A single field constraint. Exactly one of {@code value} and {@code pattern} is used:
   * {@code pattern} when non-null, otherwise equality with {@code value}.
   *
   * @param field   field name, may be one of the {@link Document} metadata keys
   * @param value   expected value for equality
   * @param pattern pattern searched in the field's string form
   */
  public record Constraint(String field, Object value, Pattern pattern) {

    public Constraint {
      Objects.requireNonNull(field, "field");
    }

    boolean test(Document document) {
      Object actual = document.get(field);
      if (pattern != null) {
        return actual != null && pattern.matcher(actual.toString()).find();
      }
      if (actual instanceof Number a && value instanceof Number b) {
        return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
      }
      return Objects.equals(actual, value);
    }
  }

  private final List<Constraint> constraints;

  private DocumentFilter(List<Constraint> constraints) {
    this.constraints = List.copyOf(constraints);
  }

  public static DocumentFilter empty() {
    return EMPTY;
  }

  public static DocumentFilter eq(String field, Object value) {
    return EMPTY.andEq(field, value);
  }

  public static DocumentFilter byId(String id) {
    return eq(Document.ID, id);
  }

  public static DocumentFilter matches(String field, String regex) {
    return EMPTY.andMatches(field, regex);
  }

  public DocumentFilter andEq(String field, Object value) {
    return with(new Constraint(field, value, null));
  }

  public DocumentFilter andMatches(String field, String regex) {
    return with(new Constraint(field, null, Pattern.compile(regex)));
  }

  private DocumentFilter with(Constraint constraint) {
    List<Constraint> next = new ArrayList<>(constraints);
    next.add(constraint);
    return new DocumentFilter(next);
  }

  public List<Constraint> constraints() {
    return constraints;
  }

  public boolean isEmpty() {
    return constraints.isEmpty();
  }

  /**
   * Returns true when every constraint holds for the document.
   */
  public boolean test(Document document) {
    for (Constraint constraint : constraints) {
      if (!constraint.test(document)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return "DocumentFilter" + constraints;
  }
}
