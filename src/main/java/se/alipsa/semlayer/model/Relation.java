package se.alipsa.semlayer.model;

import se.alipsa.semlayer.InvalidSchemaException;

/**
 * A join condition between two datasets of a view, written as qualified
 * {@code table.column} references.
 *
 * @param name
 *          optional relation name
 * @param description
 *          optional description
 * @param from
 *          the left side, e.g. {@code orders.customer_id}
 * @param to
 *          the right side, e.g. {@code customers.id}
 */
public record Relation(String name, String description, String from, String to) {

  /**
   * Validates both sides.
   */
  public Relation {
    requireQualified("from", from);
    requireQualified("to", to);
    from = from.trim();
    to = to.trim();
  }

  /**
   * Create an unnamed relation.
   *
   * @param from
   *          the left side
   * @param to
   *          the right side
   * @return a new relation
   */
  public static Relation of(String from, String to) {
    return new Relation(null, null, from, to);
  }

  public String fromTable() {
    return tablePart(from);
  }

  public String fromColumn() {
    return columnPart(from);
  }

  public String toTable() {
    return tablePart(to);
  }

  public String toColumn() {
    return columnPart(to);
  }

  static String tablePart(String qualified) {
    return qualified.substring(0, qualified.lastIndexOf('.'));
  }

  static String columnPart(String qualified) {
    return qualified.substring(qualified.lastIndexOf('.') + 1);
  }

  private static void requireQualified(String side, String value) {
    if (value == null) {
      throw new InvalidSchemaException(null, "Relation '" + side + "' must not be null");
    }
    int dot = value.trim().lastIndexOf('.');
    if (dot <= 0 || dot == value.trim().length() - 1) {
      throw new InvalidSchemaException(null,
          "Relation '" + side + "' must be written as table.column: " + value);
    }
  }
}
