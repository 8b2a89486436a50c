package se.alipsa.semlayer.model;

import se.alipsa.semlayer.InvalidSchemaException;

/**
 * A column of a dataset.
 *
 * @param name
 *          logical column name, unique within a schema
 * @param type
 *          logical type (may be {@code null} when not declared)
 * @param description
 *          free text description (may be {@code null})
 * @param expression
 *          raw SQL expression replacing the column reference (may be
 *          {@code null})
 * @param alias
 *          output name (may be {@code null})
 */
public record Column(String name, ColumnType type, String description, String expression, String alias) {

  /**
   * Validates the column name and blanks out empty optional values.
   */
  public Column {
    if (name == null || name.isBlank()) {
      throw new InvalidSchemaException(null, "Column name must not be blank");
    }
    name = name.trim();
    description = blankToNull(description);
    expression = blankToNull(expression);
    alias = blankToNull(alias);
  }

  /**
   * Create a plain column without expression or alias.
   *
   * @param name
   *          the column name
   * @param type
   *          the column type
   * @return a new column
   */
  public static Column of(String name, ColumnType type) {
    return new Column(name, type, null, null, null);
  }

  /**
   * Create an expression column.
   *
   * @param name
   *          the column name
   * @param type
   *          the column type
   * @param expression
   *          the SQL expression computing the column
   * @param alias
   *          the output name (may be {@code null})
   * @return a new column
   */
  public static Column expression(String name, ColumnType type, String expression, String alias) {
    return new Column(name, type, null, expression, alias);
  }

  /**
   * Whether the column is computed by an expression (typically an aggregate).
   *
   * @return {@code true} if an expression is declared
   */
  public boolean hasExpression() {
    return expression != null;
  }

  /**
   * Copy this column with a different alias.
   *
   * @param newAlias
   *          the alias to use
   * @return a new column
   */
  public Column withAlias(String newAlias) {
    return new Column(name, type, description, expression, newAlias);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
