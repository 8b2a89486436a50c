package se.alipsa.semlayer;

/**
 * Raised when {@code group_by} names an expression (aggregated) column, or
 * when a plain column is neither grouped nor aggregated.
 */
public class InvalidGroupByException extends InvalidSchemaException {

  private static final long serialVersionUID = 1L;

  private final String column;

  /**
   * Create an exception for the offending column.
   *
   * @param schemaName
   *          the schema being validated
   * @param column
   *          the offending column name
   * @param message
   *          the detail message
   */
  public InvalidGroupByException(String schemaName, String column, String message) {
    super(schemaName, message);
    this.column = column;
  }

  /**
   * The column that violated the grouping rules.
   *
   * @return the column name
   */
  public String getColumn() {
    return column;
  }
}
