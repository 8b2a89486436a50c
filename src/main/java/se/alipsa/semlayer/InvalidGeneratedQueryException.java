package se.alipsa.semlayer;

/**
 * Raised when SQL emitted by the compiler fails to parse. This indicates a
 * schema that slipped through validation with content the SQL grammar cannot
 * express (typically a malformed column expression).
 */
public class InvalidGeneratedQueryException extends SemanticLayerException {

  private static final long serialVersionUID = 1L;

  private final String sql;
  private final String schemaName;

  /**
   * Create an exception for a generated statement.
   *
   * @param schemaName
   *          the schema the statement was compiled from
   * @param sql
   *          the generated SQL text
   * @param cause
   *          the parser failure
   */
  public InvalidGeneratedQueryException(String schemaName, String sql, Throwable cause) {
    super("Generated query for schema '" + schemaName + "' is not valid SQL: " + sql, cause);
    this.sql = sql;
    this.schemaName = schemaName;
  }

  /**
   * The SQL text that failed the check.
   *
   * @return the generated SQL
   */
  public String getSql() {
    return sql;
  }

  /**
   * The name of the schema the SQL was compiled from.
   *
   * @return the schema name
   */
  public String getSchemaName() {
    return schemaName;
  }
}
