package se.alipsa.semlayer;

/** Raised when an input statement is not valid SQL under the requested or detected dialect. */
public class SqlParseException extends SemanticLayerException {

  private static final long serialVersionUID = 1L;

  private final String sql;
  private final String dialect;

  /**
   * Create an exception for an unparseable statement.
   *
   * @param sql
   *          the statement text
   * @param dialect
   *          the dialect the statement was parsed under, or {@code null} when
   *          autodetection was used
   * @param cause
   *          the parser failure
   */
  public SqlParseException(String sql, String dialect, Throwable cause) {
    super("Failed to parse SQL" + (dialect == null ? "" : " (" + dialect + ")") + ": " + sql, cause);
    this.sql = sql;
    this.dialect = dialect;
  }

  /**
   * The statement that failed to parse.
   *
   * @return the SQL text
   */
  public String getSql() {
    return sql;
  }

  /**
   * The dialect used for parsing.
   *
   * @return the dialect name, or {@code null} when autodetected
   */
  public String getDialect() {
    return dialect;
  }
}
