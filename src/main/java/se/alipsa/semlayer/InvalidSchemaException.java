package se.alipsa.semlayer;

/**
 * Raised when a schema cannot be constructed because its declaration is
 * inconsistent (duplicate or missing columns, an invalid name, no source, a
 * non positive limit, missing transformation parameters).
 */
public class InvalidSchemaException extends SemanticLayerException {

  private static final long serialVersionUID = 1L;

  private final String schemaName;

  /**
   * Create an exception for the given schema.
   *
   * @param schemaName
   *          the name of the schema being built (may be {@code null} when the
   *          name itself is the problem)
   * @param message
   *          the detail message
   */
  public InvalidSchemaException(String schemaName, String message) {
    super(message);
    this.schemaName = schemaName;
  }

  /**
   * Create an exception for the given schema with an underlying cause.
   *
   * @param schemaName
   *          the name of the schema being built
   * @param message
   *          the detail message
   * @param cause
   *          the underlying cause
   */
  public InvalidSchemaException(String schemaName, String message, Throwable cause) {
    super(message, cause);
    this.schemaName = schemaName;
  }

  /**
   * The name of the schema that failed validation.
   *
   * @return the schema name, or {@code null} when unknown
   */
  public String getSchemaName() {
    return schemaName;
  }
}
