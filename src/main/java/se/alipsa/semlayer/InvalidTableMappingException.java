package se.alipsa.semlayer;

/** Raised when a table mapping value cannot be used as a physical table expression. */
public class InvalidTableMappingException extends SemanticLayerException {

  private static final long serialVersionUID = 1L;

  private final String key;
  private final String value;

  /**
   * Create an exception for a mapping entry.
   *
   * @param key
   *          the logical table name
   * @param value
   *          the rejected physical expression
   * @param message
   *          the detail message
   * @param cause
   *          the underlying cause (may be {@code null})
   */
  public InvalidTableMappingException(String key, String value, String message, Throwable cause) {
    super(message, cause);
    this.key = key;
    this.value = value;
  }

  /**
   * The logical table name of the rejected entry.
   *
   * @return the mapping key
   */
  public String getKey() {
    return key;
  }

  /**
   * The rejected physical expression.
   *
   * @return the mapping value
   */
  public String getValue() {
    return value;
  }
}
