package se.alipsa.semlayer;

/**
 * Base class for every error raised while building schemas, compiling them to
 * SQL or rewriting SQL statements. All subclasses carry the offending input so
 * that the caller can report it.
 */
public class SemanticLayerException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Create an exception with a message.
   *
   * @param message
   *          the detail message
   */
  public SemanticLayerException(String message) {
    super(message);
  }

  /**
   * Create an exception with a message and an underlying cause.
   *
   * @param message
   *          the detail message
   * @param cause
   *          the underlying cause
   */
  public SemanticLayerException(String message, Throwable cause) {
    super(message, cause);
  }
}
