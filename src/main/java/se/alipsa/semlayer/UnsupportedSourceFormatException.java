package se.alipsa.semlayer;

/** Raised when a source type is neither a known file format nor a known relational engine. */
public class UnsupportedSourceFormatException extends SemanticLayerException {

  private static final long serialVersionUID = 1L;

  private final String sourceType;

  /**
   * Create an exception for an unknown source type.
   *
   * @param sourceType
   *          the unrecognized source type
   */
  public UnsupportedSourceFormatException(String sourceType) {
    super("Unsupported source format: " + sourceType);
    this.sourceType = sourceType;
  }

  /**
   * The source type that was not recognized.
   *
   * @return the raw source type
   */
  public String getSourceType() {
    return sourceType;
  }
}
