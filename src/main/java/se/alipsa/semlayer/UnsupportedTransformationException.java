package se.alipsa.semlayer;

/** Raised when a transformation kind is not part of the supported catalog. */
public class UnsupportedTransformationException extends SemanticLayerException {

  private static final long serialVersionUID = 1L;

  private final String transformationType;

  /**
   * Create an exception for an unknown transformation kind.
   *
   * @param transformationType
   *          the unrecognized kind as written in the declaration
   */
  public UnsupportedTransformationException(String transformationType) {
    super("Unsupported transformation type: " + transformationType);
    this.transformationType = transformationType;
  }

  /**
   * The transformation kind that was not recognized.
   *
   * @return the raw transformation type
   */
  public String getTransformationType() {
    return transformationType;
  }
}
