package se.alipsa.semlayer.model;

/**
 * Where the rows of a dataset come from. Exactly one of three variants: a
 * local file, a table of a relational database, or a view joining other
 * datasets.
 */
public sealed interface TableSource permits FileSource, RelationalSource, ViewSource {

  /**
   * The physical source type, or {@code null} for views.
   *
   * @return the source type
   */
  SourceType type();
}
