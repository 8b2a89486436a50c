package se.alipsa.semlayer.engine;

/**
 * A column expression after the transformation pipeline has run.
 *
 * @param expression
 *          the SQL expression
 * @param alias
 *          the output name, or {@code null} when the column keeps its own name
 */
public record RewrittenColumn(String expression, String alias) {

  public boolean hasAlias() {
    return alias != null;
  }
}
