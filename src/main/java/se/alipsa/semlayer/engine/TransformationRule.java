package se.alipsa.semlayer.engine;

/**
 * Rewrites one column expression for a transformation kind.
 */
@FunctionalInterface
public interface TransformationRule {

  /**
   * Rewrite a column expression.
   *
   * @param expression
   *          the current expression of the column
   * @param params
   *          the parameters of the transformation
   * @return the rewritten expression
   */
  String rewrite(String expression, TransformationParams params);
}
