package se.alipsa.semlayer.helper;

import java.math.BigDecimal;
import java.math.BigInteger;

/** Renders Java values as SQL literals. */
public final class SqlLiterals {

  private SqlLiterals() {
  }

  /**
   * Render a value as a SQL literal. Strings are single quoted with embedded
   * quotes doubled, numbers and booleans are written as is.
   *
   * @param value
   *          the value (may be {@code null})
   * @return the literal
   */
  public static String literal(Object value) {
    if (value == null) {
      return "NULL";
    }
    if (value instanceof Boolean bool) {
      return bool ? "TRUE" : "FALSE";
    }
    if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long
        || value instanceof BigInteger) {
      return value.toString();
    }
    if (value instanceof BigDecimal bd) {
      return bd.toPlainString();
    }
    if (value instanceof Float || value instanceof Double) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("Not a finite number: " + value);
      }
      return BigDecimal.valueOf(d).toPlainString();
    }
    return string(value.toString());
  }

  /**
   * Render text as a quoted string literal.
   *
   * @param text
   *          the text
   * @return the literal, e.g. {@code 'O''Reilly'}
   */
  public static String string(String text) {
    return "'" + text.replace("'", "''") + "'";
  }

  /**
   * Render a value that must be numeric. Numeric strings are accepted so that
   * values read from documents as text still work.
   *
   * @param value
   *          the value
   * @param name
   *          the parameter name used in the error message
   * @return the numeric literal
   * @throws IllegalArgumentException
   *           if the value is not numeric
   */
  public static String number(Object value, String name) {
    if (value instanceof Number) {
      return literal(value);
    }
    if (value != null) {
      try {
        return new BigDecimal(value.toString().trim()).toPlainString();
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Parameter '" + name + "' must be numeric: " + value, e);
      }
    }
    throw new IllegalArgumentException("Parameter '" + name + "' must be numeric: null");
  }

  /**
   * Render a file path as a string literal for a file scan function. Paths
   * containing statement separators or comment markers are rejected.
   *
   * @param path
   *          the file path
   * @return the quoted path
   * @throws IllegalArgumentException
   *           if the path contains {@code ;}, {@code --}, <code>/*</code> or
   *           <code>*&#47;</code>
   */
  public static String filePath(String path) {
    if (path.contains(";") || path.contains("--") || path.contains("/*") || path.contains("*/")) {
      throw new IllegalArgumentException("Illegal characters in file path: " + path);
    }
    return string(path);
  }
}
