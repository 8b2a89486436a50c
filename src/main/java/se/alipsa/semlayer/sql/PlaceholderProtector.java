package se.alipsa.semlayer.sql;

/**
 * Hides {@code %s} positional placeholders from the parser. Each placeholder
 * outside a string literal or quoted identifier is replaced by an inert
 * identifier token before parsing, and the token is turned into the target
 * dialect's marker after serialization.
 */
public final class PlaceholderProtector {

  /** The token standing in for a placeholder while the statement is parsed. */
  public static final String TOKEN = "___PLACEHOLDER___";

  private static final String PYFORMAT = "%s";

  private PlaceholderProtector() {
  }

  /**
   * Replace every {@code %s} placeholder with {@link #TOKEN}.
   *
   * @param sql
   *          the SQL text
   * @return the text with placeholders protected
   */
  public static String protect(String sql) {
    return replaceOutsideQuotes(sql, PYFORMAT, TOKEN);
  }

  /**
   * Turn protected placeholders into the given dialect's marker. Occurrences
   * of {@link #TOKEN} inside string literals and quoted identifiers are text
   * the statement already contained and are kept.
   *
   * @param sql
   *          serialized SQL containing {@link #TOKEN}
   * @param placeholder
   *          the target convention
   * @return the text with markers restored
   */
  public static String restore(String sql, Dialect.Placeholder placeholder) {
    return replaceOutsideQuotes(sql, TOKEN, placeholder.marker());
  }

  private static String replaceOutsideQuotes(String sql, String target, String replacement) {
    StringBuilder sb = new StringBuilder(sql.length());
    char closing = 0;
    for (int i = 0; i < sql.length(); i++) {
      char c = sql.charAt(i);
      if (closing != 0) {
        sb.append(c);
        if (c == closing) {
          if (i + 1 < sql.length() && sql.charAt(i + 1) == closing) {
            sb.append(sql.charAt(++i));
          } else {
            closing = 0;
          }
        }
        continue;
      }
      if (sql.startsWith(target, i)) {
        sb.append(replacement);
        i += target.length() - 1;
        continue;
      }
      if (c == '\'' || c == '"' || c == '`') {
        closing = c;
      } else if (c == '[') {
        closing = ']';
      }
      sb.append(c);
    }
    return sb.toString();
  }

  /**
   * Whether the text contains a protected placeholder.
   *
   * @param sql
   *          the SQL text
   * @return {@code true} if {@link #TOKEN} occurs in the text
   */
  public static boolean isProtected(String sql) {
    return sql.contains(TOKEN);
  }
}
