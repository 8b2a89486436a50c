package se.alipsa.semlayer.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import se.alipsa.semlayer.sql.Dialect;

/**
 * Utility methods for working with SQL identifier strings.
 */
public final class IdentifierUtil {

  private IdentifierUtil() {
  }

  /**
   * Determine whether the identifier text is enclosed in quote characters.
   *
   * @param identifier
   *          the trimmed identifier text
   * @return {@code true} for {@code "x"}, {@code `x`} and {@code [x]}
   */
  public static boolean isQuoted(String identifier) {
    if (identifier == null || identifier.length() < 2) {
      return false;
    }
    char first = identifier.charAt(0);
    char last = identifier.charAt(identifier.length() - 1);
    return (first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']');
  }

  /**
   * Remove the quote characters surrounding an identifier, collapsing doubled
   * closing quotes inside it.
   *
   * @param identifier
   *          identifier text that may include leading and trailing quotes
   * @return the identifier without enclosing quotes; {@code null} when the
   *         input is {@code null}
   */
  public static String unquote(String identifier) {
    if (identifier == null) {
      return null;
    }
    String trimmed = identifier.trim();
    if (!isQuoted(trimmed)) {
      return trimmed;
    }
    char close = trimmed.charAt(trimmed.length() - 1);
    String inner = trimmed.substring(1, trimmed.length() - 1);
    String doubled = String.valueOf(close) + close;
    return inner.replace(doubled, String.valueOf(close));
  }

  /**
   * Split a possibly qualified name such as {@code sales."Q1 data".orders}
   * into its parts. Dots inside quotes do not separate parts.
   *
   * @param qualified
   *          the qualified name
   * @return the parts in order
   */
  public static List<Identifier> parts(String qualified) {
    List<Identifier> parts = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    char closing = 0;
    for (int i = 0; i < qualified.length(); i++) {
      char c = qualified.charAt(i);
      if (closing != 0) {
        current.append(c);
        if (c == closing) {
          if (i + 1 < qualified.length() && qualified.charAt(i + 1) == closing) {
            current.append(qualified.charAt(++i));
          } else {
            closing = 0;
          }
        }
        continue;
      }
      if (c == '"' || c == '`') {
        closing = c;
      } else if (c == '[') {
        closing = ']';
      } else if (c == '.') {
        addPart(parts, current);
        continue;
      }
      current.append(c);
    }
    addPart(parts, current);
    return parts;
  }

  /**
   * Quote every part of a qualified name for the given dialect.
   *
   * @param qualified
   *          the qualified name, e.g. {@code public.orders}
   * @param dialect
   *          the target dialect
   * @return the quoted name, e.g. {@code "public"."orders"}
   */
  public static String render(String qualified, Dialect dialect) {
    return parts(qualified).stream().map(p -> p.render(dialect)).collect(Collectors.joining("."));
  }

  /**
   * The output name synthesized for a column: the normalized parts of its name
   * joined with underscores, so {@code orders.customer_id} becomes
   * {@code orders_customer_id}.
   *
   * @param columnName
   *          the logical column name
   * @return the alias
   */
  public static String columnAlias(String columnName) {
    return parts(columnName).stream().map(Identifier::normalized).collect(Collectors.joining("_"));
  }

  private static void addPart(List<Identifier> parts, StringBuilder current) {
    Identifier part = Identifier.of(current.toString());
    if (part == null) {
      throw new IllegalArgumentException("Empty identifier part in qualified name");
    }
    parts.add(part);
    current.setLength(0);
  }
}
