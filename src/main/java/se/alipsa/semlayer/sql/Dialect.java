package se.alipsa.semlayer.sql;

import java.util.Locale;
import java.util.function.Consumer;
import net.sf.jsqlparser.parser.CCJSqlParser;

/**
 * The SQL engines statements are compiled for or transpiled between. Each
 * dialect fixes how identifiers are quoted and case folded, which placeholder
 * convention its drivers use and how a row limit is written.
 */
public enum Dialect {
  ANSI('"', '"', CaseFolding.LOWER, Placeholder.QMARK, LimitStyle.LIMIT),
  DUCKDB('"', '"', CaseFolding.LOWER, Placeholder.QMARK, LimitStyle.LIMIT),
  POSTGRES('"', '"', CaseFolding.LOWER, Placeholder.PYFORMAT, LimitStyle.LIMIT),
  MYSQL('`', '`', CaseFolding.NONE, Placeholder.PYFORMAT, LimitStyle.LIMIT),
  SQLSERVER('[', ']', CaseFolding.NONE, Placeholder.QMARK, LimitStyle.TOP),
  ORACLE('"', '"', CaseFolding.UPPER, Placeholder.QMARK, LimitStyle.FETCH);

  /** How unquoted identifiers are folded by the engine. */
  public enum CaseFolding {
    LOWER, UPPER, NONE
  }

  /** Positional parameter marker expected by the engine's drivers. */
  public enum Placeholder {
    QMARK("?"), PYFORMAT("%s");

    private final String marker;

    Placeholder(String marker) {
      this.marker = marker;
    }

    public String marker() {
      return marker;
    }
  }

  /** How a row limit is written. */
  public enum LimitStyle {
    LIMIT, TOP, FETCH
  }

  private final char openQuote;
  private final char closeQuote;
  private final CaseFolding caseFolding;
  private final Placeholder placeholder;
  private final LimitStyle limitStyle;

  Dialect(char openQuote, char closeQuote, CaseFolding caseFolding, Placeholder placeholder, LimitStyle limitStyle) {
    this.openQuote = openQuote;
    this.closeQuote = closeQuote;
    this.caseFolding = caseFolding;
    this.placeholder = placeholder;
    this.limitStyle = limitStyle;
  }

  public CaseFolding caseFolding() {
    return caseFolding;
  }

  public Placeholder placeholder() {
    return placeholder;
  }

  public LimitStyle limitStyle() {
    return limitStyle;
  }

  /**
   * Quote identifier text, escaping embedded closing quote characters by
   * doubling them.
   *
   * @param text
   *          the unquoted identifier text
   * @return the quoted identifier
   */
  public String quote(String text) {
    String close = String.valueOf(closeQuote);
    return openQuote + text.replace(close, close + close) + closeQuote;
  }

  /**
   * Fold unquoted identifier text the way the engine does.
   *
   * @param text
   *          the identifier text as written without quotes
   * @return the folded text
   */
  public String fold(String text) {
    return switch (caseFolding) {
      case LOWER -> text.toLowerCase(Locale.ROOT);
      case UPPER -> text.toUpperCase(Locale.ROOT);
      case NONE -> text;
    };
  }

  /**
   * Render a row limit clause.
   *
   * @param rows
   *          the number of rows
   * @return the clause for LIMIT and FETCH styles; for TOP the caller places
   *         {@link #topClause(int)} after SELECT instead and this returns an
   *         empty string
   */
  public String limitClause(int rows) {
    return switch (limitStyle) {
      case LIMIT -> " LIMIT " + rows;
      case FETCH -> " FETCH FIRST " + rows + " ROWS ONLY";
      case TOP -> "";
    };
  }

  /**
   * Render the TOP modifier for dialects that limit rows with it.
   *
   * @param rows
   *          the number of rows
   * @return {@code "TOP n "} for TOP dialects, otherwise an empty string
   */
  public String topClause(int rows) {
    return limitStyle == LimitStyle.TOP ? "TOP " + rows + " " : "";
  }

  /**
   * Parser features this dialect needs.
   *
   * @return a consumer configuring the JSqlParser parser
   */
  public Consumer<CCJSqlParser> parserFeatures() {
    if (this == SQLSERVER) {
      return parser -> parser.withSquareBracketQuotation(true);
    }
    return parser -> {
    };
  }

  /**
   * The name used in configuration and on the command line.
   *
   * @return the lower case name
   */
  public String dialectName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolve a dialect by name. Accepts the common aliases {@code postgresql},
   * {@code mssql} and {@code tsql}.
   *
   * @param name
   *          the dialect name, case insensitive
   * @return the dialect
   * @throws IllegalArgumentException
   *           if the name is unknown
   */
  public static Dialect fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Dialect name must not be blank");
    }
    String key = name.trim().toLowerCase(Locale.ROOT);
    switch (key) {
      case "postgresql":
        return POSTGRES;
      case "mssql":
      case "tsql":
        return SQLSERVER;
      default:
        break;
    }
    for (Dialect dialect : values()) {
      if (dialect.dialectName().equals(key)) {
        return dialect;
      }
    }
    throw new IllegalArgumentException("Unknown SQL dialect: " + name);
  }
}
