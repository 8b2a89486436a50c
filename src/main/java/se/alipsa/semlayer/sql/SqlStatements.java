package se.alipsa.semlayer.sql;

import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.semlayer.SqlParseException;

/**
 * Parsing entry points shared by the compiler self-check and the statement
 * rewriter. Every failure is reported as a {@link SqlParseException} carrying
 * the statement text and the dialect it was parsed under.
 */
public final class SqlStatements {

  private static final Logger log = LoggerFactory.getLogger(SqlStatements.class);
  private static final Pattern BLANK_LINES = Pattern.compile("\\R[ \\t]*(?:\\R[ \\t]*)+");

  private SqlStatements() {
  }

  /**
   * Parse a single statement.
   *
   * @param sql
   *          the SQL text, optionally containing comments
   * @param dialect
   *          the dialect the text is written in; {@code null} to autodetect
   * @return the parsed statement
   * @throws SqlParseException
   *           if the text is not a valid statement
   */
  public static Statement parse(String sql, Dialect dialect) {
    requireText(sql, dialect);
    String normalized = normalize(sql);
    if (dialect != null) {
      try {
        return CCJSqlParserUtil.parse(normalized, dialect.parserFeatures());
      } catch (JSQLParserException | RuntimeException e) {
        throw new SqlParseException(sql, dialect.dialectName(), e);
      }
    }
    try {
      return CCJSqlParserUtil.parse(normalized);
    } catch (JSQLParserException | RuntimeException e) {
      log.debug("Standard parse failed, retrying with bracket quoted identifiers: {}", e.getMessage());
      try {
        return CCJSqlParserUtil.parse(normalized, Dialect.SQLSERVER.parserFeatures());
      } catch (JSQLParserException | RuntimeException retry) {
        retry.addSuppressed(e);
        throw new SqlParseException(sql, null, retry);
      }
    }
  }

  /**
   * Parse every statement of a script.
   *
   * @param sql
   *          one or more statements separated by semicolons
   * @param dialect
   *          the dialect the text is written in; {@code null} to autodetect
   * @return the parsed statements
   * @throws SqlParseException
   *           if any statement is invalid
   */
  public static Statements parseAll(String sql, Dialect dialect) {
    requireText(sql, dialect);
    String normalized = normalize(sql);
    Dialect features = dialect == null ? Dialect.ANSI : dialect;
    try {
      return CCJSqlParserUtil.parseStatements(normalized, features.parserFeatures());
    } catch (JSQLParserException | RuntimeException e) {
      if (dialect != null) {
        throw new SqlParseException(sql, dialect.dialectName(), e);
      }
      try {
        return CCJSqlParserUtil.parseStatements(normalized, Dialect.SQLSERVER.parserFeatures());
      } catch (JSQLParserException | RuntimeException retry) {
        retry.addSuppressed(e);
        throw new SqlParseException(sql, null, retry);
      }
    }
  }

  // the 5.3 grammar treats a blank line as the end of a statement
  private static String normalize(String sql) {
    return BLANK_LINES.matcher(stripSqlComments(sql).trim()).replaceAll("\n");
  }

  private static void requireText(String sql, Dialect dialect) {
    if (sql == null || sql.isBlank()) {
      throw new SqlParseException(String.valueOf(sql), dialect == null ? null : dialect.dialectName(),
          new IllegalArgumentException("SQL text is empty"));
    }
  }

  /**
   * Remove SQL comments while preserving quoted literals and identifiers.
   *
   * @param sql
   *          the raw SQL text
   * @return SQL text with comments removed
   */
  static String stripSqlComments(String sql) {
    if (sql == null || sql.isEmpty()) {
      return sql;
    }

    StringBuilder result = new StringBuilder(sql.length());
    boolean inSingleQuote = false;
    char identifierClose = 0;
    boolean inLineComment = false;
    boolean inBlockComment = false;

    for (int i = 0; i < sql.length(); i++) {
      char c = sql.charAt(i);
      char next = i + 1 < sql.length() ? sql.charAt(i + 1) : '\0';

      if (inLineComment) {
        if (c == '\n') {
          result.append(c);
          inLineComment = false;
        }
        continue;
      }
      if (inBlockComment) {
        if (c == '\n') {
          result.append(c);
        }
        if (c == '*' && next == '/') {
          inBlockComment = false;
          i++;
        }
        continue;
      }

      if (inSingleQuote) {
        result.append(c);
        if (c == '\'' && next == '\'') {
          result.append(next);
          i++;
        } else if (c == '\'') {
          inSingleQuote = false;
        }
        continue;
      }
      if (identifierClose != 0) {
        result.append(c);
        if (c == identifierClose && next == identifierClose) {
          result.append(next);
          i++;
        } else if (c == identifierClose) {
          identifierClose = 0;
        }
        continue;
      }

      if (c == '-' && next == '-') {
        inLineComment = true;
        i++;
        continue;
      }
      if (c == '/' && next == '*') {
        inBlockComment = true;
        i++;
        result.append(' ');
        continue;
      }
      if (c == '\'') {
        inSingleQuote = true;
      } else if (c == '"' || c == '`') {
        identifierClose = c;
      } else if (c == '[') {
        identifierClose = ']';
      }
      result.append(c);
    }
    return result.toString();
  }
}
