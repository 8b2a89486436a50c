package se.alipsa.semlayer.engine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.semlayer.InvalidGeneratedQueryException;
import se.alipsa.semlayer.InvalidGroupByException;
import se.alipsa.semlayer.InvalidSchemaException;
import se.alipsa.semlayer.SqlParseException;
import se.alipsa.semlayer.model.Column;
import se.alipsa.semlayer.model.SemanticSchema;
import se.alipsa.semlayer.model.ViewSource;
import se.alipsa.semlayer.sql.Dialect;
import se.alipsa.semlayer.sql.IdentifierQuoter;
import se.alipsa.semlayer.sql.SqlStatements;

/**
 * Compiles a {@link SemanticSchema} into SQL text: the full query, a preview
 * of the first rows and a row count.
 *
 * <p>
 * Every statement is parsed again before it is returned; text the parser
 * rejects is reported as an {@link InvalidGeneratedQueryException} instead of
 * being handed to an execution engine. The parsed statement then gets one
 * quoting pass, so identifiers inside column expressions and transformation
 * output are quoted like the declared names, and the re-serialized statement
 * is returned. Instances hold no mutable state and can be shared between
 * threads.
 * </p>
 */
public final class QueryCompiler {

  private static final Logger log = LoggerFactory.getLogger(QueryCompiler.class);

  /** Number of rows of a preview when none is requested. */
  public static final int DEFAULT_HEAD_ROWS = 5;

  private static final Pattern ORDER_KEY = Pattern.compile(
      "^(.+?)(?:\\s+(ASC|DESC))?(?:\\s+NULLS\\s+(FIRST|LAST))?$", Pattern.CASE_INSENSITIVE);

  private final TableExpressionResolver resolver;
  private final TransformationPipeline pipeline;

  /**
   * Create a compiler resolving file sources against the working directory.
   */
  public QueryCompiler() {
    this(Path.of("").toAbsolutePath());
  }

  /**
   * Create a compiler.
   *
   * @param datasetPath
   *          the directory relative file source paths are resolved against
   */
  public QueryCompiler(Path datasetPath) {
    this(new TableExpressionResolver(datasetPath), new TransformationPipeline());
  }

  QueryCompiler(TableExpressionResolver resolver, TransformationPipeline pipeline) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
  }

  /**
   * The dialect a schema compiles to: the embedded engine's dialect for files
   * and views, the remote engine's dialect for relational sources.
   *
   * @param schema
   *          the schema
   * @return the dialect of the compiled text
   */
  public Dialect dialectFor(SemanticSchema schema) {
    if (schema.source() instanceof ViewSource) {
      return Dialect.DUCKDB;
    }
    return schema.source().type().dialect();
  }

  /**
   * Compile the full query of a schema.
   *
   * @param schema
   *          the schema
   * @return the SQL text
   * @throws InvalidGeneratedQueryException
   *           if the compiled text does not parse
   */
  public String buildQuery(SemanticSchema schema) {
    Dialect dialect = dialectFor(schema);
    Integer limit = schema.limit();
    StringBuilder sql = selectFrom(schema, dialect, limit == null ? null : limit);
    appendOrderBy(sql, schema, dialect);
    if (limit != null) {
      sql.append(dialect.limitClause(limit));
    }
    return validated(schema, sql.toString(), dialect);
  }

  /**
   * Compile a preview of the first {@value #DEFAULT_HEAD_ROWS} rows.
   *
   * @param schema
   *          the schema
   * @return the SQL text
   */
  public String buildHeadQuery(SemanticSchema schema) {
    return buildHeadQuery(schema, DEFAULT_HEAD_ROWS);
  }

  /**
   * Compile a preview of the first rows. Ordering and the declared limit are
   * not applied.
   *
   * @param schema
   *          the schema
   * @param rows
   *          the number of rows, must be positive
   * @return the SQL text
   */
  public String buildHeadQuery(SemanticSchema schema, int rows) {
    if (rows <= 0) {
      throw new IllegalArgumentException("Number of rows must be positive: " + rows);
    }
    Dialect dialect = dialectFor(schema);
    StringBuilder sql = selectFrom(schema, dialect, rows);
    sql.append(dialect.limitClause(rows));
    return validated(schema, sql.toString(), dialect);
  }

  /**
   * Compile a count of the rows the full query returns, ignoring ordering and
   * the declared limit.
   *
   * @param schema
   *          the schema
   * @return the SQL text
   */
  public String buildRowCountQuery(SemanticSchema schema) {
    Dialect dialect = dialectFor(schema);
    String sql;
    if (schema.groupBy().isEmpty() && !schema.distinct()) {
      sql = "SELECT COUNT(*) FROM " + resolver.resolve(schema, dialect);
    } else {
      sql = "SELECT COUNT(*) FROM (" + selectFrom(schema, dialect, null) + ") " + dialect.quote("row_source");
    }
    return validated(schema, sql, dialect);
  }

  /**
   * Render the projection of a schema, one entry per column in declaration
   * order, or {@code *} when no columns are declared.
   *
   * @param schema
   *          the schema
   * @param dialect
   *          the dialect identifiers are quoted for
   * @return the projection items
   */
  public List<String> columnList(SemanticSchema schema, Dialect dialect) {
    if (schema.columns().isEmpty()) {
      return List.of("*");
    }
    List<String> items = new ArrayList<>(schema.columns().size());
    for (Column column : schema.columns()) {
      String start = column.hasExpression() ? column.expression() : quoteName(schema, column.name(), dialect);
      String alias = column.alias();
      if (alias == null && (column.hasExpression() || column.name().indexOf('.') > 0)) {
        alias = IdentifierUtil.columnAlias(column.name());
      }
      RewrittenColumn rewritten = pipeline.apply(start, column.name(), alias, schema.transformations());
      if (rewritten.hasAlias()) {
        items.add(rewritten.expression() + " AS " + quoteName(schema, rewritten.alias(), dialect));
      } else {
        items.add(rewritten.expression());
      }
    }
    return items;
  }

  private StringBuilder selectFrom(SemanticSchema schema, Dialect dialect, Integer top) {
    StringBuilder sql = new StringBuilder("SELECT ");
    if (schema.distinct()) {
      sql.append("DISTINCT ");
    }
    if (top != null) {
      sql.append(dialect.topClause(top));
    }
    sql.append(String.join(", ", columnList(schema, dialect)));
    sql.append(" FROM ").append(resolver.resolve(schema, dialect));
    appendGroupBy(sql, schema, dialect);
    return sql;
  }

  private void appendGroupBy(StringBuilder sql, SemanticSchema schema, Dialect dialect) {
    if (schema.groupBy().isEmpty()) {
      return;
    }
    List<String> keys = new ArrayList<>(schema.groupBy().size());
    for (String entry : schema.groupBy()) {
      schema.findColumn(entry).filter(Column::hasExpression).ifPresent(c -> {
        throw new InvalidGroupByException(schema.name(), entry, "Cannot group by expression column '" + entry + "'");
      });
      keys.add(quoteName(schema, entry, dialect));
    }
    sql.append(" GROUP BY ").append(String.join(", ", keys));
  }

  private void appendOrderBy(StringBuilder sql, SemanticSchema schema, Dialect dialect) {
    if (schema.orderBy().isEmpty()) {
      return;
    }
    List<String> keys = new ArrayList<>(schema.orderBy().size());
    for (String entry : schema.orderBy()) {
      Matcher m = ORDER_KEY.matcher(entry.trim());
      if (!m.matches()) {
        throw new InvalidSchemaException(schema.name(), "Invalid order_by entry: " + entry);
      }
      StringBuilder key = new StringBuilder(quoteName(schema, m.group(1), dialect));
      if (m.group(2) != null) {
        key.append(' ').append(m.group(2).toUpperCase(Locale.ROOT));
      }
      if (m.group(3) != null) {
        key.append(" NULLS ").append(m.group(3).toUpperCase(Locale.ROOT));
      }
      keys.add(key.toString());
    }
    sql.append(" ORDER BY ").append(String.join(", ", keys));
  }

  private static String quoteName(SemanticSchema schema, String name, Dialect dialect) {
    try {
      return IdentifierUtil.render(name.trim(), dialect);
    } catch (IllegalArgumentException e) {
      throw new InvalidSchemaException(schema.name(), "Invalid identifier '" + name + "'", e);
    }
  }

  private static String validated(SemanticSchema schema, String sql, Dialect dialect) {
    Statement statement;
    try {
      statement = SqlStatements.parse(sql, dialect);
    } catch (SqlParseException e) {
      throw new InvalidGeneratedQueryException(schema.name(), sql, e.getCause());
    }
    new IdentifierQuoter(dialect, IdentifierQuoter.Mode.QUOTE_ALL).apply(statement);
    String quoted = statement.toString();
    if (log.isDebugEnabled()) {
      log.debug("Compiled {} ({}): {}", schema.name(), dialect.dialectName(), quoted);
    }
    return quoted;
  }
}
