package se.alipsa.semlayer.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import se.alipsa.semlayer.InvalidSchemaException;
import se.alipsa.semlayer.UnsupportedSourceFormatException;
import se.alipsa.semlayer.helper.SqlLiterals;
import se.alipsa.semlayer.model.Column;
import se.alipsa.semlayer.model.FileSource;
import se.alipsa.semlayer.model.Relation;
import se.alipsa.semlayer.model.RelationalSource;
import se.alipsa.semlayer.model.SemanticSchema;
import se.alipsa.semlayer.model.SourceType;
import se.alipsa.semlayer.model.ViewSource;
import se.alipsa.semlayer.sql.Dialect;

/**
 * Resolves the FROM clause of a compiled query: a file scan call for local
 * files, a quoted table name for relational sources, or a chain of joins for
 * views.
 */
public final class TableExpressionResolver {

  private final Path datasetPath;

  /**
   * Create a resolver.
   *
   * @param datasetPath
   *          the directory relative file source paths are resolved against
   */
  public TableExpressionResolver(Path datasetPath) {
    this.datasetPath = Objects.requireNonNull(datasetPath, "datasetPath");
  }

  public Path datasetPath() {
    return datasetPath;
  }

  /**
   * Resolve the table expression of a schema.
   *
   * @param schema
   *          the schema
   * @param dialect
   *          the dialect identifiers are quoted for
   * @return the table expression
   * @throws UnsupportedSourceFormatException
   *           if a file source has no reader function
   */
  public String resolve(SemanticSchema schema, Dialect dialect) {
    if (schema.source() instanceof FileSource file) {
      return fileScan(schema, file);
    }
    if (schema.source() instanceof RelationalSource relational) {
      return IdentifierUtil.render(relational.table(), dialect);
    }
    return joins(schema, (ViewSource) schema.source(), dialect);
  }

  /**
   * The absolute, normalized path of a file source.
   *
   * @param file
   *          the file source
   * @return the resolved path
   */
  public Path resolvePath(FileSource file) {
    return datasetPath.resolve(file.path()).toAbsolutePath().normalize();
  }

  private String fileScan(SemanticSchema schema, FileSource file) {
    String path = resolvePath(file).toString().replace('\\', '/');
    try {
      return readerFunction(file.type()) + "(" + SqlLiterals.filePath(path) + ")";
    } catch (IllegalArgumentException e) {
      throw new InvalidSchemaException(schema.name(), e.getMessage(), e);
    }
  }

  static String readerFunction(SourceType type) {
    return switch (type) {
      case PARQUET -> "read_parquet";
      case CSV -> "read_csv";
      case XLSX, XLS -> "read_excel";
      default -> throw new UnsupportedSourceFormatException(type.typeName());
    };
  }

  private String joins(SemanticSchema schema, ViewSource view, Dialect dialect) {
    List<Column> columns = schema.columns();
    String baseTable = columns.get(0).name().substring(0, columns.get(0).name().lastIndexOf('.'));
    StringBuilder sb = new StringBuilder(IdentifierUtil.render(baseTable, dialect));
    for (ViewSource.JoinStep step : view.joinPlan(baseTable)) {
      StringJoiner on = new StringJoiner(" AND ");
      for (Relation relation : step.conditions()) {
        on.add(IdentifierUtil.render(relation.from(), dialect) + " = " + IdentifierUtil.render(relation.to(), dialect));
      }
      sb.append(" JOIN ").append(IdentifierUtil.render(step.table(), dialect)).append(" ON ").append(on);
    }
    return sb.toString();
  }
}
