package se.alipsa.semlayer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import se.alipsa.semlayer.engine.QueryCompiler;
import se.alipsa.semlayer.io.SchemaDocuments;
import se.alipsa.semlayer.model.SemanticSchema;
import se.alipsa.semlayer.sql.Dialect;
import se.alipsa.semlayer.sql.StatementRewriter;
import se.alipsa.semlayer.sql.TableMapping;

/**
 * Entry point bundling the query compiler and the statement rewriter with a
 * {@link SemLayerConfig}.
 *
 * <pre>{@code
 * SemLayer layer = new SemLayer(SemLayerConfig.fromQueryString("datasetPath=/data"));
 * SemanticSchema sales = layer.loadSchema(Path.of("/data/acme/sales"));
 * String sql = layer.compile(sales);
 * }</pre>
 */
public final class SemLayer {

  private final SemLayerConfig config;
  private final QueryCompiler compiler;
  private final StatementRewriter rewriter;

  /**
   * Create an instance with default settings.
   */
  public SemLayer() {
    this(SemLayerConfig.defaults());
  }

  /**
   * Create an instance.
   *
   * @param config
   *          the settings
   */
  public SemLayer(SemLayerConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.compiler = new QueryCompiler(config.datasetPath());
    this.rewriter = new StatementRewriter(Dialect.DUCKDB);
  }

  public SemLayerConfig config() {
    return config;
  }

  public QueryCompiler compiler() {
    return compiler;
  }

  public StatementRewriter rewriter() {
    return rewriter;
  }

  /**
   * Load a schema from a dataset directory or a schema document. Relative
   * paths are resolved against the configured dataset path.
   *
   * @param location
   *          a dataset directory or a {@code schema.yaml} file
   * @return the schema
   */
  public SemanticSchema loadSchema(Path location) {
    Path resolved = config.datasetPath().resolve(location);
    return Files.isDirectory(resolved) ? SchemaDocuments.readDataset(resolved) : SchemaDocuments.read(resolved);
  }

  public String compile(SemanticSchema schema) {
    return compiler.buildQuery(schema);
  }

  /**
   * Compile a preview of the configured number of rows.
   *
   * @param schema
   *          the schema
   * @return the SQL text
   */
  public String head(SemanticSchema schema) {
    return compiler.buildHeadQuery(schema, config.headRows());
  }

  public String head(SemanticSchema schema, int rows) {
    return compiler.buildHeadQuery(schema, rows);
  }

  public String rowCount(SemanticSchema schema) {
    return compiler.buildRowCountQuery(schema);
  }

  /**
   * Build a mapping that resolves each schema's name to its compiled query, so
   * a statement joining several datasets can run on the embedded engine.
   *
   * @param schemas
   *          the datasets the statement refers to
   * @return the mapping
   * @throws InvalidTableMappingException
   *           if a compiled query refers to another of the datasets, as views
   *           do
   */
  public TableMapping mappingFor(Collection<SemanticSchema> schemas) {
    Map<String, String> entries = new LinkedHashMap<>();
    for (SemanticSchema schema : schemas) {
      entries.put(schema.name(), compile(schema));
    }
    return TableMapping.of(entries);
  }

  public String substituteTables(String sql, TableMapping mapping) {
    return rewriter.substituteTables(sql, mapping);
  }

  public String substituteTables(String sql, Map<String, String> mapping) {
    return rewriter.substituteTables(sql, mapping);
  }

  /**
   * Transpile a statement written in the configured dialect.
   *
   * @param sql
   *          the statement
   * @param to
   *          the target dialect
   * @return the transpiled statement
   */
  public String transpile(String sql, Dialect to) {
    return rewriter.transpile(sql, to, config.dialect());
  }

  public String transpile(String sql, Dialect to, Dialect from) {
    return rewriter.transpile(sql, to, from);
  }

  /**
   * List the tables a script written in the configured dialect reads.
   *
   * @param sql
   *          one or more statements
   * @return the table names
   */
  public List<String> extractTableNames(String sql) {
    return rewriter.extractTableNames(sql, config.dialect());
  }

  public List<String> extractTableNames(String sql, Dialect dialect) {
    return rewriter.extractTableNames(sql, dialect);
  }
}
