package se.alipsa.semlayer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.semlayer.model.SemanticSchema;
import se.alipsa.semlayer.sql.Dialect;
import se.alipsa.semlayer.sql.TableMapping;

/** End to end tests of the {@link SemLayer} facade over the test datasets. */
class SemLayerTest {

  private static final Path DATASETS = Path.of("src/test/resources/datasets");

  private final SemLayer layer = new SemLayer(SemLayerConfig.defaults().withDatasetPath(DATASETS));

  @Test
  void compilesLoadedDatasets() {
    SemanticSchema sales = layer.loadSchema(Path.of("sales"));
    String csv = DATASETS.resolve("sales/sales.csv").toAbsolutePath().normalize().toString().replace('\\', '/');
    String query = "SELECT sum(\"amount\") AS \"total\" FROM read_csv('" + csv + "') GROUP BY \"region\"";
    assertEquals(query, layer.compile(sales));
    assertEquals(query + " LIMIT 5", layer.head(sales));
    assertEquals(query + " LIMIT 1", layer.head(sales, 1));
    assertEquals("SELECT COUNT(*) FROM (" + query + ") \"row_source\"", layer.rowCount(sales));
  }

  @Test
  void loadsSchemaDocumentsDirectly() {
    SemanticSchema crm = layer.loadSchema(Path.of("crm/schema.yaml"));
    assertEquals("SELECT DISTINCT \"id\", CASE WHEN LOWER(\"email\") LIKE '%_@_%._%' THEN LOWER(\"email\") ELSE NULL"
        + " END AS \"email\", \"country\" FROM \"public\".\"customers\" ORDER BY \"id\"", layer.compile(crm));
  }

  @Test
  void compilesViewsForTheEmbeddedEngine() {
    SemanticSchema view = layer.loadSchema(Path.of("customer_orders"));
    assertEquals("SELECT \"orders\".\"id\" AS \"orders_id\", \"customers\".\"name\" AS \"customers_name\","
        + " \"orders\".\"amount\" AS \"orders_amount\" FROM \"orders\" JOIN \"customers\""
        + " ON \"orders\".\"customer_id\" = \"customers\".\"id\" ORDER BY \"orders_amount\" DESC LIMIT 100",
        layer.compile(view));
  }

  @Test
  void runsStatementsAgainstSeveralDatasets() {
    SemanticSchema sales = layer.loadSchema(Path.of("sales"));
    SemanticSchema crm = layer.loadSchema(Path.of("crm"));
    TableMapping mapping = layer.mappingFor(List.of(sales, crm));
    assertEquals(2, mapping.size());
    String sql = layer.substituteTables("SELECT s.total, c.email FROM sales s CROSS JOIN customers c", mapping);
    assertTrue(sql.contains("read_csv("), sql);
    assertTrue(sql.contains("FROM \"public\".\"customers\""), sql);
    assertTrue(sql.contains("\"s\""), sql);
    assertTrue(sql.contains("\"c\""), sql);
  }

  @Test
  void viewsCannotBeMappedNextToTheirTables() {
    SemanticSchema view = layer.loadSchema(Path.of("customer_orders"));
    SemanticSchema crm = layer.loadSchema(Path.of("crm"));
    assertThrows(InvalidTableMappingException.class, () -> layer.mappingFor(List.of(view, crm)));
  }

  @Test
  void usesConfiguredDialectForTranspileAndExtraction() {
    assertEquals("SELECT TOP 3 * FROM t WHERE id = ?",
        layer.transpile("SELECT * FROM t WHERE id = %s LIMIT 3", Dialect.SQLSERVER));
    assertEquals(List.of("orders"), layer.extractTableNames("SELECT * FROM orders WHERE id = %s"));
    assertEquals(List.of("t"), layer.extractTableNames("SELECT [a] FROM [t]", Dialect.SQLSERVER));
  }

  @Test
  void missingDatasetIsReported() {
    assertThrows(UncheckedIOException.class, () -> layer.loadSchema(Path.of("nope")));
  }
}
