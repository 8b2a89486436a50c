package se.alipsa.semlayer.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.semlayer.InvalidSchemaException;
import se.alipsa.semlayer.UnsupportedSourceFormatException;
import se.alipsa.semlayer.sql.Dialect;

/** Tests for the small value types of the schema model. */
class ModelTypesTest {

  @Test
  void sourceTypesResolveByName() {
    assertEquals(SourceType.POSTGRES, SourceType.fromName("PostgreSQL"));
    assertEquals(SourceType.XLSX, SourceType.fromName(" xlsx "));
    assertTrue(SourceType.PARQUET.isLocal());
    assertTrue(SourceType.ORACLE.isRelational());
    assertEquals(Dialect.DUCKDB, SourceType.CSV.dialect());
    assertEquals(Dialect.SQLSERVER, SourceType.SQLSERVER.dialect());
    assertThrows(UnsupportedSourceFormatException.class, () -> SourceType.fromName("json"));
  }

  @Test
  void columnTypesResolveByName() {
    assertEquals(ColumnType.DATETIME, ColumnType.fromName("DateTime"));
    assertNull(ColumnType.fromName(null));
    assertThrows(InvalidSchemaException.class, () -> ColumnType.fromName("decimal"));
  }

  @Test
  void fileSourceRequiresLocalTypeAndPath() {
    assertThrows(UnsupportedSourceFormatException.class, () -> new FileSource(SourceType.MYSQL, "x.csv"));
    assertThrows(InvalidSchemaException.class, () -> new FileSource(SourceType.CSV, " "));
  }

  @Test
  void relationalSourceRequiresTable() {
    assertThrows(UnsupportedSourceFormatException.class, () -> new RelationalSource(SourceType.CSV, null, "t"));
    assertThrows(InvalidSchemaException.class, () -> new RelationalSource(SourceType.MYSQL, null, null));
    assertEquals("orders", new RelationalSource(SourceType.MYSQL, null, " orders ").table());
  }

  @Test
  void columnBlanksBecomeNull() {
    Column column = new Column(" region ", ColumnType.STRING, " ", "", null);
    assertEquals("region", column.name());
    assertNull(column.description());
    assertFalse(column.hasExpression());
    assertEquals("r", column.withAlias("r").alias());
    assertThrows(InvalidSchemaException.class, () -> Column.of("", ColumnType.STRING));
  }

  @Test
  void relationsSplitQualifiedNames() {
    Relation relation = Relation.of("sales.orders.customer_id", "customers.id");
    assertEquals("sales.orders", relation.fromTable());
    assertEquals("customer_id", relation.fromColumn());
    assertEquals("customers", relation.toTable());
    assertEquals("id", relation.toColumn());
    assertThrows(InvalidSchemaException.class, () -> Relation.of("orders", "customers.id"));
    assertThrows(InvalidSchemaException.class, () -> Relation.of("orders.id", "customers."));
  }

  @Test
  void viewJoinPlanFollowsRelations() {
    ViewSource view = new ViewSource(List.of(Relation.of("items.order_id", "orders.id"),
        Relation.of("orders.customer_id", "customers.id"), Relation.of("orders.region", "customers.region")));
    List<ViewSource.JoinStep> plan = view.joinPlan("orders");
    assertEquals(2, plan.size());
    assertEquals("items", plan.get(0).table());
    assertEquals("customers", plan.get(1).table());
    assertEquals(2, plan.get(1).conditions().size());
    assertEquals(List.of("orders", "items", "customers"), List.copyOf(view.reachableTables("orders")));
    assertThrows(InvalidSchemaException.class, () -> view.joinPlan("products"));
  }

  @Test
  void connectionBuildsJdbcUrls() {
    ConnectionConfig config = new ConnectionConfig("db", null, "u", "secret", "crm", null);
    assertEquals("jdbc:postgresql://db:5432/crm?currentSchema=public", config.jdbcUrl(SourceType.POSTGRES));
    assertEquals("jdbc:mysql://db:3306/crm", config.jdbcUrl(SourceType.MYSQL));
    assertEquals("jdbc:sqlserver://db:1433;databaseName=crm", config.jdbcUrl(SourceType.SQLSERVER));
    assertEquals("jdbc:oracle:thin:@//db:1521/crm", config.jdbcUrl(SourceType.ORACLE));
    assertThrows(IllegalArgumentException.class, () -> config.jdbcUrl(SourceType.CSV));
    assertFalse(config.toString().contains("secret"));
  }
}
