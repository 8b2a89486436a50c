package se.alipsa.semlayer.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.alipsa.semlayer.InvalidGroupByException;
import se.alipsa.semlayer.InvalidSchemaException;

/** Tests for {@link SemanticSchema} validation. */
class SemanticSchemaTest {

  private static final FileSource SALES_CSV = new FileSource(SourceType.CSV, "sales.csv");

  @Test
  void buildsValidSchema() {
    SemanticSchema schema = SemanticSchema.builder("sales").source(SALES_CSV)
        .column(Column.expression("amount", ColumnType.FLOAT, "sum(amount)", "total")).groupBy(List.of("region"))
        .limit(10).build();
    assertEquals("sales", schema.name());
    assertEquals(1, schema.columns().size());
    assertEquals(List.of("region"), schema.groupBy());
    assertEquals(10, schema.limit());
    assertFalse(schema.isView());
    assertFalse(schema.distinct());
    assertTrue(schema.findColumn("amount").isPresent());
    assertTrue(schema.findColumn("region").isEmpty());
  }

  @Test
  void rejectsBlankOrInvalidName() {
    assertThrows(InvalidSchemaException.class, () -> SemanticSchema.builder("  ").source(SALES_CSV).build());
    InvalidSchemaException e = assertThrows(InvalidSchemaException.class,
        () -> SemanticSchema.builder("my-sales").source(SALES_CSV).build());
    assertEquals("my-sales", e.getSchemaName());
  }

  @Test
  void requiresSource() {
    assertThrows(InvalidSchemaException.class, () -> SemanticSchema.builder("sales").build());
  }

  @Test
  void rejectsDuplicateColumns() {
    SemanticSchema.Builder builder = SemanticSchema.builder("sales").source(SALES_CSV)
        .column(Column.of("region", ColumnType.STRING)).column(Column.of("region", ColumnType.STRING));
    assertThrows(InvalidSchemaException.class, builder::build);
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(InvalidSchemaException.class,
        () -> SemanticSchema.builder("sales").source(SALES_CSV).limit(0).build());
  }

  @Test
  void rejectsGroupingOnExpressionColumn() {
    SemanticSchema.Builder builder = SemanticSchema.builder("sales").source(SALES_CSV)
        .column(Column.expression("amount", ColumnType.FLOAT, "sum(amount)", null)).groupBy(List.of("amount"));
    InvalidGroupByException e = assertThrows(InvalidGroupByException.class, builder::build);
    assertEquals("amount", e.getColumn());
  }

  @Test
  void rejectsUngroupedPlainColumn() {
    SemanticSchema.Builder builder = SemanticSchema.builder("sales").source(SALES_CSV)
        .column(Column.of("country", ColumnType.STRING))
        .column(Column.expression("amount", ColumnType.FLOAT, "sum(amount)", null)).groupBy(List.of("region"));
    InvalidGroupByException e = assertThrows(InvalidGroupByException.class, builder::build);
    assertEquals("country", e.getColumn());
  }

  @Test
  void removeDuplicatesMakesSchemaDistinct() {
    SemanticSchema schema = SemanticSchema.builder("sales").source(SALES_CSV)
        .transformation(Transformation.of("remove_duplicates", Map.of())).build();
    assertTrue(schema.distinct());
  }

  @Test
  void validatesViewColumnsAndRelations() {
    ViewSource view = new ViewSource(List.of(Relation.of("orders.customer_id", "customers.id")));
    SemanticSchema schema = SemanticSchema.builder("customer_orders").source(view)
        .column(Column.of("orders.id", ColumnType.INTEGER)).column(Column.of("customers.name", ColumnType.STRING))
        .build();
    assertTrue(schema.isView());
    assertEquals(1, schema.relations().size());

    assertThrows(InvalidSchemaException.class, () -> SemanticSchema.builder("v").source(view).build());
    assertThrows(InvalidSchemaException.class,
        () -> SemanticSchema.builder("v").source(view).column(Column.of("id", ColumnType.INTEGER)).build());
    assertThrows(InvalidSchemaException.class, () -> SemanticSchema.builder("v").source(view)
        .column(Column.of("orders.id", ColumnType.INTEGER)).column(Column.of("products.sku", ColumnType.STRING))
        .build());
  }

  @Test
  void withDescriptionReturnsCopy() {
    SemanticSchema schema = SemanticSchema.builder("sales").source(SALES_CSV).description("old").build();
    SemanticSchema updated = schema.withDescription("new");
    assertEquals("old", schema.description());
    assertEquals("new", updated.description());
    assertNotEquals(schema, updated);
    assertEquals(schema, updated.withDescription("old"));
  }

  @Test
  void rejectsUnusableTransformationParameters() {
    List<Transformation> invalid = List.of(
        Transformation.of("pad", Map.of("column", "region", "width", 5, "side", "middle")),
        Transformation.of("truncate", Map.of("column", "region", "length", 0)),
        Transformation.of("bin", Map.of("column", "amount", "bins", List.of(0, "ten", 20))),
        Transformation.of("bin", Map.of("column", "amount", "bins", List.of(0, 10, 20), "labels", List.of("low"))),
        Transformation.of("normalize_phone", Map.of("column", "phone", "country_code", "+46-8")),
        Transformation.of("fill_na", Map.of("column", "amount", "value", Double.NaN)));
    for (Transformation transformation : invalid) {
      SemanticSchema.Builder builder = SemanticSchema.builder("sales").source(SALES_CSV)
          .transformation(transformation);
      InvalidSchemaException e = assertThrows(InvalidSchemaException.class, builder::build,
          transformation.toString());
      assertEquals("sales", e.getSchemaName());
      assertTrue(e.getMessage().startsWith("Transformation " + transformation.type().typeName()), e.getMessage());
    }
  }

  @Test
  void acceptsUsableTransformationParameters() {
    SemanticSchema schema = SemanticSchema.builder("sales").source(SALES_CSV)
        .transformation(Transformation.of("pad", Map.of("column", "region", "width", 5, "side", "right")))
        .transformation(Transformation.of("bin", Map.of("column", "amount", "bins", List.of(0, "10.5", 20))))
        .build();
    assertEquals(2, schema.transformations().size());
  }
}
