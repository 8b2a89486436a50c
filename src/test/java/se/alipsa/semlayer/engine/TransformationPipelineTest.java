package se.alipsa.semlayer.engine;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.alipsa.semlayer.InvalidSchemaException;
import se.alipsa.semlayer.model.Transformation;
import se.alipsa.semlayer.model.TransformationType;
import se.alipsa.semlayer.sql.Dialect;
import se.alipsa.semlayer.sql.SqlStatements;

/** Tests for the column rewrites of {@link TransformationPipeline}. */
class TransformationPipelineTest {

  private final TransformationPipeline pipeline = new TransformationPipeline();

  private String rewrite(String type, Map<String, Object> params) {
    Map<String, Object> withColumn = new LinkedHashMap<>(params);
    withColumn.put("column", "c");
    return pipeline.apply("c", "c", List.of(Transformation.of(type, withColumn)));
  }

  @Test
  void rewritesSimpleFunctions() {
    assertEquals("MD5(CAST(c AS VARCHAR))", rewrite("anonymize", Map.of()));
    assertEquals("LOWER(c)", rewrite("to_lowercase", Map.of()));
    assertEquals("UPPER(c)", rewrite("to_uppercase", Map.of()));
    assertEquals("TRIM(c)", rewrite("strip", Map.of()));
    assertEquals("CAST(c AS DOUBLE)", rewrite("to_numeric", Map.of()));
    assertEquals("CAST(c AS TIMESTAMP)", rewrite("to_datetime", Map.of()));
    assertEquals("(DENSE_RANK() OVER (ORDER BY c) - 1)", rewrite("encode_categorical", Map.of()));
    assertEquals("CASE WHEN c > 0 THEN c ELSE NULL END", rewrite("ensure_positive", Map.of()));
    assertEquals("CASE WHEN c LIKE '%_@_%._%' THEN c ELSE NULL END", rewrite("validate_email", Map.of()));
  }

  @Test
  void rewritesParameterizedFunctions() {
    assertEquals("ROUND(c, 0)", rewrite("round_numbers", Map.of()));
    assertEquals("ROUND(c, 2)", rewrite("round_numbers", Map.of("decimals", 2)));
    assertEquals("(c * 1.5)", rewrite("scale", Map.of("factor", 1.5)));
    assertEquals("STRFTIME(c, '%Y-%m')", rewrite("format_date", Map.of("format", "%Y-%m")));
    assertEquals("COALESCE(c, 0)", rewrite("fill_na", Map.of("value", 0)));
    assertEquals("COALESCE(c, 'n/a')", rewrite("fill_na", Map.of("value", "n/a")));
    assertEquals("REPLACE(c, 'O''Brien', 'OBrien')",
        rewrite("replace", Map.of("old_value", "O'Brien", "new_value", "OBrien")));
    assertEquals("REGEXP_EXTRACT(c, '[0-9]+')", rewrite("extract", Map.of("pattern", "[0-9]+")));
    assertEquals("SUBSTR(c, 1, 8)", rewrite("truncate", Map.of("length", 8)));
  }

  @Test
  void convertsTimezones() {
    assertEquals("(c AT TIME ZONE 'UTC')", rewrite("convert_timezone", Map.of("to", "UTC")));
    assertEquals("((c AT TIME ZONE 'Europe/Stockholm') AT TIME ZONE 'UTC')",
        rewrite("convert_timezone", Map.of("from", "Europe/Stockholm", "to", "UTC")));
  }

  @Test
  void padsOnEitherSide() {
    assertEquals("LPAD(c, 5, ' ')", rewrite("pad", Map.of("width", 5)));
    assertEquals("RPAD(c, 5, '0')", rewrite("pad", Map.of("width", 5, "side", "RIGHT", "pad_char", "0")));
    assertThrows(InvalidSchemaException.class, () -> rewrite("pad", Map.of("width", 5, "side", "middle")));
    assertThrows(InvalidSchemaException.class, () -> rewrite("pad", Map.of("width", 0)));
  }

  @Test
  void clipsOneOrBothBounds() {
    assertEquals("LEAST(GREATEST(c, 0), 100)", rewrite("clip", Map.of("lower", 0, "upper", 100)));
    assertEquals("GREATEST(c, 0)", rewrite("clip", Map.of("lower", 0)));
    assertEquals("LEAST(c, 9.5)", rewrite("clip", Map.of("upper", "9.5")));
    assertThrows(InvalidSchemaException.class, () -> rewrite("clip", Map.of("upper", "lots")));
  }

  @Test
  void binsWithAndWithoutLabels() {
    assertEquals("CASE WHEN c >= 0 AND c < 10 THEN 'low' WHEN c >= 10 AND c <= 20 THEN 'high' ELSE NULL END",
        rewrite("bin", Map.of("bins", List.of(0, 10, 20), "labels", List.of("low", "high"))));
    assertEquals("CASE WHEN c >= 0 AND c < 10 THEN 0 WHEN c >= 10 AND c <= 20 THEN 1 ELSE NULL END",
        rewrite("bin", Map.of("bins", List.of(0, 10, 20))));
    assertThrows(InvalidSchemaException.class,
        () -> rewrite("bin", Map.of("bins", List.of(0, 10, 20), "labels", List.of("only"))));
    assertThrows(InvalidSchemaException.class, () -> rewrite("bin", Map.of("bins", List.of(0))));
    assertThrows(InvalidSchemaException.class, () -> rewrite("bin", Map.of("bins", List.of(0, "ten"))));
  }

  @Test
  void normalizesAndStandardizes() {
    assertEquals("((c - MIN(c) OVER ()) / NULLIF(MAX(c) OVER () - MIN(c) OVER (), 0))",
        rewrite("normalize", Map.of()));
    assertEquals("((c - AVG(c) OVER ()) / NULLIF(STDDEV(c) OVER (), 0))", rewrite("standardize", Map.of()));
  }

  @Test
  void mapsValues() {
    Map<String, Object> mapping = new LinkedHashMap<>();
    mapping.put("M", "male");
    mapping.put("F", "female");
    assertEquals("CASE WHEN c = 'M' THEN 'male' WHEN c = 'F' THEN 'female' ELSE c END",
        rewrite("map_values", Map.of("mapping", mapping)));
    assertEquals("CASE WHEN LOWER(c) = LOWER('M') THEN 'male' WHEN LOWER(c) = LOWER('F') THEN 'female' ELSE c END",
        rewrite("standardize_categories", Map.of("mapping", mapping)));
    assertThrows(InvalidSchemaException.class, () -> rewrite("map_values", Map.of("mapping", "M=male")));
  }

  @Test
  void validatesRangesAndReferences() {
    assertEquals("CASE WHEN c BETWEEN '2020-01-01' AND '2020-12-31' THEN c ELSE NULL END",
        rewrite("validate_date_range", Map.of("start_date", "2020-01-01", "end_date", "2020-12-31")));
    assertEquals("CASE WHEN c >= '2020-01-01' THEN c ELSE NULL END",
        rewrite("validate_date_range", Map.of("start_date", "2020-01-01")));
    assertEquals("CASE WHEN c <= '2020-12-31' THEN c ELSE NULL END",
        rewrite("validate_date_range", Map.of("end_date", "2020-12-31")));
    assertEquals("CASE WHEN c IN (1, 2, 'x') THEN c ELSE NULL END",
        rewrite("validate_foreign_key", Map.of("ref_values", List.of(1, 2, "x"))));
  }

  @Test
  void normalizesPhoneNumbers() {
    assertEquals("REGEXP_REPLACE(c, '[^0-9+]', '', 'g')", rewrite("normalize_phone", Map.of()));
    assertEquals("('+46' || REGEXP_REPLACE(c, '[^0-9+]', '', 'g'))",
        rewrite("normalize_phone", Map.of("country_code", "46")));
    assertThrows(InvalidSchemaException.class,
        () -> rewrite("normalize_phone", Map.of("country_code", "46'; DROP TABLE x")));
  }

  @Test
  void foldsLeftToRightAndSynthesizesAlias() {
    List<Transformation> transformations = List.of(
        Transformation.of("strip", Map.of("column", "email")),
        Transformation.of("to_lowercase", Map.of("column", "email")),
        Transformation.of("to_uppercase", Map.of("column", "other")));
    RewrittenColumn column = pipeline.apply("\"email\"", "email", null, transformations);
    assertEquals("LOWER(TRIM(\"email\"))", column.expression());
    assertEquals("email", column.alias());

    RewrittenColumn untouched = pipeline.apply("\"name\"", "name", null, transformations);
    assertEquals("\"name\"", untouched.expression());
    assertNull(untouched.alias());
    assertFalse(untouched.hasAlias());
    assertTrue(pipeline.isTransformed("email", transformations));
    assertFalse(pipeline.isTransformed("name", transformations));
  }

  @Test
  void renameOnlyChangesAlias() {
    RewrittenColumn column = pipeline.apply("\"amt\"", "amt", "x",
        List.of(Transformation.of("rename", Map.of("column", "amt", "new_name", "amount"))));
    assertEquals("\"amt\"", column.expression());
    assertEquals("amount", column.alias());
  }

  @Test
  void keepsDeclaredAlias() {
    RewrittenColumn column = pipeline.apply("\"amount\"", "amount", "total",
        List.of(Transformation.of("fill_na", Map.of("column", "amount", "value", 0))));
    assertEquals("total", column.alias());
  }

  @Test
  void removeDuplicatesLeavesColumnsAlone() {
    RewrittenColumn column = pipeline.apply("\"a\"", "a", null,
        List.of(Transformation.of("remove_duplicates", Map.of())));
    assertEquals("\"a\"", column.expression());
    assertNull(column.alias());
  }

  @Test
  void everyRuleProducesParseableSql() {
    Map<TransformationType, Map<String, Object>> samples = new LinkedHashMap<>();
    for (TransformationType type : TransformationType.values()) {
      samples.put(type, Map.of());
    }
    samples.put(TransformationType.CONVERT_TIMEZONE, Map.of("to", "UTC"));
    samples.put(TransformationType.SCALE, Map.of("factor", 2));
    samples.put(TransformationType.FORMAT_DATE, Map.of("format", "%Y"));
    samples.put(TransformationType.FILL_NA, Map.of("value", 0));
    samples.put(TransformationType.REPLACE, Map.of("old_value", "a", "new_value", "b"));
    samples.put(TransformationType.EXTRACT, Map.of("pattern", "[a-z]+"));
    samples.put(TransformationType.TRUNCATE, Map.of("length", 3));
    samples.put(TransformationType.PAD, Map.of("width", 3));
    samples.put(TransformationType.CLIP, Map.of("lower", 1, "upper", 2));
    samples.put(TransformationType.BIN, Map.of("bins", List.of(0, 1, 2)));
    samples.put(TransformationType.MAP_VALUES, Map.of("mapping", Map.of("a", "b")));
    samples.put(TransformationType.RENAME, Map.of("new_name", "d"));
    samples.put(TransformationType.VALIDATE_DATE_RANGE, Map.of("start_date", "2020-01-01"));
    samples.put(TransformationType.VALIDATE_FOREIGN_KEY, Map.of("ref_values", List.of(1)));
    samples.put(TransformationType.STANDARDIZE_CATEGORIES, Map.of("mapping", Map.of("a", "b")));
    samples.forEach((type, params) -> {
      String expression = rewrite(type.typeName(), params);
      assertDoesNotThrow(() -> SqlStatements.parse("SELECT " + expression + " FROM t", Dialect.DUCKDB),
          type.typeName());
    });
  }
}
