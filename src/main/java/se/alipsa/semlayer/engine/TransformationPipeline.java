package se.alipsa.semlayer.engine;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import se.alipsa.semlayer.InvalidSchemaException;
import se.alipsa.semlayer.helper.SqlLiterals;
import se.alipsa.semlayer.model.Transformation;
import se.alipsa.semlayer.model.TransformationType;

/**
 * Applies the declared transformations of a schema to column expressions.
 * Each transformation kind has exactly one rewrite rule; the transformations
 * targeting a column fold left to right, so later ones see the already
 * rewritten expression.
 *
 * <p>
 * The pipeline is stateless and thread safe.
 * </p>
 */
public final class TransformationPipeline {

  private static final Map<TransformationType, TransformationRule> RULES = new EnumMap<>(TransformationType.class);

  static {
    for (TransformationType type : TransformationType.values()) {
      RULES.put(type, ruleFor(type));
    }
  }

  /**
   * Rewrite the expression of one column.
   *
   * @param expression
   *          the starting expression: the column's own expression or its
   *          quoted name
   * @param columnName
   *          the logical column name transformations are matched against
   * @param alias
   *          the declared alias (may be {@code null})
   * @param transformations
   *          all transformations of the schema in declaration order
   * @return the rewritten expression and its alias; when at least one
   *         transformation applied and no alias was declared, the alias is the
   *         normalized column name
   */
  public RewrittenColumn apply(String expression, String columnName, String alias,
      List<Transformation> transformations) {
    String current = expression;
    String outputName = alias;
    boolean applied = false;
    for (Transformation transformation : transformations) {
      if (!transformation.targets(columnName)) {
        continue;
      }
      TransformationParams params = new TransformationParams(transformation);
      current = RULES.get(transformation.type()).rewrite(current, params);
      if (transformation.type() == TransformationType.RENAME) {
        outputName = params.text("new_name");
      }
      applied = true;
    }
    if (applied && outputName == null) {
      outputName = IdentifierUtil.columnAlias(columnName);
    }
    return new RewrittenColumn(current, outputName);
  }

  /**
   * Rewrite a column expression, ignoring the alias.
   *
   * @param expression
   *          the starting expression
   * @param columnName
   *          the logical column name
   * @param transformations
   *          the transformations to apply
   * @return the rewritten expression
   */
  public String apply(String expression, String columnName, List<Transformation> transformations) {
    return apply(expression, columnName, null, transformations).expression();
  }

  /**
   * Whether any transformation targets the column.
   *
   * @param columnName
   *          the logical column name
   * @param transformations
   *          the transformations of the schema
   * @return {@code true} if at least one transformation applies
   */
  public boolean isTransformed(String columnName, List<Transformation> transformations) {
    return transformations.stream().anyMatch(t -> t.targets(columnName));
  }

  /**
   * Check the parameter values of a transformation by rewriting a stand-in
   * column reference with its rule.
   *
   * @param transformation
   *          the transformation to check
   * @throws InvalidSchemaException
   *           if a parameter is missing or has a value the rule cannot render
   */
  public static void validate(Transformation transformation) {
    TransformationParams params = new TransformationParams(transformation);
    try {
      RULES.get(transformation.type()).rewrite("\"" + transformation.type().typeName() + "\"", params);
    } catch (IllegalArgumentException e) {
      throw params.invalid(e.getMessage(), e);
    }
  }

  static TransformationRule ruleFor(TransformationType type) {
    return switch (type) {
      case ANONYMIZE -> (e, p) -> "MD5(CAST(" + e + " AS VARCHAR))";
      case CONVERT_TIMEZONE -> (e, p) -> p.has("from")
          ? "((" + e + " AT TIME ZONE " + p.string("from") + ") AT TIME ZONE " + p.string("to") + ")"
          : "(" + e + " AT TIME ZONE " + p.string("to") + ")";
      case TO_LOWERCASE -> (e, p) -> "LOWER(" + e + ")";
      case TO_UPPERCASE -> (e, p) -> "UPPER(" + e + ")";
      case STRIP -> (e, p) -> "TRIM(" + e + ")";
      case ROUND_NUMBERS -> (e, p) -> "ROUND(" + e + ", " + p.integer("decimals", 0) + ")";
      case SCALE -> (e, p) -> "(" + e + " * " + p.number("factor") + ")";
      case FORMAT_DATE -> (e, p) -> "STRFTIME(" + e + ", " + p.string("format") + ")";
      case TO_NUMERIC -> (e, p) -> "CAST(" + e + " AS DOUBLE)";
      case TO_DATETIME -> (e, p) -> "CAST(" + e + " AS TIMESTAMP)";
      case FILL_NA -> (e, p) -> "COALESCE(" + e + ", " + p.literal("value") + ")";
      case REPLACE -> (e, p) -> "REPLACE(" + e + ", " + p.string("old_value") + ", " + p.string("new_value") + ")";
      case EXTRACT -> (e, p) -> "REGEXP_EXTRACT(" + e + ", " + p.string("pattern") + ")";
      case TRUNCATE -> (e, p) -> "SUBSTR(" + e + ", 1, " + positive(p, "length") + ")";
      case PAD -> TransformationPipeline::pad;
      case CLIP -> TransformationPipeline::clip;
      case BIN -> TransformationPipeline::bin;
      case NORMALIZE -> (e, p) -> "((" + e + " - MIN(" + e + ") OVER ()) / NULLIF(MAX(" + e + ") OVER () - MIN(" + e
          + ") OVER (), 0))";
      case STANDARDIZE -> (e, p) -> "((" + e + " - AVG(" + e + ") OVER ()) / NULLIF(STDDEV(" + e
          + ") OVER (), 0))";
      case MAP_VALUES -> (e, p) -> caseMapping(e, e, p.mapping("mapping"), false);
      case RENAME, REMOVE_DUPLICATES -> (e, p) -> e;
      case ENCODE_CATEGORICAL -> (e, p) -> "(DENSE_RANK() OVER (ORDER BY " + e + ") - 1)";
      case VALIDATE_EMAIL -> (e, p) -> "CASE WHEN " + e + " LIKE '%_@_%._%' THEN " + e + " ELSE NULL END";
      case VALIDATE_DATE_RANGE -> TransformationPipeline::dateRange;
      case NORMALIZE_PHONE -> TransformationPipeline::phone;
      case VALIDATE_FOREIGN_KEY -> (e, p) -> {
        StringJoiner values = new StringJoiner(", ");
        p.list("ref_values").forEach(v -> values.add(SqlLiterals.literal(v)));
        return "CASE WHEN " + e + " IN (" + values + ") THEN " + e + " ELSE NULL END";
      };
      case ENSURE_POSITIVE -> (e, p) -> "CASE WHEN " + e + " > 0 THEN " + e + " ELSE NULL END";
      case STANDARDIZE_CATEGORIES -> (e, p) -> caseMapping(e, "LOWER(" + e + ")", p.mapping("mapping"), true);
    };
  }

  private static int positive(TransformationParams p, String name) {
    int value = p.integer(name, 0);
    if (value <= 0) {
      throw p.invalid("Parameter '" + name + "' must be positive: " + p.text(name), null);
    }
    return value;
  }

  private static String pad(String e, TransformationParams p) {
    int width = positive(p, "width");
    String side = p.has("side") ? p.text("side").trim().toLowerCase(Locale.ROOT) : "left";
    String function = switch (side) {
      case "left" -> "LPAD";
      case "right" -> "RPAD";
      default -> throw p.invalid("Parameter 'side' must be left or right: " + side, null);
    };
    String padChar = p.has("pad_char") ? p.text("pad_char") : " ";
    if (padChar.isEmpty()) {
      throw p.invalid("Parameter 'pad_char' must not be empty", null);
    }
    return function + "(" + e + ", " + width + ", " + SqlLiterals.string(padChar) + ")";
  }

  private static String clip(String e, TransformationParams p) {
    String clipped = e;
    if (p.has("lower")) {
      clipped = "GREATEST(" + clipped + ", " + p.number("lower") + ")";
    }
    if (p.has("upper")) {
      clipped = "LEAST(" + clipped + ", " + p.number("upper") + ")";
    }
    return clipped;
  }

  private static String bin(String e, TransformationParams p) {
    List<Object> edges = p.list("bins");
    if (edges.size() < 2) {
      throw p.invalid("Parameter 'bins' needs at least two edges", null);
    }
    List<Object> labels = p.has("labels") ? p.list("labels") : null;
    if (labels != null && labels.size() != edges.size() - 1) {
      throw p.invalid("Parameter 'labels' must have one entry per bin (" + (edges.size() - 1) + ")", null);
    }
    StringBuilder sb = new StringBuilder("CASE");
    for (int i = 0; i < edges.size() - 1; i++) {
      String lower = edge(p, edges.get(i));
      String upper = edge(p, edges.get(i + 1));
      boolean last = i == edges.size() - 2;
      sb.append(" WHEN ").append(e).append(" >= ").append(lower).append(" AND ").append(e)
          .append(last ? " <= " : " < ").append(upper).append(" THEN ")
          .append(labels == null ? String.valueOf(i) : SqlLiterals.literal(labels.get(i)));
    }
    return sb.append(" ELSE NULL END").toString();
  }

  private static String edge(TransformationParams p, Object value) {
    try {
      return SqlLiterals.number(value, "bins");
    } catch (IllegalArgumentException e) {
      throw p.invalid(e.getMessage(), e);
    }
  }

  private static String caseMapping(String e, String subject, Map<String, Object> mapping, boolean ignoreCase) {
    StringBuilder sb = new StringBuilder("CASE");
    for (Map.Entry<String, Object> entry : mapping.entrySet()) {
      String key = SqlLiterals.string(entry.getKey());
      sb.append(" WHEN ").append(subject).append(" = ").append(ignoreCase ? "LOWER(" + key + ")" : key)
          .append(" THEN ").append(SqlLiterals.literal(entry.getValue()));
    }
    return sb.append(" ELSE ").append(e).append(" END").toString();
  }

  private static String dateRange(String e, TransformationParams p) {
    String condition;
    if (p.has("start_date") && p.has("end_date")) {
      condition = e + " BETWEEN " + p.string("start_date") + " AND " + p.string("end_date");
    } else if (p.has("start_date")) {
      condition = e + " >= " + p.string("start_date");
    } else {
      condition = e + " <= " + p.string("end_date");
    }
    return "CASE WHEN " + condition + " THEN " + e + " ELSE NULL END";
  }

  private static String phone(String e, TransformationParams p) {
    String digits = "REGEXP_REPLACE(" + e + ", '[^0-9+]', '', 'g')";
    if (!p.has("country_code")) {
      return digits;
    }
    String code = p.text("country_code").trim();
    if (!code.matches("\\+?[0-9]{1,4}")) {
      throw p.invalid("Parameter 'country_code' must be 1 to 4 digits: " + code, null);
    }
    return "(" + SqlLiterals.string(code.startsWith("+") ? code : "+" + code) + " || " + digits + ")";
  }
}
