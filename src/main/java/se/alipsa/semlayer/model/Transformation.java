package se.alipsa.semlayer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import se.alipsa.semlayer.InvalidSchemaException;

/**
 * A parameterized rewrite applied to one column. The target column is the
 * {@code column} parameter; {@code remove_duplicates} has no target and
 * applies to the whole dataset.
 *
 * @param type
 *          the transformation kind
 * @param params
 *          kind specific parameters, insertion ordered
 */
public record Transformation(TransformationType type, Map<String, Object> params) {

  /**
   * Validates that every parameter the kind needs is present.
   */
  public Transformation {
    Objects.requireNonNull(type, "type");
    Map<String, Object> copy = new LinkedHashMap<>();
    if (params != null) {
      copy.putAll(params);
    }
    for (String required : type.requiredParams()) {
      if (copy.get(required) == null) {
        throw new InvalidSchemaException(null,
            "Transformation " + type.typeName() + " requires parameter '" + required + "'");
      }
    }
    if (!type.anyOfParams().isEmpty() && type.anyOfParams().stream().allMatch(p -> copy.get(p) == null)) {
      throw new InvalidSchemaException(null,
          "Transformation " + type.typeName() + " requires at least one of " + type.anyOfParams());
    }
    params = Collections.unmodifiableMap(copy);
  }

  /**
   * Create a transformation from its document representation.
   *
   * @param type
   *          the transformation name, e.g. {@code fill_na}
   * @param params
   *          the parameters
   * @return a new transformation
   * @throws se.alipsa.semlayer.UnsupportedTransformationException
   *           if {@code type} is not part of the catalog
   */
  public static Transformation of(String type, Map<String, Object> params) {
    return new Transformation(TransformationType.fromName(type), params);
  }

  /**
   * The column this transformation targets.
   *
   * @return the column name, or {@code null} for dataset level transformations
   */
  public String column() {
    Object column = params.get("column");
    return column == null ? null : column.toString();
  }

  /**
   * Whether this transformation applies to the given column.
   *
   * @param columnName
   *          the logical column name
   * @return {@code true} if the target column equals {@code columnName}
   */
  public boolean targets(String columnName) {
    return columnName != null && columnName.equals(column());
  }
}
