package se.alipsa.semlayer.model;

import java.util.List;
import java.util.Locale;
import se.alipsa.semlayer.UnsupportedTransformationException;

/**
 * The closed catalog of column transformations. Each kind lists the
 * parameters that must be present ({@link #requiredParams()}) and, for kinds
 * with alternative bounds, a group of which at least one must be present
 * ({@link #anyOfParams()}).
 */
public enum TransformationType {
  ANONYMIZE(List.of("column")),
  CONVERT_TIMEZONE(List.of("column", "to")),
  TO_LOWERCASE(List.of("column")),
  TO_UPPERCASE(List.of("column")),
  STRIP(List.of("column")),
  ROUND_NUMBERS(List.of("column")),
  SCALE(List.of("column", "factor")),
  FORMAT_DATE(List.of("column", "format")),
  TO_NUMERIC(List.of("column")),
  TO_DATETIME(List.of("column")),
  FILL_NA(List.of("column", "value")),
  REPLACE(List.of("column", "old_value", "new_value")),
  EXTRACT(List.of("column", "pattern")),
  TRUNCATE(List.of("column", "length")),
  PAD(List.of("column", "width")),
  CLIP(List.of("column"), List.of("lower", "upper")),
  BIN(List.of("column", "bins")),
  NORMALIZE(List.of("column")),
  STANDARDIZE(List.of("column")),
  MAP_VALUES(List.of("column", "mapping")),
  RENAME(List.of("column", "new_name")),
  ENCODE_CATEGORICAL(List.of("column")),
  VALIDATE_EMAIL(List.of("column")),
  VALIDATE_DATE_RANGE(List.of("column"), List.of("start_date", "end_date")),
  NORMALIZE_PHONE(List.of("column")),
  REMOVE_DUPLICATES(List.of()),
  VALIDATE_FOREIGN_KEY(List.of("column", "ref_values")),
  ENSURE_POSITIVE(List.of("column")),
  STANDARDIZE_CATEGORIES(List.of("column", "mapping"));

  private final List<String> requiredParams;
  private final List<String> anyOfParams;

  TransformationType(List<String> requiredParams) {
    this(requiredParams, List.of());
  }

  TransformationType(List<String> requiredParams, List<String> anyOfParams) {
    this.requiredParams = requiredParams;
    this.anyOfParams = anyOfParams;
  }

  public List<String> requiredParams() {
    return requiredParams;
  }

  public List<String> anyOfParams() {
    return anyOfParams;
  }

  /**
   * The name used in schema documents.
   *
   * @return the snake case name, e.g. {@code fill_na}
   */
  public String typeName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolve a transformation kind from its document name.
   *
   * @param name
   *          the snake case name, case insensitive
   * @return the matching kind
   * @throws UnsupportedTransformationException
   *           if the name is not part of the catalog
   */
  public static TransformationType fromName(String name) {
    if (name != null) {
      String key = name.trim().toLowerCase(Locale.ROOT);
      for (TransformationType type : values()) {
        if (type.typeName().equals(key)) {
          return type;
        }
      }
    }
    throw new UnsupportedTransformationException(name);
  }
}
