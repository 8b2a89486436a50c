package se.alipsa.semlayer.model;

import java.util.Locale;
import se.alipsa.semlayer.InvalidSchemaException;

/** The logical type of a dataset column. */
public enum ColumnType {
  STRING, INTEGER, FLOAT, DATETIME, BOOLEAN;

  /**
   * The name used in schema documents.
   *
   * @return the lower case type name
   */
  public String typeName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolve a type from its document name.
   *
   * @param name
   *          the type name, case insensitive
   * @return the matching type, or {@code null} when {@code name} is
   *         {@code null} or blank
   * @throws InvalidSchemaException
   *           if the name is not a known column type
   */
  public static ColumnType fromName(String name) {
    if (name == null || name.isBlank()) {
      return null;
    }
    String key = name.trim().toLowerCase(Locale.ROOT);
    for (ColumnType type : values()) {
      if (type.typeName().equals(key)) {
        return type;
      }
    }
    throw new InvalidSchemaException(null, "Invalid column type: " + name);
  }
}
