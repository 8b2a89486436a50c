package se.alipsa.semlayer.model;

import java.util.Objects;
import se.alipsa.semlayer.InvalidSchemaException;
import se.alipsa.semlayer.UnsupportedSourceFormatException;

/**
 * A local file read by the embedded engine.
 *
 * @param type
 *          the file format
 * @param path
 *          the file path, absolute or relative to the dataset directory
 */
public record FileSource(SourceType type, String path) implements TableSource {

  /**
   * Validates the format and path.
   */
  public FileSource {
    Objects.requireNonNull(type, "type");
    if (!type.isLocal()) {
      throw new UnsupportedSourceFormatException(type.typeName());
    }
    if (path == null || path.isBlank()) {
      throw new InvalidSchemaException(null, "A " + type.typeName() + " source requires a path");
    }
  }
}
