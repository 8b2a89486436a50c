package se.alipsa.semlayer.model;

import java.util.Objects;
import se.alipsa.semlayer.InvalidSchemaException;
import se.alipsa.semlayer.UnsupportedSourceFormatException;

/**
 * A table of a remote relational database.
 *
 * @param type
 *          the database engine
 * @param connection
 *          connection details, {@code null} when the connection is supplied
 *          by the caller (table only sources)
 * @param table
 *          the table name at the remote engine, optionally schema qualified
 */
public record RelationalSource(SourceType type, ConnectionConfig connection, String table) implements TableSource {

  /**
   * Validates the engine and table.
   */
  public RelationalSource {
    Objects.requireNonNull(type, "type");
    if (!type.isRelational()) {
      throw new UnsupportedSourceFormatException(type.typeName());
    }
    if (table == null || table.isBlank()) {
      throw new InvalidSchemaException(null, "A " + type.typeName() + " source requires a table");
    }
    table = table.trim();
  }
}
