package se.alipsa.semlayer.helper;

import java.sql.Types;
import java.util.Locale;
import se.alipsa.semlayer.UnsupportedSourceFormatException;
import se.alipsa.semlayer.model.ColumnType;
import se.alipsa.semlayer.model.SourceType;

/**
 * Utility methods for mapping database catalog types to the logical
 * {@link ColumnType} of a schema column.
 */
public final class NativeTypeMapper {

  private NativeTypeMapper() {
  }

  /**
   * Map a catalog type name reported by a relational engine to a column type.
   * Length, precision and array suffixes such as {@code varchar(255)} or
   * {@code int unsigned} are ignored.
   *
   * @param engine
   *          the relational engine reporting the type
   * @param nativeType
   *          the type name as stored in the engine catalog
   * @return the matching column type; {@link ColumnType#STRING} for anything
   *         unknown
   * @throws UnsupportedSourceFormatException
   *           if {@code engine} is not a relational engine
   */
  public static ColumnType fromNativeType(SourceType engine, String nativeType) {
    if (engine == null || !engine.isRelational()) {
      throw new UnsupportedSourceFormatException(engine == null ? "null" : engine.typeName());
    }
    if (nativeType == null || nativeType.isBlank()) {
      return ColumnType.STRING;
    }
    String base = baseTypeName(nativeType);
    return switch (engine) {
      case MYSQL -> mysql(base);
      case POSTGRES -> postgres(base);
      case ORACLE -> oracle(base, nativeType);
      case SQLSERVER -> sqlServer(base);
      default -> ColumnType.STRING;
    };
  }

  /**
   * Map a {@link Types} constant to a column type.
   *
   * @param jdbcType
   *          the JDBC type constant
   * @return the matching column type
   */
  public static ColumnType fromJdbcType(int jdbcType) {
    return switch (jdbcType) {
      case Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT -> ColumnType.INTEGER;
      case Types.REAL, Types.FLOAT, Types.DOUBLE, Types.NUMERIC, Types.DECIMAL -> ColumnType.FLOAT;
      case Types.DATE, Types.TIME, Types.TIMESTAMP, Types.TIME_WITH_TIMEZONE, Types.TIMESTAMP_WITH_TIMEZONE ->
        ColumnType.DATETIME;
      case Types.BIT, Types.BOOLEAN -> ColumnType.BOOLEAN;
      default -> ColumnType.STRING;
    };
  }

  static String baseTypeName(String nativeType) {
    String lower = nativeType.trim().toLowerCase(Locale.ROOT);
    int paren = lower.indexOf('(');
    if (paren >= 0) {
      lower = lower.substring(0, paren);
    }
    if (lower.endsWith("[]")) {
      return "array";
    }
    for (String suffix : new String[]{
        " unsigned", " signed", " zerofill"
    }) {
      int idx = lower.indexOf(suffix);
      if (idx > 0) {
        lower = lower.substring(0, idx);
      }
    }
    return lower.trim();
  }

  private static ColumnType mysql(String base) {
    return switch (base) {
      case "tinyint", "smallint", "mediumint", "int", "integer", "bigint" -> ColumnType.INTEGER;
      case "float", "double", "decimal", "numeric", "real" -> ColumnType.FLOAT;
      case "date", "datetime", "timestamp", "time", "year" -> ColumnType.DATETIME;
      case "bool", "boolean", "bit" -> ColumnType.BOOLEAN;
      default -> ColumnType.STRING;
    };
  }

  private static ColumnType postgres(String base) {
    return switch (base) {
      case "smallint", "integer", "bigint", "int", "int2", "int4", "int8", "serial", "bigserial", "smallserial" ->
        ColumnType.INTEGER;
      case "real", "double precision", "numeric", "decimal", "float4", "float8", "money" -> ColumnType.FLOAT;
      case "date", "timestamp", "timestamptz", "timestamp without time zone", "timestamp with time zone", "time",
          "time without time zone", "time with time zone", "interval" ->
        ColumnType.DATETIME;
      case "boolean", "bool" -> ColumnType.BOOLEAN;
      default -> ColumnType.STRING;
    };
  }

  private static ColumnType oracle(String base, String nativeType) {
    if (base.startsWith("timestamp")) {
      return ColumnType.DATETIME;
    }
    return switch (base) {
      case "number" -> nativeType.contains(",") && !nativeType.replace(" ", "").endsWith(",0)") ? ColumnType.FLOAT
          : ColumnType.INTEGER;
      case "integer", "int", "smallint" -> ColumnType.INTEGER;
      case "float", "binary_float", "binary_double" -> ColumnType.FLOAT;
      case "date" -> ColumnType.DATETIME;
      default -> ColumnType.STRING;
    };
  }

  private static ColumnType sqlServer(String base) {
    return switch (base) {
      case "tinyint", "smallint", "int", "bigint" -> ColumnType.INTEGER;
      case "float", "real", "decimal", "numeric", "money", "smallmoney" -> ColumnType.FLOAT;
      case "date", "datetime", "datetime2", "smalldatetime", "datetimeoffset", "time" -> ColumnType.DATETIME;
      case "bit" -> ColumnType.BOOLEAN;
      default -> ColumnType.STRING;
    };
  }
}
