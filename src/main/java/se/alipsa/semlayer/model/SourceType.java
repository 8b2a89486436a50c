package se.alipsa.semlayer.model;

import java.util.Locale;
import se.alipsa.semlayer.UnsupportedSourceFormatException;
import se.alipsa.semlayer.sql.Dialect;

/**
 * The physical kinds of data a schema can be backed by: local files read by
 * the embedded engine, or tables of a remote relational database.
 */
public enum SourceType {
  CSV(true, Dialect.DUCKDB),
  PARQUET(true, Dialect.DUCKDB),
  XLSX(true, Dialect.DUCKDB),
  XLS(true, Dialect.DUCKDB),
  MYSQL(false, Dialect.MYSQL),
  POSTGRES(false, Dialect.POSTGRES),
  SQLSERVER(false, Dialect.SQLSERVER),
  ORACLE(false, Dialect.ORACLE);

  private final boolean local;
  private final Dialect dialect;

  SourceType(boolean local, Dialect dialect) {
    this.local = local;
    this.dialect = dialect;
  }

  /**
   * Whether this is a file format read from local storage.
   *
   * @return {@code true} for csv, parquet and excel files
   */
  public boolean isLocal() {
    return local;
  }

  /**
   * Whether this is a remote relational engine.
   *
   * @return {@code true} for mysql, postgres, sqlserver and oracle
   */
  public boolean isRelational() {
    return !local;
  }

  /**
   * The SQL dialect queries against this source are written in.
   *
   * @return the dialect
   */
  public Dialect dialect() {
    return dialect;
  }

  /**
   * The name used in schema documents.
   *
   * @return the lower case type name
   */
  public String typeName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolve a source type from its document name.
   *
   * @param name
   *          the type name, case insensitive
   * @return the matching source type
   * @throws UnsupportedSourceFormatException
   *           if the name is not a supported file format or engine
   */
  public static SourceType fromName(String name) {
    if (name != null) {
      String key = name.trim().toLowerCase(Locale.ROOT);
      if ("postgresql".equals(key)) {
        return POSTGRES;
      }
      for (SourceType type : values()) {
        if (type.typeName().equals(key)) {
          return type;
        }
      }
    }
    throw new UnsupportedSourceFormatException(name);
  }
}
