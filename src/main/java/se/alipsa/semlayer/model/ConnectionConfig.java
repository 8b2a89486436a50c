package se.alipsa.semlayer.model;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Connection details for a relational source.
 *
 * @param host
 *          the database host
 * @param port
 *          the port, or {@code null} to use the engine default
 * @param user
 *          the user name
 * @param password
 *          the password
 * @param database
 *          the database (or Oracle service) name
 * @param schema
 *          the schema to search, or {@code null} for the engine default
 */
public record ConnectionConfig(String host, Integer port, String user, String password, String database,
    String schema) {

  /**
   * Build the JDBC URL for the given engine.
   *
   * @param engine
   *          the relational engine
   * @return the JDBC URL
   * @throws IllegalArgumentException
   *           if {@code engine} is a file format
   */
  public String jdbcUrl(SourceType engine) {
    String h = host == null ? "localhost" : host;
    return switch (engine) {
      case POSTGRES -> "jdbc:postgresql://" + h + ":" + portOr(5432) + "/" + database + "?currentSchema="
          + URLEncoder.encode(schema == null ? "public" : schema, StandardCharsets.UTF_8);
      case MYSQL -> "jdbc:mysql://" + h + ":" + portOr(3306) + "/" + database;
      case SQLSERVER -> "jdbc:sqlserver://" + h + ":" + portOr(1433) + ";databaseName=" + database;
      case ORACLE -> "jdbc:oracle:thin:@//" + h + ":" + portOr(1521) + "/" + database;
      case CSV, PARQUET, XLSX, XLS -> throw new IllegalArgumentException(
          "No JDBC URL for file source " + engine.typeName());
    };
  }

  private int portOr(int defaultPort) {
    return port == null ? defaultPort : port;
  }

  @Override
  public String toString() {
    // password omitted
    return "ConnectionConfig[host=" + host + ", port=" + port + ", user=" + user + ", database=" + database
        + ", schema=" + schema + "]";
  }
}
