package se.alipsa.semlayer;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;
import se.alipsa.semlayer.engine.QueryCompiler;
import se.alipsa.semlayer.helper.SemLayerUtil;
import se.alipsa.semlayer.sql.Dialect;

/**
 * Settings of a {@link SemLayer}.
 *
 * <ul>
 * <li>{@code datasetPath}: directory relative file sources are resolved
 * against (default: the working directory)</li>
 * <li>{@code headRows}: rows of a preview query (default
 * {@value QueryCompiler#DEFAULT_HEAD_ROWS})</li>
 * <li>{@code dialect}: dialect statements are written in when a caller does
 * not name one (default {@code postgres})</li>
 * </ul>
 *
 * @param datasetPath
 *          the dataset base directory
 * @param headRows
 *          the number of preview rows
 * @param dialect
 *          the default statement dialect
 */
public record SemLayerConfig(Path datasetPath, int headRows, Dialect dialect) {

  /** Prefix of system properties read by {@link #fromSystemProperties()}. */
  public static final String SYSTEM_PREFIX = "semlayer.";

  public static final String DATASET_PATH = "datasetPath";
  public static final String HEAD_ROWS = "headRows";
  public static final String DIALECT = "dialect";

  /**
   * Validates the settings.
   */
  public SemLayerConfig {
    datasetPath = Objects.requireNonNull(datasetPath, DATASET_PATH).toAbsolutePath().normalize();
    Objects.requireNonNull(dialect, DIALECT);
    if (headRows <= 0) {
      throw new IllegalArgumentException(HEAD_ROWS + " must be positive: " + headRows);
    }
  }

  /**
   * The default settings.
   *
   * @return settings with every default applied
   */
  public static SemLayerConfig defaults() {
    return fromProperties(new Properties());
  }

  /**
   * Read settings from properties; absent keys get their default.
   *
   * @param props
   *          the properties
   * @return the settings
   * @throws IllegalArgumentException
   *           if a value is invalid
   */
  public static SemLayerConfig fromProperties(Properties props) {
    String path = props.getProperty(DATASET_PATH);
    String rows = props.getProperty(HEAD_ROWS);
    String dialect = props.getProperty(DIALECT);
    int headRows;
    try {
      headRows = rows == null || rows.isBlank() ? QueryCompiler.DEFAULT_HEAD_ROWS : Integer.parseInt(rows.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(HEAD_ROWS + " must be an integer: " + rows, e);
    }
    return new SemLayerConfig(path == null || path.isBlank() ? Path.of("") : Path.of(path.trim()), headRows,
        dialect == null || dialect.isBlank() ? Dialect.POSTGRES : Dialect.fromName(dialect));
  }

  /**
   * Read settings from a URL style query string such as
   * {@code datasetPath=/data&headRows=10&dialect=duckdb}.
   *
   * @param query
   *          the query string, optionally starting with {@code ?}
   * @return the settings
   */
  public static SemLayerConfig fromQueryString(String query) {
    return fromProperties(SemLayerUtil.parseUrlQuery(query));
  }

  /**
   * Read settings from system properties prefixed with
   * {@value #SYSTEM_PREFIX}, e.g. {@code -Dsemlayer.headRows=10}.
   *
   * @return the settings
   */
  public static SemLayerConfig fromSystemProperties() {
    Properties props = new Properties();
    for (String key : new String[]{
        DATASET_PATH, HEAD_ROWS, DIALECT
    }) {
      String value = System.getProperty(SYSTEM_PREFIX + key);
      if (value != null) {
        props.setProperty(key, value);
      }
    }
    return fromProperties(props);
  }

  public SemLayerConfig withDatasetPath(Path path) {
    return new SemLayerConfig(path, headRows, dialect);
  }

  public SemLayerConfig withHeadRows(int rows) {
    return new SemLayerConfig(datasetPath, rows, dialect);
  }

  public SemLayerConfig withDialect(Dialect newDialect) {
    return new SemLayerConfig(datasetPath, headRows, newDialect);
  }
}
