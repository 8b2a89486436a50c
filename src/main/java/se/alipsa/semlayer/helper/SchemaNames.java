package se.alipsa.semlayer.helper;

import java.util.Locale;
import java.util.regex.Pattern;

/** Rules for logical dataset (table) names. */
public final class SchemaNames {

  private static final Pattern TABLE_NAME = Pattern.compile("[a-z_][a-z0-9_]*");
  private static final int MAX_LENGTH = 64;

  private SchemaNames() {
  }

  /**
   * Check that a name is usable as an unquoted SQL identifier once lower cased.
   *
   * @param name
   *          the logical table name
   * @return {@code true} if the name is valid
   */
  public static boolean isValidTableName(String name) {
    return name != null && name.length() <= MAX_LENGTH
        && TABLE_NAME.matcher(name.toLowerCase(Locale.ROOT)).matches();
  }

  /**
   * Turn arbitrary text into a valid table name: lower case, characters outside
   * {@code [a-z0-9_]} replaced by underscores, a leading digit prefixed with an
   * underscore, truncated to 64 characters.
   *
   * @param name
   *          the text to sanitize
   * @return a valid table name
   * @throws IllegalArgumentException
   *           if {@code name} is {@code null} or blank
   */
  public static String sanitize(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Table name must not be blank");
    }
    String lower = name.trim().toLowerCase(Locale.ROOT);
    StringBuilder sb = new StringBuilder(lower.length());
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean valid = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
      sb.append(valid ? c : '_');
    }
    if (Character.isDigit(sb.charAt(0))) {
      sb.insert(0, '_');
    }
    return sb.length() > MAX_LENGTH ? sb.substring(0, MAX_LENGTH) : sb.toString();
  }

  /**
   * Derive the table name of a dataset from its {@code organization/dataset}
   * path.
   *
   * @param datasetPath
   *          the dataset path, e.g. {@code my-org/sales-data}
   * @return the table name, e.g. {@code sales_data}
   */
  public static String fromDatasetPath(String datasetPath) {
    if (datasetPath == null || datasetPath.isBlank()) {
      throw new IllegalArgumentException("Dataset path must not be blank");
    }
    String trimmed = datasetPath.trim().replace('\\', '/');
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    int slash = trimmed.lastIndexOf('/');
    return sanitize(slash >= 0 ? trimmed.substring(slash + 1) : trimmed);
  }
}
