package se.alipsa.semlayer.helper;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/** Utility methods. */
public final class SemLayerUtil {

  private SemLayerUtil() {
  }

  /**
   * Parses a URL query string into a Properties object.
   *
   * @param qs
   *          the query string
   * @return a Properties object containing the key-value pairs
   */
  public static Properties parseUrlQuery(String qs) {
    Properties p = new Properties();
    if (qs == null || qs.isEmpty()) {
      return p;
    }
    String s = qs.charAt(0) == '?' ? qs.substring(1) : qs;
    for (String kv : s.split("&")) {
      if (kv.isEmpty()) {
        continue;
      }
      String[] arr = kv.split("=", 2);
      String k = URLDecoder.decode(arr[0], StandardCharsets.UTF_8);
      String v = arr.length == 2 ? URLDecoder.decode(arr[1], StandardCharsets.UTF_8) : "";
      if (!k.isEmpty()) {
        p.setProperty(k, v);
      }
    }
    return p;
  }

  /**
   * Split a {@code key=value} argument at the first equals sign.
   *
   * @param argument
   *          the argument text
   * @return a two element array of trimmed key and value, or {@code null} when
   *         there is no equals sign or the key is blank
   */
  public static String[] splitAssignment(String argument) {
    if (argument == null) {
      return null;
    }
    int eq = argument.indexOf('=');
    if (eq <= 0) {
      return null;
    }
    String key = argument.substring(0, eq).trim();
    if (key.isEmpty()) {
      return null;
    }
    return new String[]{
        key, argument.substring(eq + 1).trim()
    };
  }
}
