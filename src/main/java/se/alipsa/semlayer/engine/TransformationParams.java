package se.alipsa.semlayer.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import se.alipsa.semlayer.InvalidSchemaException;
import se.alipsa.semlayer.helper.SqlLiterals;
import se.alipsa.semlayer.model.Transformation;

/**
 * Typed access to the parameters of a {@link Transformation}. Every accessor
 * that renders SQL returns literal text that is safe to splice into an
 * expression.
 */
public final class TransformationParams {

  private final Transformation transformation;

  TransformationParams(Transformation transformation) {
    this.transformation = transformation;
  }

  public boolean has(String name) {
    return transformation.params().get(name) != null;
  }

  /**
   * The raw value of a parameter as text.
   *
   * @param name
   *          the parameter name
   * @return the text, or {@code null} when the parameter is absent
   */
  public String text(String name) {
    Object value = transformation.params().get(name);
    return value == null ? null : value.toString();
  }

  /**
   * A parameter rendered as a string literal.
   *
   * @param name
   *          the parameter name
   * @return the quoted literal
   */
  public String string(String name) {
    return SqlLiterals.string(require(name).toString());
  }

  /**
   * A parameter rendered as a literal of its own type.
   *
   * @param name
   *          the parameter name
   * @return the literal
   */
  public String literal(String name) {
    return SqlLiterals.literal(require(name));
  }

  /**
   * A numeric parameter.
   *
   * @param name
   *          the parameter name
   * @return the numeric literal
   */
  public String number(String name) {
    Object value = require(name);
    try {
      return SqlLiterals.number(value, name);
    } catch (IllegalArgumentException e) {
      throw invalid(e.getMessage(), e);
    }
  }

  /**
   * An integer parameter.
   *
   * @param name
   *          the parameter name
   * @param defaultValue
   *          the value used when the parameter is absent
   * @return the value
   */
  public int integer(String name, int defaultValue) {
    Object value = transformation.params().get(name);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number n) {
      if (n.doubleValue() != Math.rint(n.doubleValue())) {
        throw invalid("Parameter '" + name + "' must be an integer: " + value, null);
      }
      return n.intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw invalid("Parameter '" + name + "' must be an integer: " + value, e);
    }
  }

  /**
   * A list parameter; a single value is treated as a one element list.
   *
   * @param name
   *          the parameter name
   * @return the values
   */
  public List<Object> list(String name) {
    Object value = require(name);
    List<Object> values = new ArrayList<>();
    if (value instanceof Collection<?> c) {
      values.addAll(c);
    } else if (value instanceof Object[] arr) {
      values.addAll(List.of(arr));
    } else {
      values.add(value);
    }
    if (values.isEmpty()) {
      throw invalid("Parameter '" + name + "' must not be empty", null);
    }
    return values;
  }

  /**
   * A mapping parameter with insertion order preserved.
   *
   * @param name
   *          the parameter name
   * @return the entries
   */
  public Map<String, Object> mapping(String name) {
    Object value = require(name);
    if (!(value instanceof Map<?, ?> m) || m.isEmpty()) {
      throw invalid("Parameter '" + name + "' must be a non empty mapping", null);
    }
    Map<String, Object> entries = new LinkedHashMap<>();
    m.forEach((k, v) -> entries.put(String.valueOf(k), v));
    return entries;
  }

  private Object require(String name) {
    Object value = transformation.params().get(name);
    if (value == null) {
      throw invalid("Missing parameter '" + name + "'", null);
    }
    return value;
  }

  InvalidSchemaException invalid(String message, Throwable cause) {
    String msg = "Transformation " + transformation.type().typeName() + ": " + message;
    return cause == null ? new InvalidSchemaException(null, msg) : new InvalidSchemaException(null, msg, cause);
  }
}
