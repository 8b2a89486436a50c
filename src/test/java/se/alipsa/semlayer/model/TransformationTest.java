package se.alipsa.semlayer.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.alipsa.semlayer.InvalidSchemaException;
import se.alipsa.semlayer.UnsupportedTransformationException;

class TransformationTest {

  @Test
  void resolvesTypeByName() {
    Transformation t = Transformation.of("Fill_NA", Map.of("column", "amount", "value", 0));
    assertEquals(TransformationType.FILL_NA, t.type());
    assertEquals("amount", t.column());
    assertTrue(t.targets("amount"));
    assertFalse(t.targets("Amount"));
  }

  @Test
  void unknownTypeIsRejected() {
    UnsupportedTransformationException e = assertThrows(UnsupportedTransformationException.class,
        () -> Transformation.of("explode", Map.of("column", "a")));
    assertEquals("explode", e.getTransformationType());
  }

  @Test
  void requiredParametersAreChecked() {
    assertThrows(InvalidSchemaException.class, () -> Transformation.of("scale", Map.of("column", "amount")));
    Map<String, Object> nullValue = new HashMap<>();
    nullValue.put("column", "amount");
    nullValue.put("value", null);
    assertThrows(InvalidSchemaException.class, () -> Transformation.of("fill_na", nullValue));
  }

  @Test
  void clipNeedsAtLeastOneBound() {
    assertThrows(InvalidSchemaException.class, () -> Transformation.of("clip", Map.of("column", "amount")));
    assertEquals(TransformationType.CLIP, Transformation.of("clip", Map.of("column", "amount", "upper", 10)).type());
  }

  @Test
  void paramsAreImmutable() {
    Map<String, Object> params = new HashMap<>(Map.of("column", "name"));
    Transformation t = Transformation.of("strip", params);
    params.put("column", "other");
    assertEquals("name", t.column());
    assertThrows(UnsupportedOperationException.class, () -> t.params().put("x", 1));
  }
}
