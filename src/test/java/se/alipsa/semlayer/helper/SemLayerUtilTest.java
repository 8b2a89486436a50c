package se.alipsa.semlayer.helper;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class SemLayerUtilTest {

  @Test
  void parsesQueryStrings() {
    Properties props = SemLayerUtil.parseUrlQuery("?datasetPath=%2Fdata%2Fsets&headRows=10&empty=&ignored");
    assertEquals("/data/sets", props.getProperty("datasetPath"));
    assertEquals("10", props.getProperty("headRows"));
    assertEquals("", props.getProperty("empty"));
    assertTrue(SemLayerUtil.parseUrlQuery(null).isEmpty());
  }

  @Test
  void splitsAssignments() {
    assertArrayEquals(new String[]{
        "orders", "SELECT * FROM t WHERE a = 1"
    }, SemLayerUtil.splitAssignment(" orders = SELECT * FROM t WHERE a = 1"));
    assertNull(SemLayerUtil.splitAssignment("orders"));
    assertNull(SemLayerUtil.splitAssignment("=t"));
    assertNull(SemLayerUtil.splitAssignment(null));
  }
}
