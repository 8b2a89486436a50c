package se.alipsa.semlayer.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PlaceholderProtectorTest {

  @Test
  void protectsOnlyPlaceholdersOutsideQuotes() {
    String protectedSql = PlaceholderProtector.protect("SELECT * FROM t WHERE a = %s AND b LIKE '%s%' AND \"%s\" = %s");
    assertEquals("SELECT * FROM t WHERE a = ___PLACEHOLDER___ AND b LIKE '%s%' AND \"%s\" = ___PLACEHOLDER___",
        protectedSql);
    assertTrue(PlaceholderProtector.isProtected(protectedSql));
  }

  @Test
  void handlesEscapedQuotes() {
    assertEquals("SELECT 'it''s %s' , ___PLACEHOLDER___",
        PlaceholderProtector.protect("SELECT 'it''s %s' , %s"));
  }

  @Test
  void restoresTargetMarker() {
    String protectedSql = PlaceholderProtector.protect("VALUES (%s, %s)");
    assertEquals("VALUES (?, ?)", PlaceholderProtector.restore(protectedSql, Dialect.Placeholder.QMARK));
    assertEquals("VALUES (%s, %s)", PlaceholderProtector.restore(protectedSql, Dialect.Placeholder.PYFORMAT));
    assertFalse(PlaceholderProtector.isProtected("VALUES (?)"));
  }

  @Test
  void restoresOnlyTokensOutsideQuotes() {
    assertEquals("SELECT '___PLACEHOLDER___', \"___PLACEHOLDER___\", ?", PlaceholderProtector
        .restore("SELECT '___PLACEHOLDER___', \"___PLACEHOLDER___\", ___PLACEHOLDER___", Dialect.Placeholder.QMARK));
    assertEquals("SELECT 'it''s ___PLACEHOLDER___' WHERE a = %s",
        PlaceholderProtector.restore("SELECT 'it''s ___PLACEHOLDER___' WHERE a = ___PLACEHOLDER___",
            Dialect.Placeholder.PYFORMAT));
  }
}
