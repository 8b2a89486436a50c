package se.alipsa.semlayer.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.semlayer.sql.Dialect;

class IdentifierTest {

  @Test
  void parsesQuotedAndUnquotedText() {
    Identifier quoted = Identifier.of(" \"Order \"\"Id\"\"\" ");
    assertTrue(quoted.quoted());
    assertEquals("Order \"Id\"", quoted.text());
    assertFalse(Identifier.of("orders").quoted());
    assertNull(Identifier.of("   "));
    assertNull(Identifier.of(null));
  }

  @Test
  void comparesUnquotedCaseInsensitively() {
    assertEquals(Identifier.of("Orders"), Identifier.of("ORDERS"));
    assertEquals(Identifier.of("orders"), Identifier.of("[orders]"));
    assertFalse(Identifier.of("Orders").matches(Identifier.of("\"Orders\"")));
  }

  @Test
  void rendersPerDialect() {
    Identifier name = Identifier.of("Total");
    assertEquals("\"total\"", name.render(Dialect.DUCKDB));
    assertEquals("\"TOTAL\"", name.render(Dialect.ORACLE));
    assertEquals("[Total]", name.render(Dialect.SQLSERVER));
    assertEquals("`Total`", name.render(Dialect.MYSQL));
    assertEquals("Total", name.requote(Dialect.MYSQL));
    assertEquals("`a``b`", Identifier.of("\"a`b\"").requote(Dialect.MYSQL));
  }

  @Test
  void splitsQualifiedNames() {
    List<Identifier> parts = IdentifierUtil.parts("crm.\"Sales.Data\".[orders]");
    assertEquals(3, parts.size());
    assertEquals("Sales.Data", parts.get(1).text());
    assertEquals("\"crm\".\"Sales.Data\".\"orders\"", IdentifierUtil.render("crm.\"Sales.Data\".[orders]",
        Dialect.POSTGRES));
    assertThrows(IllegalArgumentException.class, () -> IdentifierUtil.parts("crm..orders"));
  }

  @Test
  void buildsColumnAliases() {
    assertEquals("orders_id", IdentifierUtil.columnAlias("orders.id"));
    assertEquals("Orders_id", IdentifierUtil.columnAlias("\"Orders\".ID"));
    assertEquals("amount", IdentifierUtil.columnAlias("Amount"));
  }

  @Test
  void unquotesAllQuoteStyles() {
    assertEquals("a", IdentifierUtil.unquote("`a`"));
    assertEquals("a]b", IdentifierUtil.unquote("[a]]b]"));
    assertEquals("plain", IdentifierUtil.unquote(" plain "));
    assertFalse(IdentifierUtil.isQuoted("\"a"));
  }
}
