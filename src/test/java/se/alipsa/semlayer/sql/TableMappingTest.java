package se.alipsa.semlayer.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import se.alipsa.semlayer.InvalidTableMappingException;

class TableMappingTest {

  @Test
  void classifiesTargets() {
    TableMapping mapping = TableMapping.empty().with("orders", "sales.orders").with("items", "read_csv('i.csv')")
        .with("customers", "SELECT * FROM crm.customers;");
    assertEquals(3, mapping.size());
    assertEquals(Optional.of(TableMapping.Kind.TABLE), mapping.kindOf("orders"));
    assertEquals(Optional.of(TableMapping.Kind.FUNCTION), mapping.kindOf("ITEMS"));
    assertEquals(Optional.of(TableMapping.Kind.SUBQUERY), mapping.kindOf("customers"));
    assertTrue(mapping.kindOf("other").isEmpty());
  }

  @Test
  void isImmutable() {
    TableMapping first = TableMapping.empty().with("orders", "a");
    TableMapping second = first.with("ORDERS", "b");
    assertEquals(Map.of("orders", "a"), first.asMap());
    assertEquals(Map.of("ORDERS", "b"), second.asMap());
    assertEquals(0, second.without("orders").size());
    assertEquals(1, second.size());
    assertTrue(TableMapping.empty().isEmpty());
    assertThrows(UnsupportedOperationException.class, () -> first.asMap().put("x", "y"));
  }

  @Test
  void keepsQuotedKeys() {
    TableMapping mapping = TableMapping.of(Map.of("\"Orders\"", "sales.orders"));
    assertEquals(List.of("\"Orders\""), List.copyOf(mapping.asMap().keySet()));
    assertTrue(mapping.kindOf("orders").isEmpty());
    assertTrue(mapping.kindOf("\"Orders\"").isPresent());
  }

  @Test
  void equalityFollowsEntries() {
    assertEquals(TableMapping.of(Map.of("a", "t")), TableMapping.empty().with("a", "t"));
    assertNotEquals(TableMapping.of(Map.of("a", "t")), TableMapping.of(Map.of("a", "u")));
  }

  @Test
  void rejectsUnusableValues() {
    assertThrows(InvalidTableMappingException.class, () -> TableMapping.of(Map.of("a", " ")));
    assertThrows(InvalidTableMappingException.class, () -> TableMapping.of(Map.of(" ", "t")));
    assertThrows(InvalidTableMappingException.class, () -> TableMapping.of(Map.of("a", "t AS x")));
    assertThrows(InvalidTableMappingException.class, () -> TableMapping.of(Map.of("a", "t JOIN u ON t.id = u.id")));
    assertThrows(InvalidTableMappingException.class, () -> TableMapping.of(Map.of("a", "t WHERE 1 = 1")));
    InvalidTableMappingException e = assertThrows(InvalidTableMappingException.class,
        () -> TableMapping.of(Map.of("a", "(((")));
    assertEquals("a", e.getKey());
    assertEquals("(((", e.getValue());
  }

  @Test
  void rejectsQueriesReferencingOtherMappedTables() {
    TableMapping base = TableMapping.empty().with("customers", "crm.customers");
    assertThrows(InvalidTableMappingException.class,
        () -> base.with("orders", "SELECT * FROM orders JOIN customers ON orders.cid = customers.id"));
  }
}
