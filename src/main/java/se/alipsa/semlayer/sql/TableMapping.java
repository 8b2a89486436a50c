package se.alipsa.semlayer.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.TableFunction;
import se.alipsa.semlayer.InvalidTableMappingException;
import se.alipsa.semlayer.SqlParseException;
import se.alipsa.semlayer.engine.Identifier;

/**
 * An immutable mapping from logical table names to the physical table
 * expressions that replace them: a table name, a table function call such as a
 * file scan, or a query.
 *
 * <p>
 * Every value is parsed when the mapping is created; a value that is not a
 * usable table expression is rejected with an
 * {@link InvalidTableMappingException}. Substitution is a single pass, so a
 * query value may not reference another key of the same mapping.
 * </p>
 */
public final class TableMapping {

  private static final Pattern QUERY_START = Pattern.compile("^(?is)(select|with)\\b.*");

  /** The shape of a physical table expression. */
  public enum Kind {
    TABLE, FUNCTION, SUBQUERY
  }

  private record Target(String rawKey, Identifier key, String value, String fromItemText, Kind kind) {
  }

  private static final TableMapping EMPTY = new TableMapping(new LinkedHashMap<>());

  private final Map<String, Target> targets;

  private TableMapping(Map<String, Target> targets) {
    this.targets = targets;
  }

  /**
   * The mapping without entries.
   *
   * @return an empty mapping
   */
  public static TableMapping empty() {
    return EMPTY;
  }

  /**
   * Create a mapping.
   *
   * @param entries
   *          logical table name to physical table expression, in the order
   *          they should be reported
   * @return the mapping
   * @throws InvalidTableMappingException
   *           if a key is blank or a value is not a table expression
   */
  public static TableMapping of(Map<String, String> entries) {
    Map<String, Target> targets = new LinkedHashMap<>();
    entries.forEach((key, value) -> {
      Target target = parse(key, value);
      targets.put(target.key().normalized(), target);
    });
    targets.values().forEach(t -> checkReferences(t, targets));
    return new TableMapping(targets);
  }

  /**
   * Copy this mapping with one entry added or replaced.
   *
   * @param key
   *          the logical table name
   * @param value
   *          the physical table expression
   * @return the new mapping
   */
  public TableMapping with(String key, String value) {
    Target target = parse(key, value);
    Map<String, String> copy = new LinkedHashMap<>(asMap());
    copy.keySet().removeIf(k -> target.key().matches(Identifier.of(k)));
    copy.put(key, value);
    return of(copy);
  }

  /**
   * Copy this mapping without the entry for {@code key}.
   *
   * @param key
   *          the logical table name
   * @return the new mapping
   */
  public TableMapping without(String key) {
    Identifier identifier = Identifier.of(key);
    Map<String, Target> copy = new LinkedHashMap<>(targets);
    if (identifier != null) {
      copy.remove(identifier.normalized());
    }
    return new TableMapping(copy);
  }

  /**
   * The entries as written.
   *
   * @return logical table name to physical table expression
   */
  public Map<String, String> asMap() {
    Map<String, String> map = new LinkedHashMap<>();
    targets.values().forEach(t -> map.put(t.rawKey(), t.value()));
    return Collections.unmodifiableMap(map);
  }

  public boolean isEmpty() {
    return targets.isEmpty();
  }

  public int size() {
    return targets.size();
  }

  /**
   * The kind of physical expression a key maps to.
   *
   * @param key
   *          the logical table name
   * @return the kind, if the key is mapped
   */
  public Optional<Kind> kindOf(String key) {
    Identifier identifier = Identifier.of(key);
    return identifier == null ? Optional.empty()
        : Optional.ofNullable(targets.get(identifier.normalized())).map(Target::kind);
  }

  /**
   * Find the key a table reference is mapped by. The unqualified table name
   * is compared using SQL identifier rules.
   *
   * @param table
   *          the table reference
   * @return the normalized key, if the table is mapped
   */
  Optional<String> keyFor(Table table) {
    Identifier name = Identifier.of(table.getName());
    if (name == null) {
      return Optional.empty();
    }
    return targets.values().stream().filter(t -> t.key().matches(name)).map(t -> t.key().normalized())
        .findFirst();
  }

  /**
   * Create a new, unaliased FROM item for a key. Each call returns a fresh
   * node.
   *
   * @param key
   *          the normalized key as returned by {@link #keyFor(Table)}
   * @return the FROM item
   */
  FromItem createFromItem(String key) {
    Target target = Objects.requireNonNull(targets.get(key), key);
    return parseFromItem(target.key().text(), target.value(), target.fromItemText());
  }

  /**
   * Create a new, unaliased table for a key whose reference is written to by
   * an INSERT, UPDATE, DELETE or MERGE.
   *
   * @param key
   *          the normalized key as returned by {@link #keyFor(Table)}
   * @return the table
   * @throws InvalidTableMappingException
   *           if the key maps to a table function or a query
   */
  Table createTable(String key) {
    Target target = Objects.requireNonNull(targets.get(key), key);
    if (target.kind() != Kind.TABLE) {
      throw new InvalidTableMappingException(target.key().text(), target.value(), "Mapping for '"
          + target.key().text() + "' is not a table and cannot be the target of a modification: " + target.value(),
          null);
    }
    return (Table) parseFromItem(target.key().text(), target.value(), target.fromItemText());
  }

  private static Target parse(String key, String value) {
    Identifier identifier = Identifier.of(key);
    if (identifier == null) {
      throw new InvalidTableMappingException(key, value, "Mapping key must not be blank", null);
    }
    if (value == null || value.isBlank()) {
      throw new InvalidTableMappingException(key, value, "Mapping for '" + key + "' has no table expression", null);
    }
    String trimmed = value.trim();
    while (trimmed.endsWith(";")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
    }
    String fromItemText = QUERY_START.matcher(trimmed).matches() ? "(" + trimmed + ")" : trimmed;
    FromItem fromItem = parseFromItem(key, value, fromItemText);
    Kind kind;
    if (fromItem instanceof Table) {
      kind = Kind.TABLE;
    } else if (fromItem instanceof TableFunction) {
      kind = Kind.FUNCTION;
    } else if (fromItem instanceof ParenthesedSelect) {
      kind = Kind.SUBQUERY;
    } else {
      throw new InvalidTableMappingException(key, value,
          "Mapping for '" + key + "' is not a table, table function or query: " + value, null);
    }
    return new Target(key.trim(), identifier, value, fromItemText, kind);
  }

  private static FromItem parseFromItem(String key, String value, String fromItemText) {
    Statement statement;
    try {
      statement = SqlStatements.parse("SELECT * FROM " + fromItemText, null);
    } catch (SqlParseException e) {
      throw new InvalidTableMappingException(key, value,
          "Mapping for '" + key + "' is not a valid table expression: " + value, e.getCause());
    }
    if (!(statement instanceof PlainSelect select) || select.getFromItem() == null
        || (select.getJoins() != null && !select.getJoins().isEmpty()) || select.getWhere() != null
        || select.getFromItem().getAlias() != null) {
      throw new InvalidTableMappingException(key, value,
          "Mapping for '" + key + "' must be a single unaliased table expression: " + value, null);
    }
    return select.getFromItem();
  }

  private static void checkReferences(Target target, Map<String, Target> targets) {
    if (target.kind() != Kind.SUBQUERY) {
      return;
    }
    FromItem fromItem = parseFromItem(target.key().text(), target.value(), target.fromItemText());
    SqlTreeWalker.walk((ParenthesedSelect) fromItem, new SqlTreeWalker.Listener() {
      @Override
      public void table(Table table) {
        Identifier name = Identifier.of(table.getName());
        if (name == null || name.matches(target.key())) {
          return;
        }
        Target other = targets.get(name.normalized());
        if (other != null) {
          throw new InvalidTableMappingException(target.key().text(), target.value(),
              "Mapping for '" + target.key().text() + "' references the mapped table '" + other.key().text()
                  + "'; nested substitution is not supported",
              null);
        }
      }
    });
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TableMapping other && asMap().equals(other.asMap());
  }

  @Override
  public int hashCode() {
    return asMap().hashCode();
  }

  @Override
  public String toString() {
    return asMap().toString();
  }
}
