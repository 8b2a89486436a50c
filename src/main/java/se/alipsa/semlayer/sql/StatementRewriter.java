package se.alipsa.semlayer.sql;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import net.sf.jsqlparser.expression.Alias;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.merge.Merge;
import net.sf.jsqlparser.statement.select.Fetch;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.Offset;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.Top;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.statement.update.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.semlayer.InvalidTableMappingException;
import se.alipsa.semlayer.SqlParseException;
import se.alipsa.semlayer.engine.Identifier;

/**
 * Rewrites SQL statements written against logical table names.
 *
 * <ul>
 * <li>{@link #substituteTables(String, TableMapping)} replaces logical table
 * references with physical table expressions and quotes every identifier.</li>
 * <li>{@link #transpile(String, Dialect, Dialect)} re-serializes a statement
 * for another dialect, converting {@code %s} placeholders, identifier quotes
 * and row limits.</li>
 * <li>{@link #extractTableNames(String, Dialect)} lists the physical tables a
 * script reads or writes, leaving out common table expressions.</li>
 * </ul>
 *
 * <p>
 * All operations are pure functions of their arguments; an instance only
 * holds the dialect used for quoting and can be shared between threads.
 * </p>
 */
public final class StatementRewriter {

  private static final Logger log = LoggerFactory.getLogger(StatementRewriter.class);

  private final Dialect dialect;

  /**
   * Create a rewriter quoting identifiers for the embedded engine.
   */
  public StatementRewriter() {
    this(Dialect.DUCKDB);
  }

  /**
   * Create a rewriter.
   *
   * @param dialect
   *          the dialect statements are parsed in and identifiers are quoted
   *          for
   */
  public StatementRewriter(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public Dialect dialect() {
    return dialect;
  }

  /**
   * Replace logical table references.
   *
   * @param sql
   *          the statement
   * @param mapping
   *          logical table name to physical table expression
   * @return the rewritten statement
   * @throws InvalidTableMappingException
   *           if a mapping value is not a table expression
   * @throws SqlParseException
   *           if the statement does not parse
   */
  public String substituteTables(String sql, Map<String, String> mapping) {
    return substituteTables(sql, TableMapping.of(mapping));
  }

  /**
   * Replace every table reference whose unqualified name is a key of the
   * mapping. A reference keeps its alias; an unaliased reference is aliased
   * with its original name so qualified column references keep resolving.
   * References to common table expressions are left alone. Every identifier
   * of the result is quoted for this rewriter's dialect.
   *
   * @param sql
   *          the statement
   * @param mapping
   *          the table mapping
   * @return the rewritten statement
   * @throws SqlParseException
   *           if the statement does not parse
   */
  public String substituteTables(String sql, TableMapping mapping) {
    Objects.requireNonNull(mapping, "mapping");
    Statement statement = SqlStatements.parse(PlaceholderProtector.protect(sql), dialect);

    Set<String> cteNames = new HashSet<>();
    List<PlainSelect> plainSelects = new ArrayList<>();
    List<ParenthesedFromItem> parenthesedItems = new ArrayList<>();
    SqlTreeWalker.walk(statement, new SqlTreeWalker.Listener() {
      @Override
      public void withItems(List<WithItem<?>> withItems) {
        cteNames.addAll(cteNames(withItems));
      }

      @Override
      public void plainSelect(PlainSelect plainSelect) {
        plainSelects.add(plainSelect);
      }

      @Override
      public void parenthesedFromItem(ParenthesedFromItem fromItem) {
        parenthesedItems.add(fromItem);
      }
    });

    int replaced = replaceModificationTables(statement, mapping, cteNames);
    for (PlainSelect plainSelect : plainSelects) {
      FromItem from = replacement(plainSelect.getFromItem(), mapping, cteNames);
      if (from != null) {
        plainSelect.setFromItem(from);
        replaced++;
      }
      replaced += replaceJoins(plainSelect.getJoins(), mapping, cteNames);
    }
    for (ParenthesedFromItem item : parenthesedItems) {
      FromItem from = replacement(item.getFromItem(), mapping, cteNames);
      if (from != null) {
        item.setFromItem(from);
        replaced++;
      }
      replaced += replaceJoins(item.getJoins(), mapping, cteNames);
    }

    new IdentifierQuoter(dialect, IdentifierQuoter.Mode.QUOTE_ALL).apply(statement);
    String result = PlaceholderProtector.restore(statement.toString(), Dialect.Placeholder.PYFORMAT);
    if (log.isDebugEnabled()) {
      log.debug("Substituted {} table reference(s): {} -> {}", replaced, sql, result);
    }
    return result;
  }

  /**
   * Quote every identifier of a statement for this rewriter's dialect without
   * substituting anything. Quoting already quoted output changes nothing.
   *
   * @param sql
   *          the statement
   * @return the statement with quoted identifiers
   */
  public String quoteIdentifiers(String sql) {
    return substituteTables(sql, TableMapping.empty());
  }

  /**
   * Transpile a statement, autodetecting the source dialect.
   *
   * @param sql
   *          the statement
   * @param to
   *          the target dialect
   * @return the transpiled statement
   */
  public String transpile(String sql, Dialect to) {
    return transpile(sql, to, null);
  }

  /**
   * Re-serialize a statement for another dialect. {@code %s} placeholders
   * outside string literals become the target's marker, quoted identifiers
   * get the target's quote characters and row limits are written in the
   * target's style.
   *
   * @param sql
   *          the statement
   * @param to
   *          the target dialect
   * @param from
   *          the dialect the statement is written in, {@code null} to
   *          autodetect
   * @return the transpiled statement
   * @throws SqlParseException
   *           if the statement does not parse
   * @throws IllegalArgumentException
   *           if the row limit cannot be written in the target dialect, e.g.
   *           an OFFSET without ORDER BY for SQL Server
   */
  public String transpile(String sql, Dialect to, Dialect from) {
    Objects.requireNonNull(to, "to");
    Statement statement = SqlStatements.parse(PlaceholderProtector.protect(sql), from);
    new IdentifierQuoter(to, IdentifierQuoter.Mode.REQUOTE).apply(statement);
    String suffix = statement instanceof Select select ? convertRowLimit(select, to) : "";
    String result = PlaceholderProtector.restore(statement + suffix, to.placeholder());
    if (log.isDebugEnabled()) {
      log.debug("Transpiled {} -> {}: {} -> {}", from == null ? "auto" : from.dialectName(), to.dialectName(), sql,
          result);
    }
    return result;
  }

  /**
   * List the tables a script reads or writes. The table an INSERT, UPDATE,
   * DELETE or MERGE writes to is reported before the tables the statement
   * reads. Names bound by a WITH clause in any statement of the script are
   * excluded. Names are reported unqualified and unquoted in the order they
   * first appear; a table referenced again under the same alias is reported
   * once, the same table under another alias is reported again.
   *
   * @param sql
   *          one or more statements
   * @param sourceDialect
   *          the dialect the script is written in, {@code null} to autodetect
   * @return the table names
   * @throws SqlParseException
   *           if a statement does not parse
   */
  public List<String> extractTableNames(String sql, Dialect sourceDialect) {
    Statements statements = SqlStatements.parseAll(PlaceholderProtector.protect(sql), sourceDialect);
    Set<Identifier> cteNames = new HashSet<>();
    List<Table> tables = new ArrayList<>();
    for (Statement statement : statements) {
      SqlTreeWalker.walk(statement, new SqlTreeWalker.Listener() {
        @Override
        public void withItems(List<WithItem<?>> withItems) {
          cteNames(withItems).forEach(name -> cteNames.add(Identifier.of(name)));
        }

        @Override
        public void table(Table table) {
          if (table.getName() != null) {
            tables.add(table);
          }
        }
      });
    }
    Set<List<Identifier>> reported = new LinkedHashSet<>();
    List<String> names = new ArrayList<>();
    for (Table table : tables) {
      Identifier name = Identifier.of(table.getName());
      if (cteNames.contains(name)) {
        continue;
      }
      Identifier alias = table.getAlias() == null ? name : Identifier.of(table.getAlias().getName());
      if (reported.add(List.of(name, alias == null ? name : alias))) {
        names.add(name.text());
      }
    }
    return names;
  }

  private static List<String> cteNames(List<WithItem<?>> withItems) {
    List<String> names = new ArrayList<>();
    for (WithItem<?> withItem : withItems) {
      if (withItem.getAlias() != null && withItem.getAlias().getName() != null) {
        names.add(withItem.getAlias().getName());
      }
    }
    return names;
  }

  private static boolean isCte(Table table, Set<String> cteNames) {
    if (table.getSchemaName() != null) {
      return false;
    }
    Identifier name = Identifier.of(table.getName());
    return cteNames.stream().map(Identifier::of).anyMatch(cte -> cte != null && cte.matches(name));
  }

  private static FromItem replacement(FromItem item, TableMapping mapping, Set<String> cteNames) {
    if (!(item instanceof Table table) || table.getName() == null || isCte(table, cteNames)) {
      return null;
    }
    Optional<String> key = mapping.keyFor(table);
    if (key.isEmpty()) {
      return null;
    }
    FromItem target = mapping.createFromItem(key.get());
    Alias alias = table.getAlias() != null ? table.getAlias() : new Alias(table.getName());
    target.setAlias(alias);
    return target;
  }

  private static Table targetReplacement(Table table, TableMapping mapping, Set<String> cteNames) {
    if (table == null || table.getName() == null || isCte(table, cteNames)) {
      return null;
    }
    Optional<String> key = mapping.keyFor(table);
    if (key.isEmpty()) {
      return null;
    }
    Table target = mapping.createTable(key.get());
    target.setAlias(table.getAlias());
    return target;
  }

  /**
   * Rename the tables an INSERT, UPDATE, DELETE or MERGE writes to and
   * substitute the FROM items of UPDATE, DELETE and MERGE. A written table
   * keeps its alias but is not given one.
   */
  private static int replaceModificationTables(Statement statement, TableMapping mapping, Set<String> cteNames) {
    int replaced = 0;
    if (statement instanceof Insert insert) {
      Table table = targetReplacement(insert.getTable(), mapping, cteNames);
      if (table != null) {
        insert.setTable(table);
        replaced++;
      }
    } else if (statement instanceof Update update) {
      Table table = targetReplacement(update.getTable(), mapping, cteNames);
      if (table != null) {
        update.setTable(table);
        replaced++;
      }
      FromItem from = replacement(update.getFromItem(), mapping, cteNames);
      if (from != null) {
        update.setFromItem(from);
        replaced++;
      }
      replaced += replaceJoins(update.getStartJoins(), mapping, cteNames);
      replaced += replaceJoins(update.getJoins(), mapping, cteNames);
    } else if (statement instanceof Delete delete) {
      Table table = targetReplacement(delete.getTable(), mapping, cteNames);
      if (table != null) {
        delete.setTable(table);
        replaced++;
      }
      List<Table> using = delete.getUsingList();
      if (using != null) {
        for (int i = 0; i < using.size(); i++) {
          Table usingTable = targetReplacement(using.get(i), mapping, cteNames);
          if (usingTable != null) {
            using.set(i, usingTable);
            replaced++;
          }
        }
      }
      replaced += replaceJoins(delete.getJoins(), mapping, cteNames);
    } else if (statement instanceof Merge merge) {
      Table table = targetReplacement(merge.getTable(), mapping, cteNames);
      if (table != null) {
        merge.setTable(table);
        replaced++;
      }
      FromItem from = replacement(merge.getFromItem(), mapping, cteNames);
      if (from != null) {
        merge.setFromItem(from);
        replaced++;
      }
    }
    return replaced;
  }

  private static int replaceJoins(List<Join> joins, TableMapping mapping, Set<String> cteNames) {
    if (joins == null) {
      return 0;
    }
    int replaced = 0;
    for (Join join : joins) {
      FromItem right = replacement(join.getRightItem(), mapping, cteNames);
      if (right != null) {
        join.setRightItem(right);
        replaced++;
      }
    }
    return replaced;
  }

  /**
   * Rewrite the row limit and offset of the outermost query in the target
   * style. A limit already written in the target style is left alone.
   *
   * @return text to append to the serialized statement
   * @throws IllegalArgumentException
   *           if the limit has no equivalent in the target dialect
   */
  private static String convertRowLimit(Select select, Dialect to) {
    Limit limit = select.getLimit();
    Fetch fetch = select.getFetch();
    Offset offsetClause = select.getOffset();
    Top top = select instanceof PlainSelect plain ? plain.getTop() : null;
    Expression offset = offsetClause != null ? offsetClause.getOffset() : limit != null ? limit.getOffset() : null;
    Expression rows = limit != null ? limit.getRowCount() : top != null ? top.getExpression() : fetchRows(fetch);
    if (limit != null && (limit.isLimitAll() || limit.isLimitNull())) {
      rows = null;
    }
    if (limit == null && top == null && fetch == null && offsetClause == null) {
      return "";
    }
    boolean alreadyInTargetStyle = switch (to.limitStyle()) {
      case TOP -> limit == null && fetch == null && offsetClause == null;
      case LIMIT -> top == null && fetch == null;
      case FETCH -> top == null && limit == null && (offsetClause == null || offsetClause.getOffsetParam() != null);
    };
    if (alreadyInTargetStyle) {
      return "";
    }
    if (top != null && (top.isPercentage() || top.isWithTies())) {
      throw new IllegalArgumentException(top.toString().trim() + " has no " + to.dialectName() + " equivalent");
    }
    boolean useTop = to.limitStyle() == Dialect.LimitStyle.TOP && offset == null && select instanceof PlainSelect;
    if (to.limitStyle() == Dialect.LimitStyle.TOP && !useTop
        && (select.getOrderByElements() == null || select.getOrderByElements().isEmpty())) {
      throw new IllegalArgumentException(to.dialectName() + " pages with OFFSET ... FETCH, which needs an ORDER BY: "
          + select);
    }
    select.setLimit(null);
    select.setOffset(null);
    select.setFetch(null);
    if (top != null) {
      ((PlainSelect) select).setTop(null);
    }
    if (useTop) {
      if (rows != null) {
        Top newTop = new Top();
        newTop.setExpression(rows);
        ((PlainSelect) select).setTop(newTop);
      }
      return "";
    }
    return switch (to.limitStyle()) {
      case LIMIT -> (rows != null ? " LIMIT " + rows : "") + (offset != null ? " OFFSET " + offset : "");
      case FETCH -> offset != null ? offsetFetch(offset, rows)
          : rows != null ? " FETCH FIRST " + rows + " ROWS ONLY" : "";
      case TOP -> offsetFetch(offset, rows);
    };
  }

  private static String offsetFetch(Expression offset, Expression rows) {
    return " OFFSET " + (offset != null ? offset : "0") + " ROWS" + (rows != null ? " FETCH NEXT " + rows
        + " ROWS ONLY" : "");
  }

  private static Expression fetchRows(Fetch fetch) {
    if (fetch == null) {
      return null;
    }
    return fetch.getExpression() != null ? fetch.getExpression() : new LongValue(1);
  }
}
