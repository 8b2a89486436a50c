package se.alipsa.semlayer.sql;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import net.sf.jsqlparser.expression.Alias;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.AllTableColumns;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.TableFunction;
import net.sf.jsqlparser.statement.select.WithItem;
import se.alipsa.semlayer.engine.Identifier;

/**
 * Normalizes the identifiers of a parsed statement in place: column and table
 * references, table qualifiers of columns, select item aliases, table aliases
 * and common table expression names.
 *
 * <p>
 * In {@link Mode#QUOTE_ALL} every identifier is quoted for the target dialect,
 * unquoted ones after case folding, so running the quoter over its own output
 * changes nothing. In {@link Mode#REQUOTE} only identifiers that were quoted
 * in the input are re-quoted with the target dialect's quote characters.
 * </p>
 */
public final class IdentifierQuoter implements SqlTreeWalker.Listener {

  /** How identifiers are treated. */
  public enum Mode {
    QUOTE_ALL, REQUOTE
  }

  private static final Set<String> KEYWORD_COLUMNS = Set.of("TRUE", "FALSE", "NULL", "CURRENT_DATE", "CURRENT_TIME",
      "CURRENT_TIMESTAMP", "LOCALTIME", "LOCALTIMESTAMP", "SYSDATE", "CURRENT_USER", "SESSION_USER");

  private final Dialect dialect;
  private final Mode mode;

  /**
   * Create a quoter.
   *
   * @param dialect
   *          the dialect whose quote characters and case folding are used
   * @param mode
   *          which identifiers are quoted
   */
  public IdentifierQuoter(Dialect dialect, Mode mode) {
    this.dialect = dialect;
    this.mode = mode;
  }

  /**
   * Normalize every identifier of the statement.
   *
   * @param statement
   *          the statement, modified in place
   */
  public void apply(Statement statement) {
    SqlTreeWalker.walk(statement, this);
  }

  /**
   * Quote a single identifier.
   *
   * @param raw
   *          the identifier as written
   * @return the identifier in the target form, or {@code raw} unchanged when
   *         it is {@code null}, blank or the placeholder token
   */
  public String quote(String raw) {
    if (raw == null || raw.isBlank() || PlaceholderProtector.TOKEN.equals(raw)) {
      return raw;
    }
    Identifier identifier = Identifier.of(raw);
    return mode == Mode.QUOTE_ALL ? identifier.render(dialect) : identifier.requote(dialect);
  }

  @Override
  public void withItems(List<WithItem<?>> withItems) {
    for (WithItem<?> withItem : withItems) {
      quoteAlias(withItem.getAlias());
    }
  }

  @Override
  public void column(Column column) {
    String name = column.getColumnName();
    if (name == null || KEYWORD_COLUMNS.contains(name.toUpperCase(Locale.ROOT))) {
      return;
    }
    column.setColumnName(quote(name));
    quoteQualifier(column.getTable());
  }

  @Override
  public void allTableColumns(AllTableColumns allTableColumns) {
    quoteQualifier(allTableColumns.getTable());
  }

  @Override
  public void table(Table table) {
    quoteQualifier(table);
    fromItemAlias(table.getAlias());
  }

  @Override
  public void parenthesedSelect(ParenthesedSelect select) {
    fromItemAlias(select.getAlias());
  }

  @Override
  public void parenthesedFromItem(ParenthesedFromItem fromItem) {
    fromItemAlias(fromItem.getAlias());
  }

  @Override
  public void tableFunction(TableFunction tableFunction) {
    fromItemAlias(tableFunction.getAlias());
  }

  @Override
  public void selectItem(SelectItem<?> selectItem) {
    quoteAlias(selectItem.getAlias());
  }

  private void quoteQualifier(Table table) {
    if (table == null || table.getName() == null) {
      return;
    }
    table.setName(quote(table.getName()));
    if (table.getSchemaName() != null) {
      table.setSchemaName(quote(table.getSchemaName()));
    }
  }

  private void fromItemAlias(Alias alias) {
    if (alias == null) {
      return;
    }
    quoteAlias(alias);
    if (dialect == Dialect.ORACLE) {
      alias.setUseAs(false);
    }
  }

  private void quoteAlias(Alias alias) {
    if (alias != null && alias.getName() != null) {
      alias.setName(quote(alias.getName()));
    }
  }
}
