package se.alipsa.semlayer.sql;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.merge.Merge;
import net.sf.jsqlparser.statement.select.AllTableColumns;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.FromItemVisitor;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SelectVisitor;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.TableFunction;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.util.deparser.ExpressionDeParser;
import net.sf.jsqlparser.util.deparser.SelectDeParser;
import net.sf.jsqlparser.util.deparser.StatementDeParser;

/**
 * Visits every node of a parsed statement that the rewriter cares about, in
 * the order the nodes appear in the statement text. The walk piggybacks on the
 * JSqlParser deparsers, which already reach every nested query, and discards
 * the text they produce. The tables written by INSERT, UPDATE, DELETE and MERGE
 * and the FROM lists of UPDATE and DELETE are not reached by the deparsers and
 * are visited explicitly, before the rest of the statement.
 *
 * <p>
 * Each node is reported at most once per walk.
 * </p>
 */
final class SqlTreeWalker {

  /** Callbacks invoked during a walk; every method defaults to a no-op. */
  interface Listener {

    /**
     * The WITH items of a query or a data modifying statement.
     *
     * @param withItems
     *          the common table expressions, never empty
     */
    default void withItems(List<WithItem<?>> withItems) {
    }

    default void plainSelect(PlainSelect plainSelect) {
    }

    default void parenthesedSelect(ParenthesedSelect select) {
    }

    default void parenthesedFromItem(ParenthesedFromItem fromItem) {
    }

    default void table(Table table) {
    }

    /**
     * The table an INSERT, UPDATE, DELETE or MERGE writes to. Defaults to
     * {@link #table(Table)}.
     *
     * @param table
     *          the written table
     */
    default void targetTable(Table table) {
      table(table);
    }

    default void tableFunction(TableFunction tableFunction) {
    }

    default void selectItem(SelectItem<?> selectItem) {
    }

    default void column(Column column) {
    }

    default void allTableColumns(AllTableColumns allTableColumns) {
    }
  }

  private SqlTreeWalker() {
  }

  /**
   * Walk a statement.
   *
   * @param statement
   *          the parsed statement
   * @param listener
   *          the callbacks
   */
  static void walk(Statement statement, Listener listener) {
    Set<Object> reported = Collections.newSetFromMap(new IdentityHashMap<>());
    StringBuilder buffer = new StringBuilder();
    ExpressionDeParser expressionDeParser = new ExpressionDeParser() {
      @Override
      public <S> StringBuilder visit(Column column, S context) {
        if (reported.add(column)) {
          listener.column(column);
        }
        return super.visit(column, context);
      }

      @Override
      public <S> StringBuilder visit(AllTableColumns allTableColumns, S context) {
        if (reported.add(allTableColumns)) {
          listener.allTableColumns(allTableColumns);
        }
        return super.visit(allTableColumns, context);
      }
    };
    SelectDeParser selectDeParser = new SelectDeParser(expressionDeParser, buffer) {
      @Override
      public <S> StringBuilder visit(PlainSelect plainSelect, S context) {
        if (reported.add(plainSelect)) {
          withItems(plainSelect.getWithItemsList(), listener);
          listener.plainSelect(plainSelect);
          if (plainSelect.getSelectItems() != null) {
            for (SelectItem<?> item : plainSelect.getSelectItems()) {
              if (reported.add(item)) {
                listener.selectItem(item);
              }
            }
          }
        }
        return super.visit(plainSelect, context);
      }

      @Override
      public <S> StringBuilder visit(SetOperationList list, S context) {
        if (reported.add(list)) {
          withItems(list.getWithItemsList(), listener);
        }
        return super.visit(list, context);
      }

      @Override
      public <S> StringBuilder visit(ParenthesedSelect select, S context) {
        if (reported.add(select)) {
          withItems(select.getWithItemsList(), listener);
          listener.parenthesedSelect(select);
        }
        return super.visit(select, context);
      }

      @Override
      public <S> StringBuilder visit(ParenthesedFromItem fromItem, S context) {
        if (reported.add(fromItem)) {
          listener.parenthesedFromItem(fromItem);
        }
        return super.visit(fromItem, context);
      }

      @Override
      public <S> StringBuilder visit(Table table, S context) {
        if (reported.add(table)) {
          listener.table(table);
        }
        return super.visit(table, context);
      }

      @Override
      public <S> StringBuilder visit(TableFunction tableFunction, S context) {
        if (reported.add(tableFunction)) {
          listener.tableFunction(tableFunction);
        }
        return super.visit(tableFunction, context);
      }
    };
    expressionDeParser.setSelectVisitor(selectDeParser);
    expressionDeParser.setBuilder(buffer);
    selectDeParser.setBuilder(buffer);

    if (statement instanceof Select select) {
      select.accept((SelectVisitor<StringBuilder>) selectDeParser, null);
      return;
    }
    Modification modification = new Modification(listener, reported, expressionDeParser, selectDeParser);
    if (statement instanceof Insert insert) {
      modification.visit(insert.getWithItemsList(), insert.getTable());
      modification.expression(insert.getColumns());
    } else if (statement instanceof Update update) {
      modification.visit(update.getWithItemsList(), update.getTable());
      modification.joins(update.getStartJoins());
      modification.fromItem(update.getFromItem());
      modification.joins(update.getJoins());
      if (update.getUpdateSets() != null) {
        update.getUpdateSets().forEach(set -> modification.expression(set.getColumns()));
      }
    } else if (statement instanceof Delete delete) {
      modification.visit(delete.getWithItemsList(), delete.getTable());
      if (delete.getUsingList() != null) {
        delete.getUsingList().forEach(modification::fromItem);
      }
      modification.joins(delete.getJoins());
    } else if (statement instanceof Merge merge) {
      modification.visit(merge.getWithItemsList(), merge.getTable());
      modification.fromItem(merge.getFromItem());
    }
    StatementDeParser statementDeParser = new StatementDeParser(expressionDeParser, selectDeParser, buffer);
    statement.accept(statementDeParser, null);
  }

  private static void withItems(List<WithItem<?>> withItems, Listener listener) {
    if (withItems != null && !withItems.isEmpty()) {
      listener.withItems(withItems);
    }
  }

  /** Visits the parts of a data modifying statement the deparsers skip. */
  private record Modification(Listener listener, Set<Object> reported, ExpressionDeParser expressionDeParser,
      SelectDeParser selectDeParser) {

    void visit(List<WithItem<?>> withItems, Table target) {
      withItems(withItems, listener);
      if (target != null && target.getName() != null && reported.add(target)) {
        listener.targetTable(target);
      }
      if (withItems != null) {
        for (WithItem<?> withItem : withItems) {
          if (withItem.getParenthesedStatement() instanceof ParenthesedSelect select) {
            select.accept((SelectVisitor<StringBuilder>) selectDeParser, null);
          }
        }
      }
    }

    void fromItem(FromItem fromItem) {
      if (fromItem != null) {
        fromItem.accept((FromItemVisitor<StringBuilder>) selectDeParser, null);
      }
    }

    void joins(List<Join> joins) {
      if (joins == null) {
        return;
      }
      for (Join join : joins) {
        fromItem(join.getRightItem());
        if (join.getOnExpressions() != null) {
          join.getOnExpressions().forEach(this::expression);
        }
      }
    }

    void expression(Expression expression) {
      if (expression != null) {
        expression.accept(expressionDeParser, null);
      }
    }
  }
}
