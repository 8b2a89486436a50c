package se.alipsa.semlayer.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import se.alipsa.semlayer.InvalidSchemaException;

/**
 * A view over other datasets, joined through {@link Relation}s. View columns
 * are written as {@code table.column}.
 *
 * @param relations
 *          the join conditions between the participating datasets
 */
public record ViewSource(List<Relation> relations) implements TableSource {

  /**
   * Copies the relation list.
   */
  public ViewSource {
    relations = relations == null ? List.of() : List.copyOf(relations);
  }

  @Override
  public SourceType type() {
    return null;
  }

  /**
   * One table joined into the view together with the conditions linking it to
   * the tables joined before it.
   *
   * @param table
   *          the joined table
   * @param conditions
   *          the relations forming the ON clause, in declaration order
   */
  public record JoinStep(String table, List<Relation> conditions) {
  }

  /**
   * Order the relations into joins starting from {@code baseTable}. A relation
   * between two tables that are both already joined is added as an extra
   * condition of the later of the two joins.
   *
   * @param baseTable
   *          the table the view selects from
   * @return the joins in the order they must be emitted
   * @throws InvalidSchemaException
   *           if a relation cannot be connected to the base table
   */
  public List<JoinStep> joinPlan(String baseTable) {
    Set<String> joined = new LinkedHashSet<>();
    joined.add(baseTable);
    List<String> stepTables = new ArrayList<>();
    List<List<Relation>> stepConditions = new ArrayList<>();
    List<Relation> pending = new ArrayList<>(relations);
    boolean progress = true;
    while (!pending.isEmpty() && progress) {
      progress = false;
      Iterator<Relation> it = pending.iterator();
      while (it.hasNext()) {
        Relation relation = it.next();
        boolean hasFrom = joined.contains(relation.fromTable());
        boolean hasTo = joined.contains(relation.toTable());
        if (hasFrom && hasTo) {
          int idx = Math.max(stepTables.indexOf(relation.fromTable()), stepTables.indexOf(relation.toTable()));
          if (idx < 0) {
            throw new InvalidSchemaException(null, "Relation joins the base table to itself: " + relation);
          }
          stepConditions.get(idx).add(relation);
        } else if (hasFrom || hasTo) {
          String table = hasFrom ? relation.toTable() : relation.fromTable();
          joined.add(table);
          stepTables.add(table);
          List<Relation> conditions = new ArrayList<>();
          conditions.add(relation);
          stepConditions.add(conditions);
        } else {
          continue;
        }
        it.remove();
        progress = true;
      }
    }
    if (!pending.isEmpty()) {
      throw new InvalidSchemaException(null, "Relations are not connected to table " + baseTable + ": " + pending);
    }
    List<JoinStep> steps = new ArrayList<>(stepTables.size());
    for (int i = 0; i < stepTables.size(); i++) {
      steps.add(new JoinStep(stepTables.get(i), List.copyOf(stepConditions.get(i))));
    }
    return List.copyOf(steps);
  }

  /**
   * All tables reachable from {@code baseTable} through the relations.
   *
   * @param baseTable
   *          the table the view selects from
   * @return the base table followed by every joined table
   */
  public Set<String> reachableTables(String baseTable) {
    Set<String> tables = new LinkedHashSet<>();
    tables.add(baseTable);
    for (JoinStep step : joinPlan(baseTable)) {
      tables.add(step.table());
    }
    return tables;
  }
}
