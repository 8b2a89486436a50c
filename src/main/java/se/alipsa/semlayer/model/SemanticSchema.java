package se.alipsa.semlayer.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import se.alipsa.semlayer.InvalidGroupByException;
import se.alipsa.semlayer.InvalidSchemaException;
import se.alipsa.semlayer.engine.TransformationPipeline;
import se.alipsa.semlayer.helper.SchemaNames;

/**
 * The declarative description of one logical dataset: its columns, where its
 * rows come from, the transformations applied to the columns and the
 * grouping, ordering and limiting of the result.
 *
 * <p>
 * Instances are immutable and fully validated: every invariant is checked by
 * {@link Builder#build()}, so a schema that exists can always be compiled.
 * </p>
 */
public final class SemanticSchema {

  private final String name;
  private final String description;
  private final List<Column> columns;
  private final TableSource source;
  private final List<Transformation> transformations;
  private final List<String> groupBy;
  private final List<String> orderBy;
  private final Integer limit;

  private SemanticSchema(Builder b) {
    this.name = b.name;
    this.description = b.description;
    this.columns = List.copyOf(b.columns);
    this.source = b.source;
    this.transformations = List.copyOf(b.transformations);
    this.groupBy = List.copyOf(b.groupBy);
    this.orderBy = List.copyOf(b.orderBy);
    this.limit = b.limit;
  }

  /**
   * Start building a schema.
   *
   * @param name
   *          the logical table name
   * @return a new builder
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  /**
   * The declared columns in output order; empty means all columns.
   *
   * @return the columns
   */
  public List<Column> columns() {
    return columns;
  }

  public TableSource source() {
    return source;
  }

  public List<Transformation> transformations() {
    return transformations;
  }

  public List<String> groupBy() {
    return groupBy;
  }

  public List<String> orderBy() {
    return orderBy;
  }

  /**
   * The row limit.
   *
   * @return the limit, or {@code null} when unlimited
   */
  public Integer limit() {
    return limit;
  }

  /**
   * Whether the dataset is a view over other datasets.
   *
   * @return {@code true} when the source is a {@link ViewSource}
   */
  public boolean isView() {
    return source instanceof ViewSource;
  }

  /**
   * The relations of a view.
   *
   * @return the relations, empty for non view datasets
   */
  public List<Relation> relations() {
    return source instanceof ViewSource view ? view.relations() : List.of();
  }

  /**
   * Whether duplicate rows are removed, i.e. a {@code remove_duplicates}
   * transformation is declared.
   *
   * @return {@code true} if the compiled query must be DISTINCT
   */
  public boolean distinct() {
    return transformations.stream().anyMatch(t -> t.type() == TransformationType.REMOVE_DUPLICATES);
  }

  /**
   * Look up a declared column by name.
   *
   * @param columnName
   *          the column name
   * @return the column, if declared
   */
  public Optional<Column> findColumn(String columnName) {
    return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
  }

  /**
   * Copy this schema with a new description. The description is the only
   * attribute that may change after creation.
   *
   * @param newDescription
   *          the description
   * @return a copy with the new description
   */
  public SemanticSchema withDescription(String newDescription) {
    return toBuilder().description(newDescription).build();
  }

  /**
   * Create a builder pre-populated with this schema.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    Builder b = new Builder(name).description(description).source(source).limit(limit);
    b.columns.addAll(columns);
    b.transformations.addAll(transformations);
    b.groupBy.addAll(groupBy);
    b.orderBy.addAll(orderBy);
    return b;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SemanticSchema other)) {
      return false;
    }
    return name.equals(other.name) && Objects.equals(description, other.description)
        && columns.equals(other.columns) && Objects.equals(source, other.source)
        && transformations.equals(other.transformations) && groupBy.equals(other.groupBy)
        && orderBy.equals(other.orderBy) && Objects.equals(limit, other.limit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, description, columns, source, transformations, groupBy, orderBy, limit);
  }

  @Override
  public String toString() {
    return "SemanticSchema[name=" + name + ", source=" + source + ", columns=" + columns.size() + "]";
  }

  /** Builder validating every schema invariant in {@link #build()}. */
  public static final class Builder {

    private final String name;
    private String description;
    private final List<Column> columns = new ArrayList<>();
    private TableSource source;
    private final List<Transformation> transformations = new ArrayList<>();
    private final List<String> groupBy = new ArrayList<>();
    private final List<String> orderBy = new ArrayList<>();
    private Integer limit;

    private Builder(String name) {
      this.name = name == null ? null : name.trim();
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder column(Column column) {
      columns.add(Objects.requireNonNull(column, "column"));
      return this;
    }

    public Builder columns(List<Column> columns) {
      columns.forEach(this::column);
      return this;
    }

    public Builder source(TableSource source) {
      this.source = source;
      return this;
    }

    public Builder transformation(Transformation transformation) {
      transformations.add(Objects.requireNonNull(transformation, "transformation"));
      return this;
    }

    public Builder transformations(List<Transformation> transformations) {
      transformations.forEach(this::transformation);
      return this;
    }

    public Builder groupBy(List<String> columnNames) {
      groupBy.addAll(columnNames);
      return this;
    }

    public Builder orderBy(List<String> orderKeys) {
      orderBy.addAll(orderKeys);
      return this;
    }

    public Builder limit(Integer limit) {
      this.limit = limit;
      return this;
    }

    /**
     * Validate and create the schema.
     *
     * @return the schema
     * @throws InvalidSchemaException
     *           if any invariant is violated
     * @throws InvalidGroupByException
     *           if the grouping is inconsistent with the columns
     */
    public SemanticSchema build() {
      if (name == null || name.isEmpty()) {
        throw new InvalidSchemaException(null, "Schema name must not be blank");
      }
      if (!SchemaNames.isValidTableName(name)) {
        throw new InvalidSchemaException(name, "Schema name is not a valid SQL identifier: " + name);
      }
      if (source == null) {
        throw new InvalidSchemaException(name, "Schema " + name + " requires a source or must be a view");
      }
      if (limit != null && limit <= 0) {
        throw new InvalidSchemaException(name, "Limit must be positive: " + limit);
      }
      Set<String> seen = new HashSet<>();
      for (Column column : columns) {
        if (!seen.add(column.name())) {
          throw new InvalidSchemaException(name, "Duplicate column name: " + column.name());
        }
      }
      for (String key : orderBy) {
        if (key == null || key.isBlank()) {
          throw new InvalidSchemaException(name, "order_by entries must not be blank");
        }
      }
      for (Transformation transformation : transformations) {
        try {
          TransformationPipeline.validate(transformation);
        } catch (InvalidSchemaException e) {
          throw new InvalidSchemaException(name, e.getMessage(), e);
        }
      }
      if (source instanceof ViewSource view) {
        validateView(view);
      }
      validateGroupBy();
      return new SemanticSchema(this);
    }

    private void validateView(ViewSource view) {
      if (columns.isEmpty()) {
        throw new InvalidSchemaException(name, "View " + name + " must declare its columns");
      }
      Set<String> tables = new LinkedHashSet<>();
      for (Column column : columns) {
        int dot = column.name().lastIndexOf('.');
        if (dot <= 0 || dot == column.name().length() - 1) {
          throw new InvalidSchemaException(name,
              "View columns must be written as table.column: " + column.name());
        }
        tables.add(Relation.tablePart(column.name()));
      }
      String baseTable = tables.iterator().next();
      Set<String> reachable;
      try {
        reachable = view.reachableTables(baseTable);
      } catch (InvalidSchemaException e) {
        throw new InvalidSchemaException(name, e.getMessage(), e);
      }
      for (String table : tables) {
        if (!reachable.contains(table)) {
          throw new InvalidSchemaException(name, "No relation joins table " + table + " into view " + name);
        }
      }
    }

    private void validateGroupBy() {
      if (groupBy.isEmpty()) {
        return;
      }
      for (String entry : groupBy) {
        if (entry == null || entry.isBlank()) {
          throw new InvalidGroupByException(name, entry, "group_by entries must not be blank");
        }
        for (Column column : columns) {
          if (column.name().equals(entry) && column.hasExpression()) {
            throw new InvalidGroupByException(name, entry,
                "Cannot group by expression column '" + entry + "' (" + column.expression() + ")");
          }
        }
      }
      for (Column column : columns) {
        if (!column.hasExpression() && !groupBy.contains(column.name())) {
          throw new InvalidGroupByException(name, column.name(),
              "Column '" + column.name() + "' must be aggregated or listed in group_by");
        }
      }
    }
  }
}
