package se.alipsa.semlayer.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.semlayer.InvalidSchemaException;
import se.alipsa.semlayer.helper.SchemaNames;
import se.alipsa.semlayer.model.Column;
import se.alipsa.semlayer.model.ColumnType;
import se.alipsa.semlayer.model.ConnectionConfig;
import se.alipsa.semlayer.model.FileSource;
import se.alipsa.semlayer.model.Relation;
import se.alipsa.semlayer.model.RelationalSource;
import se.alipsa.semlayer.model.SemanticSchema;
import se.alipsa.semlayer.model.SourceType;
import se.alipsa.semlayer.model.TableSource;
import se.alipsa.semlayer.model.Transformation;
import se.alipsa.semlayer.model.ViewSource;

/**
 * Reads and writes the persisted schema document of a dataset, a
 * {@value #SCHEMA_FILE} file stored in the dataset directory.
 */
public final class SchemaDocuments {

  private static final Logger log = LoggerFactory.getLogger(SchemaDocuments.class);

  /** File name of the schema document inside a dataset directory. */
  public static final String SCHEMA_FILE = "schema.yaml";

  private static final ObjectMapper MAPPER = new ObjectMapper(
      new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
          .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

  private static final TypeReference<LinkedHashMap<String, Object>> PARAMS = new TypeReference<>() {
  };

  private SchemaDocuments() {
  }

  /**
   * Read the schema document of a dataset directory. When the document has no
   * name, the name is derived from the directory name.
   *
   * @param datasetDir
   *          the dataset directory
   * @return the schema
   * @throws InvalidSchemaException
   *           if the directory has no schema document or the document is
   *           invalid
   */
  public static SemanticSchema readDataset(Path datasetDir) {
    Path file = datasetDir.resolve(SCHEMA_FILE);
    if (!Files.isRegularFile(file)) {
      throw new InvalidSchemaException(null, "No " + SCHEMA_FILE + " found in " + datasetDir);
    }
    Path dirName = datasetDir.toAbsolutePath().normalize().getFileName();
    return read(file, dirName == null ? null : SchemaNames.fromDatasetPath(dirName.toString()));
  }

  /**
   * Read a schema document.
   *
   * @param file
   *          the document
   * @return the schema
   */
  public static SemanticSchema read(Path file) {
    return read(file, null);
  }

  private static SemanticSchema read(Path file, String defaultName) {
    String content;
    try {
      content = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + file, e);
    }
    log.debug("Reading schema document {}", file);
    return parse(content, defaultName);
  }

  /**
   * Parse a schema document.
   *
   * @param yaml
   *          the document text
   * @return the schema
   * @throws InvalidSchemaException
   *           if the document is malformed or violates a schema invariant
   */
  public static SemanticSchema parse(String yaml) {
    return parse(yaml, null);
  }

  static SemanticSchema parse(String yaml, String defaultName) {
    JsonNode root;
    try {
      root = MAPPER.readTree(yaml);
    } catch (JsonProcessingException e) {
      throw new InvalidSchemaException(defaultName, "Malformed schema document: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new InvalidSchemaException(defaultName, "Schema document must be a mapping");
    }
    String name = text(root, "name");
    if (name == null) {
      name = defaultName;
    }
    try {
      SemanticSchema.Builder builder = SemanticSchema.builder(name).description(text(root, "description"));
      for (JsonNode node : elements(root, "columns")) {
        builder.column(column(node));
      }
      builder.source(source(root));
      for (JsonNode node : elements(root, "transformations")) {
        builder.transformation(transformation(node));
      }
      builder.groupBy(strings(root, "group_by")).orderBy(strings(root, "order_by"));
      JsonNode limit = root.get("limit");
      if (limit != null && !limit.isNull()) {
        if (!limit.canConvertToInt() || !limit.isIntegralNumber()) {
          throw new InvalidSchemaException(name, "limit must be an integer: " + limit.asText());
        }
        builder.limit(limit.intValue());
      }
      return builder.build();
    } catch (InvalidSchemaException e) {
      if (e.getSchemaName() == null && name != null) {
        throw new InvalidSchemaException(name, e.getMessage(), e);
      }
      throw e;
    }
  }

  /**
   * Serialize a schema to its document form.
   *
   * @param schema
   *          the schema
   * @return the YAML text
   */
  public static String toYaml(SemanticSchema schema) {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("name", schema.name());
    if (schema.description() != null) {
      root.put("description", schema.description());
    }
    TableSource source = schema.source();
    if (source instanceof ViewSource view) {
      root.put("view", true);
      ArrayNode relations = root.putArray("relations");
      for (Relation relation : view.relations()) {
        ObjectNode node = relations.addObject();
        putIfPresent(node, "name", relation.name());
        putIfPresent(node, "description", relation.description());
        node.put("from", relation.from());
        node.put("to", relation.to());
      }
    } else {
      ObjectNode node = root.putObject("source");
      node.put("type", source.type().typeName());
      if (source instanceof FileSource file) {
        node.put("path", file.path());
      } else if (source instanceof RelationalSource relational) {
        ConnectionConfig connection = relational.connection();
        if (connection != null) {
          ObjectNode conn = node.putObject("connection");
          putIfPresent(conn, "host", connection.host());
          if (connection.port() != null) {
            conn.put("port", connection.port());
          }
          putIfPresent(conn, "user", connection.user());
          putIfPresent(conn, "password", connection.password());
          putIfPresent(conn, "database", connection.database());
          putIfPresent(conn, "schema", connection.schema());
        }
        node.put("table", relational.table());
      }
    }
    if (!schema.columns().isEmpty()) {
      ArrayNode columns = root.putArray("columns");
      for (Column column : schema.columns()) {
        ObjectNode node = columns.addObject();
        node.put("name", column.name());
        putIfPresent(node, "type", column.type() == null ? null : column.type().typeName());
        putIfPresent(node, "description", column.description());
        putIfPresent(node, "expression", column.expression());
        putIfPresent(node, "alias", column.alias());
      }
    }
    if (!schema.transformations().isEmpty()) {
      ArrayNode transformations = root.putArray("transformations");
      for (Transformation transformation : schema.transformations()) {
        ObjectNode node = transformations.addObject();
        node.put("type", transformation.type().typeName());
        node.set("params", MAPPER.valueToTree(transformation.params()));
      }
    }
    if (!schema.groupBy().isEmpty()) {
      ArrayNode groupBy = root.putArray("group_by");
      schema.groupBy().forEach(groupBy::add);
    }
    if (!schema.orderBy().isEmpty()) {
      ArrayNode orderBy = root.putArray("order_by");
      schema.orderBy().forEach(orderBy::add);
    }
    if (schema.limit() != null) {
      root.put("limit", schema.limit());
    }
    try {
      return MAPPER.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize schema " + schema.name(), e);
    }
  }

  /**
   * Write the schema document into a dataset directory.
   *
   * @param schema
   *          the schema
   * @param datasetDir
   *          the dataset directory, created if missing
   * @return the written file
   */
  public static Path write(SemanticSchema schema, Path datasetDir) {
    Path file = datasetDir.resolve(SCHEMA_FILE);
    try {
      Files.createDirectories(datasetDir);
      Files.writeString(file, toYaml(schema), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + file, e);
    }
    return file;
  }

  private static Column column(JsonNode node) {
    if (!node.isObject()) {
      throw new InvalidSchemaException(null, "Column entries must be mappings: " + node);
    }
    return new Column(text(node, "name"), ColumnType.fromName(text(node, "type")), text(node, "description"),
        text(node, "expression"), text(node, "alias"));
  }

  private static TableSource source(JsonNode root) {
    JsonNode view = root.get("view");
    JsonNode source = root.get("source");
    boolean isView = view != null && view.asBoolean(false);
    if (isView && source != null && !source.isNull()) {
      throw new InvalidSchemaException(null, "A view cannot declare a source");
    }
    if (isView) {
      List<Relation> relations = new ArrayList<>();
      for (JsonNode node : elements(root, "relations")) {
        relations.add(new Relation(text(node, "name"), text(node, "description"), text(node, "from"),
            text(node, "to")));
      }
      return new ViewSource(relations);
    }
    if (source == null || source.isNull()) {
      return null;
    }
    SourceType type = SourceType.fromName(text(source, "type"));
    if (type.isLocal()) {
      return new FileSource(type, text(source, "path"));
    }
    JsonNode conn = source.get("connection");
    ConnectionConfig connection = null;
    if (conn != null && conn.isObject()) {
      JsonNode port = conn.get("port");
      connection = new ConnectionConfig(text(conn, "host"), port == null || port.isNull() ? null : port.asInt(),
          text(conn, "user"), text(conn, "password"), text(conn, "database"), text(conn, "schema"));
    }
    return new RelationalSource(type, connection, text(source, "table"));
  }

  private static Transformation transformation(JsonNode node) {
    JsonNode params = node.get("params");
    Map<String, Object> values = params == null || params.isNull() ? Map.of() : MAPPER.convertValue(params, PARAMS);
    return Transformation.of(text(node, "type"), values);
  }

  private static List<String> strings(JsonNode root, String field) {
    JsonNode node = root.get(field);
    List<String> values = new ArrayList<>();
    if (node == null || node.isNull()) {
      return values;
    }
    if (node.isArray()) {
      node.forEach(n -> values.add(n.asText()));
    } else {
      values.add(node.asText());
    }
    return values;
  }

  private static Iterable<JsonNode> elements(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull()) {
      return List.of();
    }
    if (!node.isArray()) {
      throw new InvalidSchemaException(null, field + " must be a list");
    }
    return node;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static void putIfPresent(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }
}
