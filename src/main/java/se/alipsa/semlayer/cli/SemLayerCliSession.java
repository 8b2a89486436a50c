package se.alipsa.semlayer.cli;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import se.alipsa.semlayer.SemLayer;
import se.alipsa.semlayer.SemLayerConfig;
import se.alipsa.semlayer.SemanticLayerException;
import se.alipsa.semlayer.helper.SemLayerUtil;
import se.alipsa.semlayer.model.SemanticSchema;
import se.alipsa.semlayer.sql.Dialect;
import se.alipsa.semlayer.sql.TableMapping;

/**
 * A simple command processor for the semlayer command line interface. Lines
 * starting with "/" are commands; every other line is a SQL statement that is
 * rewritten through the current table mapping.
 */
public class SemLayerCliSession {

  private static final String UNKNOWN_VERSION = "DEV";
  /**
   * ANSI color used for the CLI prompt to keep it subtly visible.
   */
  public static final String PROMPT_COLOR = "\u001B[2;37m";
  /**
   * ANSI color used to render user input a bit brighter than the prompt.
   */
  public static final String USER_INPUT = "\u001B[0;97m";
  /**
   * ANSI code that resets styling after colored segments.
   */
  public static final String ANSI_RESET = "\u001B[0m";

  private SemLayer layer;
  private SemanticSchema current;
  private TableMapping mapping = TableMapping.empty();
  private final PrintWriter out;
  private final PrintWriter err;

  /**
   * Create a new CLI session.
   *
   * @param config
   *          the initial settings
   * @param out
   *          writer used for standard output
   * @param err
   *          writer used for error output
   */
  public SemLayerCliSession(SemLayerConfig config, PrintWriter out, PrintWriter err) {
    this.layer = new SemLayer(Objects.requireNonNull(config, "config"));
    this.out = Objects.requireNonNull(out, "out");
    this.err = Objects.requireNonNull(err, "err");
  }

  /**
   * Compute the prompt to display to the user.
   *
   * @return the current prompt string
   */
  public String prompt() {
    if (current == null) {
      return PROMPT_COLOR + "semlayer>" + ANSI_RESET + " ";
    }
    return PROMPT_COLOR + "semlayer(" + current.name() + ")>" + ANSI_RESET + " ";
  }

  /**
   * Handle a single line of input.
   *
   * @param line
   *          the input line
   * @return {@code false} if the session should terminate, {@code true} otherwise
   */
  public boolean handleLine(String line) {
    if (line == null) {
      return false;
    }
    String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      return true;
    }
    try {
      if (trimmed.startsWith("/")) {
        return handleCommand(trimmed);
      }
      out.println(layer.substituteTables(trimmed, mapping));
      out.flush();
    } catch (SemanticLayerException | IllegalArgumentException | UncheckedIOException e) {
      err.println(e.getMessage());
      err.flush();
    }
    return true;
  }

  private boolean handleCommand(String command) {
    int space = command.indexOf(' ');
    String name = (space < 0 ? command : command.substring(0, space)).toLowerCase(Locale.ROOT);
    String argument = space < 0 ? "" : command.substring(space + 1).trim();
    switch (name) {
      case "/exit" -> {
        return false;
      }
      case "/help" -> printHelp();
      case "/load" -> load(argument);
      case "/compile" -> withSchema(schema -> layer.compile(schema));
      case "/head" -> withSchema(schema -> argument.isEmpty() ? layer.head(schema)
          : layer.head(schema, parseRows(argument)));
      case "/count" -> withSchema(schema -> layer.rowCount(schema));
      case "/map" -> map(argument);
      case "/unmap" -> unmap(argument);
      case "/mappings" -> printMappings();
      case "/tables" -> tables(argument);
      case "/transpile" -> transpile(argument);
      case "/dialect" -> dialect(argument);
      case "/info" -> printInfo();
      default -> {
        err.println("Unknown command: " + command + ". Use /help to list commands.");
        err.flush();
      }
    }
    return true;
  }

  /**
   * Load a dataset and make it the current schema. The dataset is also added
   * to the table mapping under its name.
   *
   * @param location
   *          a dataset directory or schema document
   */
  public void load(String location) {
    if (location == null || location.isBlank()) {
      usage("/load <dataset directory or schema.yaml>");
      return;
    }
    SemanticSchema schema = layer.loadSchema(Path.of(location.trim()));
    mapping = mapping.with(schema.name(), layer.compile(schema));
    current = schema;
    out.println(PROMPT_COLOR + "Loaded " + schema.name() + " (" + describeSource(schema) + ")" + ANSI_RESET);
    out.flush();
  }

  private void withSchema(Function<SemanticSchema, String> action) {
    if (current == null) {
      err.println("No dataset loaded. Use /load <dataset directory> first.");
      err.flush();
      return;
    }
    out.println(action.apply(current));
    out.flush();
  }

  private int parseRows(String argument) {
    try {
      return Integer.parseInt(argument.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Number of rows must be an integer: " + argument, e);
    }
  }

  private void map(String argument) {
    String[] assignment = SemLayerUtil.splitAssignment(argument);
    if (assignment == null || assignment[1].isEmpty()) {
      usage("/map <name>=<table, table function or query>");
      return;
    }
    mapping = mapping.with(assignment[0], assignment[1]);
    out.println("Mapped " + assignment[0] + " to " + assignment[1]);
    out.flush();
  }

  private void unmap(String argument) {
    if (argument.isEmpty()) {
      usage("/unmap <name>");
      return;
    }
    int before = mapping.size();
    mapping = mapping.without(argument);
    out.println(before == mapping.size() ? "No mapping for " + argument : "Removed mapping for " + argument);
    out.flush();
  }

  private void printMappings() {
    if (mapping.isEmpty()) {
      out.println("No table mappings.");
    } else {
      for (Map.Entry<String, String> entry : mapping.asMap().entrySet()) {
        out.println(entry.getKey() + " = " + entry.getValue());
      }
    }
    out.flush();
  }

  private void tables(String sql) {
    if (sql.isEmpty()) {
      usage("/tables <sql>");
      return;
    }
    List<String> names = layer.extractTableNames(sql);
    out.println(names.isEmpty() ? "No tables referenced." : String.join(", ", names));
    out.flush();
  }

  private void transpile(String argument) {
    int space = argument.indexOf(' ');
    if (space < 0) {
      usage("/transpile <dialect> <sql>");
      return;
    }
    Dialect to = Dialect.fromName(argument.substring(0, space));
    out.println(layer.transpile(argument.substring(space + 1).trim(), to));
    out.flush();
  }

  private void dialect(String argument) {
    if (argument.isEmpty()) {
      out.println("Dialect: " + layer.config().dialect().dialectName());
    } else {
      layer = new SemLayer(layer.config().withDialect(Dialect.fromName(argument)));
      out.println("Dialect set to " + layer.config().dialect().dialectName());
    }
    out.flush();
  }

  private void printHelp() {
    out.println("Available commands:");
    out.println("/load <dataset directory or schema.yaml> - Load a dataset and map its name");
    out.println("/compile - Show the query of the current dataset");
    out.println("/head [n] - Show a preview query of the current dataset");
    out.println("/count - Show the row count query of the current dataset");
    out.println("/map <name>=<sql> - Map a table name to a table, table function or query");
    out.println("/unmap <name> - Remove a table mapping");
    out.println("/mappings - List the table mappings");
    out.println("/tables <sql> - List the tables a statement reads");
    out.println("/transpile <dialect> <sql> - Rewrite a statement for another dialect");
    out.println("/dialect [name] - Show or set the dialect statements are written in");
    out.println("/info - Show the session settings");
    out.println("/help - Display this help text");
    out.println("/exit - Exit the CLI");
    out.println("Any other input is treated as SQL and rewritten through the table mappings.");
    out.flush();
  }

  private void printInfo() {
    SemLayerConfig config = layer.config();
    out.println("Version: " + cliVersion());
    out.println("Dataset path: " + config.datasetPath());
    out.println("Dialect: " + config.dialect().dialectName());
    out.println("Head rows: " + config.headRows());
    out.println("Current dataset: " + (current == null ? "none" : current.name()));
    out.println("Table mappings: " + mapping.size());
    out.flush();
  }

  private void usage(String text) {
    err.println("Usage: " + text);
    err.flush();
  }

  private static String describeSource(SemanticSchema schema) {
    if (schema.isView()) {
      return "view";
    }
    return schema.source().type().typeName();
  }

  /**
   * The dataset most recently loaded.
   *
   * @return the current schema, or {@code null}
   */
  public SemanticSchema currentSchema() {
    return current;
  }

  public TableMapping mapping() {
    return mapping;
  }

  /**
   * Resolve the CLI version from the package manifest.
   *
   * @return the implementation version, or {@value #UNKNOWN_VERSION} when not
   *         available
   */
  public static String cliVersion() {
    Package pkg = SemLayerCliSession.class.getPackage();
    if (pkg != null) {
      String implementationVersion = pkg.getImplementationVersion();
      if (implementationVersion != null && !implementationVersion.isBlank()) {
        return implementationVersion;
      }
    }
    String sysVersion = System.getProperty("semlayer.version");
    if (sysVersion != null && !sysVersion.isBlank()) {
      return sysVersion;
    }
    return UNKNOWN_VERSION;
  }
}
