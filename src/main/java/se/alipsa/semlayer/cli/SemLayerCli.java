package se.alipsa.semlayer.cli;

import static se.alipsa.semlayer.cli.SemLayerCliSession.ANSI_RESET;
import static se.alipsa.semlayer.cli.SemLayerCliSession.PROMPT_COLOR;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;
import se.alipsa.semlayer.SemLayerConfig;

/**
 * Entry point for the interactive semlayer command line interface.
 */
public final class SemLayerCli {

  private static final Logger LOG = LoggerFactory.getLogger(SemLayerCli.class);

  private SemLayerCli() {
    // utility class
  }

  /**
   * Start the CLI.
   *
   * @param args
   *          optional first argument naming the directory datasets are loaded
   *          from; an optional second argument is a dataset to load at start
   */
  public static void main(String[] args) {
    try {
      configureLogging();
      SemLayerConfig config = resolveConfig(args);
      Terminal terminal = TerminalBuilder.builder().system(true).build();
      Path historyFile = Paths.get(System.getProperty("user.home"), ".semlayer_history");
      LineReader reader = LineReaderBuilder.builder().terminal(terminal).appName("semlayer")
          .variable(LineReader.HISTORY_FILE, historyFile).highlighter(new UserInputHighlighter()).build();
      PrintWriter out = new PrintWriter(terminal.output(), true);
      PrintWriter err = new PrintWriter(terminal.output(), true);
      SemLayerCliSession session = new SemLayerCliSession(config, out, err);
      out.println(PROMPT_COLOR + "semlayer CLI version " + SemLayerCliSession.cliVersion() + ANSI_RESET);
      if (args.length > 1) {
        session.handleLine("/load " + args[1]);
      }
      boolean running = true;
      while (running) {
        String line;
        try {
          line = reader.readLine(session.prompt());
        } catch (UserInterruptException e) {
          // keep the session alive so /exit can be typed
          continue;
        } catch (EndOfFileException e) {
          break;
        }
        running = session.handleLine(line);
      }
      terminal.close();
    } catch (IllegalArgumentException e) {
      LOG.error(e.getMessage());
      System.exit(1);
    } catch (IOException e) {
      LOG.error("Failed to start semlayer CLI: {}", e.getMessage(), e);
      System.exit(1);
    }
  }

  private static void configureLogging() {
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();
    if (System.getProperty(org.slf4j.simple.SimpleLogger.DEFAULT_LOG_LEVEL_KEY) == null) {
      System.setProperty(org.slf4j.simple.SimpleLogger.DEFAULT_LOG_LEVEL_KEY, "error");
    }
  }

  /**
   * Build the session settings from {@code semlayer.*} system properties, with
   * the first argument overriding the dataset path.
   *
   * @param args
   *          the command line arguments
   * @return the settings
   */
  static SemLayerConfig resolveConfig(String[] args) {
    SemLayerConfig config = SemLayerConfig.fromSystemProperties();
    if (args != null && args.length > 0 && !args[0].isBlank()) {
      Path dir = Paths.get(args[0]).toAbsolutePath().normalize();
      config = config.withDatasetPath(dir);
    }
    return config;
  }
}
