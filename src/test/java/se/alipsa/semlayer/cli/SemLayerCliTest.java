package se.alipsa.semlayer.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import se.alipsa.semlayer.SemLayerConfig;

class SemLayerCliTest {

  @Test
  void firstArgumentSetsDatasetPath() {
    SemLayerConfig config = SemLayerCli.resolveConfig(new String[]{
        "src/test/resources/datasets"
    });
    assertEquals(Paths.get("src/test/resources/datasets").toAbsolutePath().normalize(), config.datasetPath());
  }

  @Test
  void workingDirectoryIsTheDefault() {
    Path workingDir = Paths.get("").toAbsolutePath().normalize();
    assertEquals(workingDir, SemLayerCli.resolveConfig(null).datasetPath());
    assertEquals(workingDir, SemLayerCli.resolveConfig(new String[]{
        "  "
    }).datasetPath());
    assertEquals(workingDir, SemLayerCli.resolveConfig(new String[]{}).datasetPath());
  }

  @Test
  void highlighterTintsCommandsAndSql() {
    assertEquals(UserInputHighlighter.COMMAND_COLOR + " /help" + SemLayerCliSession.ANSI_RESET,
        UserInputHighlighter.colorize(" /help"));
    assertEquals(SemLayerCliSession.USER_INPUT + "SELECT 1" + SemLayerCliSession.ANSI_RESET,
        UserInputHighlighter.colorize("SELECT 1"));
    assertEquals(SemLayerCliSession.USER_INPUT + SemLayerCliSession.ANSI_RESET, UserInputHighlighter.colorize(null));
  }

  @Test
  void versionFallsBackToDevelopmentMarker() {
    assertFalse(SemLayerCliSession.cliVersion().isBlank());
  }
}
