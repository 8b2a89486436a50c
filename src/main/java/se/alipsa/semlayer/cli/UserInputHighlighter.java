package se.alipsa.semlayer.cli;

import java.util.regex.Pattern;
import org.jline.reader.Highlighter;
import org.jline.reader.LineReader;
import org.jline.utils.AttributedString;

/**
 * Tints the line being typed: commands in {@link #COMMAND_COLOR}, SQL in
 * {@link SemLayerCliSession#USER_INPUT}.
 */
public class UserInputHighlighter implements Highlighter {

  /** ANSI color for lines starting with {@code /}. */
  public static final String COMMAND_COLOR = "\u001B[0;96m";

  @Override
  public AttributedString highlight(LineReader reader, String buffer) {
    return AttributedString.fromAnsi(colorize(buffer));
  }

  /**
   * Wrap the input in the color matching its kind.
   *
   * @param buffer
   *          the text being entered, may be {@code null}
   * @return the input with ANSI color codes, reset at the end
   */
  static String colorize(String buffer) {
    String content = buffer == null ? "" : buffer;
    String color = content.stripLeading().startsWith("/") ? COMMAND_COLOR : SemLayerCliSession.USER_INPUT;
    return color + content + SemLayerCliSession.ANSI_RESET;
  }

  @Override
  public void setErrorIndex(int errorIndex) {
    // input is tinted as a whole
  }

  @Override
  public void setErrorPattern(Pattern pattern) {
    // input is tinted as a whole
  }
}
