package se.alipsa.semlayer.engine;

import java.util.Locale;
import java.util.Objects;
import se.alipsa.semlayer.sql.Dialect;

/**
 * Represents a SQL identifier while preserving whether it was quoted in the
 * source text. Quoted identifiers keep their case and are re-quoted for the
 * target dialect as they are; unquoted identifiers are folded the way the
 * target engine folds them before being quoted, so quoting never changes
 * which object an identifier resolves to.
 */
public final class Identifier {

  private final String text;
  private final boolean quoted;

  private Identifier(String text, boolean quoted) {
    this.text = Objects.requireNonNull(text, "text");
    this.quoted = quoted;
  }

  /**
   * Create an {@link Identifier} from raw identifier text.
   *
   * @param raw
   *          identifier text that may be enclosed in double quotes, backticks or
   *          square brackets
   * @return a populated {@link Identifier} or {@code null} when {@code raw} is
   *         {@code null} or blank
   */
  public static Identifier of(String raw) {
    if (raw == null) {
      return null;
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    if (IdentifierUtil.isQuoted(trimmed)) {
      return new Identifier(IdentifierUtil.unquote(trimmed), true);
    }
    return new Identifier(trimmed, false);
  }

  /**
   * Create an identifier that is already known to be unquoted text.
   *
   * @param text
   *          the identifier text
   * @return the identifier
   */
  public static Identifier unquoted(String text) {
    return new Identifier(text, false);
  }

  /**
   * Determine whether the identifier was quoted in the originating text.
   *
   * @return {@code true} when the identifier was quoted
   */
  public boolean quoted() {
    return quoted;
  }

  /**
   * Retrieve the identifier text with surrounding quote characters removed.
   *
   * @return the unquoted identifier text
   */
  public String text() {
    return text;
  }

  /**
   * Compute the normalized text used for comparisons. Quoted identifiers retain
   * their original casing whereas unquoted identifiers are converted to lower
   * case.
   *
   * @return normalized identifier text
   */
  public String normalized() {
    return quoted ? text : text.toLowerCase(Locale.ROOT);
  }

  /**
   * Render the identifier quoted for the given dialect. Unquoted identifiers
   * are folded with the dialect's case rules first.
   *
   * @param dialect
   *          the target dialect
   * @return the quoted identifier
   */
  public String render(Dialect dialect) {
    return dialect.quote(quoted ? text : dialect.fold(text));
  }

  /**
   * Render the identifier for the given dialect, quoting only identifiers that
   * were quoted to begin with.
   *
   * @param dialect
   *          the target dialect
   * @return the identifier, re-quoted when it was quoted
   */
  public String requote(Dialect dialect) {
    return quoted ? dialect.quote(text) : text;
  }

  /**
   * Determine whether this identifier represents the same logical reference as
   * the supplied identifier, using SQL quoting semantics.
   *
   * @param other
   *          identifier to compare with (may be {@code null})
   * @return {@code true} when both identifiers match under SQL rules
   */
  public boolean matches(Identifier other) {
    return other != null && normalized().equals(other.normalized());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Identifier other)) {
      return false;
    }
    return matches(other);
  }

  @Override
  public int hashCode() {
    return normalized().hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}
