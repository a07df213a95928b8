package io.papyrser.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One unit of a transcription line.
 *
 * <p>Tokens are immutable. Gap-like tokens ({@link Gap}, {@link Supplied}) carry a {@link
 * Position} that the parser fixes once their line is closed; until then they are created as
 * {@link Position#MID_LINE}.
 */
public sealed interface Token
    permits Token.GapLike,
        Token.Glyph,
        Token.Space,
        Token.Milestone,
        Token.Abbreviation,
        Token.GlyphType,
        Token.Rendition,
        Token.Added {

  enum Certainty {
    CERTAIN,
    UNCERTAIN
  }

  enum Reason {
    LOST,
    ILLEGIBLE;

    public static Reason fromAttribute(String reason) {
      return "illegible".equals(reason) ? ILLEGIBLE : LOST;
    }
  }

  /** Line an {@link Added} passage is moved to. */
  enum Target {
    PREVIOUS,
    NEXT,
    /** Only the placement marker stays; the passage is not reproduced. */
    NONE
  }

  /** Tokens rendered from the bracket/dash family. */
  sealed interface GapLike extends Token permits Gap, Supplied {
    Extent extent();

    Position position();

    GapLike withPosition(Position position);

    /**
     * Whether this token renders inside square brackets when it is mid-line. Only known-length
     * illegible gaps render as a bare dash run.
     */
    boolean bracketed();
  }

  /** A single normalized character. */
  record Glyph(int codePoint, Certainty certainty) implements Token {
    public static Glyph certain(int codePoint) {
      return new Glyph(codePoint, Certainty.CERTAIN);
    }

    public Glyph withCodePoint(int replacement) {
      return new Glyph(replacement, certainty);
    }

    public boolean uncertain() {
      return certainty == Certainty.UNCERTAIN;
    }

    public String text() {
      return new String(Character.toChars(codePoint));
    }
  }

  /** Physically missing or unreadable text. */
  record Gap(Extent extent, Reason reason, Position position) implements GapLike {
    public Gap {
      Objects.requireNonNull(extent, "extent");
      Objects.requireNonNull(reason, "reason");
      Objects.requireNonNull(position, "position");
    }

    public Gap(Extent extent, Reason reason) {
      this(extent, reason, Position.MID_LINE);
    }

    @Override
    public Gap withPosition(Position position) {
      return new Gap(extent, reason, position);
    }

    @Override
    public boolean bracketed() {
      return reason == Reason.LOST || !extent.known();
    }
  }

  /** Text restored by the editor. */
  record Supplied(Extent extent, Position position) implements GapLike {
    public Supplied {
      Objects.requireNonNull(extent, "extent");
      Objects.requireNonNull(position, "position");
    }

    public Supplied(Extent extent) {
      this(extent, Position.MID_LINE);
    }

    @Override
    public Supplied withPosition(Position position) {
      return new Supplied(extent, position);
    }

    @Override
    public boolean bracketed() {
      return true;
    }
  }

  /** Blank space left by the scribe (vacat). */
  record Space(Extent extent) implements Token {}

  /** Structural marker that starts its own line. */
  record Milestone(String rendition) implements Token {}

  /**
   * Abbreviation whose expansion is supplied only by the editor.
   *
   * @param expansion normalized text of the {@code ex} element
   * @param expansionTextPresent whether the source spells the word out; such tokens render nothing
   */
  record Abbreviation(String expansion, boolean expansionTextPresent) implements Token {}

  /** Special glyph named by {@code g/@type}. */
  record GlyphType(String type) implements Token {}

  /** Tokens highlighted by {@code hi/@rend}. */
  record Rendition(String type, List<Token> inner) implements Token {
    public Rendition {
      inner = List.copyOf(inner);
    }
  }

  /**
   * Scribal addition outside the line. The marker for {@code place} stays in the line; the inner
   * tokens move to the line identified by {@code relocationId} when {@code target} is {@link
   * Target#PREVIOUS} or {@link Target#NEXT}.
   */
  record Added(String place, Target target, List<Token> inner, int relocationId)
      implements Token {
    public static final int NOT_RELOCATED = -1;

    public Added {
      inner = List.copyOf(inner);
    }

    public Added(String place, Target target, List<Token> inner) {
      this(place, target, inner, NOT_RELOCATED);
    }

    public boolean relocates() {
      return target == Target.PREVIOUS || target == Target.NEXT;
    }
  }
}
