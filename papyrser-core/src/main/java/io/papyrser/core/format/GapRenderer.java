package io.papyrser.core.format;

import io.papyrser.core.model.Extent;
import io.papyrser.core.model.Position;
import io.papyrser.core.model.Token;

/**
 * Bracket and dash notation for gaps and supplied passages.
 *
 * <pre>
 * position    token                  known(n)      unknown
 * LINE_START  bracketed              ]             ]
 * LINE_END    bracketed              [             [
 * MID_LINE    lost gap, supplied     [n dashes]    [?]
 * any         illegible gap          n dashes      [?]
 * </pre>
 */
public final class GapRenderer {
  public static final String UNKNOWN = "[?]";

  public enum Variant {
    GAP,
    SUPPLIED
  }

  private GapRenderer() {}

  public static String render(Token.GapLike token) {
    if (token instanceof Token.Gap) {
      Token.Gap gap = (Token.Gap) token;
      return render(Variant.GAP, gap.reason(), gap.position(), gap.extent());
    }
    return render(Variant.SUPPLIED, Token.Reason.LOST, token.position(), token.extent());
  }

  public static String render(
      Variant variant, Token.Reason reason, Position position, Extent extent) {
    boolean illegible = variant == Variant.GAP && reason == Token.Reason.ILLEGIBLE;
    if (illegible && extent.known()) {
      return dashes(extent.count());
    }
    switch (position) {
      case LINE_START:
        return "]";
      case LINE_END:
        return "[";
      default:
        return extent.known() ? "[" + dashes(extent.count()) + "]" : UNKNOWN;
    }
  }

  /** Single mid-line bracket for a run of adjacent bracketed tokens. */
  static String merged(Extent total) {
    return render(Variant.SUPPLIED, Token.Reason.LOST, Position.MID_LINE, total);
  }

  static String dashes(int count) {
    return "-".repeat(count);
  }
}
