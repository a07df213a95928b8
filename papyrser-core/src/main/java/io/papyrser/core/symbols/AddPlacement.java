package io.papyrser.core.symbols;

import io.papyrser.core.model.Token;
import java.util.Objects;

/**
 * Treatment of an {@code add/@place} value.
 *
 * @param marker arrow left in the line where the addition sits, may be empty
 * @param inline whether the addition is read in place, like ordinary text
 * @param target line the added text moves to when not inline
 * @param inlineSingleGlyph whether a one-letter addition is read in place regardless of target
 */
public record AddPlacement(
    String marker, boolean inline, Token.Target target, boolean inlineSingleGlyph) {

  public AddPlacement {
    Objects.requireNonNull(marker, "marker");
    Objects.requireNonNull(target, "target");
  }
}
