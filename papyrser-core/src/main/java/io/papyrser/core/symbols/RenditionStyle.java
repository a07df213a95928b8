package io.papyrser.core.symbols;

import java.util.Objects;

/**
 * How a {@code hi/@rend} value is rendered.
 *
 * @param mark combining characters appended to the highlighted text, empty for typographic
 *     renditions with no D5 counterpart
 * @param scope whether the mark follows the whole passage once or every base character
 */
public record RenditionStyle(String mark, Scope scope) {

  public enum Scope {
    TRAILING,
    EACH
  }

  public RenditionStyle {
    Objects.requireNonNull(mark, "mark");
    Objects.requireNonNull(scope, "scope");
  }

  public boolean noOp() {
    return mark.isEmpty();
  }
}
