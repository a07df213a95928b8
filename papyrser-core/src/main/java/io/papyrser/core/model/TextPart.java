package io.papyrser.core.model;

import java.util.List;

/**
 * Lines of one {@code ab} block of the edition.
 *
 * @param n {@code @n} of the enclosing {@code div}, may be null
 * @param subtype {@code @subtype} of the enclosing {@code div}, may be null
 * @param language nearest {@code @xml:lang} in scope, may be null
 * @param lines closed lines including relocated insertions
 */
public record TextPart(String n, String subtype, String language, List<Line> lines) {

  public TextPart {
    lines = List.copyOf(lines);
  }
}
