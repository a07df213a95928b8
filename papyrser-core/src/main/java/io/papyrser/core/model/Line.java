package io.papyrser.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A closed line of a text part.
 *
 * @param number line number as written in {@code lb/@n}, or derived from the previous line
 * @param kind how the line came into existence
 * @param tokens tokens in document order
 * @param relocationId for {@link LineKind#INSERTION} lines, the id shared with the {@link
 *     Token.Added} whose content the line holds; otherwise {@link Token.Added#NOT_RELOCATED}
 */
public record Line(String number, LineKind kind, List<Token> tokens, int relocationId) {

  public Line {
    Objects.requireNonNull(number, "number");
    Objects.requireNonNull(kind, "kind");
    tokens = List.copyOf(tokens);
  }

  public Line(String number, LineKind kind, List<Token> tokens) {
    this(number, kind, tokens, Token.Added.NOT_RELOCATED);
  }

  public boolean isEmpty() {
    return tokens.isEmpty();
  }
}
