package io.papyrser.core.parser;

import io.papyrser.core.model.Position;
import io.papyrser.core.model.Token;
import io.papyrser.core.symbols.AddPlacement;
import io.papyrser.core.symbols.SymbolTables;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixes the {@link Position} of gap-like tokens once a line is complete.
 *
 * <p>The maximal leading run of bracketed tokens is marked {@link Position#LINE_START}, the maximal
 * trailing run {@link Position#LINE_END}. A line made only of bracketed tokens is a single leading
 * run. Tokens that render with zero width (vacats, spelled-out abbreviations, additions without
 * a marker) are skipped when looking for the edges. A rendition holding only gap-like tokens counts
 * as one of them, its inner tokens taking the position.
 */
public final class BoundaryResolver {
  private final SymbolTables tables;

  public BoundaryResolver(SymbolTables tables) {
    this.tables = tables;
  }

  public List<Token> resolve(List<Token> tokens) {
    List<Token> result = new ArrayList<>(tokens.size());
    List<Integer> edges = new ArrayList<>();
    for (Token token : tokens) {
      token = position(token, Position.MID_LINE);
      if (!transparent(token)) {
        edges.add(result.size());
      }
      result.add(token);
    }
    if (edges.isEmpty()) {
      return result;
    }

    int lead = 0;
    while (lead < edges.size() && bracketed(result.get(edges.get(lead)))) {
      mark(result, edges.get(lead), Position.LINE_START);
      lead++;
    }
    if (lead == edges.size()) {
      return result;
    }
    if (lead == 0 && gapLike(result.get(edges.get(0)))) {
      mark(result, edges.get(0), Position.LINE_START);
    }

    int trail = edges.size() - 1;
    while (trail >= lead && bracketed(result.get(edges.get(trail)))) {
      mark(result, edges.get(trail), Position.LINE_END);
      trail--;
    }
    int last = edges.size() - 1;
    if (trail == last && last > 0 && gapLike(result.get(edges.get(last)))) {
      mark(result, edges.get(last), Position.LINE_END);
    }
    return result;
  }

  private static void mark(List<Token> tokens, int index, Position position) {
    tokens.set(index, position(tokens.get(index), position));
  }

  private static Token position(Token token, Position position) {
    if (token instanceof Token.GapLike) {
      return ((Token.GapLike) token).withPosition(position);
    }
    if (token instanceof Token.Rendition) {
      Token.Rendition rendition = (Token.Rendition) token;
      List<Token> inner = new ArrayList<>(rendition.inner().size());
      for (Token t : rendition.inner()) {
        inner.add(position(t, position));
      }
      return new Token.Rendition(rendition.type(), inner);
    }
    return token;
  }

  private static boolean gapLike(Token token) {
    if (token instanceof Token.Rendition) {
      List<Token> inner = ((Token.Rendition) token).inner();
      return !inner.isEmpty() && inner.stream().allMatch(BoundaryResolver::gapLike);
    }
    return token instanceof Token.GapLike;
  }

  private static boolean bracketed(Token token) {
    if (token instanceof Token.Rendition) {
      List<Token> inner = ((Token.Rendition) token).inner();
      return !inner.isEmpty() && inner.stream().allMatch(BoundaryResolver::bracketed);
    }
    return token instanceof Token.GapLike && ((Token.GapLike) token).bracketed();
  }

  boolean transparent(Token token) {
    if (token instanceof Token.Space) {
      return true;
    }
    if (token instanceof Token.Abbreviation) {
      return ((Token.Abbreviation) token).expansionTextPresent();
    }
    if (token instanceof Token.Added) {
      Token.Added added = (Token.Added) token;
      return added.relocates()
          && tables.placement(added.place()).map(AddPlacement::marker).orElse("?").isEmpty();
    }
    return false;
  }
}
