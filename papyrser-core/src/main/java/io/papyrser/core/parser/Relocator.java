package io.papyrser.core.parser;

import io.papyrser.core.model.Line;
import io.papyrser.core.model.LineKind;
import io.papyrser.core.model.Token;
import java.util.ArrayList;
import java.util.List;

/**
 * Second pass over the lines of a text part: the content of every relocating {@link Token.Added}
 * becomes an {@link LineKind#INSERTION} line placed right before or after the line holding it.
 * The addition keeps its marker and shares a fresh id with the inserted line. Additions nested in
 * a relocated addition get their own lines next to the insertion line of the outer one.
 */
final class Relocator {
  private final BoundaryResolver resolver;
  private int nextId;

  Relocator(BoundaryResolver resolver) {
    this.resolver = resolver;
  }

  List<Line> relocate(List<Line> lines) {
    List<Line> result = new ArrayList<>(lines.size());
    for (Line line : lines) {
      List<Line> before = new ArrayList<>();
      List<Line> after = new ArrayList<>();
      List<Token> tokens = new ArrayList<>(line.tokens().size());
      for (Token token : line.tokens()) {
        tokens.add(rewrite(token, line.number(), before, after));
      }
      result.addAll(before);
      result.add(
          before.isEmpty() && after.isEmpty()
              ? line
              : new Line(line.number(), line.kind(), tokens, line.relocationId()));
      result.addAll(after);
    }
    return result;
  }

  private Token rewrite(Token token, String number, List<Line> before, List<Line> after) {
    if (token instanceof Token.Rendition) {
      Token.Rendition rendition = (Token.Rendition) token;
      List<Token> inner = new ArrayList<>();
      for (Token t : rendition.inner()) {
        inner.add(rewrite(t, number, before, after));
      }
      return new Token.Rendition(rendition.type(), inner);
    }
    if (!(token instanceof Token.Added)) {
      return token;
    }
    Token.Added added = (Token.Added) token;
    if (!added.relocates() || added.inner().isEmpty()) {
      return added;
    }
    int id = nextId++;
    List<Line> nestedBefore = new ArrayList<>();
    List<Line> nestedAfter = new ArrayList<>();
    List<Token> inner = new ArrayList<>(added.inner().size());
    for (Token t : added.inner()) {
      inner.add(rewrite(t, number, nestedBefore, nestedAfter));
    }
    // nested additions are placed around the insertion line of their parent
    List<Line> side = added.target() == Token.Target.PREVIOUS ? before : after;
    side.addAll(nestedBefore);
    side.add(new Line(number, LineKind.INSERTION, resolver.resolve(inner), id));
    side.addAll(nestedAfter);
    return new Token.Added(added.place(), added.target(), inner, id);
  }
}
