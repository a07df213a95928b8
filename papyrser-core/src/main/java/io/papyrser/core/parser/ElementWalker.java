package io.papyrser.core.parser;

import io.papyrser.core.api.TeiParseException;
import io.papyrser.core.model.Extent;
import io.papyrser.core.model.Line;
import io.papyrser.core.model.Token;
import io.papyrser.core.symbols.AddPlacement;
import io.papyrser.core.symbols.CharacterNormalizer;
import io.papyrser.core.symbols.SymbolTables;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Depth-first walk over one {@code ab} block.
 *
 * <p>Elements that transform their content as a whole ({@code supplied}, {@code hi}, {@code add},
 * the literal part of {@code expan}, the {@code del} of a {@code subst}) collect their tokens in a
 * {@link Frame}. A line break inside such an element drains every open frame into its parent and
 * then into the line, so a passage spanning two lines yields one token per line.
 *
 * <p>Not thread-safe; one instance per text part.
 */
final class ElementWalker {
  private static final Logger log = LoggerFactory.getLogger(ElementWalker.class);

  /** Elements whose content never reaches the output. */
  static final Set<String> SKIPPED =
      Set.of("del", "reg", "corr", "rdg", "note", "desc", "figDesc", "bibl");

  /** Elements whose content is read as if the element were absent. */
  static final Set<String> TRANSPARENT =
      Set.of(
          "choice", "app", "lem", "orig", "sic", "abbr", "surplus", "q", "foreign", "seg", "w",
          "name", "persName", "placeName", "geogName", "orgName", "date", "rs", "term", "measure",
          "div", "ab", "p", "l", "lg", "handShift", "certainty", "am");

  private final SymbolTables tables;
  private final CharacterNormalizer normalizer;
  private final boolean debug;
  private final LineBuffer buffer;
  private final Deque<Frame> frames = new ArrayDeque<>();

  private int unclearDepth;
  private String element = "ab";

  ElementWalker(
      SymbolTables tables,
      CharacterNormalizer normalizer,
      BoundaryResolver resolver,
      String part,
      boolean debug) {
    this.tables = tables;
    this.normalizer = normalizer;
    this.debug = debug;
    this.buffer = new LineBuffer(resolver, part, debug);
  }

  List<Line> walk(Element ab) throws TeiParseException {
    walkChildren(ab);
    return buffer.finish();
  }

  private void walkChildren(Node parent) throws TeiParseException {
    for (Node child : Dom.children(parent)) {
      walkNode(child);
    }
  }

  private void walkNode(Node node) throws TeiParseException {
    switch (node.getNodeType()) {
      case Node.TEXT_NODE:
      case Node.CDATA_SECTION_NODE:
        text(node.getNodeValue());
        break;
      case Node.ELEMENT_NODE:
        String outer = element;
        element = Dom.localName(node);
        try {
          walkElement((Element) node, element);
        } finally {
          element = outer;
        }
        break;
      default:
        // comments and processing instructions
        break;
    }
  }

  private void walkElement(Element el, String name) throws TeiParseException {
    if (debug) {
      log.debug("<{}> at line {}", name, buffer.currentNumber());
    }
    switch (name) {
      case "lb":
        lineBreak(Dom.attr(el, "n"));
        break;
      case "gap":
        gap(el);
        break;
      case "space":
        space(el);
        break;
      case "supplied":
        supplied(el);
        break;
      case "unclear":
        unclearDepth++;
        try {
          walkChildren(el);
        } finally {
          unclearDepth--;
        }
        break;
      case "milestone":
        milestone(el);
        break;
      case "expan":
        expansion(el);
        break;
      case "ex":
        // only meaningful inside expan
        break;
      case "g":
        String type = Dom.attr(el, "type");
        if (type != null) {
          emit(new Token.GlyphType(type));
        }
        break;
      case "hi":
        highlight(el);
        break;
      case "add":
        addition(el);
        break;
      case "num":
        walkChildren(el);
        if ("tick".equals(Dom.attr(el, "rend"))) {
          emit(new Token.GlyphType("apostrophe"));
        }
        break;
      case "subst":
        substitution(el);
        break;
      default:
        if (SKIPPED.contains(name)) {
          if (debug) {
            log.debug("Skipped <{}>", name);
          }
        } else if (TRANSPARENT.contains(name)) {
          walkChildren(el);
        } else {
          unknown(el, name);
        }
    }
  }

  private void unknown(Element el, String name) throws TeiParseException {
    String content = el.getTextContent();
    if (!normalizer.normalize(content).isEmpty()) {
      throw TeiParseException.unsupportedElement(name, buffer.currentNumber(), content);
    }
    if (debug) {
      log.debug("Ignored content-free <{}>", name);
    }
  }

  private void text(String value) throws TeiParseException {
    if (value == null) {
      return;
    }
    Token.Certainty certainty =
        unclearDepth > 0 ? Token.Certainty.UNCERTAIN : Token.Certainty.CERTAIN;
    Iterator<Integer> it = normalizer.normalize(value).codePoints().iterator();
    while (it.hasNext()) {
      emit(new Token.Glyph(it.next(), certainty));
    }
  }

  private void lineBreak(String n) throws TeiParseException {
    drainFrames();
    buffer.openLine(n);
  }

  private void gap(Element el) throws TeiParseException {
    Optional<Extent> extent = extentOf(el);
    if (extent.isPresent()) {
      emit(new Token.Gap(extent.get(), Token.Reason.fromAttribute(Dom.attr(el, "reason"))));
    }
  }

  private void space(Element el) throws TeiParseException {
    Optional<Extent> extent = extentOf(el);
    if (extent.isPresent()) {
      emit(new Token.Space(extent.get()));
    }
  }

  /**
   * Character extent of a {@code gap} or {@code space}.
   *
   * @return empty for line-unit elements, which produce no token
   */
  static Optional<Extent> extentOf(Element el) {
    String unit = Dom.attr(el, "unit");
    if ("line".equals(unit)) {
      return Optional.empty();
    }
    if (!"character".equals(unit)) {
      return Optional.of(Extent.UNKNOWN);
    }
    try {
      String quantity = Dom.attr(el, "quantity");
      if (quantity != null) {
        return Optional.of(Extent.of(Integer.parseInt(quantity.strip())));
      }
      String atLeast = Dom.attr(el, "atLeast");
      String atMost = Dom.attr(el, "atMost");
      if (atLeast != null && atMost != null) {
        double mean = (Integer.parseInt(atLeast.strip()) + Integer.parseInt(atMost.strip())) / 2.0;
        return Optional.of(Extent.of((int) Math.rint(mean)));
      }
    } catch (NumberFormatException e) {
      log.debug("Unreadable extent on <{}>: {}", Dom.localName(el), e.getMessage());
    }
    return Optional.of(Extent.UNKNOWN);
  }

  private void supplied(Element el) throws TeiParseException {
    if ("omitted".equals(Dom.attr(el, "reason"))) {
      return;
    }
    within(new Frame(ElementWalker::suppliedOf), el);
  }

  private static List<Token> suppliedOf(List<Token> inner) {
    Extent length = measure(inner);
    if (length.known() && length.count() == 0) {
      return List.of();
    }
    return List.of(new Token.Supplied(length));
  }

  /** Number of characters the tokens occupy in the line; unknown gaps make it unknown. */
  static Extent measure(List<Token> tokens) {
    Extent total = Extent.of(0);
    for (Token token : tokens) {
      if (token instanceof Token.Glyph || token instanceof Token.GlyphType) {
        total = total.plus(Extent.of(1));
      } else if (token instanceof Token.Abbreviation) {
        if (!((Token.Abbreviation) token).expansionTextPresent()) {
          total = total.plus(Extent.of(1));
        }
      } else if (token instanceof Token.GapLike) {
        total = total.plus(((Token.GapLike) token).extent());
      } else if (token instanceof Token.Rendition) {
        total = total.plus(measure(((Token.Rendition) token).inner()));
      } else if (token instanceof Token.Added && !((Token.Added) token).relocates()) {
        total = total.plus(measure(((Token.Added) token).inner()));
      }
    }
    return total;
  }

  private void milestone(Element el) throws TeiParseException {
    String rend = Dom.attr(el, "rend");
    if (rend == null) {
      return;
    }
    drainFrames();
    buffer.openMilestone(new Token.Milestone(rend), "milestone");
  }

  private void expansion(Element expan) throws TeiParseException {
    Frame literal = push(new Frame(UnaryOperator.identity()));
    List<Element> abbreviated = new ArrayList<>();
    try {
      for (Node child : Dom.children(expan)) {
        if (child.getNodeType() == Node.ELEMENT_NODE && "ex".equals(Dom.localName(child))) {
          abbreviated.add((Element) child);
        } else {
          walkNode(child);
        }
      }
    } finally {
      frames.pop();
    }
    List<Token> content = literal.drain();
    for (Token token : content) {
      emit(token);
    }
    boolean spelledOut = literal.producedAny();
    for (Element ex : abbreviated) {
      String expansion = normalizer.normalize(ex.getTextContent());
      if (!expansion.isEmpty()) {
        emit(new Token.Abbreviation(expansion, spelledOut));
      }
    }
  }

  private void highlight(Element el) throws TeiParseException {
    String rend = Dom.attr(el, "rend");
    if (rend == null) {
      walkChildren(el);
      return;
    }
    within(
        new Frame(inner -> inner.isEmpty() ? inner : List.of(new Token.Rendition(rend, inner))),
        el);
  }

  private void addition(Element el) throws TeiParseException {
    String place = Dom.attr(el, "place");
    String key = place == null ? "unspecified" : place;
    Optional<AddPlacement> placement = tables.placement(key);
    within(new Frame(inner -> additionOf(key, placement, inner)), el);
  }

  private static List<Token> additionOf(
      String place, Optional<AddPlacement> placement, List<Token> inner) {
    if (inner.isEmpty()) {
      return inner;
    }
    if (placement.isEmpty()) {
      // reported by the formatter
      return List.of(new Token.Added(place, Token.Target.NONE, inner));
    }
    AddPlacement p = placement.get();
    if (p.inline()
        || (p.inlineSingleGlyph() && inner.size() == 1 && inner.get(0) instanceof Token.Glyph)) {
      return inner;
    }
    return List.of(new Token.Added(place, p.target(), inner));
  }

  private void substitution(Element subst) throws TeiParseException {
    Element inlineAdd = null;
    List<Element> deletions = new ArrayList<>();
    for (Node child : Dom.children(subst)) {
      if (child.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      Element el = (Element) child;
      String name = Dom.localName(el);
      if ("add".equals(name) && inlineAdd == null && isInline(Dom.attr(el, "place"))) {
        inlineAdd = el;
      } else if ("del".equals(name)) {
        deletions.add(el);
      }
    }
    if (inlineAdd != null) {
      walkChildren(inlineAdd);
      return;
    }
    for (Element del : deletions) {
      within(new Frame(ElementWalker::withoutBracketed), del);
    }
  }

  private boolean isInline(String place) {
    return place == null || tables.placement(place).map(AddPlacement::inline).orElse(false);
  }

  private static List<Token> withoutBracketed(List<Token> inner) {
    List<Token> kept = new ArrayList<>(inner.size());
    for (Token token : inner) {
      if (!(token instanceof Token.GapLike && ((Token.GapLike) token).bracketed())) {
        kept.add(token);
      }
    }
    return kept;
  }

  private void within(Frame frame, Element el) throws TeiParseException {
    push(frame);
    try {
      walkChildren(el);
    } finally {
      frames.pop();
    }
    for (Token token : frame.drain()) {
      emit(token);
    }
  }

  private Frame push(Frame frame) {
    frames.push(frame);
    return frame;
  }

  private void emit(Token token) throws TeiParseException {
    Frame top = frames.peek();
    if (top != null) {
      top.collect(token);
    } else {
      buffer.append(token, element);
    }
  }

  /** Hands partial frame content down to the line, innermost frame first. */
  private void drainFrames() throws TeiParseException {
    List<Frame> open = new ArrayList<>(frames);
    for (int i = 0; i < open.size(); i++) {
      List<Token> out = open.get(i).drain();
      for (Token token : out) {
        if (i + 1 < open.size()) {
          open.get(i + 1).collect(token);
        } else {
          buffer.append(token, element);
        }
      }
    }
  }

  /** Tokens collected by an element that transforms its content as a whole. */
  static final class Frame {
    private final UnaryOperator<List<Token>> completion;
    private final List<Token> collected = new ArrayList<>();
    private boolean producedAny;

    Frame(UnaryOperator<List<Token>> completion) {
      this.completion = completion;
    }

    void collect(Token token) {
      collected.add(token);
    }

    List<Token> drain() {
      List<Token> out = completion.apply(List.copyOf(collected));
      collected.clear();
      producedAny |= !out.isEmpty();
      return out;
    }

    boolean producedAny() {
      return producedAny;
    }
  }
}
