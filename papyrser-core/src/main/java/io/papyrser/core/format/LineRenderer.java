package io.papyrser.core.format;

import io.papyrser.core.model.Extent;
import io.papyrser.core.model.Line;
import io.papyrser.core.model.Position;
import io.papyrser.core.model.Token;
import io.papyrser.core.symbols.AddPlacement;
import io.papyrser.core.symbols.CharacterNormalizer;
import io.papyrser.core.symbols.RenditionStyle;
import io.papyrser.core.symbols.SymbolTables;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Turns the tokens of a line into D5 text. Table misses are reported to the {@link Findings} and
 * render as nothing.
 */
final class LineRenderer {
  private final SymbolTables tables;
  private final CharacterNormalizer normalizer;

  LineRenderer(SymbolTables tables, CharacterNormalizer normalizer) {
    this.tables = tables;
    this.normalizer = normalizer;
  }

  /** Text of the line and one record per token, vacats at the edges excluded. */
  record Rendered(String text, List<TokenRecord> records) {}

  Rendered render(Line line, boolean correctLookalikes, Findings findings) {
    Context ctx = new Context(line.number(), correctLookalikes, findings);
    List<TokenRecord> records = new ArrayList<>();
    String text = sequence(trimVacats(line.tokens()), ctx, records);
    return new Rendered(text, records);
  }

  private static List<Token> trimVacats(List<Token> tokens) {
    int from = 0;
    int to = tokens.size();
    while (from < to && tokens.get(from) instanceof Token.Space) {
      from++;
    }
    while (to > from && tokens.get(to - 1) instanceof Token.Space) {
      to--;
    }
    return tokens.subList(from, to);
  }

  private String sequence(List<Token> tokens, Context ctx, List<TokenRecord> records) {
    StringBuilder out = new StringBuilder();
    boolean lastWasFallback = false;
    int i = 0;
    while (i < tokens.size()) {
      Token token = tokens.get(i);
      if (isBracketed(token)) {
        Position position = ((Token.GapLike) token).position();
        Extent total = Extent.of(0);
        int j = i;
        while (j < tokens.size()
            && isBracketed(tokens.get(j))
            && ((Token.GapLike) tokens.get(j)).position() == position) {
          total = total.plus(((Token.GapLike) tokens.get(j)).extent());
          j++;
        }
        String rendered =
            position == Position.MID_LINE
                ? GapRenderer.merged(total)
                : GapRenderer.render((Token.GapLike) token);
        out.append(rendered);
        if (records != null) {
          for (int k = i; k < j; k++) {
            records.add(record(tokens.get(k), k == i ? rendered : ""));
          }
        }
        lastWasFallback = false;
        i = j;
        continue;
      }

      String rendered = token(token, ctx);
      if (token instanceof Token.Abbreviation && tables.isAbbreviationFallback(rendered)) {
        if (lastWasFallback) {
          rendered = "";
        }
        lastWasFallback = true;
      } else if (!rendered.isEmpty()) {
        lastWasFallback = false;
      }
      out.append(rendered);
      if (records != null) {
        records.add(record(token, rendered));
      }
      i++;
    }
    return out.toString();
  }

  private static boolean isBracketed(Token token) {
    return token instanceof Token.GapLike && ((Token.GapLike) token).bracketed();
  }

  private String token(Token token, Context ctx) {
    if (token instanceof Token.Glyph) {
      return glyph((Token.Glyph) token, ctx);
    }
    if (token instanceof Token.GapLike) {
      return GapRenderer.render((Token.GapLike) token);
    }
    if (token instanceof Token.Space) {
      Extent extent = ((Token.Space) token).extent();
      return extent.known() ? " ".repeat(extent.count()) : " ? ";
    }
    if (token instanceof Token.Milestone) {
      String rend = ((Token.Milestone) token).rendition();
      return lookup(tables.milestone(rend), SymbolTables.MILESTONES, rend, "milestone", ctx);
    }
    if (token instanceof Token.GlyphType) {
      String type = ((Token.GlyphType) token).type();
      return lookup(tables.glyph(type), SymbolTables.GLYPH_TYPES, type, "g", ctx);
    }
    if (token instanceof Token.Abbreviation) {
      Token.Abbreviation abbreviation = (Token.Abbreviation) token;
      if (abbreviation.expansionTextPresent()) {
        return "";
      }
      String expansion = abbreviation.expansion();
      String symbol =
          lookup(tables.abbreviation(expansion), SymbolTables.ABBREVIATIONS, expansion, "ex", ctx);
      if (tables.isAbbreviationFallback(symbol)) {
        ctx.findings.add(ValidationIssue.fallbackAbbreviation(expansion, symbol, ctx.line));
      }
      return symbol;
    }
    if (token instanceof Token.Rendition) {
      return rendition((Token.Rendition) token, ctx);
    }
    if (token instanceof Token.Added) {
      String place = ((Token.Added) token).place();
      Optional<String> marker = tables.placement(place).map(AddPlacement::marker);
      return lookup(marker, SymbolTables.PLACEMENTS, place, "add", ctx);
    }
    throw new IllegalStateException("Unhandled token " + token);
  }

  private String glyph(Token.Glyph glyph, Context ctx) {
    if (ctx.correctLookalikes) {
      OptionalInt greek = normalizer.latinLookalike(glyph.codePoint());
      if (greek.isPresent()) {
        Token.Glyph corrected = glyph.withCodePoint(greek.getAsInt());
        ctx.findings.corrected(
            String.format(
                "Changed \"%s\" to \"%s\" in line %s", glyph.text(), corrected.text(), ctx.line));
        glyph = corrected;
      }
    }
    return glyph.uncertain() ? normalizer.markUncertain(glyph.text()) : glyph.text();
  }

  private String rendition(Token.Rendition rendition, Context ctx) {
    Optional<RenditionStyle> style = tables.rendition(rendition.type());
    if (style.isEmpty()) {
      report(SymbolTables.RENDITIONS, rendition.type(), "hi", ctx);
      return sequence(rendition.inner(), ctx, null);
    }
    if (style.get().scope() == RenditionStyle.Scope.EACH) {
      return markEachGlyph(rendition.inner(), style.get().mark(), ctx);
    }
    // nested trailing renditions: marks follow the content outermost first
    StringBuilder marks = new StringBuilder(style.get().mark());
    Token.Rendition innermost = rendition;
    while (innermost.inner().size() == 1 && innermost.inner().get(0) instanceof Token.Rendition) {
      Token.Rendition nested = (Token.Rendition) innermost.inner().get(0);
      Optional<RenditionStyle> nestedStyle = tables.rendition(nested.type());
      if (nestedStyle.isEmpty() || nestedStyle.get().scope() != RenditionStyle.Scope.TRAILING) {
        break;
      }
      marks.append(nestedStyle.get().mark());
      innermost = nested;
    }
    return sequence(innermost.inner(), ctx, null) + marks;
  }

  /** Marks the letters and symbols of {@code inner}; gaps and their brackets stay unmarked. */
  private String markEachGlyph(List<Token> inner, String mark, Context ctx) {
    StringBuilder out = new StringBuilder();
    int i = 0;
    while (i < inner.size()) {
      boolean gaps = inner.get(i) instanceof Token.GapLike;
      int j = i;
      while (j < inner.size() && (inner.get(j) instanceof Token.GapLike) == gaps) {
        j++;
      }
      String text = sequence(inner.subList(i, j), ctx, null);
      out.append(gaps ? text : markEach(text, mark));
      i = j;
    }
    return out.toString();
  }

  /** Appends {@code mark} after every base character and its combining marks. */
  static String markEach(String text, String mark) {
    if (mark.isEmpty() || text.isEmpty()) {
      return text;
    }
    StringBuilder out = new StringBuilder();
    boolean open = false;
    for (int cp : text.codePoints().toArray()) {
      int type = Character.getType(cp);
      boolean combining =
          type == Character.NON_SPACING_MARK
              || type == Character.ENCLOSING_MARK
              || type == Character.COMBINING_SPACING_MARK;
      if (!combining && open) {
        out.append(mark);
      }
      out.appendCodePoint(cp);
      open = true;
    }
    return out.append(mark).toString();
  }

  private String lookup(
      Optional<String> symbol, String table, String value, String element, Context ctx) {
    if (symbol.isPresent()) {
      return symbol.get();
    }
    report(table, value, element, ctx);
    return "";
  }

  private static void report(String table, String value, String element, Context ctx) {
    ctx.findings.add(ValidationIssue.unsupportedSymbol(table, value, element, ctx.line));
  }

  private static TokenRecord record(Token token, String rendered) {
    if (token instanceof Token.Glyph) {
      String detail = ((Token.Glyph) token).uncertain() ? "uncertain" : "";
      return new TokenRecord("glyph", detail, rendered);
    }
    if (token instanceof Token.Gap) {
      Token.Gap gap = (Token.Gap) token;
      return new TokenRecord(
          "gap", gap.reason().name().toLowerCase(Locale.ROOT) + ":" + gap.extent(), rendered);
    }
    if (token instanceof Token.Supplied) {
      return new TokenRecord("supplied", ((Token.Supplied) token).extent().toString(), rendered);
    }
    if (token instanceof Token.Space) {
      return new TokenRecord("space", ((Token.Space) token).extent().toString(), rendered);
    }
    if (token instanceof Token.Milestone) {
      return new TokenRecord("milestone", ((Token.Milestone) token).rendition(), rendered);
    }
    if (token instanceof Token.Abbreviation) {
      return new TokenRecord("abbreviation", ((Token.Abbreviation) token).expansion(), rendered);
    }
    if (token instanceof Token.GlyphType) {
      return new TokenRecord("glyph-type", ((Token.GlyphType) token).type(), rendered);
    }
    if (token instanceof Token.Rendition) {
      return new TokenRecord("rendition", ((Token.Rendition) token).type(), rendered);
    }
    Token.Added added = (Token.Added) token;
    return new TokenRecord("added", added.place(), rendered);
  }

  private static final class Context {
    private final String line;
    private final boolean correctLookalikes;
    private final Findings findings;

    private Context(String line, boolean correctLookalikes, Findings findings) {
      this.line = line;
      this.correctLookalikes = correctLookalikes;
      this.findings = findings;
    }
  }
}
