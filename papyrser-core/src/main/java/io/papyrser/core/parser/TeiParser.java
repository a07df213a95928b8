package io.papyrser.core.parser;

import io.papyrser.core.api.ConversionOptions;
import io.papyrser.core.api.TeiParseException;
import io.papyrser.core.model.Line;
import io.papyrser.core.model.TextPart;
import io.papyrser.core.model.Transcription;
import io.papyrser.core.symbols.CharacterNormalizer;
import io.papyrser.core.symbols.SymbolTables;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Builds the line/token model of an EpiDoc edition.
 *
 * <p>Every {@code ab} inside {@code div[@type="edition"]} (or every {@code ab} of the document when
 * there is no edition division) becomes a {@link TextPart}. Lines start at {@code lb}; content
 * before the first {@code lb} of a block is an error. Blocks without any {@code lb} are skipped.
 *
 * <p>Instances hold no per-document state and may be shared between threads.
 */
public final class TeiParser {
  private static final Logger log = LoggerFactory.getLogger(TeiParser.class);

  private final SymbolTables tables;
  private final CharacterNormalizer normalizer;
  private final ConversionOptions options;

  public TeiParser() {
    this(ConversionOptions.DEFAULT);
  }

  public TeiParser(ConversionOptions options) {
    this(SymbolTables.defaults(), CharacterNormalizer.defaults(), options);
  }

  public TeiParser(
      SymbolTables tables, CharacterNormalizer normalizer, ConversionOptions options) {
    this.tables = tables;
    this.normalizer = normalizer;
    this.options = options;
  }

  /**
   * Parses an edition, taking the identifier from its first {@code idno[@type="TM"]}.
   *
   * @param document the TEI document
   * @return the transcription
   * @throws TeiParseException if a text part cannot be turned into lines
   */
  public Transcription parse(Document document) throws TeiParseException {
    return parse(document, null);
  }

  /**
   * Parses an edition.
   *
   * @param document the TEI document
   * @param id catalog identifier; when null the first TM {@code idno} is used
   * @return the transcription
   * @throws TeiParseException if a text part cannot be turned into lines
   */
  public Transcription parse(Document document, String id) throws TeiParseException {
    Element root = document.getDocumentElement();
    if (root == null) {
      throw new TeiParseException("Document has no root element");
    }
    String identifier = id != null ? id : tmNumber(root);
    Set<String> languages = languages(root);
    BoundaryResolver resolver = new BoundaryResolver(tables);
    Relocator relocator = new Relocator(resolver);

    List<TextPart> parts = new ArrayList<>();
    for (Element ab : textBlocks(root)) {
      if (Dom.descendants(ab, "lb").isEmpty()) {
        log.debug("Skipping <ab> without line breaks in {}", identifier);
        continue;
      }
      Element div = Dom.ancestor(ab, "div");
      String n = div == null ? null : Dom.attr(div, "n");
      String subtype = div == null ? null : Dom.attr(div, "subtype");
      ElementWalker walker =
          new ElementWalker(tables, normalizer, resolver, n, options.debugMode());
      List<Line> lines = relocator.relocate(walker.walk(ab));
      parts.add(new TextPart(n, subtype, Dom.inheritedLang(ab), lines));
    }
    if (options.debugMode()) {
      log.debug(
          "Parsed {}: {} text parts, languages {}", identifier, parts.size(), languages);
    }
    return new Transcription(identifier, languages, parts);
  }

  private static List<Element> textBlocks(Element root) {
    List<Element> blocks = new ArrayList<>();
    for (Element div : Dom.descendants(root, "div")) {
      if ("edition".equals(Dom.attr(div, "type"))) {
        blocks.addAll(Dom.descendants(div, "ab"));
      }
    }
    if (blocks.isEmpty()) {
      if ("ab".equals(Dom.localName(root))) {
        blocks.add(root);
      }
      blocks.addAll(Dom.descendants(root, "ab"));
    }
    return blocks;
  }

  private static String tmNumber(Element root) {
    for (Element idno : Dom.descendants(root, "idno")) {
      if ("TM".equals(Dom.attr(idno, "type"))) {
        String value = idno.getTextContent().strip();
        if (!value.isEmpty()) {
          return value.split("\\s+")[0];
        }
      }
    }
    return "";
  }

  /** Every {@code xml:lang} used in the document except English. */
  static Set<String> languages(Element root) {
    Set<String> languages = new LinkedHashSet<>();
    List<Element> elements = new ArrayList<>();
    elements.add(root);
    elements.addAll(Dom.allElements(root));
    for (Element el : elements) {
      String lang = Dom.lang(el);
      if (lang != null && !lang.isBlank() && !"en".equals(lang)) {
        languages.add(lang);
      }
    }
    return languages;
  }
}
