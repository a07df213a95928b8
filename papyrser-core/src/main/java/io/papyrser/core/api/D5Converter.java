package io.papyrser.core.api;

import io.papyrser.core.format.FormattedTranscription;
import io.papyrser.core.format.Formatter;
import io.papyrser.core.model.Transcription;
import io.papyrser.core.parser.TeiParser;
import io.papyrser.core.symbols.CharacterNormalizer;
import io.papyrser.core.symbols.SymbolTables;
import org.w3c.dom.Document;

/** Parses and formats an edition in one call. Shareable between threads. */
public final class D5Converter {
  private final TeiParser parser;
  private final Formatter formatter;

  public D5Converter(ConversionOptions options) {
    this(SymbolTables.defaults(), CharacterNormalizer.defaults(), options);
  }

  public D5Converter(
      SymbolTables tables, CharacterNormalizer normalizer, ConversionOptions options) {
    this.parser = new TeiParser(tables, normalizer, options);
    this.formatter = new Formatter(tables, normalizer, options);
  }

  /**
   * Converts an edition to D5.
   *
   * @param document the TEI document
   * @param id catalog identifier, or null to read it from the document
   * @return the formatted edition
   * @throws TeiParseException if the markup cannot be turned into lines
   * @throws UnsupportedSymbolException if a symbol has no table entry and issues are not ignored
   * @throws FormattingException if a line is malformed and issues are not ignored
   */
  public FormattedTranscription convert(Document document, String id) throws PapyrserException {
    Transcription transcription = parser.parse(document, id);
    return formatter.format(transcription);
  }

  public TeiParser parser() {
    return parser;
  }

  public Formatter formatter() {
    return formatter;
  }
}
