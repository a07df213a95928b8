package io.papyrser.core.format;

import io.papyrser.core.api.ConversionOptions;
import io.papyrser.core.api.FormattingException;
import io.papyrser.core.api.UnsupportedSymbolException;
import io.papyrser.core.model.Line;
import io.papyrser.core.model.LineKind;
import io.papyrser.core.model.TextPart;
import io.papyrser.core.model.Token;
import io.papyrser.core.model.Transcription;
import io.papyrser.core.symbols.CharacterNormalizer;
import io.papyrser.core.symbols.SymbolTables;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes a {@link Transcription} to D5 lines and validates the result.
 *
 * <p>Lines that render empty, or only to a lone {@code ]} or {@code [}, are dropped. Every other
 * line is checked against the vocabulary of the symbol tables and the bracket conventions. Symbol
 * table misses are reported as {@link ValidationIssue.Kind#UNSUPPORTED_SYMBOL}.
 *
 * <p>Instances hold no per-document state and may be shared between threads.
 */
public final class Formatter {
  private static final Logger log = LoggerFactory.getLogger(Formatter.class);

  private final ConversionOptions options;
  private final LineRenderer renderer;
  private final LineValidator validator;

  public Formatter() {
    this(ConversionOptions.DEFAULT);
  }

  public Formatter(ConversionOptions options) {
    this(SymbolTables.defaults(), CharacterNormalizer.defaults(), options);
  }

  public Formatter(
      SymbolTables tables, CharacterNormalizer normalizer, ConversionOptions options) {
    this.options = options;
    this.renderer = new LineRenderer(tables, normalizer);
    this.validator = new LineValidator(normalizer.majusculeLetters(), tables.symbolCodePoints());
  }

  /**
   * Collects every issue of the document without failing on any of them.
   *
   * @param transcription parsed edition
   * @return the report, in line order
   */
  public ValidationReport validate(Transcription transcription) {
    return render(transcription).report();
  }

  /**
   * Renders the document regardless of issues. The report of the result holds them as errors.
   *
   * @param transcription parsed edition
   * @return text lines and line records per part
   */
  public FormattedTranscription serialize(Transcription transcription) {
    return render(transcription);
  }

  /**
   * Renders and validates the document.
   *
   * <p>When formatting issues are ignored, errors are logged, downgraded to warnings and the
   * output is returned. Otherwise the first error is thrown.
   *
   * @param transcription parsed edition
   * @return the output with a report holding no errors
   * @throws UnsupportedSymbolException if the first error is a symbol table miss
   * @throws FormattingException for any other error
   */
  public FormattedTranscription format(Transcription transcription)
      throws UnsupportedSymbolException, FormattingException {
    FormattedTranscription result = render(transcription);
    ValidationReport report = result.report();
    if (!report.hasErrors()) {
      return result;
    }
    if (options.ignoreFormattingIssues()) {
      for (ValidationIssue issue : report.errors()) {
        log.warn("{}: {}", label(transcription), issue.message());
      }
      return result.withReport(report.downgraded());
    }
    ValidationIssue first = report.firstError().orElseThrow();
    if (first.kind() == ValidationIssue.Kind.UNSUPPORTED_SYMBOL) {
      throw UnsupportedSymbolException.from(first);
    }
    throw new FormattingException(first, report);
  }

  private FormattedTranscription render(Transcription transcription) {
    Findings findings = new Findings();
    boolean correctLookalikes = transcription.greekOnly();
    List<FormattedPart> parts = new ArrayList<>();
    for (TextPart part : transcription.parts()) {
      checkRelocations(part, findings);
      List<LineRecord> records = new ArrayList<>();
      for (Line line : part.lines()) {
        LineRenderer.Rendered rendered = renderer.render(line, correctLookalikes, findings);
        String text = rendered.text();
        if (dropped(text)) {
          if (options.debugMode()) {
            log.debug("Line {} dropped: '{}'", line.number(), text);
          }
          continue;
        }
        validator.check(line.number(), text, findings);
        if (options.debugMode()) {
          log.debug("Line {} ({}): {}", line.number(), line.kind(), text);
        }
        records.add(
            new LineRecord(
                line.number(), line.kind(), text, line.relocationId(), rendered.records()));
      }
      if (!records.isEmpty()) {
        parts.add(new FormattedPart(part.n(), part.subtype(), part.language(), records));
      }
    }
    return new FormattedTranscription(
        transcription.id(), transcription.languages(), parts, findings.toReport());
  }

  private static boolean dropped(String text) {
    return text.isBlank() || "]".equals(text) || "[".equals(text);
  }

  private void checkRelocations(TextPart part, Findings findings) {
    Set<Integer> anchored = new HashSet<>();
    Set<Integer> inserted = new HashSet<>();
    for (Line line : part.lines()) {
      if (line.kind() == LineKind.INSERTION) {
        inserted.add(line.relocationId());
      }
      for (Token token : line.tokens()) {
        collectAnchors(token, line.number(), anchored, findings);
      }
    }
    for (Line line : part.lines()) {
      if (line.kind() == LineKind.INSERTION && !anchored.contains(line.relocationId())) {
        findings.add(dangling(line.number(), line.relocationId(), "has no addition in the text"));
      }
    }
    for (Integer id : anchored) {
      if (!inserted.contains(id)) {
        findings.add(dangling("?", id, "has no inserted line"));
      }
    }
  }

  private void collectAnchors(Token token, String number, Set<Integer> anchored, Findings out) {
    if (token instanceof Token.Rendition) {
      for (Token inner : ((Token.Rendition) token).inner()) {
        collectAnchors(inner, number, anchored, out);
      }
      return;
    }
    if (!(token instanceof Token.Added)) {
      return;
    }
    Token.Added added = (Token.Added) token;
    if (added.relocationId() != Token.Added.NOT_RELOCATED) {
      anchored.add(added.relocationId());
    } else if (added.relocates() && !added.inner().isEmpty()) {
      out.add(dangling(number, added.relocationId(), "was never moved to its own line"));
    }
  }

  private static ValidationIssue dangling(String number, int id, String what) {
    return ValidationIssue.of(
        ValidationIssue.Kind.DANGLING_RELOCATION,
        number,
        Integer.toString(id),
        String.format("Relocated addition %d in line %s %s", id, number, what));
  }

  private static String label(Transcription transcription) {
    return transcription.id().isEmpty() ? "document" : "TM " + transcription.id();
  }
}
