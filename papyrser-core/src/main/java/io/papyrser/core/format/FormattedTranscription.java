package io.papyrser.core.format;

import java.util.List;
import java.util.Set;

/**
 * D5 output of one edition.
 *
 * @param id catalog identifier of the source
 * @param languages languages declared in the source, English excluded
 * @param parts non-empty text parts in document order
 * @param report issues found while rendering and the corrections applied
 */
public record FormattedTranscription(
    String id, Set<String> languages, List<FormattedPart> parts, ValidationReport report) {

  public FormattedTranscription {
    languages = Set.copyOf(languages);
    parts = List.copyOf(parts);
  }

  /** Text of every line of every part, in order. */
  public List<String> lines() {
    return parts.stream().flatMap(p -> p.texts().stream()).toList();
  }

  public boolean isEmpty() {
    return parts.isEmpty();
  }

  public FormattedTranscription withReport(ValidationReport replacement) {
    return new FormattedTranscription(id, languages, parts, replacement);
  }
}
