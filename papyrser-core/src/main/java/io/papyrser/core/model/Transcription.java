package io.papyrser.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Line/token model of one edition.
 *
 * @param id catalog identifier, usually the Trismegistos (TM) number; empty when unknown
 * @param languages every {@code xml:lang} used in the file except English
 * @param parts text parts in document order
 */
public record Transcription(String id, Set<String> languages, List<TextPart> parts) {

  public Transcription {
    Objects.requireNonNull(id, "id");
    languages = Set.copyOf(languages);
    parts = List.copyOf(parts);
  }

  /** All lines of all parts in document order. */
  public List<Line> lines() {
    return parts.stream().flatMap(p -> p.lines().stream()).toList();
  }

  /** Whether the file is written in Greek only, which enables Latin look-alike correction. */
  public boolean greekOnly() {
    return languages.size() == 1 && languages.contains("grc");
  }
}
