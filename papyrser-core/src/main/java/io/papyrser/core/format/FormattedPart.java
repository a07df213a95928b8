package io.papyrser.core.format;

import java.util.List;

/** Serialized lines of one text part. Lines that render empty are not included. */
public record FormattedPart(String n, String subtype, String language, List<LineRecord> lines) {

  public FormattedPart {
    lines = List.copyOf(lines);
  }

  public List<String> texts() {
    return lines.stream().map(LineRecord::text).toList();
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }
}
