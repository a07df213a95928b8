package io.papyrser.core.format;

import io.papyrser.core.model.LineKind;
import java.util.List;

/**
 * A serialized line together with the renderings of its tokens.
 *
 * @param number line number of the source line
 * @param kind how the line came into existence
 * @param text the D5 line
 * @param relocationId id shared with the addition an insertion line comes from, otherwise -1
 * @param tokens per-token renderings in line order
 */
public record LineRecord(
    String number, LineKind kind, String text, int relocationId, List<TokenRecord> tokens) {

  public LineRecord {
    tokens = List.copyOf(tokens);
  }
}
