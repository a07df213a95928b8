package io.papyrser.core.parser;

import io.papyrser.core.api.TeiParseException;
import io.papyrser.core.model.Line;
import io.papyrser.core.model.LineKind;
import io.papyrser.core.model.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The line being built plus the lines already closed. Positions of gap-like tokens are only
 * resolved when a line is closed.
 */
final class LineBuffer {
  private static final Logger log = LoggerFactory.getLogger(LineBuffer.class);
  private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+)");

  private final BoundaryResolver resolver;
  private final String part;
  private final boolean debug;
  private final List<Line> closed = new ArrayList<>();

  private List<Token> pending;
  private String number;
  private LineKind kind;
  private int textLines;

  LineBuffer(BoundaryResolver resolver, String part, boolean debug) {
    this.resolver = resolver;
    this.part = part;
    this.debug = debug;
  }

  boolean isOpen() {
    return pending != null;
  }

  String currentNumber() {
    return number;
  }

  void append(Token token, String element) throws TeiParseException {
    if (pending == null) {
      throw TeiParseException.contentBeforeFirstLine(element, part);
    }
    pending.add(token);
  }

  /** Closes the current line and opens a text line numbered {@code n}, or the next number. */
  void openLine(String n) {
    String next = n != null && !n.isBlank() ? n.strip() : nextNumber();
    close();
    number = next;
    kind = LineKind.TEXT;
    pending = new ArrayList<>();
    textLines++;
  }

  /** Closes the current line and opens a milestone line carrying the number of the line before. */
  void openMilestone(Token.Milestone milestone, String element) throws TeiParseException {
    if (pending == null) {
      throw TeiParseException.contentBeforeFirstLine(element, part);
    }
    close();
    kind = LineKind.MILESTONE;
    pending = new ArrayList<>();
    pending.add(milestone);
  }

  List<Line> finish() {
    close();
    return closed;
  }

  private void close() {
    if (pending == null) {
      return;
    }
    Line line = new Line(number, kind, resolver.resolve(pending));
    if (debug) {
      log.debug("Closed {} line {} with {} tokens", kind, number, line.tokens().size());
    }
    closed.add(line);
    pending = null;
  }

  private String nextNumber() {
    if (number != null) {
      Matcher m = LEADING_NUMBER.matcher(number);
      if (m.find()) {
        return Long.toString(Long.parseLong(m.group(1)) + 1);
      }
    }
    return Integer.toString(textLines + 1);
  }
}
