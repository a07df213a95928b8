package io.papyrser.core.format;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a rendered line against the D5 vocabulary and bracket conventions.
 *
 * <p>A well-formed line is an optional leading {@code ]}, a body, and an optional trailing
 * {@code [}. The body neither starts nor ends with a bracket or {@code ?}; brackets inside it
 * enclose either {@code ?} or a run of dashes.
 */
final class LineValidator {
  private static final String GAP_CHARS = "[]-?";

  private final Set<Integer> vocabulary;

  LineValidator(Set<Integer> letters, Set<Integer> symbols) {
    Set<Integer> all = new HashSet<>(letters);
    all.addAll(symbols);
    GAP_CHARS.codePoints().forEach(all::add);
    this.vocabulary = Set.copyOf(all);
  }

  void check(String number, String text, Findings findings) {
    Set<Integer> forbidden = new LinkedHashSet<>();
    text.codePoints().filter(cp -> !vocabulary.contains(cp)).forEach(forbidden::add);
    if (!forbidden.isEmpty()) {
      String chars =
          forbidden.stream()
              .map(cp -> new String(Character.toChars(cp)))
              .collect(Collectors.joining(", ", "[", "]"));
      findings.add(
          ValidationIssue.of(
              ValidationIssue.Kind.FORBIDDEN_CHARACTER,
              number,
              chars,
              String.format("Forbidden character(s) %s found in \"%s\"", chars, text)));
      return;
    }
    if (text.contains("[]")) {
      findings.add(
          ValidationIssue.of(
              ValidationIssue.Kind.EMPTY_BRACKETS,
              number,
              text,
              String.format("Empty brackets in \"%s\"", text)));
    } else if (!wellFormed(text)) {
      findings.add(
          ValidationIssue.of(
              ValidationIssue.Kind.MALFORMED_BRACKETS,
              number,
              text,
              String.format("Invalid gap notation in \"%s\"", text)));
    }
  }

  static boolean wellFormed(String text) {
    int start = text.startsWith("]") ? 1 : 0;
    int end = text.length();
    if (end > start && text.endsWith("[")) {
      end--;
    }
    String body = text.substring(start, end);
    if (body.isEmpty()) {
      return false;
    }
    if ("[]?".indexOf(body.charAt(0)) >= 0 || "[]?".indexOf(body.charAt(body.length() - 1)) >= 0) {
      return false;
    }
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c == ']') {
        return false;
      }
      if (c == '[') {
        int close = body.indexOf(']', i + 1);
        if (close < 0) {
          return false;
        }
        String inside = body.substring(i + 1, close);
        if (!inside.equals("?") && !inside.matches("-+")) {
          return false;
        }
        i = close;
      }
    }
    return true;
  }
}
