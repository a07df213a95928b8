package io.papyrser.core.format;

import io.papyrser.core.symbols.SymbolTables;

/**
 * One problem found while rendering or checking a line.
 *
 * @param severity {@link Severity#ERROR} unless formatting issues are ignored or the value still
 *     rendered through a table fallback
 * @param kind what is wrong
 * @param lineNumber number of the offending line
 * @param element markup element the value came from, or null for line-level issues
 * @param value offending attribute value or characters
 * @param message human readable description
 * @param table symbol table that lacks an entry, only for {@link Kind#UNSUPPORTED_SYMBOL}
 */
public record ValidationIssue(
    Severity severity,
    Kind kind,
    String lineNumber,
    String element,
    String value,
    String message,
    String table) {

  public enum Severity {
    ERROR,
    WARNING
  }

  public enum Kind {
    UNSUPPORTED_SYMBOL,
    FORBIDDEN_CHARACTER,
    MALFORMED_BRACKETS,
    EMPTY_BRACKETS,
    DANGLING_RELOCATION
  }

  static ValidationIssue unsupportedSymbol(
      String table, String value, String element, String lineNumber) {
    return new ValidationIssue(
        Severity.ERROR,
        Kind.UNSUPPORTED_SYMBOL,
        lineNumber,
        element,
        value,
        String.format("No %s entry for '%s' on <%s> in line %s", table, value, element, lineNumber),
        table);
  }

  /** An expansion missing from the abbreviation table, rendered with the table fallback. */
  static ValidationIssue fallbackAbbreviation(String expansion, String symbol, String lineNumber) {
    return new ValidationIssue(
        Severity.WARNING,
        Kind.UNSUPPORTED_SYMBOL,
        lineNumber,
        "ex",
        expansion,
        String.format(
            "No %s entry for '%s' on <ex> in line %s, rendered as %s",
            SymbolTables.ABBREVIATIONS, expansion, lineNumber, symbol),
        SymbolTables.ABBREVIATIONS);
  }

  static ValidationIssue of(Kind kind, String lineNumber, String value, String message) {
    return new ValidationIssue(Severity.ERROR, kind, lineNumber, null, value, message, null);
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  public ValidationIssue asWarning() {
    return new ValidationIssue(
        Severity.WARNING, kind, lineNumber, element, value, message, table);
  }

  @Override
  public String toString() {
    return severity + " " + kind + ": " + message;
  }
}
