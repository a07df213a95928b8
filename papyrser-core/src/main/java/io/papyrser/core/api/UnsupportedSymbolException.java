package io.papyrser.core.api;

import io.papyrser.core.format.ValidationIssue;

/**
 * Thrown when an attribute value has no entry in a symbol table. The message names the table, the
 * value, the element and the line so that a maintainer can add the missing entry.
 */
public class UnsupportedSymbolException extends PapyrserException {
  private final String table;
  private final String value;
  private final String element;

  public UnsupportedSymbolException(
      String table, String value, String element, String lineNumber) {
    super(
        Stage.SYMBOL,
        String.format("No %s entry for '%s' on <%s>", table, value, element),
        lineNumber);
    this.table = table;
    this.value = value;
    this.element = element;
  }

  public static UnsupportedSymbolException from(ValidationIssue issue) {
    return new UnsupportedSymbolException(
        issue.table(), issue.value(), issue.element(), issue.lineNumber());
  }

  public String getTable() {
    return table;
  }

  public String getValue() {
    return value;
  }

  public String getElement() {
    return element;
  }
}
