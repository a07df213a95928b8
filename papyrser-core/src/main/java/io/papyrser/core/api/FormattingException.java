package io.papyrser.core.api;

import io.papyrser.core.format.ValidationIssue;
import io.papyrser.core.format.ValidationReport;

/** Thrown when a formatted line violates the D5 conventions and issues are not ignored. */
public class FormattingException extends PapyrserException {
  private final transient ValidationReport report;

  public FormattingException(ValidationIssue issue, ValidationReport report) {
    super(Stage.FORMAT, issue.message(), issue.lineNumber());
    this.report = report;
  }

  /**
   * Gets the full report of the document, including issues found after the first error.
   *
   * @return the validation report
   */
  public ValidationReport getReport() {
    return report;
  }
}
