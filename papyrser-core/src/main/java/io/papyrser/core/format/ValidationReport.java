package io.papyrser.core.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Everything found wrong with a document, in line order, plus the automatic corrections applied
 * while rendering it.
 */
public final class ValidationReport {
  private static final ValidationReport EMPTY = new ValidationReport(List.of(), List.of());

  private final List<ValidationIssue> issues;
  private final List<String> corrections;

  public ValidationReport(List<ValidationIssue> issues, List<String> corrections) {
    this.issues = List.copyOf(issues);
    this.corrections = List.copyOf(corrections);
  }

  public static ValidationReport empty() {
    return EMPTY;
  }

  public List<ValidationIssue> issues() {
    return issues;
  }

  public List<String> corrections() {
    return corrections;
  }

  public List<ValidationIssue> errors() {
    return issues.stream().filter(ValidationIssue::isError).toList();
  }

  public List<ValidationIssue> warnings() {
    return issues.stream().filter(i -> !i.isError()).toList();
  }

  public boolean hasErrors() {
    return issues.stream().anyMatch(ValidationIssue::isError);
  }

  public boolean isClean() {
    return issues.isEmpty();
  }

  public Optional<ValidationIssue> firstError() {
    return issues.stream().filter(ValidationIssue::isError).findFirst();
  }

  /** The same report with every error downgraded to a warning. */
  public ValidationReport downgraded() {
    List<ValidationIssue> warnings = new ArrayList<>(issues.size());
    for (ValidationIssue issue : issues) {
      warnings.add(issue.isError() ? issue.asWarning() : issue);
    }
    return new ValidationReport(warnings, corrections);
  }

  @Override
  public String toString() {
    return "ValidationReport{issues=" + issues + ", corrections=" + corrections + "}";
  }
}
