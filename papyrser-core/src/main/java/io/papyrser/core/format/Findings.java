package io.papyrser.core.format;

import java.util.ArrayList;
import java.util.List;

/** Issues and corrections collected while rendering one document. */
final class Findings {
  private final List<ValidationIssue> issues = new ArrayList<>();
  private final List<String> corrections = new ArrayList<>();

  void add(ValidationIssue issue) {
    issues.add(issue);
  }

  void corrected(String message) {
    corrections.add(message);
  }

  ValidationReport toReport() {
    return new ValidationReport(issues, corrections);
  }
}
