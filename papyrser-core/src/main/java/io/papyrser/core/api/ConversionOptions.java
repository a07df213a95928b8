package io.papyrser.core.api;

/**
 * Conversion configuration, passed explicitly to the parser and formatter.
 *
 * @param ignoreFormattingIssues downgrade validation errors to warnings and still return output
 * @param debugMode emit step-by-step tracing through the logger at DEBUG level
 */
public record ConversionOptions(boolean ignoreFormattingIssues, boolean debugMode) {

  /** Strict validation, no tracing. */
  public static final ConversionOptions DEFAULT = new ConversionOptions(false, false);

  /** Output is produced even for documents with formatting issues. */
  public static final ConversionOptions LENIENT = new ConversionOptions(true, false);

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private boolean ignoreFormattingIssues = false;
    private boolean debugMode = false;

    public Builder ignoreFormattingIssues(boolean value) {
      this.ignoreFormattingIssues = value;
      return this;
    }

    public Builder debugMode(boolean value) {
      this.debugMode = value;
      return this;
    }

    public ConversionOptions build() {
      return new ConversionOptions(ignoreFormattingIssues, debugMode);
    }
  }
}
