package io.papyrser.core.api;

/**
 * Base exception for conversion errors. Carries the {@link Stage} that failed and, when known, the
 * number of the edition line being converted, which is also appended to the message.
 */
public abstract class PapyrserException extends Exception {

  /** Conversion step that raised the error. */
  public enum Stage {
    /** Walking the TEI markup into lines. */
    PARSE,
    /** Looking up an attribute value in the symbol tables. */
    SYMBOL,
    /** Rendering or validating D5 lines. */
    FORMAT
  }

  private final Stage stage;
  private final String lineNumber;

  protected PapyrserException(Stage stage, String message, String lineNumber) {
    this(stage, message, lineNumber, null);
  }

  protected PapyrserException(Stage stage, String message, String lineNumber, Throwable cause) {
    super(lineNumber == null ? message : message + " (line " + lineNumber + ")", cause);
    this.stage = stage;
    this.lineNumber = lineNumber;
  }

  public Stage getStage() {
    return stage;
  }

  /**
   * Gets the {@code lb/@n} of the line being converted.
   *
   * @return the line number, or null when the error is not tied to a line
   */
  public String getLineNumber() {
    return lineNumber;
  }
}
