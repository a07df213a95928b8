package io.papyrser.core.api;

/**
 * Thrown when the markup of an edition cannot be turned into a coherent line sequence. Fatal for
 * the document being parsed only.
 */
public class TeiParseException extends PapyrserException {

  public TeiParseException(String message) {
    super(Stage.PARSE, message, null);
  }

  public TeiParseException(String message, String lineNumber) {
    super(Stage.PARSE, message, lineNumber);
  }

  /**
   * Creates an exception for content found before the first line break of a text part.
   *
   * @param element local name of the element carrying the content
   * @param part the {@code @n} of the text part, may be null
   * @return a new TeiParseException instance
   */
  public static TeiParseException contentBeforeFirstLine(String element, String part) {
    return new TeiParseException(
        String.format(
            "Content outside of any line in text part %s: <%s> precedes the first <lb>",
            part == null ? "?" : part, element));
  }

  /**
   * Creates an exception for an element without handler whose text would be lost.
   *
   * @param element local name of the element
   * @param line number of the line being built, may be null
   * @param text the text content that would be dropped
   * @return a new TeiParseException instance
   */
  public static TeiParseException unsupportedElement(String element, String line, String text) {
    return new TeiParseException(
        String.format("Unsupported element <%s> carries text '%s'", element, text.strip()),
        line);
  }
}
