package io.papyrser.core.format;

/**
 * Rendering of one token.
 *
 * @param type token variant, e.g. {@code glyph} or {@code gap}
 * @param detail variant specific value such as the glyph type or the extent, may be empty
 * @param rendered text the token contributed to the line
 */
public record TokenRecord(String type, String detail, String rendered) {}
