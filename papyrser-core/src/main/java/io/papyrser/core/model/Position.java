package io.papyrser.core.model;

/** Where a gap-like token sits in its line, fixed when the line is closed. */
public enum Position {
  LINE_START,
  LINE_END,
  MID_LINE
}
