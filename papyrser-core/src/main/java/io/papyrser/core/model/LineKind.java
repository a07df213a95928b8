package io.papyrser.core.model;

/** Origin of a {@link Line}. */
public enum LineKind {
  /** Opened by an {@code lb} element. */
  TEXT,
  /** Opened by a {@code milestone} with a rendition. */
  MILESTONE,
  /** Created by relocating the content of an {@code add} to an adjacent line. */
  INSERTION
}
