package io.papyrser.core.model;

/**
 * Number of characters covered by a gap, a supplied passage or a vacat.
 *
 * <p>Either a known count or {@link #UNKNOWN}. A known extent of zero is legal but never produced
 * by the parser for gap-like tokens.
 */
public record Extent(int count, boolean known) {

  /** Extent whose size the edition does not state. */
  public static final Extent UNKNOWN = new Extent(0, false);

  public Extent {
    if (count < 0) {
      throw new IllegalArgumentException("extent must not be negative: " + count);
    }
    if (!known && count != 0) {
      throw new IllegalArgumentException("unknown extent cannot carry a count");
    }
  }

  public static Extent of(int count) {
    return new Extent(count, true);
  }

  /**
   * Adds two extents. Unknown is absorbing.
   *
   * @param other extent to add
   * @return the combined extent
   */
  public Extent plus(Extent other) {
    if (!known || !other.known) {
      return UNKNOWN;
    }
    return of(count + other.count);
  }

  @Override
  public String toString() {
    return known ? Integer.toString(count) : "?";
  }
}
