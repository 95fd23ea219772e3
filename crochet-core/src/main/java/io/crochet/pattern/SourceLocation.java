package io.crochet.pattern;

/**
 * A one-based {@code (line, column)} position in pattern source text. Both values address the exact
 * character the position refers to; a newline character belongs to the line it terminates.
 */
public record SourceLocation(int line, int column) {

  public SourceLocation {
    if (line < 1 || column < 1) {
      throw new IllegalArgumentException("Locations are one-based: " + line + ":" + column);
    }
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
