package io.crochet.pattern;

import java.util.Objects;

/**
 * Exception thrown when pattern source cannot be tokenized or parsed. Always pinned to the source
 * location of the offending character.
 */
public final class PatternParseException extends RuntimeException {

  private final SourceLocation location;

  public PatternParseException(SourceLocation location, String message) {
    super(message + " at " + Objects.requireNonNull(location, "location"));
    this.location = location;
  }

  public SourceLocation location() {
    return location;
  }

  public int line() {
    return location.line();
  }

  public int column() {
    return location.column();
  }
}
