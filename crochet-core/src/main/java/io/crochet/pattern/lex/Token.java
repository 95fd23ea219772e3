package io.crochet.pattern.lex;

import io.crochet.pattern.SourceLocation;
import java.util.Objects;

/**
 * A lexed token. {@code number} is only meaningful for {@link TokenKind#NUMBER} and {@code comment}
 * only for {@link TokenKind#COMMENT} (the trimmed text between the {@code %} markers).
 */
public record Token(TokenKind kind, SourceLocation location, long number, String comment) {

  public Token {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(location, "location");
    if (kind == TokenKind.COMMENT) {
      Objects.requireNonNull(comment, "comment");
    }
  }

  public static Token of(TokenKind kind, SourceLocation location) {
    if (kind == TokenKind.NUMBER || kind == TokenKind.COMMENT) {
      throw new IllegalArgumentException(kind + " tokens carry a payload");
    }
    return new Token(kind, location, 0, null);
  }

  public static Token number(long value, SourceLocation location) {
    return new Token(TokenKind.NUMBER, location, value, null);
  }

  public static Token comment(String text, SourceLocation location) {
    return new Token(TokenKind.COMMENT, location, 0, text);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case NUMBER -> "NUMBER(" + number + ")@" + location;
      case COMMENT -> "COMMENT(" + comment + ")@" + location;
      default -> kind + "@" + location;
    };
  }
}
