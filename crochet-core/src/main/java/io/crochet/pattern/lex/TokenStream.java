package io.crochet.pattern.lex;

import io.crochet.pattern.SourceLocation;
import java.util.Objects;

/**
 * Lazy token sequence with one token of lookahead. Not restartable: re-tokenizing requires a fresh
 * call to {@link #tokenize(CharSequence)} on the original text.
 */
public final class TokenStream {

  private final PatternLexer lexer;
  private Token peeked;

  private TokenStream(PatternLexer lexer) {
    this.lexer = lexer;
  }

  public static TokenStream tokenize(CharSequence source) {
    return new TokenStream(new PatternLexer(Objects.requireNonNull(source, "source")));
  }

  /** Returns the next token without consuming it, or {@code null} if none can be produced. */
  public Token peek() {
    if (peeked == null) {
      peeked = lexer.next();
    }
    return peeked;
  }

  /** Kind of the next token, or {@code null} if none can be produced. */
  public TokenKind peekKind() {
    Token token = peek();
    return token == null ? null : token.kind();
  }

  /** Consumes and returns the next token, or {@code null} if none can be produced. */
  public Token advance() {
    Token token = peek();
    peeked = null;
    return token;
  }

  /**
   * True when no token is buffered and the source is fully consumed. A character no lexer rule
   * recognizes keeps the stream non-empty.
   */
  public boolean isEmpty() {
    return peek() == null && lexer.isAtEnd();
  }

  /**
   * Location of the buffered lookahead token if there is one, otherwise the scanner's current
   * position.
   */
  public SourceLocation currentLocation() {
    return peeked != null ? peeked.location() : lexer.location();
  }
}
