package io.crochet.pattern.lex;

import io.crochet.pattern.PatternParseException;
import io.crochet.pattern.SourceLocation;
import java.util.Objects;

/**
 * Single-pass scanner over pattern source text.
 *
 * <p>At each position, after skipping spaces and tabs, the rules are tried in priority order:
 *
 * <ol>
 *   <li>structural symbols: newline, {@code [}, {@code ]}, {@code ,}
 *   <li>keywords, longest candidate first
 *   <li>integer literals: a maximal run of decimal digits
 *   <li>comments: {@code %} up to and including the next {@code %}
 * </ol>
 *
 * If no rule matches, {@link #next()} returns {@code null} and leaves the offending character
 * unconsumed, so {@link #location()} points at it.
 */
public final class PatternLexer {

  /** Largest value an integer literal may hold (unsigned 32-bit). */
  public static final long MAX_NUMBER = 0xFFFF_FFFFL;

  private final String source;
  private int pos;
  private int line = 1;
  private int column = 1;

  public PatternLexer(CharSequence source) {
    this.source = Objects.requireNonNull(source, "source").toString();
  }

  /** Current scan position: the location of the next unconsumed character. */
  public SourceLocation location() {
    return new SourceLocation(line, column);
  }

  /** True once every character of the source has been consumed. */
  public boolean isAtEnd() {
    return pos >= source.length();
  }

  /**
   * Scans the next token.
   *
   * @return the token, or {@code null} at end of input or when no rule matches
   * @throws PatternParseException if an integer literal exceeds {@link #MAX_NUMBER}
   */
  public Token next() {
    skipWhitespace();
    if (isAtEnd()) {
      return null;
    }
    Token token = lexSymbol();
    if (token == null) token = lexKeyword();
    if (token == null) token = lexNumber();
    if (token == null) token = lexComment();
    return token;
  }

  private void skipWhitespace() {
    while (!isAtEnd() && (peekChar() == ' ' || peekChar() == '\t')) {
      advance();
    }
  }

  private Token lexSymbol() {
    TokenKind kind = TokenKind.symbolFor(peekChar());
    if (kind == null) {
      return null;
    }
    Token token = Token.of(kind, location());
    advance();
    return token;
  }

  private Token lexKeyword() {
    for (TokenKind kind : TokenKind.KEYWORDS_LONGEST_FIRST) {
      if (source.startsWith(kind.text(), pos)) {
        Token token = Token.of(kind, location());
        for (int i = 0; i < kind.text().length(); i++) {
          advance();
        }
        return token;
      }
    }
    return null;
  }

  private Token lexNumber() {
    if (!isDigit(peekChar())) {
      return null;
    }
    SourceLocation start = location();
    long value = 0;
    while (!isAtEnd() && isDigit(peekChar())) {
      value = value * 10 + (advance() - '0');
      if (value > MAX_NUMBER) {
        throw new PatternParseException(
            start, "Number literal exceeds the maximum of " + MAX_NUMBER);
      }
    }
    return Token.number(value, start);
  }

  private Token lexComment() {
    if (peekChar() != '%') {
      return null;
    }
    int savedPos = pos;
    int savedLine = line;
    int savedColumn = column;
    SourceLocation start = location();

    advance(); // opening '%'
    int textStart = pos;
    while (!isAtEnd() && peekChar() != '%') {
      advance();
    }
    if (isAtEnd()) {
      // unterminated: roll back so the opening '%' is reported as unrecognized
      pos = savedPos;
      line = savedLine;
      column = savedColumn;
      return null;
    }
    String text = source.substring(textStart, pos).strip();
    advance(); // closing '%'
    return Token.comment(text, start);
  }

  private char peekChar() {
    return source.charAt(pos);
  }

  /** Consumes one character (a whole surrogate pair counts as one) and updates the position. */
  private char advance() {
    char c = source.charAt(pos++);
    if (c == '\n') {
      line++;
      column = 1;
      return c;
    }
    if (Character.isHighSurrogate(c) && !isAtEnd() && Character.isLowSurrogate(peekChar())) {
      pos++;
    }
    column++;
    return c;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
