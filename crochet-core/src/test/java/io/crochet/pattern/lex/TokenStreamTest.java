package io.crochet.pattern.lex;

import static org.junit.jupiter.api.Assertions.*;

import io.crochet.pattern.PatternParseException;
import io.crochet.pattern.SourceLocation;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TokenStreamTest {

  private static List<Token> drain(String source) {
    TokenStream ts = TokenStream.tokenize(source);
    List<Token> tokens = new ArrayList<>();
    Token t;
    while ((t = ts.advance()) != null) {
      tokens.add(t);
    }
    return tokens;
  }

  private static Token tok(TokenKind kind, int line, int col) {
    return Token.of(kind, new SourceLocation(line, col));
  }

  private static Token num(long value, int line, int col) {
    return Token.number(value, new SourceLocation(line, col));
  }

  @Test
  void tokenizesRoundsWithPositions() {
    List<Token> expected =
        List.of(
            tok(TokenKind.SC, 1, 1),
            num(6, 1, 4),
            tok(TokenKind.NEWLINE, 1, 5),
            tok(TokenKind.INC, 2, 1),
            num(6, 2, 5),
            tok(TokenKind.NEWLINE, 2, 6),
            tok(TokenKind.SC, 3, 1),
            num(2, 3, 4),
            tok(TokenKind.COMMA, 3, 5),
            tok(TokenKind.LBRACKET, 3, 7),
            tok(TokenKind.SC, 3, 8),
            tok(TokenKind.COMMA, 3, 10),
            tok(TokenKind.INC, 3, 12),
            tok(TokenKind.RBRACKET, 3, 15),
            num(5, 3, 17));

    assertEquals(expected, drain("sc 6\ninc 6\nsc 2, [sc, inc] 5"));
  }

  @Test
  void magicRingIsNotShadowedByInc() {
    List<Token> tokens = drain("sc6in mr, inc");
    assertEquals(
        List.of(TokenKind.SC, TokenKind.NUMBER, TokenKind.IN_MR, TokenKind.COMMA, TokenKind.INC),
        tokens.stream().map(Token::kind).toList());
    assertEquals(new SourceLocation(1, 4), tokens.get(2).location());
  }

  @Test
  void recognizesEveryStitchKeyword() {
    List<Token> tokens = drain("ch tch sc fpsc bpsc blsc inc flinc blinc dec skip");
    assertEquals(
        List.of(
            TokenKind.CH,
            TokenKind.TCH,
            TokenKind.SC,
            TokenKind.FPSC,
            TokenKind.BPSC,
            TokenKind.BLSC,
            TokenKind.INC,
            TokenKind.FLINC,
            TokenKind.BLINC,
            TokenKind.DEC,
            TokenKind.SKIP),
        tokens.stream().map(Token::kind).toList());
  }

  @Test
  void keywordTableIsLongestFirst() {
    List<TokenKind> keywords = TokenKind.KEYWORDS_LONGEST_FIRST;
    for (int i = 1; i < keywords.size(); i++) {
      assertTrue(keywords.get(i - 1).text().length() >= keywords.get(i).text().length());
    }
    assertTrue(keywords.indexOf(TokenKind.IN_MR) < keywords.indexOf(TokenKind.INC));
    assertTrue(keywords.indexOf(TokenKind.TCH) < keywords.indexOf(TokenKind.CH));
  }

  @Test
  void commentPayloadIsTrimmed() {
    List<Token> tokens = drain("%   turn work  %, sc");
    assertEquals(TokenKind.COMMENT, tokens.get(0).kind());
    assertEquals("turn work", tokens.get(0).comment());
    assertEquals(new SourceLocation(1, 1), tokens.get(0).location());
    assertEquals(new SourceLocation(1, 17), tokens.get(1).location());
  }

  @Test
  void commentMaySpanLines() {
    List<Token> tokens = drain("% a\nb %\nsc");
    assertEquals("a\nb", tokens.get(0).comment());
    assertEquals(tok(TokenKind.NEWLINE, 2, 4), tokens.get(1));
    assertEquals(tok(TokenKind.SC, 3, 1), tokens.get(2));
  }

  @Test
  void unterminatedCommentRollsBack() {
    TokenStream ts = TokenStream.tokenize("sc, % foobar");
    assertEquals(TokenKind.SC, ts.advance().kind());
    assertEquals(TokenKind.COMMA, ts.advance().kind());
    assertNull(ts.peek());
    assertFalse(ts.isEmpty());
    assertEquals(new SourceLocation(1, 5), ts.currentLocation());
  }

  @Test
  void unrecognizedCharacterIsLeftUnconsumed() {
    TokenStream ts = TokenStream.tokenize("sc  @");
    assertEquals(TokenKind.SC, ts.advance().kind());
    assertNull(ts.advance());
    assertFalse(ts.isEmpty());
    assertEquals(new SourceLocation(1, 5), ts.currentLocation());
  }

  @Test
  void trailingWhitespaceCountsAsEmpty() {
    TokenStream ts = TokenStream.tokenize("sc \t ");
    ts.advance();
    assertTrue(ts.isEmpty());
  }

  @Test
  void currentLocationPrefersLookahead() {
    TokenStream ts = TokenStream.tokenize("sc   inc");
    ts.advance();
    assertEquals(TokenKind.INC, ts.peekKind());
    assertEquals(new SourceLocation(1, 6), ts.currentLocation());
  }

  @Test
  void leadingZerosAreAllowed() {
    List<Token> tokens = drain("007 0");
    assertEquals(num(7, 1, 1), tokens.get(0));
    assertEquals(num(0, 1, 5), tokens.get(1));
  }

  @Test
  void largestNumberIsAccepted() {
    assertEquals(PatternLexer.MAX_NUMBER, drain("4294967295").get(0).number());
  }

  @Test
  void numberOverflowIsLocatedAtLiteralStart() {
    TokenStream ts = TokenStream.tokenize("sc 4294967296");
    ts.advance();
    PatternParseException e = assertThrows(PatternParseException.class, ts::peek);
    assertEquals(1, e.line());
    assertEquals(4, e.column());
  }
}
