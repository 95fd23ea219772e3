package io.crochet.pattern.lex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Kinds of tokens produced by {@link PatternLexer}. */
public enum TokenKind {
  // Stitch keywords
  CH("ch"),
  TCH("tch"),
  SC("sc"),
  FPSC("fpsc"),
  BPSC("bpsc"),
  BLSC("blsc"),
  INC("inc"),
  FLINC("flinc"),
  BLINC("blinc"),
  DEC("dec"),

  // Other keywords
  IN_MR("in mr"),
  SKIP("skip"),

  // Literals
  NUMBER(null),
  COMMENT(null),

  // Structural symbols
  NEWLINE("\n"),
  LBRACKET("["),
  RBRACKET("]"),
  COMMA(",");

  /** Keywords ordered longest first, so {@code in mr} is tried before {@code inc}. */
  static final List<TokenKind> KEYWORDS_LONGEST_FIRST;

  static {
    List<TokenKind> keywords = new ArrayList<>();
    for (TokenKind kind : values()) {
      if (kind.isKeyword()) {
        keywords.add(kind);
      }
    }
    keywords.sort(Comparator.comparingInt((TokenKind k) -> k.text.length()).reversed());
    KEYWORDS_LONGEST_FIRST = List.copyOf(keywords);
  }

  private final String text;

  TokenKind(String text) {
    this.text = text;
  }

  /** The literal source text of this kind, or {@code null} for numbers and comments. */
  public String text() {
    return text;
  }

  public boolean isStitch() {
    return ordinal() <= DEC.ordinal();
  }

  public boolean isKeyword() {
    return ordinal() <= SKIP.ordinal();
  }

  /** Single-character structural symbol for {@code c}, or {@code null}. */
  static TokenKind symbolFor(char c) {
    return switch (c) {
      case '\n' -> NEWLINE;
      case '[' -> LBRACKET;
      case ']' -> RBRACKET;
      case ',' -> COMMA;
      default -> null;
    };
  }

  /** Human-readable description used in diagnostics. */
  public String describe() {
    return switch (this) {
      case NUMBER -> "number";
      case COMMENT -> "comment";
      case NEWLINE -> "newline";
      default -> "'" + text + "'";
    };
  }
}
