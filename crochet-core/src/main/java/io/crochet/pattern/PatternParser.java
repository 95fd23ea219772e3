package io.crochet.pattern;

import io.crochet.pattern.Instruction.Stitch;
import io.crochet.pattern.lex.Token;
import io.crochet.pattern.lex.TokenKind;
import io.crochet.pattern.lex.TokenStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for crochet round notation.
 *
 * <p>Grammar:
 *
 * <pre>
 * pattern     := NEWLINE* round (NEWLINE+ round)* NEWLINE*
 * round       := group                 (followed by NEWLINE or end of input)
 * group       := instruction (',' instruction)*
 * instruction := stitch suffix?
 *              | 'skip' NUMBER
 *              | COMMENT
 *              | '[' group ']' suffix?
 * suffix      := NUMBER? 'in mr'?
 * </pre>
 *
 * A trailing number wraps the instruction in {@link Instruction.Repeat}; a following {@code in mr}
 * then wraps the result in {@link Instruction.IntoMagicRing}. Counts that would overflow a
 * {@code long} are rejected here, so the counts of a parsed tree are always computable.
 */
public final class PatternParser {

  private final TokenStream tokens;

  private PatternParser(TokenStream tokens) {
    this.tokens = tokens;
  }

  /**
   * Parses pattern source into its rounds, one instruction tree per round.
   *
   * @param source the pattern text
   * @return the rounds in source order, never empty
   * @throws PatternParseException if the source is malformed or not fully consumed
   */
  public static List<Instruction> parse(CharSequence source) {
    TokenStream tokens = TokenStream.tokenize(source);
    List<Instruction> rounds = new PatternParser(tokens).parsePattern();
    if (!tokens.isEmpty()) {
      throw unexpected(tokens);
    }
    return rounds;
  }

  private List<Instruction> parsePattern() {
    skipNewlines();
    List<Instruction> rounds = new ArrayList<>();
    rounds.add(parseRound());
    while (tokens.peekKind() == TokenKind.NEWLINE) {
      skipNewlines();
      if (tokens.isEmpty()) {
        break;
      }
      rounds.add(parseRound());
    }
    return List.copyOf(rounds);
  }

  private Instruction parseRound() {
    Instruction round = parseGroup();
    if (tokens.peekKind() != TokenKind.NEWLINE && !tokens.isEmpty()) {
      throw unexpected(tokens);
    }
    return round;
  }

  private Instruction.Group parseGroup() {
    List<Instruction> members = new ArrayList<>();
    long input = 0;
    long output = 0;
    while (true) {
      tokens.peek();
      SourceLocation start = tokens.currentLocation();
      Instruction member = parseInstruction();
      try {
        input = Math.addExact(input, member.inputCount());
        output = Math.addExact(output, member.outputCount());
      } catch (ArithmeticException e) {
        throw new PatternParseException(start, "Stitch count overflows");
      }
      members.add(member);
      if (tokens.peekKind() != TokenKind.COMMA) {
        return new Instruction.Group(members);
      }
      tokens.advance();
    }
  }

  private Instruction parseInstruction() {
    Token token = tokens.advance();
    if (token == null) {
      throw unexpected(tokens);
    }
    TokenKind kind = token.kind();
    if (kind.isStitch()) {
      return parseSuffix(stitchFor(kind));
    }
    switch (kind) {
      case SKIP -> {
        Token count = tokens.peek();
        if (count == null || count.kind() != TokenKind.NUMBER) {
          throw unexpected(tokens, "Expected number after 'skip'");
        }
        tokens.advance();
        return new Instruction.Skip(count.number());
      }
      case COMMENT -> {
        return new Instruction.Comment(token.comment());
      }
      case LBRACKET -> {
        Instruction.Group group = parseGroup();
        Token close = tokens.peek();
        if (close == null || close.kind() != TokenKind.RBRACKET) {
          throw unexpected(tokens, "Expected ']'");
        }
        tokens.advance();
        return parseSuffix(group);
      }
      default -> throw new PatternParseException(
          token.location(), "Unexpected " + kind.describe());
    }
  }

  private Instruction parseSuffix(Instruction inst) {
    Token count = tokens.peek();
    if (count != null && count.kind() == TokenKind.NUMBER) {
      tokens.advance();
      try {
        Math.multiplyExact(inst.inputCount(), count.number());
        Math.multiplyExact(inst.outputCount(), count.number());
      } catch (ArithmeticException e) {
        throw new PatternParseException(count.location(), "Stitch count overflows");
      }
      inst = new Instruction.Repeat(inst, count.number());
    }
    if (tokens.peekKind() == TokenKind.IN_MR) {
      tokens.advance();
      inst = new Instruction.IntoMagicRing(inst);
    }
    return inst;
  }

  private void skipNewlines() {
    while (tokens.peekKind() == TokenKind.NEWLINE) {
      tokens.advance();
    }
  }

  private static Stitch stitchFor(TokenKind kind) {
    return switch (kind) {
      case CH -> Stitch.CH;
      case TCH -> Stitch.TCH;
      case SC -> Stitch.SC;
      case FPSC -> Stitch.FPSC;
      case BPSC -> Stitch.BPSC;
      case BLSC -> Stitch.BLSC;
      case INC -> Stitch.INC;
      case FLINC -> Stitch.FLINC;
      case BLINC -> Stitch.BLINC;
      case DEC -> Stitch.DEC;
      default -> throw new IllegalArgumentException("Not a stitch keyword: " + kind);
    };
  }

  private static PatternParseException unexpected(TokenStream tokens) {
    Token next = tokens.peek();
    if (next != null) {
      return new PatternParseException(next.location(), "Unexpected " + next.kind().describe());
    }
    if (tokens.isEmpty()) {
      return new PatternParseException(tokens.currentLocation(), "Unexpected end of input");
    }
    return new PatternParseException(tokens.currentLocation(), "Unrecognized input");
  }

  private static PatternParseException unexpected(TokenStream tokens, String expectation) {
    Token next = tokens.peek();
    String found;
    if (next != null) {
      found = next.kind().describe();
    } else if (tokens.isEmpty()) {
      found = "end of input";
    } else {
      found = "unrecognized input";
    }
    return new PatternParseException(tokens.currentLocation(), expectation + ", found " + found);
  }
}
