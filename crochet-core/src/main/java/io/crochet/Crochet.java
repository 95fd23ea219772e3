package io.crochet;

import io.crochet.lint.Lint;
import io.crochet.lint.PatternLinter;
import io.crochet.pattern.Instruction;
import io.crochet.pattern.PatternParseException;
import io.crochet.pattern.PatternParser;
import io.crochet.render.PatternPrinter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points for compiling crochet round notation.
 *
 * <pre>
 * List&lt;Instruction&gt; rounds = Crochet.parseRounds("sc 6 in mr\ninc 6\n[inc, sc] 6");
 * Crochet.lintRounds(rounds);    // []
 * Crochet.prettyFormat(rounds);  // Round 1: sc 6 in mr (6) ...
 * </pre>
 */
public final class Crochet {

  private static final Logger LOG = LoggerFactory.getLogger(Crochet.class);

  private Crochet() {}

  /**
   * Tokenizes and parses a whole pattern.
   *
   * @throws PatternParseException located at the offending character
   */
  public static List<Instruction> parseRounds(String source) {
    List<Instruction> rounds = PatternParser.parse(source);
    LOG.debug("Parsed {} round(s)", rounds.size());
    return rounds;
  }

  /** Runs the stitch-count lint pass; findings are values for the caller to format. */
  public static List<Lint> lintRounds(List<Instruction> rounds) {
    return PatternLinter.lint(rounds);
  }

  /** Canonical numbered report, one line per round. */
  public static String prettyFormat(List<Instruction> rounds) {
    return PatternPrinter.render(rounds);
  }
}
