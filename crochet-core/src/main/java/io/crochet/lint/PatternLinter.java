package io.crochet.lint;

import io.crochet.pattern.Instruction;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stitch-count consistency checks over a parsed pattern. Rounds with neither input nor output
 * (comment-only rounds, turning chains) are decorative and skipped when pairing rounds.
 */
public final class PatternLinter {

  private static final Logger LOG = LoggerFactory.getLogger(PatternLinter.class);

  private PatternLinter() {}

  /**
   * Lints the rounds of a pattern.
   *
   * @param rounds rounds in pattern order
   * @return findings: stitch-count mismatches in round order, then the first-round check
   */
  public static List<Lint> lint(List<Instruction> rounds) {
    List<Lint> findings = new ArrayList<>(mismatchedStitchCounts(rounds));
    Lint firstRound = nonzeroFirstRoundInput(rounds);
    if (firstRound != null) {
      findings.add(firstRound);
    }
    LOG.debug("Linted {} rounds, {} finding(s)", rounds.size(), findings.size());
    return List.copyOf(findings);
  }

  static List<Lint> mismatchedStitchCounts(List<Instruction> rounds) {
    List<Lint> findings = new ArrayList<>();
    for (int a = 0; a + 1 < rounds.size(); a++) {
      Instruction producer = rounds.get(a);
      if (producer.isDecorative()) {
        continue;
      }
      int b = a + 1;
      while (b < rounds.size() && rounds.get(b).isDecorative()) {
        b++;
      }
      if (b == rounds.size()) {
        // only decorative rounds remain
        break;
      }
      long produced = producer.outputCount();
      long consumed = rounds.get(b).inputCount();
      if (produced != consumed) {
        findings.add(new Lint.MismatchedStitchCount(a + 1, produced, b + 1, consumed));
      }
    }
    return findings;
  }

  static Lint nonzeroFirstRoundInput(List<Instruction> rounds) {
    if (rounds.isEmpty()) {
      return null;
    }
    long consumed = rounds.get(0).inputCount();
    return consumed != 0 ? new Lint.NonzeroFirstRoundInput(consumed) : null;
  }
}
