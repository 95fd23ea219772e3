package io.crochet.render;

import io.crochet.pattern.Instruction;
import java.util.List;

/** Renders parsed rounds as a numbered report suitable for publishing. */
public final class PatternPrinter {
  private PatternPrinter() {}

  /**
   * Formats one line per round as {@code Round N: <instruction> (<stitches produced>)}, joined by
   * newlines with no trailing newline.
   */
  public static String render(List<Instruction> rounds) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < rounds.size(); i++) {
      if (i > 0) sb.append('\n');
      Instruction round = rounds.get(i);
      sb.append("Round ")
          .append(i + 1)
          .append(": ")
          .append(round)
          .append(" (")
          .append(round.outputCount())
          .append(')');
    }
    return sb.toString();
  }
}
