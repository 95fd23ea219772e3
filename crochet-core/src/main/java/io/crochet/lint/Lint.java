package io.crochet.lint;

/** A non-fatal consistency finding about a parsed pattern. */
public sealed interface Lint permits Lint.MismatchedStitchCount, Lint.NonzeroFirstRoundInput {

  /** Human-readable description of the finding. */
  String message();

  /**
   * A round produces a different number of stitches than the next working round consumes.
   *
   * @param producingRound one-based index of the producing round
   * @param produced stitches the producing round leaves
   * @param consumingRound one-based index of the next non-decorative round
   * @param consumed stitches that round works into
   */
  record MismatchedStitchCount(int producingRound, long produced, int consumingRound, long consumed)
      implements Lint {

    @Override
    public String message() {
      return "round " + producingRound + " produces " + stitches(produced)
          + " but round " + consumingRound + " consumes " + stitches(consumed);
    }
  }

  /** The first round works into stitches that do not exist yet. */
  record NonzeroFirstRoundInput(long consumed) implements Lint {

    @Override
    public String message() {
      return "round 1 consumes " + stitches(consumed)
          + " but the first round shouldn't consume any stitches";
    }
  }

  private static String stitches(long n) {
    return n + (n == 1 ? " stitch" : " stitches");
  }
}
