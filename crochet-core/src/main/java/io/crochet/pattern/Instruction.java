package io.crochet.pattern;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Instruction tree for one crochet round.
 *
 * <p>Every node knows how many stitches of the previous round it works into ({@link #inputCount()})
 * and how many stitches it leaves for the next round ({@link #outputCount()}). Counts are computed
 * structurally; trees are immutable.
 *
 * <p>{@link #toString()} renders the canonical surface syntax accepted by {@link PatternParser}:
 *
 * <pre>
 * sc 6 in mr
 * [inc, sc] 6
 * skip 2, sc, % turn here %, dec 3
 * </pre>
 */
public sealed interface Instruction
    permits Instruction.Stitch,
        Instruction.Skip,
        Instruction.Comment,
        Instruction.IntoMagicRing,
        Instruction.Group,
        Instruction.Repeat {

  /** Stitches of the previous round this instruction consumes. */
  long inputCount();

  /** Stitches this instruction produces for the next round. */
  long outputCount();

  /** True for instructions with no stitch effect at all, such as a bare comment. */
  default boolean isDecorative() {
    return inputCount() == 0 && outputCount() == 0;
  }

  /** Primitive stitch operations. */
  enum Stitch implements Instruction {
    CH("ch", 0, 1),
    /** Turning chain; not counted as a stitch. */
    TCH("tch", 0, 0),
    SC("sc", 1, 1),
    FPSC("fpsc", 1, 1),
    BPSC("bpsc", 1, 1),
    BLSC("blsc", 1, 1),
    INC("inc", 1, 2),
    FLINC("flinc", 1, 2),
    BLINC("blinc", 1, 2),
    DEC("dec", 2, 1);

    private final String keyword;
    private final long input;
    private final long output;

    Stitch(String keyword, long input, long output) {
      this.keyword = keyword;
      this.input = input;
      this.output = output;
    }

    public String keyword() {
      return keyword;
    }

    @Override
    public long inputCount() {
      return input;
    }

    @Override
    public long outputCount() {
      return output;
    }

    @Override
    public String toString() {
      return keyword;
    }
  }

  /** Skip {@code count} stitches of the previous round without working into them. */
  record Skip(long count) implements Instruction {

    public Skip {
      if (count < 0) {
        throw new IllegalArgumentException("Skip count must be non-negative: " + count);
      }
    }

    @Override
    public long inputCount() {
      return count;
    }

    @Override
    public long outputCount() {
      return 0;
    }

    @Override
    public String toString() {
      return "skip " + count;
    }
  }

  /** Free text with no stitch effect. */
  record Comment(String text) implements Instruction {

    public Comment {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public long inputCount() {
      return 0;
    }

    @Override
    public long outputCount() {
      return 0;
    }

    @Override
    public String toString() {
      return "% " + text + " %";
    }
  }

  /** Works {@code inner} into a magic ring: nothing is consumed, the output is kept. */
  record IntoMagicRing(Instruction inner) implements Instruction {

    public IntoMagicRing {
      Objects.requireNonNull(inner, "inner");
    }

    @Override
    public long inputCount() {
      return 0;
    }

    @Override
    public long outputCount() {
      return inner.outputCount();
    }

    @Override
    public String toString() {
      return bracketed(inner) + " in mr";
    }
  }

  /** Ordered, non-empty sequence of sibling instructions. */
  record Group(List<Instruction> members) implements Instruction {

    public Group {
      members = List.copyOf(members);
      if (members.isEmpty()) {
        throw new IllegalArgumentException("Group must have at least one member");
      }
    }

    public static Group of(Instruction... members) {
      return new Group(List.of(members));
    }

    @Override
    public long inputCount() {
      long sum = 0;
      for (Instruction member : members) {
        sum = Math.addExact(sum, member.inputCount());
      }
      return sum;
    }

    @Override
    public long outputCount() {
      long sum = 0;
      for (Instruction member : members) {
        sum = Math.addExact(sum, member.outputCount());
      }
      return sum;
    }

    @Override
    public String toString() {
      return members.stream().map(Instruction::toString).collect(Collectors.joining(", "));
    }
  }

  /** {@code inner} performed {@code times} times. */
  record Repeat(Instruction inner, long times) implements Instruction {

    public Repeat {
      Objects.requireNonNull(inner, "inner");
      if (times < 0) {
        throw new IllegalArgumentException("Repeat count must be non-negative: " + times);
      }
    }

    @Override
    public long inputCount() {
      return Math.multiplyExact(inner.inputCount(), times);
    }

    @Override
    public long outputCount() {
      return Math.multiplyExact(inner.outputCount(), times);
    }

    @Override
    public String toString() {
      return bracketed(inner) + " " + times;
    }
  }

  // a group only needs brackets when a suffix follows it
  private static String bracketed(Instruction inner) {
    return inner instanceof Group ? "[" + inner + "]" : inner.toString();
  }
}
