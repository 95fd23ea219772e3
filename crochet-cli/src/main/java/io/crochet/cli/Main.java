package io.crochet.cli;

import io.crochet.Crochet;
import io.crochet.lint.Lint;
import io.crochet.pattern.Instruction;
import io.crochet.pattern.PatternParseException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "crochet",
    description = "Checks the stitch counts of a crochet pattern and prints it as numbered rounds",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_LINT = 3;

  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  @CommandLine.Parameters(
      index = "0",
      paramLabel = "FILE",
      description = "Pattern file to read, or '-' for standard input")
  private String file;

  @CommandLine.Option(
      names = {"-f", "--force"},
      description = "Print the report even when lint findings exist (findings go to stderr)")
  private boolean force;

  @CommandLine.ArgGroup(exclusive = true)
  private LintMode lintMode = new LintMode();

  static class LintMode {
    @CommandLine.Option(names = "--no-lint", description = "Skip the stitch-count checks")
    boolean noLint;

    @CommandLine.Option(names = "--lint-only", description = "Print only lint findings")
    boolean lintOnly;
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() {
    String source;
    try {
      source = read(file);
    } catch (IOException e) {
      LOG.debug("Failed to read {}", file, e);
      System.err.println("Can't read `" + file + "`: " + e);
      return EXIT_FAILURE;
    }

    List<Instruction> rounds;
    try {
      rounds = Crochet.parseRounds(source);
    } catch (PatternParseException e) {
      LOG.debug("Parse failed: {}", e.getMessage());
      System.err.println("Parse error at " + e.line() + ":" + e.column());
      System.err.println(SourceSnippet.render(source, e.location()));
      return EXIT_FAILURE;
    }

    List<Lint> lints = lintMode.noLint ? List.of() : Crochet.lintRounds(rounds);

    if (lintMode.lintOnly) {
      lints.forEach(l -> System.out.println("Lint: " + l.message()));
      return lints.isEmpty() ? EXIT_OK : EXIT_LINT;
    }

    if (!lints.isEmpty() && !force) {
      lints.forEach(l -> System.out.println("Lint: " + l.message()));
      return EXIT_LINT;
    }
    lints.forEach(l -> System.err.println("Lint: " + l.message()));
    System.out.println(Crochet.prettyFormat(rounds));
    return EXIT_OK;
  }

  private static String read(String file) throws IOException {
    if ("-".equals(file)) {
      return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
    }
    Path path = Paths.get(file);
    LOG.debug("Reading pattern from {}", path.toAbsolutePath());
    return Files.readString(path, StandardCharsets.UTF_8);
  }
}
