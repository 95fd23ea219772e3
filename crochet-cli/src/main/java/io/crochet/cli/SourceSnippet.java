package io.crochet.cli;

import io.crochet.pattern.SourceLocation;

/**
 * Renders the source line a diagnostic points at, with a caret under the offending column:
 *
 * <pre>
 * 2 | sc 2, ]
 *   |       ^
 * </pre>
 */
final class SourceSnippet {
  private SourceSnippet() {}

  static String render(String source, SourceLocation location) {
    String text = lineAt(source, location.line());
    String number = String.valueOf(location.line());

    StringBuilder sb = new StringBuilder();
    sb.append(number).append(" | ").append(text).append('\n');
    sb.append(" ".repeat(number.length())).append(" | ");

    // tabs are kept so the caret lines up with what the terminal shows above it
    int[] codePoints = text.codePoints().toArray();
    for (int i = 0; i < location.column() - 1; i++) {
      sb.append(i < codePoints.length && codePoints[i] == '\t' ? '\t' : ' ');
    }
    return sb.append('^').toString();
  }

  /** The one-based {@code line} of {@code source} without its terminator, or "" past the end. */
  static String lineAt(String source, int line) {
    String[] lines = source.split("\n", -1);
    if (line > lines.length) {
      return "";
    }
    String text = lines[line - 1];
    return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
  }
}
