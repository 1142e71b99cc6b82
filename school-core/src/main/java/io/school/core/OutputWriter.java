package io.school.core;

import java.io.PrintStream;

/**
 * Where the tool's text goes. Rendered tables and status lines are whole lines; picker prompts
 * stay on the current line and must reach the terminal before input is read.
 */
public interface OutputWriter {

  void println(String line);

  /** Shows {@code text} without a line break and flushes it. */
  void prompt(String text);

  /** Diagnostic line about the environment rather than the user's data. */
  void error(String line);

  /** Prints {@code lines} in order, one per line. */
  default void printLines(Iterable<String> lines) {
    for (String line : lines) {
      println(line);
    }
  }

  /** Everything, diagnostics included, goes to {@code stream}. */
  static OutputWriter forPrintStream(PrintStream stream) {
    return new Streams(stream, stream);
  }

  /** Stdout for lines and prompts, stderr for diagnostics. */
  static OutputWriter system() {
    return new Streams(System.out, System.err);
  }

  final class Streams implements OutputWriter {
    private final PrintStream out;
    private final PrintStream err;

    Streams(PrintStream out, PrintStream err) {
      this.out = out;
      this.err = err;
    }

    @Override
    public void println(String line) {
      out.println(line);
    }

    @Override
    public void prompt(String text) {
      out.print(text);
      out.flush();
    }

    @Override
    public void error(String line) {
      err.println(line);
    }
  }
}
