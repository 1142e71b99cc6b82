package io.school.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;

/** Source of user responses, one line at a time. */
@FunctionalInterface
public interface LineInput {

  /**
   * Shows {@code prompt} and reads one line without its terminator.
   *
   * @throws InputCancelledException if input has ended
   */
  String readLine(String prompt) throws InputCancelledException;

  /** Interactive input through JLine; Ctrl+D and Ctrl+C both cancel. */
  static LineInput forLineReader(LineReader reader) {
    return prompt -> {
      try {
        return reader.readLine(prompt);
      } catch (EndOfFileException | UserInterruptException e) {
        throw new InputCancelledException(e);
      }
    };
  }

  /** Plain input for pipes and tests. The prompt goes to {@code out}. */
  static LineInput forReader(BufferedReader in, OutputWriter out) {
    return prompt -> {
      out.prompt(prompt);
      try {
        String line = in.readLine();
        if (line == null) {
          throw new InputCancelledException();
        }
        return line;
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    };
  }
}
