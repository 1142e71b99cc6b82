package io.school.core;

import java.util.List;

/**
 * Lets the user choose one of several items by number.
 *
 * <pre>
 * 1) Algebra
 * 2) Physics
 * Pick one (leave blank for 1): 2
 * </pre>
 *
 * <p>Blank input picks the first item. Anything that is not a valid number is ignored and the
 * prompt is shown again, without complaint.
 */
public final class InteractivePicker {
  static final String PROMPT = "Pick one (leave blank for 1): ";

  private final LineInput input;
  private final OutputWriter out;

  public InteractivePicker(LineInput input, OutputWriter out) {
    this.input = input;
    this.out = out;
  }

  /**
   * Returns the chosen item. A single item is returned at once, without printing or reading.
   *
   * @throws IllegalArgumentException if {@code choices} is empty
   * @throws InputCancelledException if input ends before a valid choice was made
   */
  public <T> T pick(List<T> choices) throws InputCancelledException {
    if (choices.isEmpty()) {
      throw new IllegalArgumentException("Nothing to pick from");
    }
    if (choices.size() == 1) {
      return choices.get(0);
    }

    for (int i = 0; i < choices.size(); i++) {
      out.println((i + 1) + ") " + choices.get(i));
    }

    while (true) {
      int index = parseChoice(input.readLine(PROMPT), choices.size());
      if (index >= 0) {
        return choices.get(index);
      }
    }
  }

  /** Zero-based index for {@code response}, or -1 if it does not name an item. */
  static int parseChoice(String response, int count) {
    String trimmed = response.trim();
    if (trimmed.isEmpty()) {
      return 0;
    }
    int number;
    try {
      number = Integer.parseInt(trimmed);
    } catch (NumberFormatException e) {
      return -1;
    }
    return number >= 1 && number <= count ? number - 1 : -1;
  }
}
