package io.school.core.render;

import java.util.regex.Pattern;

/**
 * ANSI helpers for styled terminal text.
 *
 * <p>Width computations treat escape sequences as zero-width. Only one escape grammar is
 * recognized: {@code ESC} followed by a single byte in {@code @-Z \ -_}, or a CSI sequence
 * ({@code ESC [} parameter bytes, intermediate bytes, final byte). Any other control text counts
 * as visible.
 */
public final class Ansi {

  private static final Pattern ESCAPE =
      Pattern.compile("\u001B(?:[@-Z\\\\-_]|\\[[0-?]*[ -/]*[@-~])");

  private static final String RESET = "\u001B[0m";

  /** 256-colour palette index used for de-emphasised text. */
  public static final int GRAY = 240;

  /** Palette index for error status lines. */
  public static final int RED = 9;

  /** Palette index for success status lines. */
  public static final int GREEN = 10;

  /** Horizontal alignment for {@link #pad}. */
  public enum Alignment {
    LEFT,
    RIGHT,
    CENTER
  }

  private Ansi() {}

  /** Paints {@code text} with a 256-colour foreground. */
  public static String color(String text, int color) {
    return "\u001B[38;5;" + color + "m" + text + RESET;
  }

  public static String gray(String text) {
    return color(text, GRAY);
  }

  public static String bold(String text) {
    return "\u001B[1m" + text + RESET;
  }

  public static String underline(String text) {
    return "\u001B[4m" + text + RESET;
  }

  public static String italics(String text) {
    return "\u001B[3m" + text + RESET;
  }

  /**
   * Removes every recognized escape sequence. Removing one sequence can join its neighbours into
   * a new one, so stripping repeats until nothing changes.
   */
  public static String strip(String text) {
    String current = text;
    while (true) {
      String stripped = ESCAPE.matcher(current).replaceAll("");
      if (stripped.equals(current)) {
        return stripped;
      }
      current = stripped;
    }
  }

  /** Number of characters a terminal actually renders for {@code text}. */
  public static int visibleWidth(String text) {
    return strip(text).length();
  }

  /**
   * Pads {@code text} with {@code fill} so that its visible width is {@code width}. Text that is
   * already wider is returned unchanged. Centering puts the odd remainder on the trailing side.
   */
  public static String pad(String text, int width, Alignment alignment, char fill) {
    int target = width + (text.length() - visibleWidth(text));
    int extra = target - text.length();
    if (extra <= 0) {
      return text;
    }
    String filler = String.valueOf(fill);
    return switch (alignment) {
      case LEFT -> text + filler.repeat(extra);
      case RIGHT -> filler.repeat(extra) + text;
      case CENTER -> {
        int leading = extra / 2;
        yield filler.repeat(leading) + text + filler.repeat(extra - leading);
      }
    };
  }

  public static String ljust(String text, int width) {
    return pad(text, width, Alignment.LEFT, ' ');
  }

  public static String rjust(String text, int width) {
    return pad(text, width, Alignment.RIGHT, ' ');
  }

  public static String center(String text, int width) {
    return pad(text, width, Alignment.CENTER, ' ');
  }

  public static String center(String text, int width, char fill) {
    return pad(text, width, Alignment.CENTER, fill);
  }
}
