package io.school.core.time;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Conversions between minutes after midnight and {@code H:MM} clock strings. */
public final class ClockTimes {
  private static final Pattern CLOCK = Pattern.compile("(\\d{1,2}):(\\d{2})");
  private static final int MINUTES_PER_DAY = 24 * 60;

  private ClockTimes() {}

  /** Formats minutes as {@code HH:MM}, the hour right-aligned to two characters. */
  public static String format(int minutes) {
    if (minutes < 0) {
      throw new IllegalArgumentException("Negative minutes: " + minutes);
    }
    return String.format(Locale.ROOT, "%2d:%02d", minutes / 60, minutes % 60);
  }

  /**
   * Parses {@code H:MM} or {@code HH:MM} into minutes after midnight.
   *
   * @throws IllegalArgumentException if the text is not a time of day
   */
  public static int parse(String text) {
    Matcher m = CLOCK.matcher(text.trim());
    if (!m.matches()) {
      throw new IllegalArgumentException("'" + text + "' is not a time in H:MM format");
    }
    int hours = Integer.parseInt(m.group(1));
    int minutes = Integer.parseInt(m.group(2));
    if (minutes >= 60 || hours * 60 + minutes >= MINUTES_PER_DAY) {
      throw new IllegalArgumentException("'" + text + "' is not a valid time of day");
    }
    return hours * 60 + minutes;
  }
}
