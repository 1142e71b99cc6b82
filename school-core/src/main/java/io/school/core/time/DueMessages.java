package io.school.core.time;

import java.time.Duration;

/** Short human descriptions of how far away something is: "2 days, 3 hours", "5 minutes". */
public final class DueMessages {

  private DueMessages() {}

  /**
   * Describes the magnitude of {@code delta}; the sign is ignored. Days are followed by hours, or
   * by minutes when the hour part is zero. Seconds are dropped; under a minute reads "now" unless
   * whole days remain.
   */
  public static String describe(Duration delta) {
    Duration abs = delta.abs();
    long days = abs.toDays();
    long hours = abs.toHoursPart();
    long minutes = abs.toMinutesPart();

    StringBuilder sb = new StringBuilder();
    if (days != 0) {
      sb.append(plural(days, "day")).append(", ");
    }
    if (hours != 0) {
      sb.append(plural(hours, "hour"));
    } else {
      if (minutes != 0) {
        sb.append(plural(minutes, "minute"));
      }
      if (sb.length() == 0) {
        sb.append("now");
      }
    }

    String message = sb.toString().strip();
    return message.endsWith(",") ? message.substring(0, message.length() - 1) : message;
  }

  private static String plural(long count, String unit) {
    return count + " " + unit + (count > 1 ? "s" : "");
  }
}
