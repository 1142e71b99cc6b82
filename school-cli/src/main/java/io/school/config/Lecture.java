package io.school.config;

import io.school.core.schema.ConfigValueException;
import io.school.core.schema.RecordShape;
import io.school.core.schema.RecordValue;
import io.school.core.schema.ScalarKind;
import io.school.core.schema.ScalarShape;
import io.school.core.time.ClockTimes;
import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Set;

/**
 * One weekly meeting of a course.
 *
 * @param start minutes after midnight
 * @param end minutes after midnight, after {@code start}
 */
public record Lecture(String course, String type, DayOfWeek day, int start, int end) {

  static final RecordShape SHAPE =
      RecordShape.builder("Lecture")
          .field("course", ScalarShape.required(ScalarKind.STRING))
          .field("type", ScalarShape.required(ScalarKind.STRING))
          .field("day", ScalarShape.required(ScalarKind.STRING))
          .field("start", ScalarShape.required(ScalarKind.STRING))
          .field("end", ScalarShape.required(ScalarKind.STRING))
          .build();

  static Lecture fromRecord(RecordValue record, Set<String> courseTypes) {
    String type = record.string("type");
    if (!courseTypes.contains(type)) {
      throw new ConfigValueException(
          record.pathOf("type"), "names unknown course type '" + type + "', known: " + courseTypes);
    }
    DayOfWeek day = parseDay(record);
    int start = parseTime(record, "start");
    int end = parseTime(record, "end");
    if (end <= start) {
      throw new ConfigValueException(
          record.pathOf("end"),
          "must be later than start " + ClockTimes.format(start).strip());
    }
    return new Lecture(record.string("course"), type, day, start, end);
  }

  private static DayOfWeek parseDay(RecordValue record) {
    String day = record.string("day");
    try {
      return DayOfWeek.valueOf(day.strip().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigValueException(
          record.pathOf("day"), "must be an English weekday name but was '" + day + "'", e);
    }
  }

  private static int parseTime(RecordValue record, String field) {
    try {
      return ClockTimes.parse(record.string(field));
    } catch (IllegalArgumentException e) {
      throw new ConfigValueException(record.pathOf(field), e.getMessage(), e);
    }
  }
}
