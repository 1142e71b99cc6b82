package io.school.schedule;

import io.school.config.CourseType;
import io.school.config.Lecture;
import io.school.core.render.Ansi;
import io.school.core.render.TableRow;
import io.school.core.time.ClockTimes;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.TextStyle;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** The weekly schedule, ordered Monday first and by start time within a day. */
public final class Timetable {
  private static final Comparator<Lecture> WEEK_ORDER =
      Comparator.comparing(Lecture::day).thenComparingInt(Lecture::start);

  private final List<Lecture> lectures;
  private final Map<String, CourseType> courseTypes;

  /** A lecture together with the time left until it starts. */
  public record Upcoming(Lecture lecture, LocalDateTime startsAt, Duration until) {}

  public Timetable(List<Lecture> lectures, Map<String, CourseType> courseTypes) {
    List<Lecture> sorted = new ArrayList<>(lectures);
    sorted.sort(WEEK_ORDER);
    this.lectures = List.copyOf(sorted);
    this.courseTypes = courseTypes;
  }

  public List<Lecture> lectures() {
    return lectures;
  }

  public boolean isEmpty() {
    return lectures.isEmpty();
  }

  /** Table rows: a section per day with lectures, then one row per lecture of that day. */
  public List<TableRow> rows() {
    List<TableRow> rows = new ArrayList<>();
    DayOfWeek current = null;
    for (Lecture lecture : lectures) {
      if (lecture.day() != current) {
        current = lecture.day();
        rows.add(TableRow.section(dayName(current)));
      }
      rows.add(
          TableRow.data(
              ClockTimes.format(lecture.start()) + " - " + ClockTimes.format(lecture.end()),
              Ansi.color(lecture.course(), colorOf(lecture)),
              Ansi.gray(lecture.type())));
    }
    return rows;
  }

  /** Course names in the order they first occur during the week. */
  public List<String> courses() {
    Set<String> names = new LinkedHashSet<>();
    for (Lecture lecture : lectures) {
      names.add(lecture.course());
    }
    return List.copyOf(names);
  }

  /**
   * The lecture starting soonest at or after {@code now}, looking at most one week ahead. A
   * lecture already in progress counts from its next weekly occurrence.
   */
  public Optional<Upcoming> next(LocalDateTime now) {
    Upcoming best = null;
    for (Lecture lecture : lectures) {
      LocalDateTime startsAt = nextOccurrence(lecture, now);
      if (best == null || startsAt.isBefore(best.startsAt())) {
        best = new Upcoming(lecture, startsAt, Duration.between(now, startsAt));
      }
    }
    return Optional.ofNullable(best);
  }

  public int colorOf(Lecture lecture) {
    CourseType type = courseTypes.get(lecture.type());
    return type == null ? Ansi.GRAY : type.color();
  }

  static LocalDateTime nextOccurrence(Lecture lecture, LocalDateTime now) {
    LocalDateTime candidate =
        now.toLocalDate()
            .with(TemporalAdjusters.nextOrSame(lecture.day()))
            .atTime(LocalTime.MIN.plusMinutes(lecture.start()));
    return candidate.isBefore(now) ? candidate.plusWeeks(1) : candidate;
  }

  static String dayName(DayOfWeek day) {
    return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
  }
}
