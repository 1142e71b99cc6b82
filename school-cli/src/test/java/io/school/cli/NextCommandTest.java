package io.school.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.school.config.CourseType;
import io.school.config.Lecture;
import io.school.core.render.Ansi;
import io.school.schedule.Timetable;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NextCommandTest {
  private static final Lecture LOGIC = new Lecture("Logic", "seminar", DayOfWeek.MONDAY, 555, 645);
  private static final Timetable TIMETABLE =
      new Timetable(List.of(LOGIC), Map.of("seminar", new CourseType(200, false)));

  @Test
  void upcomingLectureShowsStartAndDistance() {
    Timetable.Upcoming upcoming =
        new Timetable.Upcoming(
            LOGIC, LocalDateTime.of(2026, 10, 26, 9, 15), Duration.ofDays(2).plusHours(3));

    String line = NextCommand.describe(upcoming, TIMETABLE);

    assertEquals("Logic (seminar) at 9:15, in 2 days, 3 hours", Ansi.strip(line));
    assertTrue(line.startsWith(Ansi.color(Ansi.bold("Logic"), 200)));
  }

  @Test
  void lectureStartingThisMinuteSaysSo() {
    Timetable.Upcoming upcoming =
        new Timetable.Upcoming(
            LOGIC, LocalDateTime.of(2026, 10, 19, 9, 15), Duration.ofSeconds(20));

    assertEquals(
        "Logic (seminar) at 9:15, starting now",
        Ansi.strip(NextCommand.describe(upcoming, TIMETABLE)));
  }
}
