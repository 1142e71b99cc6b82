package io.school.cli;

import io.school.Main;
import io.school.config.Lecture;
import io.school.config.SchoolConfig;
import io.school.core.render.Ansi;
import io.school.core.schema.LoadResult;
import io.school.core.time.ClockTimes;
import io.school.core.time.DueMessages;
import io.school.schedule.Timetable;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(name = "next", description = "Show the next lecture and how soon it starts")
public final class NextCommand implements Callable<Integer> {

  @CommandLine.ParentCommand private Main parent;

  @Override
  public Integer call() {
    LoadResult<SchoolConfig> config = parent.loadConfig();
    if (config instanceof LoadResult.Failure<SchoolConfig> failure) {
      return parent.fail(failure);
    }
    SchoolConfig loaded = config.value();
    Timetable timetable = new Timetable(loaded.timetable(), loaded.courseTypes());
    Optional<Timetable.Upcoming> next = timetable.next(LocalDateTime.now(parent.clock()));
    if (next.isEmpty()) {
      parent.out().println("No lectures scheduled.");
      return Main.EXIT_OK;
    }
    parent.out().println(describe(next.get(), timetable));
    return Main.EXIT_OK;
  }

  static String describe(Timetable.Upcoming upcoming, Timetable timetable) {
    Lecture lecture = upcoming.lecture();
    String due = DueMessages.describe(upcoming.until());
    return Ansi.color(Ansi.bold(lecture.course()), timetable.colorOf(lecture))
        + " ("
        + lecture.type()
        + ") at "
        + ClockTimes.format(lecture.start()).strip()
        + ", "
        + ("now".equals(due) ? "starting now" : "in " + due);
  }
}
