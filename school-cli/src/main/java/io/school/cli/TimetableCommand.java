package io.school.cli;

import io.school.Main;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(name = "timetable", description = "Print the weekly timetable")
public final class TimetableCommand implements Callable<Integer> {

  @CommandLine.ParentCommand private Main parent;

  @Override
  public Integer call() {
    return parent.showTimetable();
  }
}
