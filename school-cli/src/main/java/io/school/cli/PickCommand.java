package io.school.cli;

import io.school.Main;
import io.school.config.SchoolConfig;
import io.school.core.InputCancelledException;
import io.school.core.InteractivePicker;
import io.school.core.LineInput;
import io.school.core.schema.LoadResult;
import io.school.schedule.Timetable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "pick",
    description = "Choose one of the timetable's courses and print its folder")
public final class PickCommand implements Callable<Integer> {
  private static final Logger LOG = LoggerFactory.getLogger(PickCommand.class);

  @CommandLine.ParentCommand private Main parent;

  @Override
  public Integer call() {
    LoadResult<SchoolConfig> config = parent.loadConfig();
    if (config instanceof LoadResult.Failure<SchoolConfig> failure) {
      return parent.fail(failure);
    }
    SchoolConfig loaded = config.value();
    List<String> courses = new Timetable(loaded.timetable(), loaded.courseTypes()).courses();
    if (courses.isEmpty()) {
      parent
          .out()
          .println(StatusLine.error("no courses in the timetable", parent.configFile().toString()));
      return Main.EXIT_ERROR;
    }

    LineInput input = parent.lineInput();
    if (input != null) {
      return pick(loaded, courses, input);
    }
    try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
      LineReader reader = LineReaderBuilder.builder().terminal(terminal).build();
      return pick(loaded, courses, LineInput.forLineReader(reader));
    } catch (IOException e) {
      LOG.debug("Cannot open terminal", e);
      parent.out().error(StatusLine.error("cannot open terminal: " + e.getMessage(), null));
      return Main.EXIT_ERROR;
    }
  }

  private int pick(SchoolConfig config, List<String> courses, LineInput input) {
    String course;
    try {
      course = new InteractivePicker(input, parent.out()).pick(courses);
    } catch (InputCancelledException e) {
      LOG.debug("Course selection cancelled");
      return Main.EXIT_OK;
    }
    Path folder = Path.of(config.coursesFolder(), course);
    parent.out().println(StatusLine.success(folder.toString()));
    return Main.EXIT_OK;
  }
}
