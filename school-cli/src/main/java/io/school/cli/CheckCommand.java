package io.school.cli;

import io.school.Main;
import io.school.config.SchoolConfig;
import io.school.core.schema.LoadResult;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(name = "check", description = "Validate the configuration file")
public final class CheckCommand implements Callable<Integer> {

  @CommandLine.ParentCommand private Main parent;

  @Override
  public Integer call() {
    LoadResult<SchoolConfig> config = parent.loadConfig();
    if (config instanceof LoadResult.Failure<SchoolConfig> failure) {
      return parent.fail(failure);
    }
    SchoolConfig loaded = config.value();
    parent.out()
        .println(
            StatusLine.success(
                parent.configFile()
                    + " is valid ("
                    + loaded.courseTypes().size()
                    + " course types, "
                    + loaded.timetable().size()
                    + " lectures)"));
    return Main.EXIT_OK;
  }
}
