package io.school;

import io.school.cli.CheckCommand;
import io.school.cli.NextCommand;
import io.school.cli.PickCommand;
import io.school.cli.StatusLine;
import io.school.cli.TimetableCommand;
import io.school.cli.TypesCommand;
import io.school.config.SchoolConfig;
import io.school.core.LineInput;
import io.school.core.OutputWriter;
import io.school.core.render.TableRenderer;
import io.school.core.schema.LoadResult;
import io.school.schedule.Timetable;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "school",
    description = "Weekly timetable and course helper",
    version = "0.1.0",
    mixinStandardHelpOptions = true,
    subcommands = {
      TimetableCommand.class,
      NextCommand.class,
      TypesCommand.class,
      PickCommand.class,
      CheckCommand.class
    })
public final class Main implements Callable<Integer> {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_ERROR = 1;

  static final Path DEFAULT_CONFIG =
      Path.of(System.getProperty("user.home"), ".school", "config.yaml");

  @CommandLine.Option(
      names = {"-c", "--config"},
      description = "Configuration file (default: ~/.school/config.yaml)")
  private Path configFile = DEFAULT_CONFIG;

  private final OutputWriter out;
  private final LineInput lineInput;
  private final Clock clock;

  public Main() {
    this(OutputWriter.system(), null, Clock.systemDefaultZone());
  }

  /**
   * @param lineInput source of picker responses, or {@code null} to open the terminal on demand
   */
  public Main(OutputWriter out, LineInput lineInput, Clock clock) {
    this.out = out;
    this.lineInput = lineInput;
    this.clock = clock;
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  /** Without a subcommand the timetable is shown. */
  @Override
  public Integer call() {
    return showTimetable();
  }

  public int showTimetable() {
    LoadResult<SchoolConfig> config = loadConfig();
    if (config instanceof LoadResult.Failure<SchoolConfig> failure) {
      return fail(failure);
    }
    SchoolConfig loaded = config.value();
    Timetable timetable = new Timetable(loaded.timetable(), loaded.courseTypes());
    if (timetable.isEmpty()) {
      out.println("No lectures scheduled.");
      return EXIT_OK;
    }
    TableRenderer.print(timetable.rows(), out);
    return EXIT_OK;
  }

  public LoadResult<SchoolConfig> loadConfig() {
    LOG.debug("Loading configuration from {}", configFile);
    return SchoolConfig.load(configFile);
  }

  /** Reports a failed load and returns the exit code for it. */
  public int fail(LoadResult.Failure<?> failure) {
    out.println(StatusLine.error(failure));
    return EXIT_ERROR;
  }

  public Path configFile() {
    return configFile;
  }

  public OutputWriter out() {
    return out;
  }

  /** Injected picker input, {@code null} when the terminal should be used. */
  public LineInput lineInput() {
    return lineInput;
  }

  public Clock clock() {
    return clock;
  }
}
