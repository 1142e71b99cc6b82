package io.school.cli;

import io.school.Main;
import io.school.config.CourseType;
import io.school.config.SchoolConfig;
import io.school.core.render.Ansi;
import io.school.core.render.TableRenderer;
import io.school.core.render.TableRow;
import io.school.core.schema.LoadResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(name = "types", description = "List the configured course types")
public final class TypesCommand implements Callable<Integer> {

  @CommandLine.ParentCommand private Main parent;

  @Override
  public Integer call() {
    LoadResult<SchoolConfig> config = parent.loadConfig();
    if (config instanceof LoadResult.Failure<SchoolConfig> failure) {
      return parent.fail(failure);
    }
    TableRenderer.print(rows(config.value().courseTypes()), parent.out());
    return Main.EXIT_OK;
  }

  static List<TableRow> rows(Map<String, CourseType> types) {
    List<TableRow> rows = new ArrayList<>();
    rows.add(TableRow.section("Course types"));
    types.forEach(
        (name, type) ->
            rows.add(
                TableRow.data(
                    Ansi.color(name, type.color()),
                    Ansi.gray(String.valueOf(type.color())),
                    type.hasHomework() ? "homework" : "no homework")));
    return rows;
  }
}
