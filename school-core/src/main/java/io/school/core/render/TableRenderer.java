package io.school.core.render;

import io.school.core.OutputWriter;
import io.school.core.render.TableRow.DataRow;
import io.school.core.render.TableRow.SectionRow;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@link TableRow}s as a box-drawn table with rounded corners.
 *
 * <pre>
 * ╭───{ Monday }────╮
 * │  9:00 │ Algebra │
 * │                 │
 * ├───{ Tuesday }───┤
 * │ 10:40 │ Physics │
 * ╰─────────────────╯
 * </pre>
 *
 * <p>Column widths are measured with {@link Ansi#visibleWidth}, so coloured cells line up.
 */
public final class TableRenderer {
  private static final String RULE = "─";
  private static final String COLUMN_SEPARATOR = Ansi.gray(" │ ");

  private TableRenderer() {}

  /** Prints the rendered table line by line. */
  public static void print(List<TableRow> rows, OutputWriter out) {
    out.printLines(render(rows));
  }

  /**
   * Lays out {@code rows} and returns the printed lines, borders included. An empty row list
   * produces no lines.
   *
   * @throws IllegalArgumentException if the data rows disagree on their number of cells
   */
  public static List<String> render(List<TableRow> rows) {
    if (rows == null || rows.isEmpty()) {
      return List.of();
    }
    int[] widths = columnWidths(rows);
    int interior = interiorWidth(widths);

    // A caption wider than the columns stretches the last column
    int captionWidth = 0;
    for (TableRow row : rows) {
      if (row instanceof SectionRow section) {
        captionWidth = Math.max(captionWidth, Ansi.visibleWidth(captionLabel(section)));
      }
    }
    if (captionWidth > interior) {
      if (widths.length > 0) {
        widths[widths.length - 1] += captionWidth - interior;
      }
      interior = captionWidth;
    }

    List<String> lines = new ArrayList<>();
    if (!(rows.get(0) instanceof SectionRow)) {
      lines.add("╭" + RULE.repeat(interior + 2) + "╮");
    }
    TableRow previous = null;
    for (TableRow row : rows) {
      if (row instanceof SectionRow section) {
        String divider = Ansi.center(captionLabel(section), interior, RULE.charAt(0));
        if (previous == null) {
          lines.add("╭─" + divider + "─╮");
        } else {
          if (previous instanceof DataRow) {
            lines.add("│ " + " ".repeat(interior) + " │");
          }
          lines.add("├─" + divider + "─┤");
        }
      } else if (row instanceof DataRow data) {
        lines.add(dataLine(data, widths));
      }
      previous = row;
    }
    lines.add("╰" + RULE.repeat(interior + 2) + "╯");
    return lines;
  }

  /** Visible width of each column, taken over all data rows. */
  static int[] columnWidths(List<TableRow> rows) {
    int[] widths = null;
    for (TableRow row : rows) {
      if (!(row instanceof DataRow data)) {
        continue;
      }
      if (widths == null) {
        widths = new int[data.arity()];
      } else if (widths.length != data.arity()) {
        throw new IllegalArgumentException(
            "Data row has "
                + data.arity()
                + " cells but the table has "
                + widths.length
                + " columns: "
                + data.cells());
      }
      for (int i = 0; i < widths.length; i++) {
        widths[i] = Math.max(widths[i], Ansi.visibleWidth(data.cells().get(i)));
      }
    }
    return widths == null ? new int[0] : widths;
  }

  private static int interiorWidth(int[] widths) {
    if (widths.length == 0) {
      return 0;
    }
    int sum = 0;
    for (int w : widths) {
      sum += w;
    }
    return sum + Ansi.visibleWidth(COLUMN_SEPARATOR) * (widths.length - 1);
  }

  private static String dataLine(DataRow row, int[] widths) {
    StringBuilder sb = new StringBuilder("│ ");
    for (int i = 0; i < widths.length; i++) {
      if (i > 0) {
        sb.append(COLUMN_SEPARATOR);
      }
      sb.append(Ansi.ljust(row.cells().get(i), widths[i]));
    }
    return sb.append(" │").toString();
  }

  private static String captionLabel(SectionRow section) {
    return Ansi.bold("{ " + section.caption() + " }");
  }
}
