package io.school.core.render;

import java.util.List;
import java.util.Objects;

/**
 * One row of a {@link TableRenderer} table: either a multi-column data row or a full-width
 * section divider carrying a caption. Cells and captions may contain ANSI styling.
 */
public sealed interface TableRow permits TableRow.DataRow, TableRow.SectionRow {

  /** Row of cells; every data row in a table must have the same number of cells. */
  record DataRow(List<String> cells) implements TableRow {
    public DataRow {
      cells = List.copyOf(cells);
      if (cells.isEmpty()) {
        throw new IllegalArgumentException("A data row needs at least one cell");
      }
    }

    public int arity() {
      return cells.size();
    }
  }

  /** Full-width divider showing {@code caption}. */
  record SectionRow(String caption) implements TableRow {
    public SectionRow {
      Objects.requireNonNull(caption, "caption");
    }
  }

  static TableRow data(String... cells) {
    return new DataRow(List.of(cells));
  }

  static TableRow data(List<String> cells) {
    return new DataRow(cells);
  }

  static TableRow section(String caption) {
    return new SectionRow(caption);
  }
}
