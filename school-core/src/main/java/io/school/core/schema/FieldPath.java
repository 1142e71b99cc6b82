package io.school.core.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Location of a value inside a configuration document, e.g. {@code course_types.lab.color} or
 * {@code timetable[2].day}.
 */
public final class FieldPath {
  private static final FieldPath ROOT = new FieldPath(List.of());

  private final List<String> segments;

  private FieldPath(List<String> segments) {
    this.segments = segments;
  }

  public static FieldPath root() {
    return ROOT;
  }

  /** Path of a named field or map key below this one. */
  public FieldPath child(String name) {
    return append(name);
  }

  /** Path of a sequence element below this one. */
  public FieldPath index(int index) {
    return append("[" + index + "]");
  }

  public boolean isRoot() {
    return segments.isEmpty();
  }

  /** Last segment, or an empty string for the root. */
  public String leaf() {
    return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
  }

  public List<String> segments() {
    return segments;
  }

  private FieldPath append(String segment) {
    List<String> next = new ArrayList<>(segments.size() + 1);
    next.addAll(segments);
    next.add(segment);
    return new FieldPath(Collections.unmodifiableList(next));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FieldPath other && segments.equals(other.segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  @Override
  public String toString() {
    if (segments.isEmpty()) {
      return "<root>";
    }
    StringBuilder sb = new StringBuilder();
    for (String segment : segments) {
      if (sb.length() > 0 && !segment.startsWith("[")) {
        sb.append('.');
      }
      sb.append(segment);
    }
    return sb.toString();
  }
}
