package io.school.core.schema;

import java.util.List;
import java.util.Objects;

/** A list whose elements all have the same shape. */
public record SequenceShape(Shape element, boolean optional) implements Shape {

  public SequenceShape {
    Objects.requireNonNull(element, "element");
  }

  public static SequenceShape of(Shape element) {
    return new SequenceShape(element, false);
  }

  public static SequenceShape optionalOf(Shape element) {
    return new SequenceShape(element, true);
  }

  @Override
  public String typeName() {
    return "list of " + element.typeName();
  }

  @Override
  public Object emptyValue() {
    return List.of();
  }
}
