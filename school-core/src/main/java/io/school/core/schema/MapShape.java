package io.school.core.schema;

import java.util.Map;
import java.util.Objects;

/** A mapping with arbitrary string keys and values of one shape. */
public record MapShape(Shape value, boolean optional) implements Shape {

  public MapShape {
    Objects.requireNonNull(value, "value");
  }

  public static MapShape of(Shape value) {
    return new MapShape(value, false);
  }

  public static MapShape optionalOf(Shape value) {
    return new MapShape(value, true);
  }

  @Override
  public String typeName() {
    return "mapping of " + value.typeName();
  }

  @Override
  public Object emptyValue() {
    return Map.of();
  }
}
