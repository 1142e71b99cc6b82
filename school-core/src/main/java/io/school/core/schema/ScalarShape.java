package io.school.core.schema;

import java.util.Objects;

/** A string, integer, number or boolean. */
public record ScalarShape(ScalarKind kind, boolean optional, Object defaultValue)
    implements Shape {

  public ScalarShape {
    Objects.requireNonNull(kind, "kind");
    if (!optional && defaultValue != null) {
      throw new IllegalArgumentException("Only optional scalars can declare a default");
    }
  }

  public static ScalarShape required(ScalarKind kind) {
    return new ScalarShape(kind, false, null);
  }

  public static ScalarShape optional(ScalarKind kind) {
    return new ScalarShape(kind, true, null);
  }

  public static ScalarShape optional(ScalarKind kind, Object defaultValue) {
    return new ScalarShape(kind, true, defaultValue);
  }

  @Override
  public String typeName() {
    return kind.displayName();
  }

  @Override
  public Object emptyValue() {
    return defaultValue;
  }
}
