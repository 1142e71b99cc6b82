package io.school.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A structured record with a fixed, ordered set of named fields. Keys in the document that are
 * not declared here are ignored.
 */
public record RecordShape(String name, Map<String, Shape> fields, boolean optional)
    implements Shape {

  public RecordShape {
    Objects.requireNonNull(name, "name");
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Same record, accepted as missing or null. */
  public RecordShape asOptional() {
    return new RecordShape(name, fields, true);
  }

  @Override
  public String typeName() {
    return name;
  }

  /** An absent optional record has no value. */
  @Override
  public Object emptyValue() {
    return null;
  }

  /** Collects fields in declaration order. */
  public static final class Builder {
    private final String name;
    private final Map<String, Shape> fields = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder field(String fieldName, Shape shape) {
      if (fields.putIfAbsent(fieldName, Objects.requireNonNull(shape, "shape")) != null) {
        throw new IllegalArgumentException(
            "Field '" + fieldName + "' declared twice in " + name);
      }
      return this;
    }

    public RecordShape build() {
      return new RecordShape(name, fields, false);
    }
  }
}
