package io.school.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A validated record: one value per declared field of its {@link RecordShape}, already checked
 * against the field's shape. Nested records are {@code RecordValue}s, sequences are lists and
 * mappings are insertion-ordered maps.
 *
 * <p>The typed accessors trust the shape; asking for an undeclared field or the wrong kind is a
 * programming error.
 */
public final class RecordValue {
  private final RecordShape shape;
  private final FieldPath path;
  private final Map<String, Object> values;

  RecordValue(RecordShape shape, FieldPath path, Map<String, Object> values) {
    this.shape = shape;
    this.path = path;
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public RecordShape shape() {
    return shape;
  }

  /** Where this record sits in the document. */
  public FieldPath path() {
    return path;
  }

  /** Path of one of this record's fields, for error reporting by factories. */
  public FieldPath pathOf(String field) {
    declared(field);
    return path.child(field);
  }

  /** Raw field value; {@code null} for an absent optional scalar without default. */
  public Object get(String field) {
    declared(field);
    return values.get(field);
  }

  public String string(String field) {
    return (String) get(field);
  }

  public Optional<String> optionalString(String field) {
    return Optional.ofNullable(string(field));
  }

  public long integer(String field) {
    return ((Number) require(field)).longValue();
  }

  public int intValue(String field) {
    return Math.toIntExact(integer(field));
  }

  public double number(String field) {
    return ((Number) require(field)).doubleValue();
  }

  public boolean bool(String field) {
    return (Boolean) require(field);
  }

  public RecordValue record(String field) {
    return (RecordValue) require(field);
  }

  public Optional<RecordValue> optionalRecord(String field) {
    return Optional.ofNullable((RecordValue) get(field));
  }

  @SuppressWarnings("unchecked")
  public <E> List<E> list(String field) {
    return (List<E>) require(field);
  }

  @SuppressWarnings("unchecked")
  public <V> Map<String, V> map(String field) {
    return (Map<String, V>) require(field);
  }

  private Object require(String field) {
    Object value = get(field);
    if (value == null) {
      throw new IllegalStateException(
          "Field '" + field + "' of " + shape.name() + " has no value at " + path);
    }
    return value;
  }

  private void declared(String field) {
    if (!shape.fields().containsKey(field)) {
      throw new IllegalArgumentException(
          "'" + field + "' is not a field of " + shape.name() + " " + shape.fields().keySet());
    }
  }

  @Override
  public String toString() {
    return shape.name() + values;
  }
}
