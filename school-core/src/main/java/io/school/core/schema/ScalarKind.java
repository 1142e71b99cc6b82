package io.school.core.schema;

import com.fasterxml.jackson.databind.JsonNode;

/** Runtime kinds a scalar field may be declared with. Matching is exact; nothing is coerced. */
public enum ScalarKind {
  STRING("string"),
  INTEGER("integer"),
  NUMBER("number"),
  BOOLEAN("boolean");

  private final String displayName;

  ScalarKind(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  /** Whether {@code node} holds a value of this kind. */
  public boolean accepts(JsonNode node) {
    return switch (this) {
      case STRING -> node.isTextual();
      case INTEGER -> node.isIntegralNumber() && node.canConvertToLong();
      case NUMBER -> node.isNumber();
      case BOOLEAN -> node.isBoolean();
    };
  }

  /** Converts an accepted node to String, Long, Long or Double, and Boolean respectively. */
  Object convert(JsonNode node) {
    switch (this) {
      case STRING:
        return node.textValue();
      case INTEGER:
        return node.longValue();
      case NUMBER:
        if (node.isIntegralNumber() && node.canConvertToLong()) {
          return node.longValue();
        }
        return node.doubleValue();
      default:
        return node.booleanValue();
    }
  }
}
