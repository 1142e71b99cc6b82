package io.school.core.schema;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class RecordShapeTest {

  @Test
  void fieldsKeepDeclarationOrder() {
    RecordShape shape =
        RecordShape.builder("Lecture")
            .field("day", ScalarShape.required(ScalarKind.STRING))
            .field("course", ScalarShape.required(ScalarKind.STRING))
            .field("start", ScalarShape.required(ScalarKind.STRING))
            .build();

    assertEquals(List.of("day", "course", "start"), List.copyOf(shape.fields().keySet()));
    assertFalse(shape.optional());
    assertTrue(shape.asOptional().optional());
  }

  @Test
  void duplicateFieldIsAProgrammingError() {
    RecordShape.Builder builder =
        RecordShape.builder("Twice").field("a", ScalarShape.required(ScalarKind.STRING));

    assertThrows(
        IllegalArgumentException.class,
        () -> builder.field("a", ScalarShape.required(ScalarKind.INTEGER)));
  }

  @Test
  void requiredScalarCannotHaveDefault() {
    assertThrows(
        IllegalArgumentException.class, () -> new ScalarShape(ScalarKind.STRING, false, "x"));
  }

  @Test
  void typeNamesDescribeNesting() {
    assertEquals(
        "mapping of list of integer",
        MapShape.of(SequenceShape.of(ScalarShape.required(ScalarKind.INTEGER))).typeName());
  }
}
