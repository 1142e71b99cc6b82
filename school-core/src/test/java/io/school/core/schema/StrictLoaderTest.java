package io.school.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StrictLoaderTest {

  private static final RecordShape POINT =
      RecordShape.builder("Point")
          .field("x", ScalarShape.required(ScalarKind.INTEGER))
          .field("y", ScalarShape.required(ScalarKind.INTEGER))
          .build();

  private static final RecordShape ALL_OPTIONAL =
      RecordShape.builder("Settings")
          .field("name", ScalarShape.optional(ScalarKind.STRING, "untitled"))
          .field("count", ScalarShape.optional(ScalarKind.INTEGER))
          .field("tags", SequenceShape.optionalOf(ScalarShape.required(ScalarKind.STRING)))
          .field("aliases", MapShape.optionalOf(ScalarShape.required(ScalarKind.STRING)))
          .field("origin", POINT.asOptional())
          .build();

  private static LoadResult<RecordValue> load(String text, RecordShape shape) {
    return StrictLoader.load(text, "test.yaml", shape, Function.identity());
  }

  @Test
  void emptyDocumentFillsOptionalFieldsWithEmptyValues() {
    LoadResult<RecordValue> result = load("", ALL_OPTIONAL);

    assertTrue(result.isSuccess());
    RecordValue settings = result.value();
    assertEquals("untitled", settings.string("name"));
    assertNull(settings.get("count"));
    assertTrue(settings.list("tags").isEmpty());
    assertTrue(settings.map("aliases").isEmpty());
    assertTrue(settings.optionalRecord("origin").isEmpty());
  }

  @Test
  void commentOnlyAndNullDocumentsAreEmpty() {
    assertTrue(load("# nothing here\n", ALL_OPTIONAL).isSuccess());
    assertTrue(load("~\n", ALL_OPTIONAL).isSuccess());
  }

  @Test
  void explicitNullResolvesOptionalFieldToEmpty() {
    RecordValue settings = load("name:\ntags: ~\n", ALL_OPTIONAL).value();

    assertEquals("untitled", settings.string("name"));
    assertTrue(settings.list("tags").isEmpty());
  }

  @Test
  void wrongScalarTypeIsReportedWithFieldName() {
    RecordShape shape =
        RecordShape.builder("Theme").field("color", ScalarShape.required(ScalarKind.NUMBER)).build();

    LoadResult<RecordValue> result = load("{\"color\": \"blue\"}", shape);

    assertFalse(result.isSuccess());
    LoadError.TypeMismatchError error = (LoadError.TypeMismatchError) result.error();
    assertEquals("color", error.path().toString());
    assertEquals("number", error.expectedType());
    assertEquals("blue", error.actualValue());
    assertEquals("field 'color' expected type number but got value 'blue'", error.message());
  }

  @Test
  void missingFieldNamesTheMissingKeyNotItsSiblings() {
    RecordShape shape =
        RecordShape.builder("Root").field("c", ScalarShape.required(ScalarKind.STRING)).build();

    LoadResult<RecordValue> result = load("{\"a\": {\"b\": 1}}", shape);

    LoadError.MissingFieldError error = (LoadError.MissingFieldError) result.error();
    assertEquals("c", error.field());
    assertEquals("c", error.path().toString());
    assertEquals("Root", error.recordName());
    assertThat(error.message()).contains("'c'").doesNotContain("'a'").doesNotContain("'b'");
    assertEquals("missing required field 'c' at 'c'", error.message());
  }

  @Test
  void errorsInNestedStructuresCarryTheFullPath() {
    RecordShape shape =
        RecordShape.builder("Root")
            .field("points", MapShape.of(POINT))
            .field("route", SequenceShape.of(POINT))
            .build();

    LoadError mapError =
        load("points: {home: {x: 1, y: up}}\nroute: []\n", shape).error();
    assertEquals("points.home.y", mapError.path().toString());

    LoadError listError =
        load("points: {}\nroute: [{x: 1, y: 2}, {x: 3}]\n", shape).error();
    assertInstanceOf(LoadError.MissingFieldError.class, listError);
    assertEquals("route[1].y", listError.path().toString());
    assertEquals("missing required field 'y' at 'route[1].y'", listError.message());
  }

  @Test
  void undeclaredKeysAreIgnored() {
    RecordValue point = load("x: 1\ny: 2\nz: 3\ncomment: hi\n", POINT).value();

    assertEquals(1, point.integer("x"));
    assertEquals(2, point.intValue("y"));
    assertThrows(IllegalArgumentException.class, () -> point.get("z"));
  }

  @Test
  void requiredFieldRejectsNull() {
    LoadError error = load("x: 1\ny:\n", POINT).error();

    LoadError.TypeMismatchError mismatch = assertInstanceOf(LoadError.TypeMismatchError.class, error);
    assertEquals("y", mismatch.path().toString());
    assertEquals("null", mismatch.actualValue());
  }

  @Test
  void scalarKindsDoNotCoerce() {
    RecordShape shape =
        RecordShape.builder("Kinds")
            .field("s", ScalarShape.optional(ScalarKind.STRING))
            .field("i", ScalarShape.optional(ScalarKind.INTEGER))
            .field("n", ScalarShape.optional(ScalarKind.NUMBER))
            .field("b", ScalarShape.optional(ScalarKind.BOOLEAN))
            .build();

    RecordValue ok = load("s: text\ni: 7\nn: 1.5\nb: true\n", shape).value();
    assertEquals("text", ok.string("s"));
    assertEquals(7L, ok.get("i"));
    assertEquals(1.5, ok.number("n"));
    assertTrue(ok.bool("b"));

    assertEquals(3L, load("n: 3\n", shape).value().get("n"));

    assertEquals("s", load("s: 5\n", shape).error().path().toString());
    assertEquals("i", load("i: 1.5\n", shape).error().path().toString());
    assertEquals("i", load("i: \"7\"\n", shape).error().path().toString());
    assertEquals("n", load("n: \"1.5\"\n", shape).error().path().toString());
    assertEquals("b", load("b: 1\n", shape).error().path().toString());
  }

  @Test
  void sequencesAndMapsKeepDocumentOrder() {
    RecordValue settings =
        load("tags: [c, a, b]\naliases: {z: last, a: first}\n", ALL_OPTIONAL).value();

    assertEquals(List.of("c", "a", "b"), settings.list("tags"));
    Map<String, String> aliases = settings.map("aliases");
    assertEquals(List.of("z", "a"), List.copyOf(aliases.keySet()));
  }

  @Test
  void containerOfWrongKindIsAMismatch() {
    LoadError error = load("tags: single\n", ALL_OPTIONAL).error();

    LoadError.TypeMismatchError mismatch = assertInstanceOf(LoadError.TypeMismatchError.class, error);
    assertEquals("list of string", mismatch.expectedType());
  }

  @Test
  void documentThatIsNotAMappingFailsAtTheRoot() {
    LoadError error = load("- 1\n- 2\n", POINT).error();

    assertInstanceOf(LoadError.TypeMismatchError.class, error);
    assertTrue(error.path().isRoot());
    assertEquals("field '<root>' expected type Point but got value '[1,2]'", error.message());
  }

  @Test
  void malformedSyntaxIsAParseErrorWithLocation() {
    LoadResult<RecordValue> result = load("x: [1, 2\ny: 3\n", POINT);

    LoadResult.Failure<RecordValue> failure = assertInstanceOf(LoadResult.Failure.class, result);
    LoadError.ParseError error = assertInstanceOf(LoadError.ParseError.class, failure.error());
    assertEquals("test.yaml", error.source());
    assertEquals("test.yaml", failure.source());
    assertTrue(error.line() > 0);
    assertTrue(error.message().startsWith("invalid syntax at line "));
  }

  @Test
  void failuresRememberTheirSource() {
    LoadResult<RecordValue> result = load("x: 1\n", POINT);

    assertEquals("test.yaml", ((LoadResult.Failure<RecordValue>) result).source());
  }

  @Test
  void factoryRunsOnlyForValidDocuments() {
    AtomicBoolean called = new AtomicBoolean();
    Function<RecordValue, String> factory =
        record -> {
          called.set(true);
          return record.integer("x") + "," + record.integer("y");
        };

    LoadResult<String> failed = StrictLoader.load("x: 1\ny: nope\n", "p.yaml", POINT, factory);
    assertFalse(failed.isSuccess());
    assertFalse(called.get());

    LoadResult<String> loaded = StrictLoader.load("x: 1\ny: 2\n", "p.yaml", POINT, factory);
    assertEquals("1,2", loaded.value());
    assertTrue(called.get());
  }

  @Test
  void factoryRejectionBecomesInvalidValueError() {
    LoadResult<Integer> result =
        StrictLoader.load(
            "x: -4\ny: 0\n",
            "p.yaml",
            POINT,
            record -> {
              if (record.integer("x") < 0) {
                throw new ConfigValueException(record.pathOf("x"), "must not be negative");
              }
              return record.intValue("x");
            });

    LoadError.InvalidValueError error =
        assertInstanceOf(LoadError.InvalidValueError.class, result.error());
    assertEquals("x", error.path().toString());
    assertEquals("field 'x' must not be negative", error.message());
  }

  @Test
  void buildWorksOnTreesDirectly() {
    JsonNodeFactory nodes = JsonNodeFactory.instance;
    LoadResult<Object> built =
        StrictLoader.build(
            SequenceShape.of(ScalarShape.required(ScalarKind.INTEGER)),
            nodes.arrayNode().add(1).add(2),
            FieldPath.root().child("numbers"));

    assertEquals(List.of(1L, 2L), built.value());
  }

  @Test
  void missingFileLoadsLikeAnEmptyDocument(@TempDir Path dir) {
    LoadResult<RecordValue> result =
        StrictLoader.loadFile(dir.resolve("absent.yaml"), ALL_OPTIONAL, Function.identity());

    assertEquals("untitled", result.value().string("name"));
  }

  @Test
  void fileContentsAreLoaded(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("point.yaml");
    Files.writeString(file, "x: 3\n");

    LoadResult<RecordValue> result = StrictLoader.loadFile(file, POINT, Function.identity());

    assertEquals(file.toString(), ((LoadResult.Failure<RecordValue>) result).source());
    assertInstanceOf(LoadError.MissingFieldError.class, result.error());
  }
}
