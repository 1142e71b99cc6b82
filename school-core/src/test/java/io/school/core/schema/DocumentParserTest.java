package io.school.core.schema;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

class DocumentParserTest {

  @Test
  void blankTextIsAnEmptyMapping() {
    JsonNode node = DocumentParser.parse("   \n", "blank.yaml").value();

    assertTrue(node.isObject());
    assertEquals(0, node.size());
  }

  @Test
  void nestedStructuresAreKept() {
    JsonNode node =
        DocumentParser.parse("types:\n  lab:\n    color: 118\nlist: [a, b]\n", "doc.yaml")
            .value();

    assertEquals(118, node.at("/types/lab/color").intValue());
    assertEquals("b", node.get("list").get(1).textValue());
  }

  @Test
  void duplicateKeysAreRejected() {
    LoadResult<JsonNode> result = DocumentParser.parse("x: 1\nx: 2\n", "dup.yaml");

    LoadError.ParseError error = assertInstanceOf(LoadError.ParseError.class, result.error());
    assertEquals(2, error.line());
    assertTrue(error.message().startsWith("invalid syntax at line 2"), error.message());
    assertTrue(error.message().contains("Duplicate field 'x'"), error.message());
  }

  @Test
  void syntaxErrorsNameTheDocument() {
    LoadResult<JsonNode> result = DocumentParser.parse("a: {b: 1\n", "broken.yaml");

    assertFalse(result.isSuccess());
    LoadError.ParseError error = assertInstanceOf(LoadError.ParseError.class, result.error());
    assertEquals("broken.yaml", error.source());
    assertFalse(error.message().contains("\n"));
  }
}
