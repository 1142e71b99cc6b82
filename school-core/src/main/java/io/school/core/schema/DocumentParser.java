package io.school.core.schema;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Parses YAML configuration text into an untyped Jackson tree. Duplicate keys are rejected. An
 * empty, comment-only or {@code null} document parses to an empty mapping.
 */
public final class DocumentParser {
  private static final ObjectMapper MAPPER =
      new ObjectMapper(new YAMLFactory())
          .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

  private DocumentParser() {}

  public static LoadResult<JsonNode> parse(String text, String source) {
    if (text == null || text.isBlank()) {
      return LoadResult.success(MAPPER.createObjectNode());
    }
    try {
      JsonNode node = MAPPER.readTree(text);
      if (node == null || node.isMissingNode() || node.isNull()) {
        return LoadResult.success(MAPPER.createObjectNode());
      }
      return LoadResult.success(node);
    } catch (JsonProcessingException e) {
      JsonLocation location = e.getLocation();
      int line = location == null ? 0 : Math.max(0, location.getLineNr());
      int column = location == null ? 0 : Math.max(0, location.getColumnNr());
      return LoadResult.<JsonNode>failure(
              new LoadError.ParseError(source, line, column, oneLine(e.getOriginalMessage())))
          .withSource(source);
    }
  }

  private static String oneLine(String message) {
    return message == null ? "unreadable document" : message.replaceAll("\\s+", " ").trim();
  }
}
