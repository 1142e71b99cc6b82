package io.school.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a configuration document into a typed value, checking every field against a declared
 * {@link Shape}.
 *
 * <p>Loading is all-or-nothing: the record factory runs only after the whole document has been
 * validated, and the first error stops the walk. Nothing here prints or exits; callers decide how
 * to report a {@link LoadResult.Failure}.
 *
 * <pre>
 * RecordShape shape = RecordShape.builder("Settings")
 *     .field("color", ScalarShape.required(ScalarKind.INTEGER))
 *     .build();
 * LoadResult&lt;Integer&gt; color =
 *     StrictLoader.load(text, "settings.yaml", shape, r -&gt; r.intValue("color"));
 * </pre>
 */
public final class StrictLoader {
  private static final Logger LOG = LoggerFactory.getLogger(StrictLoader.class);

  private StrictLoader() {}

  /** Reads and loads {@code file}. A file that does not exist loads like an empty document. */
  public static <T> LoadResult<T> loadFile(
      Path file, RecordShape shape, Function<RecordValue, T> factory) {
    String source = file.toString();
    String text;
    try {
      text = Files.readString(file, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      LOG.debug("{} does not exist, loading defaults", file);
      text = "";
    } catch (IOException e) {
      LOG.debug("Cannot read {}", file, e);
      return LoadResult.<T>failure(
              new LoadError.ParseError(source, 0, 0, "cannot read file: " + e.getMessage()))
          .withSource(source);
    }
    return load(text, source, shape, factory);
  }

  /**
   * Parses {@code text} and builds a value of {@code shape}, then hands it to {@code factory}.
   *
   * @param source document name used in error reports
   * @param factory converts the validated record; may throw {@link ConfigValueException}
   */
  public static <T> LoadResult<T> load(
      String text, String source, RecordShape shape, Function<RecordValue, T> factory) {
    LoadResult<T> result =
        DocumentParser.parse(text, source)
            .flatMap(raw -> build(shape, raw, FieldPath.root()))
            .flatMap(value -> applyFactory(factory, (RecordValue) value));
    if (!result.isSuccess()) {
      LOG.debug("Loading {} as {} failed: {}", source, shape.name(), result.error().message());
    }
    return result.withSource(source);
  }

  /**
   * Validates {@code raw} against {@code shape} and converts it to plain Java values: String,
   * Long, Double, Boolean, List, Map and {@link RecordValue}.
   *
   * @param raw the node, or {@code null} when the key was absent
   */
  public static LoadResult<Object> build(Shape shape, JsonNode raw, FieldPath path) {
    if (raw == null || raw.isMissingNode() || raw.isNull()) {
      if (shape.optional()) {
        return LoadResult.success(shape.emptyValue());
      }
      return mismatch(shape, raw, path);
    }
    if (shape instanceof ScalarShape scalar) {
      return buildScalar(scalar, raw, path);
    } else if (shape instanceof SequenceShape sequence) {
      return buildSequence(sequence, raw, path);
    } else if (shape instanceof MapShape map) {
      return buildMap(map, raw, path);
    } else {
      return buildRecord((RecordShape) shape, raw, path);
    }
  }

  private static LoadResult<Object> buildScalar(ScalarShape shape, JsonNode raw, FieldPath path) {
    if (!shape.kind().accepts(raw)) {
      return mismatch(shape, raw, path);
    }
    return LoadResult.success(shape.kind().convert(raw));
  }

  private static LoadResult<Object> buildSequence(
      SequenceShape shape, JsonNode raw, FieldPath path) {
    if (!raw.isArray()) {
      return mismatch(shape, raw, path);
    }
    List<Object> elements = new ArrayList<>(raw.size());
    for (int i = 0; i < raw.size(); i++) {
      LoadResult<Object> element = build(shape.element(), raw.get(i), path.index(i));
      if (!element.isSuccess()) {
        return element;
      }
      elements.add(element.value());
    }
    return LoadResult.success(Collections.unmodifiableList(elements));
  }

  private static LoadResult<Object> buildMap(MapShape shape, JsonNode raw, FieldPath path) {
    if (!raw.isObject()) {
      return mismatch(shape, raw, path);
    }
    Map<String, Object> entries = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = raw.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      // Map values have no key to be missing, so null is judged by the value shape alone
      LoadResult<Object> value =
          build(shape.value(), entry.getValue(), path.child(entry.getKey()));
      if (!value.isSuccess()) {
        return value;
      }
      entries.put(entry.getKey(), value.value());
    }
    return LoadResult.success(Collections.unmodifiableMap(entries));
  }

  private static LoadResult<Object> buildRecord(RecordShape shape, JsonNode raw, FieldPath path) {
    if (!raw.isObject()) {
      return mismatch(shape, raw, path);
    }
    Map<String, Object> values = new LinkedHashMap<>();
    for (Map.Entry<String, Shape> field : shape.fields().entrySet()) {
      String name = field.getKey();
      Shape fieldShape = field.getValue();
      FieldPath fieldPath = path.child(name);
      JsonNode child = raw.get(name);
      if (child == null && !fieldShape.optional()) {
        return LoadResult.failure(new LoadError.MissingFieldError(fieldPath, name, shape.name()));
      }
      LoadResult<Object> value = build(fieldShape, child, fieldPath);
      if (!value.isSuccess()) {
        return value;
      }
      values.put(name, value.value());
    }
    return LoadResult.success(new RecordValue(shape, path, values));
  }

  private static <T> LoadResult<T> applyFactory(
      Function<RecordValue, T> factory, RecordValue record) {
    try {
      return LoadResult.success(factory.apply(record));
    } catch (ConfigValueException e) {
      return LoadResult.failure(new LoadError.InvalidValueError(e.getPath(), e.getMessage()));
    }
  }

  private static LoadResult<Object> mismatch(Shape shape, JsonNode raw, FieldPath path) {
    return LoadResult.failure(
        new LoadError.TypeMismatchError(path, shape.typeName(), describe(raw)));
  }

  private static String describe(JsonNode raw) {
    if (raw == null || raw.isMissingNode() || raw.isNull()) {
      return "null";
    }
    return raw.isTextual() ? raw.textValue() : raw.toString();
  }
}
