package io.school.config;

import io.school.core.schema.LoadResult;
import io.school.core.schema.MapShape;
import io.school.core.schema.RecordShape;
import io.school.core.schema.RecordValue;
import io.school.core.schema.ScalarKind;
import io.school.core.schema.ScalarShape;
import io.school.core.schema.SequenceShape;
import io.school.core.schema.StrictLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * User configuration, read from a YAML document such as:
 *
 * <pre>
 * courses_folder: courses/
 * course_types:
 *   lab: {color: 118, has_homework: true}
 *   lecture: {color: 39, has_homework: false}
 * file_browser: [ranger]
 * web_browser: [firefox, --target, window]
 * text_editor: [vim]
 * note_handlers: {.xopp: xournalpp, .md: vim}
 * timetable:
 *   - {course: Algebra, type: lecture, day: monday, start: "9:00", end: "10:30"}
 * </pre>
 *
 * <p>Every key is optional. Absent or empty sections fall back to the defaults below.
 */
public record SchoolConfig(
    String coursesFolder,
    Map<String, CourseType> courseTypes,
    List<String> fileBrowser,
    List<String> webBrowser,
    List<String> textEditor,
    Map<String, String> noteHandlers,
    List<Lecture> timetable) {

  public static final String DEFAULT_COURSES_FOLDER = "courses/";

  public static final Map<String, CourseType> DEFAULT_COURSE_TYPES =
      orderedMap("lab", new CourseType(118, true), "lecture", new CourseType(39, false));

  public static final List<String> DEFAULT_FILE_BROWSER = List.of("ranger");
  public static final List<String> DEFAULT_WEB_BROWSER = List.of("firefox", "--target", "window");
  public static final List<String> DEFAULT_TEXT_EDITOR = List.of("vim");
  public static final Map<String, String> DEFAULT_NOTE_HANDLERS =
      orderedMap(".xopp", "xournalpp", ".md", "vim");

  private static final ScalarShape WORD = ScalarShape.required(ScalarKind.STRING);

  public static final RecordShape SHAPE =
      RecordShape.builder("SchoolConfig")
          .field(
              "courses_folder",
              ScalarShape.optional(ScalarKind.STRING, DEFAULT_COURSES_FOLDER))
          .field("course_types", MapShape.optionalOf(CourseType.SHAPE))
          .field("file_browser", SequenceShape.optionalOf(WORD))
          .field("web_browser", SequenceShape.optionalOf(WORD))
          .field("text_editor", SequenceShape.optionalOf(WORD))
          .field("note_handlers", MapShape.optionalOf(WORD))
          .field("timetable", SequenceShape.optionalOf(Lecture.SHAPE))
          .build();

  public SchoolConfig {
    courseTypes = Collections.unmodifiableMap(new LinkedHashMap<>(courseTypes));
    fileBrowser = List.copyOf(fileBrowser);
    webBrowser = List.copyOf(webBrowser);
    textEditor = List.copyOf(textEditor);
    noteHandlers = Collections.unmodifiableMap(new LinkedHashMap<>(noteHandlers));
    timetable = List.copyOf(timetable);
  }

  /** Configuration used when no file exists. */
  public static SchoolConfig defaults() {
    return new SchoolConfig(
        DEFAULT_COURSES_FOLDER,
        DEFAULT_COURSE_TYPES,
        DEFAULT_FILE_BROWSER,
        DEFAULT_WEB_BROWSER,
        DEFAULT_TEXT_EDITOR,
        DEFAULT_NOTE_HANDLERS,
        List.of());
  }

  /** Loads {@code file}; a missing file yields {@link #defaults()}. */
  public static LoadResult<SchoolConfig> load(Path file) {
    return StrictLoader.loadFile(file, SHAPE, SchoolConfig::fromRecord);
  }

  /** Loads configuration text; {@code source} names it in error reports. */
  public static LoadResult<SchoolConfig> parse(String text, String source) {
    return StrictLoader.load(text, source, SHAPE, SchoolConfig::fromRecord);
  }

  static SchoolConfig fromRecord(RecordValue record) {
    Map<String, RecordValue> rawTypes = record.map("course_types");
    Map<String, CourseType> courseTypes = new LinkedHashMap<>();
    rawTypes.forEach((name, type) -> courseTypes.put(name, CourseType.fromRecord(type)));
    if (courseTypes.isEmpty()) {
      courseTypes.putAll(DEFAULT_COURSE_TYPES);
    }

    List<RecordValue> rawLectures = record.list("timetable");
    List<Lecture> timetable = new ArrayList<>(rawLectures.size());
    for (RecordValue lecture : rawLectures) {
      timetable.add(Lecture.fromRecord(lecture, courseTypes.keySet()));
    }

    return new SchoolConfig(
        record.string("courses_folder"),
        courseTypes,
        orDefault(record.list("file_browser"), DEFAULT_FILE_BROWSER),
        orDefault(record.list("web_browser"), DEFAULT_WEB_BROWSER),
        orDefault(record.list("text_editor"), DEFAULT_TEXT_EDITOR),
        orDefault(record.map("note_handlers"), DEFAULT_NOTE_HANDLERS),
        timetable);
  }

  private static <E> List<E> orDefault(List<E> value, List<E> fallback) {
    return value.isEmpty() ? fallback : value;
  }

  private static <V> Map<String, V> orDefault(Map<String, V> value, Map<String, V> fallback) {
    return value.isEmpty() ? fallback : value;
  }

  private static <V> Map<String, V> orderedMap(String k1, V v1, String k2, V v2) {
    Map<String, V> map = new LinkedHashMap<>();
    map.put(k1, v1);
    map.put(k2, v2);
    return Collections.unmodifiableMap(map);
  }
}
