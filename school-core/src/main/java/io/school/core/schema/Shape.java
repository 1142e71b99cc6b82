package io.school.core.schema;

/**
 * Declared shape of a configuration value. {@link StrictLoader} walks a shape and the parsed
 * document side by side and rejects every value that does not fit.
 *
 * <p>Optional shapes accept a missing key or an explicit {@code null} and resolve to their empty
 * value; required ones do not.
 */
public sealed interface Shape permits ScalarShape, SequenceShape, MapShape, RecordShape {

  boolean optional();

  /** Human readable type name used in error messages. */
  String typeName();

  /** Value a missing or null optional node resolves to. */
  Object emptyValue();
}
