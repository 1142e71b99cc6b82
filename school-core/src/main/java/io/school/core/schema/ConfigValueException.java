package io.school.core.schema;

/**
 * Thrown by record factories passed to {@link StrictLoader#load} when a value has the declared
 * type but is still unacceptable (an unknown weekday, a malformed time). The loader reports it as
 * a {@link LoadError.InvalidValueError}.
 */
public class ConfigValueException extends RuntimeException {
  private final FieldPath path;

  public ConfigValueException(FieldPath path, String message) {
    super(message);
    this.path = path;
  }

  public ConfigValueException(FieldPath path, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  public FieldPath getPath() {
    return path;
  }
}
