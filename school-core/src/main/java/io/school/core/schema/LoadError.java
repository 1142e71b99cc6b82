package io.school.core.schema;

/** Why a configuration document could not be turned into a value. */
public sealed interface LoadError
    permits LoadError.ParseError,
        LoadError.MissingFieldError,
        LoadError.TypeMismatchError,
        LoadError.InvalidValueError {

  /** Location of the offending value; the root for syntax errors. */
  FieldPath path();

  /** One-line, human readable description. */
  String message();

  /** The document text is not well-formed. Line and column are 1-based, 0 when unknown. */
  record ParseError(String source, int line, int column, String detail) implements LoadError {
    @Override
    public FieldPath path() {
      return FieldPath.root();
    }

    @Override
    public String message() {
      if (line > 0) {
        return "invalid syntax at line " + line + ", column " + column + ": " + detail;
      }
      return "invalid syntax: " + detail;
    }
  }

  /** A required key is absent. {@code path} points at the missing field itself. */
  record MissingFieldError(FieldPath path, String field, String recordName) implements LoadError {
    @Override
    public String message() {
      return "missing required field '" + field + "' at '" + path + "'";
    }
  }

  /** A value is present but has the wrong runtime type. */
  record TypeMismatchError(FieldPath path, String expectedType, String actualValue)
      implements LoadError {
    @Override
    public String message() {
      return "field '"
          + path
          + "' expected type "
          + expectedType
          + " but got value '"
          + actualValue
          + "'";
    }
  }

  /** A well-typed value rejected by the record's own rules, e.g. an unknown weekday. */
  record InvalidValueError(FieldPath path, String detail) implements LoadError {
    @Override
    public String message() {
      return "field '" + path + "' " + detail;
    }
  }
}
