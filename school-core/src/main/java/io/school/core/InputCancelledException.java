package io.school.core;

/**
 * Thrown when the user closes standard input (Ctrl+D, end of a pipe) while being asked for
 * something. This is a request to stop quietly, not a failure.
 */
public final class InputCancelledException extends Exception {

  public InputCancelledException() {
    super("Input closed");
  }

  public InputCancelledException(Throwable cause) {
    super("Input closed", cause);
  }
}
