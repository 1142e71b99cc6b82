package io.school.cli;

import io.school.core.render.Ansi;
import io.school.core.schema.LoadError;
import io.school.core.schema.LoadResult;

/** The one-line ERROR / SUCCESS reports the commands finish with. */
public final class StatusLine {

  private StatusLine() {}

  /**
   * {@code ERROR in <source>: <message>}, in red with a bold {@code ERROR}.
   *
   * @param source document or context the error belongs to, may be {@code null}
   */
  public static String error(String message, String source) {
    StringBuilder sb = new StringBuilder(Ansi.color(Ansi.bold("ERROR"), Ansi.RED));
    if (source != null) {
      sb.append(Ansi.color(" in " + source, Ansi.RED));
    }
    sb.append(Ansi.color(":", Ansi.RED));
    return sb.append(' ').append(message).toString();
  }

  /** Error line for a failed configuration load. */
  public static String error(LoadResult.Failure<?> failure) {
    LoadError error = failure.error();
    String source = failure.source();
    if (error instanceof LoadError.ParseError parse && parse.source() != null) {
      source = parse.source();
    }
    return error(error.message(), source);
  }

  /** {@code SUCCESS: <message>} with a green prefix. */
  public static String success(String message) {
    return Ansi.color("SUCCESS: ", Ansi.GREEN) + message;
  }
}
