package io.school.core.schema;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of parsing or loading a configuration document: either a value or the first error
 * encountered. Failures remember the document they came from so the caller can report it.
 */
public sealed interface LoadResult<T> permits LoadResult.Success, LoadResult.Failure {

  static <T> LoadResult<T> success(T value) {
    return new Success<>(value);
  }

  static <T> LoadResult<T> failure(LoadError error) {
    return new Failure<>(error, null);
  }

  boolean isSuccess();

  /** The value of a success. */
  T value();

  /** The error of a failure. */
  LoadError error();

  <R> LoadResult<R> map(Function<? super T, ? extends R> mapper);

  <R> LoadResult<R> flatMap(Function<? super T, LoadResult<R>> mapper);

  /** Attaches the document name to a failure; successes are returned unchanged. */
  LoadResult<T> withSource(String source);

  record Success<T>(T value) implements LoadResult<T> {
    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public LoadError error() {
      throw new IllegalStateException("Loading succeeded");
    }

    @Override
    public <R> LoadResult<R> map(Function<? super T, ? extends R> mapper) {
      return new Success<>(mapper.apply(value));
    }

    @Override
    public <R> LoadResult<R> flatMap(Function<? super T, LoadResult<R>> mapper) {
      return mapper.apply(value);
    }

    @Override
    public LoadResult<T> withSource(String source) {
      return this;
    }
  }

  /** A failed load; {@code source} is {@code null} until the document name is known. */
  record Failure<T>(LoadError error, String source) implements LoadResult<T> {
    public Failure {
      Objects.requireNonNull(error, "error");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public T value() {
      throw new IllegalStateException("Loading failed: " + error.message());
    }

    @Override
    public <R> LoadResult<R> map(Function<? super T, ? extends R> mapper) {
      return new Failure<>(error, source);
    }

    @Override
    public <R> LoadResult<R> flatMap(Function<? super T, LoadResult<R>> mapper) {
      return new Failure<>(error, source);
    }

    @Override
    public LoadResult<T> withSource(String source) {
      return new Failure<>(error, source);
    }
  }
}
