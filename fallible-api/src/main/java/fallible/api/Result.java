package fallible.api;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.Immutable;

import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Either a success value or an error, never both.
 *
 * <p>The variant type is the discriminant: a {@link Success} holding {@code false}, {@code 0} or
 * {@code null} is still a success. {@code null} is the "no error" sentinel of a success and the
 * "no value" sentinel of a failure.
 *
 * @param <T> type of the success value
 */
@CheckReturnValue
public sealed interface Result<T> permits Result.Success, Result.Failure {

  String UNKNOWN_ERROR = "unknown error";

  static <T> Result<T> ok(T value) {
    return new Success<>(value);
  }

  /** A success carrying {@link Boolean#TRUE}, for operations with nothing to return. */
  static Result<Boolean> ok() {
    return new Success<>(Boolean.TRUE);
  }

  static <T> Result<T> error(String message) {
    return new Failure<>(new FallibleException(message == null ? UNKNOWN_ERROR : message));
  }

  static <T> Result<T> error(Throwable error) {
    return new Failure<>(error == null ? new FallibleException(UNKNOWN_ERROR) : error);
  }

  /**
   * @return the success value, or {@code null} for a failure
   */
  T value();

  /**
   * @return the error, or {@code null} for a success
   */
  Throwable cause();

  default boolean isSuccess() {
    return this instanceof Result.Success<T>;
  }

  default boolean isFailure() {
    return this instanceof Result.Failure<T>;
  }

  /**
   * Extracts the value and reports the error through a slot owned by the caller.
   *
   * <p>On success the slot is cleared and the value is returned. On failure the slot receives the
   * error and {@code null} is returned. Never throws.
   */
  @CanIgnoreReturnValue
  default T unwrap(ErrorSlot slot) {
    checkNotNull(slot, "slot");
    slot.write(cause());
    return value();
  }

  <M> Result<M> map(Function<? super T, ? extends M> mapper);

  /** Continues with {@code next} on success; a failure is carried forward untouched. */
  <M> Result<M> flatMap(Function<? super T, Result<M>> next);

  T orElse(T other);

  T getOrThrow() throws Throwable;

  String describe();

  @Immutable(containerOf = "T")
  record Success<T>(T value) implements Result<T> {

    @Override
    public Throwable cause() {
      return null;
    }

    @Override
    public <M> Result<M> map(Function<? super T, ? extends M> mapper) {
      return new Success<>(mapper.apply(value));
    }

    @Override
    public <M> Result<M> flatMap(Function<? super T, Result<M>> next) {
      return checkNotNull(next.apply(value), "flatMap function returned null");
    }

    @Override
    public T orElse(T other) {
      return value;
    }

    @Override
    public T getOrThrow() {
      return value;
    }

    @Override
    public String describe() {
      return String.valueOf(value);
    }
  }

  record Failure<T>(Throwable cause) implements Result<T> {

    public Failure {
      checkNotNull(cause, "a failure needs an error");
    }

    @Override
    public T value() {
      return null;
    }

    @Override
    public <M> Result<M> map(Function<? super T, ? extends M> mapper) {
      return new Failure<>(cause);
    }

    @Override
    public <M> Result<M> flatMap(Function<? super T, Result<M>> next) {
      return new Failure<>(cause);
    }

    @Override
    public T orElse(T other) {
      return other;
    }

    @Override
    public T getOrThrow() throws Throwable {
      throw cause;
    }

    @Override
    public String describe() {
      if (cause instanceof FallibleException fallible) {
        return fallible.describe();
      }
      return cause.toString();
    }
  }
}
