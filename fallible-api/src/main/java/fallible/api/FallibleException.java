package fallible.api;

/**
 * Base error type of the library.
 *
 * <p>A plain message passed to {@link Result#error(String)} becomes an instance of this class.
 * Domain errors subclass it and override {@link #describe()} to render themselves.
 */
public class FallibleException extends RuntimeException {

  public FallibleException(Throwable cause) {
    super(cause);
  }

  public FallibleException(String message) {
    super(message);
  }

  public FallibleException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return human-readable description of this error, the message unless a subclass says otherwise
   */
  public String describe() {
    return getMessage();
  }
}
