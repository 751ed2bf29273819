package fallible.api;

import com.google.common.base.MoreObjects;

/**
 * Output slot for {@link Result#unwrap(ErrorSlot)}.
 *
 * <p>Each unwrap overwrites the slot, so one slot can follow a chain of calls. Not thread-safe; the
 * caller that created it owns it.
 */
public final class ErrorSlot {

  private Throwable error;

  public ErrorSlot() {}

  void write(Throwable error) {
    this.error = error;
  }

  /**
   * @return the error written by the last unwrap, or {@code null} if it succeeded
   */
  public Throwable get() {
    return error;
  }

  public boolean isPresent() {
    return error != null;
  }

  public boolean isEmpty() {
    return error == null;
  }

  /** Renders the held error the same way {@link Result#describe()} does; empty when no error. */
  public String describe() {
    if (error == null) {
      return "";
    }
    return Result.error(error).describe();
  }

  /** Moves the held error into a fresh failure, re-typed for the caller. */
  public <T> Result<T> toResult() {
    if (error == null) {
      throw new IllegalStateException("slot holds no error");
    }
    return Result.error(error);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("error", error).toString();
  }
}
