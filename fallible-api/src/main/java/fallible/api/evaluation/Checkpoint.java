package fallible.api.evaluation;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import fallible.api.Result;

/**
 * Handed to a {@link GuardedBlock}; every call either yields a value or leaves the block.
 *
 * <p>Leaving is done by unwinding the stack, so a block must not catch the unchecked signal that
 * these methods raise. Catch specific exception types inside a block, never {@link
 * RuntimeException} or {@link Throwable}.
 */
public interface Checkpoint {

  /**
   * @return the success value of {@code result}
   */
  @CanIgnoreReturnValue
  <V> V check(Result<V> result);

  /** Leaves the block with {@code error}. Never returns normally. */
  <V> V fail(Throwable error);

  /** Leaves the block with a plain-message error. Never returns normally. */
  <V> V fail(String message);
}
