package fallible.api.evaluation;

import com.google.errorprone.annotations.CheckReturnValue;
import dev.failsafe.function.CheckedSupplier;
import fallible.api.Result;

/**
 * Folds a fallible computation into exactly one {@link Result}, stopping at the first error.
 *
 * <p>A fault raised by the computation comes back as a failure carrying that fault. Only two
 * things escape an evaluator as exceptions:
 *
 * <ul>
 *   <li>a {@link NullPointerException} when the computation itself is {@code null};
 *   <li>the unchecked signal of a {@link Checkpoint} that belongs to an enclosing {@link
 *       #guard(GuardedBlock) guard}, which unwinds to that guard and must not be caught.
 * </ul>
 */
@CheckReturnValue
public interface Evaluator {

  /**
   * Runs {@code producer} and normalizes whatever it returns.
   *
   * <ul>
   *   <li>a {@link StepSequence} is driven with {@link #evaluate(StepSequence)};
   *   <li>a {@link Result} is returned as is;
   *   <li>anything else is wrapped with {@link Result#ok(Object)}.
   * </ul>
   *
   * The value type depends on what the producer returns at run time, so the outcome is untyped. Use
   * {@link #evaluate(CheckedSupplier)} or {@link #attempt(CheckedSupplier)} when it is known.
   *
   * @throws NullPointerException if {@code producer} is {@code null}
   */
  Result<?> anyError(CheckedSupplier<?> producer);

  /**
   * Runs {@code producer}, which returns a {@link Result}, and passes that result through. A
   * {@code null} result is contained as a failure.
   *
   * @throws NullPointerException if {@code producer} is {@code null}
   */
  <T> Result<T> attempt(CheckedSupplier<? extends Result<T>> producer);

  /**
   * Runs {@code producer} to obtain a step sequence and drives it with {@link
   * #evaluate(StepSequence)}. A {@code null} sequence is contained as a failure.
   *
   * @throws NullPointerException if {@code producer} is {@code null}
   */
  <T> Result<T> evaluate(CheckedSupplier<? extends StepSequence<T>> producer);

  /**
   * Pulls items from {@code steps} one at a time. The first {@link Throwable}, or failed {@link
   * Result}, ends the run with a fresh failure carrying that error; no item after it is requested.
   * Successful results and other items are discarded.
   *
   * <p>When the sequence runs out its return value becomes the outcome: a {@link Result} is
   * returned as is, {@code null} counts as {@link Boolean#TRUE}, anything else is wrapped. The
   * sequence is trusted to honor the typing rules of {@link StepSequence#returnValue()}.
   *
   * @throws NullPointerException if {@code steps} is {@code null}
   */
  <T> Result<T> evaluate(StepSequence<T> steps);

  /**
   * Runs {@code block}, leaving it at the first failed {@link Checkpoint#check(Result)}.
   *
   * <p>The block's own result is returned as is. A block returning {@code null} has no value to
   * give; that is contained as a failure. Blocks without a value use {@link
   * #guardAction(GuardedAction)}.
   *
   * @throws NullPointerException if {@code block} is {@code null}
   */
  <T> Result<T> guard(GuardedBlock<T> block);

  /**
   * Runs {@code action} like {@link #guard(GuardedBlock)}; an action that completes yields {@link
   * Result#ok()}.
   *
   * @throws NullPointerException if {@code action} is {@code null}
   */
  Result<Boolean> guardAction(GuardedAction action);
}
