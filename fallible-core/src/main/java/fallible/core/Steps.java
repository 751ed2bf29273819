package fallible.core;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.failsafe.function.CheckedRunnable;
import dev.failsafe.function.CheckedSupplier;
import fallible.api.Result;
import fallible.api.evaluation.StepSequence;
import fallible.core.internal.sequence.IteratorStepSequence;
import fallible.core.internal.sequence.SupplierStepSequence;

import java.util.Iterator;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Factories for {@link StepSequence}.
 *
 * <pre>{@code
 * AtomicReference<Handle> handle = new AtomicReference<>();
 * Result<String> contents =
 *     Fallible.evaluate(
 *         Steps.<String>builder()
 *             .step(() -> open(name).map(h -> { handle.set(h); return h; }))
 *             .step(() -> close(handle.get()))
 *             .returning(() -> handle.get().name()));
 * }</pre>
 *
 * Steps share state through captured variables; each one runs only when the evaluator asks for it.
 */
public final class Steps {

  private Steps() {}

  public static <T> Builder<T> builder() {
    return new Builder<>();
  }

  /**
   * @param items lazily produced items, pulled one at a time
   * @param returnValue supplies the final value once {@code items} is exhausted
   */
  public static <T> StepSequence<T> from(
      Iterator<?> items, CheckedSupplier<? extends T> returnValue) {
    checkNotNull(items, "items");
    checkNotNull(returnValue, "returnValue");
    return new IteratorStepSequence<>(items, wrap(returnValue));
  }

  /** Items without a final value; a run that gets through all of them yields {@code true}. */
  public static StepSequence<Boolean> from(Iterator<?> items) {
    checkNotNull(items, "items");
    return new IteratorStepSequence<>(items, null);
  }

  /** Turns a plain final value into a {@link Result} so that {@code null} stays a value. */
  private static <T> CheckedSupplier<Result<T>> wrap(CheckedSupplier<? extends T> returnValue) {
    return () -> Result.ok(returnValue.get());
  }

  public static final class Builder<T> {
    private final ImmutableList.Builder<CheckedSupplier<?>> steps = ImmutableList.builder();

    private Builder() {}

    /** Adds a step whose outcome is a checkpoint item: an error, a result or anything ignorable. */
    @CanIgnoreReturnValue
    public Builder<T> step(CheckedSupplier<?> step) {
      steps.add(checkNotNull(step, "step"));
      return this;
    }

    /** Adds a step run only for its effect; only a thrown fault can stop the sequence here. */
    @CanIgnoreReturnValue
    public Builder<T> run(CheckedRunnable action) {
      checkNotNull(action, "action");
      steps.add(
          () -> {
            action.run();
            return null;
          });
      return this;
    }

    /** Finishes with a plain value, wrapped with {@link Result#ok(Object)}. */
    public StepSequence<T> returning(CheckedSupplier<? extends T> returnValue) {
      checkNotNull(returnValue, "returnValue");
      return new SupplierStepSequence<>(steps.build(), wrap(returnValue));
    }

    /** Finishes with a result that is passed through unchanged, success or failure. */
    public StepSequence<T> returningResult(CheckedSupplier<? extends Result<T>> returnValue) {
      checkNotNull(returnValue, "returnValue");
      return new SupplierStepSequence<>(
          steps.build(),
          () -> checkNotNull(returnValue.get(), "returningResult supplier returned null"));
    }

    /** Finishes without a return value, which the evaluator reads as {@code true}. */
    public StepSequence<Boolean> build() {
      return new SupplierStepSequence<>(steps.build(), null);
    }
  }
}
