package fallible.api;

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.CheckReturnValue;
import dev.failsafe.function.CheckedSupplier;
import fallible.api.evaluation.Evaluator;
import fallible.api.evaluation.GuardedAction;
import fallible.api.evaluation.GuardedBlock;
import fallible.api.evaluation.StepSequence;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Static entry point to the {@link Evaluator} found on the class path.
 *
 * <p>The implementation is discovered through {@link ServiceLoader} on first use. The first one
 * found wins.
 */
@CheckReturnValue
public final class Fallible {

  private static volatile Evaluator evaluator;

  private Fallible() {}

  public static Result<?> anyError(CheckedSupplier<?> producer) {
    return evaluator().anyError(producer);
  }

  public static <T> Result<T> attempt(CheckedSupplier<? extends Result<T>> producer) {
    return evaluator().attempt(producer);
  }

  public static <T> Result<T> evaluate(CheckedSupplier<? extends StepSequence<T>> producer) {
    return evaluator().evaluate(producer);
  }

  public static <T> Result<T> evaluate(StepSequence<T> steps) {
    return evaluator().evaluate(steps);
  }

  public static <T> Result<T> guard(GuardedBlock<T> block) {
    return evaluator().guard(block);
  }

  public static Result<Boolean> guardAction(GuardedAction action) {
    return evaluator().guardAction(action);
  }

  public static Evaluator evaluator() {
    Evaluator current = evaluator;
    if (current == null) {
      synchronized (Fallible.class) {
        current = evaluator;
        if (current == null) {
          current = discover(ServiceLoader.load(Evaluator.class).iterator());
          evaluator = current;
        }
      }
    }
    return current;
  }

  @VisibleForTesting
  static Evaluator discover(Iterator<Evaluator> candidates) {
    if (!candidates.hasNext()) {
      throw new FallibleException(
          "no Evaluator implementation found, add fallible-core to the class path");
    }
    return candidates.next();
  }
}
