package fallible.core.internal.sequence;

import com.google.common.collect.ImmutableList;
import dev.failsafe.function.CheckedSupplier;

/**
 * Steps given as suppliers. Step {@code k} is invoked only when the sequence advances to position
 * {@code k}, so a step that is never reached never runs.
 */
public final class SupplierStepSequence<T> extends AbstractStepSequence<T> {

  private final ImmutableList<CheckedSupplier<?>> steps;
  private final CheckedSupplier<?> returning;
  private int next;

  public SupplierStepSequence(
      ImmutableList<CheckedSupplier<?>> steps, CheckedSupplier<?> returning) {
    this.steps = steps;
    this.returning = returning;
  }

  @Override
  protected boolean hasNextItem() {
    return next < steps.size();
  }

  @Override
  protected Object nextItem() throws Throwable {
    CheckedSupplier<?> step = steps.get(next++);
    return step.get();
  }

  @Override
  protected Object computeReturnValue() throws Throwable {
    return returning == null ? null : returning.get();
  }
}
