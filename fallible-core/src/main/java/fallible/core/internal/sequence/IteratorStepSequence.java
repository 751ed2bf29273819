package fallible.core.internal.sequence;

import dev.failsafe.function.CheckedSupplier;

import java.util.Iterator;

/** Adapts a lazy {@link Iterator}, such as {@code Stream#iterator()}, to a step sequence. */
public final class IteratorStepSequence<T> extends AbstractStepSequence<T> {

  private final Iterator<?> items;
  private final CheckedSupplier<?> returning;

  public IteratorStepSequence(Iterator<?> items, CheckedSupplier<?> returning) {
    this.items = items;
    this.returning = returning;
  }

  @Override
  protected boolean hasNextItem() {
    return items.hasNext();
  }

  @Override
  protected Object nextItem() {
    return items.next();
  }

  @Override
  protected Object computeReturnValue() throws Throwable {
    return returning == null ? null : returning.get();
  }
}
