package fallible.core.internal.sequence;

import com.google.common.base.MoreObjects;
import fallible.api.evaluation.StepSequence;

import static com.google.common.base.Preconditions.checkState;

/**
 * Position bookkeeping shared by the step sequences. Subclasses only say whether another item
 * exists and how to produce it.
 *
 * @param <T> type of the final return value
 */
abstract class AbstractStepSequence<T> implements StepSequence<T> {

  private int position = -1;
  private Object current;
  private boolean exhausted;

  private boolean returned;
  private Object returnValue;

  protected abstract boolean hasNextItem();

  protected abstract Object nextItem() throws Throwable;

  protected abstract Object computeReturnValue() throws Throwable;

  @Override
  public final boolean advance() throws Throwable {
    if (exhausted) {
      return false;
    }
    if (!hasNextItem()) {
      exhausted = true;
      current = null;
      return false;
    }
    current = nextItem();
    position++;
    return true;
  }

  @Override
  public final Object current() {
    checkState(position >= 0 && !exhausted, "no current item at position %s", position);
    return current;
  }

  @Override
  public final Object returnValue() throws Throwable {
    checkState(exhausted, "return value requested before the last item");
    if (!returned) {
      returnValue = computeReturnValue();
      returned = true;
    }
    return returnValue;
  }

  /**
   * @return index of the current item, {@code -1} before the first one
   */
  public final int position() {
    return position;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("position", position)
        .add("exhausted", exhausted)
        .toString();
  }
}
