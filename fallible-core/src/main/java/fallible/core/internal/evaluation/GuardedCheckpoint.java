package fallible.core.internal.evaluation;

import com.google.common.base.MoreObjects;
import fallible.api.Result;
import fallible.api.evaluation.Checkpoint;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/** Checkpoint bound to one run of a guarded block. Unusable once the block has returned. */
final class GuardedCheckpoint implements Checkpoint {

  private boolean open = true;
  private int checks;

  @Override
  public <V> V check(Result<V> result) {
    checkNotNull(result, "result");
    checkState(open, "checkpoint used after its guarded block returned");
    checks++;
    if (result.isFailure()) {
      throw new ShortCircuitSignal(this, result.cause());
    }
    return result.value();
  }

  @Override
  public <V> V fail(Throwable error) {
    checkState(open, "checkpoint used after its guarded block returned");
    throw new ShortCircuitSignal(this, Result.error(error).cause());
  }

  @Override
  public <V> V fail(String message) {
    checkState(open, "checkpoint used after its guarded block returned");
    throw new ShortCircuitSignal(this, Result.error(message).cause());
  }

  void close() {
    open = false;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("open", open).add("checks", checks).toString();
  }
}
