package fallible.core.internal.evaluation;

import fallible.api.evaluation.Checkpoint;

/** Unwinds a guarded block up to the guard that owns {@code origin}. Carries no stack trace. */
final class ShortCircuitSignal extends RuntimeException {

  private final transient Checkpoint origin;
  private final Throwable error;

  ShortCircuitSignal(Checkpoint origin, Throwable error) {
    super(null, null, false, false);
    this.origin = origin;
    this.error = error;
  }

  boolean raisedBy(Checkpoint checkpoint) {
    return origin == checkpoint;
  }

  Throwable getError() {
    return error;
  }
}
