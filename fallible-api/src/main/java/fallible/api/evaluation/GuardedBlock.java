package fallible.api.evaluation;

import fallible.api.Result;

/**
 * A sequence of guarded steps written as ordinary statements.
 *
 * @param <T> type of the success value
 */
@FunctionalInterface
public interface GuardedBlock<T> {

  Result<T> run(Checkpoint checkpoint) throws Throwable;
}
