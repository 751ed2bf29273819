package fallible.api.evaluation;

/**
 * A producer suspended between checkpoints.
 *
 * <p>Nothing runs until {@link #advance()} is called, and each call runs the producer forward by
 * exactly one item. Items are {@link Throwable errors}, {@link fallible.api.Result results}, or
 * anything else, which an evaluator ignores. Once the sequence is exhausted the producer supplies
 * its {@link #returnValue() return value}.
 *
 * <p>A sequence is consumed once, by one caller.
 *
 * @param <T> type of the value the producer finally returns
 */
public interface StepSequence<T> {

  /**
   * Runs the producer up to its next item.
   *
   * @return {@code false} once the producer has no more items
   * @throws Throwable whatever the producer raises while computing the item
   */
  boolean advance() throws Throwable;

  /**
   * @return the item produced by the last successful {@link #advance()}
   * @throws IllegalStateException if {@link #advance()} has not produced an item yet
   */
  Object current();

  /**
   * The value the producer returns after its last item: a {@code T}, a {@code Result<T>}, or
   * {@code null}. {@code null} reads as {@link Boolean#TRUE}, so it is only allowed when {@code T}
   * is {@link Boolean}.
   *
   * @throws IllegalStateException if the sequence is not exhausted
   * @throws Throwable whatever the producer raises while computing the value
   */
  Object returnValue() throws Throwable;
}
