package fallible.core.internal.evaluation;

import com.google.auto.service.AutoService;
import com.google.errorprone.annotations.ThreadSafe;
import dev.failsafe.function.CheckedSupplier;
import fallible.api.FallibleException;
import fallible.api.Result;
import fallible.api.evaluation.Evaluator;
import fallible.api.evaluation.GuardedAction;
import fallible.api.evaluation.GuardedBlock;
import fallible.api.evaluation.StepSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stateless {@link Evaluator}, registered for {@link java.util.ServiceLoader} discovery.
 *
 * <p>Every entry point ends in one of three places:
 *
 * <ol>
 *   <li>the first error item, or failed checkpoint, turned into a fresh failure;
 *   <li>the producer's own outcome, normalized;
 *   <li>a fault thrown anywhere on the way, turned into a failure carrying it.
 * </ol>
 *
 * <p>Signals raised by a {@link fallible.api.evaluation.Checkpoint} that belongs to an enclosing
 * guard pass through untouched so that the enclosing block is the one that leaves.
 */
@ThreadSafe
@AutoService(Evaluator.class)
public class DefaultEvaluator implements Evaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultEvaluator.class);

  @Override
  public Result<?> anyError(CheckedSupplier<?> producer) {
    checkNotNull(producer, "producer");
    Object output;
    try {
      output = producer.get();
    } catch (Throwable e) {
      return contain(e);
    }
    if (output instanceof StepSequence<?> steps) {
      return evaluate(steps);
    }
    if (output instanceof Result<?> result) {
      return result;
    }
    return Result.ok(output);
  }

  @Override
  public <T> Result<T> attempt(CheckedSupplier<? extends Result<T>> producer) {
    checkNotNull(producer, "producer");
    Result<T> result;
    try {
      result = producer.get();
    } catch (Throwable e) {
      return contain(e);
    }
    if (result == null) {
      return contain(new FallibleException("producer returned no result"));
    }
    return result;
  }

  @Override
  public <T> Result<T> evaluate(CheckedSupplier<? extends StepSequence<T>> producer) {
    checkNotNull(producer, "producer");
    StepSequence<T> steps;
    try {
      steps = producer.get();
    } catch (Throwable e) {
      return contain(e);
    }
    if (steps == null) {
      return contain(new FallibleException("producer returned no step sequence"));
    }
    return evaluate(steps);
  }

  @Override
  public <T> Result<T> evaluate(StepSequence<T> steps) {
    checkNotNull(steps, "steps");
    try {
      int position = 0;
      while (steps.advance()) {
        Object item = steps.current();
        if (item instanceof Throwable error) {
          LOGGER.debug("Step {} produced an error, stopping: {}", position, error.toString());
          return Result.error(error);
        }
        if (item instanceof Result<?> result && result.isFailure()) {
          LOGGER.debug("Step {} failed, stopping: {}", position, result.describe());
          return Result.error(result.cause());
        }
        position++;
      }
      return finish(steps.returnValue());
    } catch (Throwable e) {
      return contain(e);
    }
  }

  @Override
  public <T> Result<T> guard(GuardedBlock<T> block) {
    checkNotNull(block, "block");
    GuardedCheckpoint checkpoint = new GuardedCheckpoint();
    try {
      Result<T> result = block.run(checkpoint);
      if (result == null) {
        return contain(
            new FallibleException("guarded block returned no result, use guardAction instead"));
      }
      return result;
    } catch (ShortCircuitSignal signal) {
      if (!signal.raisedBy(checkpoint)) {
        throw signal;
      }
      LOGGER.debug("Guarded block left at a failed check: {}", signal.getError().toString());
      return Result.error(signal.getError());
    } catch (Throwable e) {
      return contain(e);
    } finally {
      checkpoint.close();
    }
  }

  @Override
  public Result<Boolean> guardAction(GuardedAction action) {
    checkNotNull(action, "action");
    return guard(
        checkpoint -> {
          action.run(checkpoint);
          return Result.ok();
        });
  }

  /**
   * Final value of an exhausted sequence; {@code null} stands for {@code true}. The casts rely on
   * the sequence keeping the typing rules of {@link StepSequence#returnValue()}; sequences built
   * with {@code Steps} always do.
   */
  @SuppressWarnings("unchecked")
  private static <T> Result<T> finish(Object returnValue) {
    if (returnValue == null) {
      return (Result<T>) Result.ok();
    }
    if (returnValue instanceof Result<?> result) {
      return (Result<T>) result;
    }
    return Result.ok((T) returnValue);
  }

  private static <T> Result<T> contain(Throwable fault) {
    if (fault instanceof ShortCircuitSignal signal) {
      throw signal;
    }
    if (fault instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    LOGGER.warn("Producer raised {}, returning it as a failure", fault.toString(), fault);
    return Result.error(fault);
  }
}
