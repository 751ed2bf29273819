package fallible.core.internal.evaluation;

import fallible.api.FallibleException;
import fallible.api.Result;
import fallible.api.evaluation.Checkpoint;
import fallible.core.Steps;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class GuardedBlockTest {

  private final DefaultEvaluator evaluator = new DefaultEvaluator();

  @Test
  @DisplayName("GB-01: passing checks hand back their values")
  void checksYieldValues() {
    Result<Integer> result =
        evaluator.guard(
            checkpoint -> {
              int a = checkpoint.check(Result.ok(20));
              int b = checkpoint.check(Result.ok(22));
              return Result.ok(a + b);
            });

    assertThat(result).isEqualTo(Result.ok(42));
  }

  @Test
  @DisplayName("GB-02: the first failed check leaves the block")
  void failedCheckLeaves() {
    List<String> reached = new ArrayList<>();
    Result<String> boom = Result.error("boom");

    Result<String> result =
        evaluator.guard(
            checkpoint -> {
              reached.add(checkpoint.check(Result.ok("a")));
              reached.add(checkpoint.check(boom));
              reached.add(checkpoint.check(Result.ok("c")));
              return Result.ok("done");
            });

    assertThat(result.cause()).isSameAs(boom.cause());
    assertThat(result).isNotSameAs(boom);
    assertThat(reached).containsExactly("a");
  }

  @Test
  @DisplayName("GB-03: fail leaves the block with the given error")
  void explicitFail() {
    Result<String> byMessage = evaluator.guard(checkpoint -> checkpoint.fail("refused"));
    IllegalArgumentException bad = new IllegalArgumentException("bad input");
    Result<String> byError = evaluator.guard(checkpoint -> checkpoint.fail(bad));

    assertThat(byMessage.cause()).isInstanceOf(FallibleException.class).hasMessage("refused");
    assertThat(byError.cause()).isSameAs(bad);
  }

  @Test
  @DisplayName("GB-04: a null result from the block is contained as a failure")
  void nullResultIsFailure() {
    Result<Boolean> result =
        evaluator.guard(
            checkpoint -> {
              checkpoint.check(Result.ok("side effect"));
              return null;
            });

    assertThat(result.isFailure()).isTrue();
    assertThat(result.cause()).isInstanceOf(FallibleException.class);
  }

  @Test
  @DisplayName("GB-04b: a guarded action that completes counts as true")
  void completedActionIsTrue() {
    List<String> reached = new ArrayList<>();

    Result<Boolean> done = evaluator.guardAction(checkpoint -> reached.add("ran"));
    Result<Boolean> stopped =
        evaluator.guardAction(
            checkpoint -> {
              checkpoint.check(Result.error("halt"));
              reached.add("after halt");
            });

    assertThat(done).isEqualTo(Result.ok());
    assertThat(stopped.cause()).hasMessage("halt");
    assertThat(reached).containsExactly("ran");
  }

  @Test
  @DisplayName("GB-05: faults thrown by the block are contained")
  void faultIsContained() {
    ArithmeticException fault = new ArithmeticException("/ by zero");

    Result<Integer> result =
        evaluator.guard(
            checkpoint -> {
              throw fault;
            });

    assertThat(result.cause()).isSameAs(fault);
  }

  @Test
  @DisplayName("GB-06: an outer checkpoint used in a nested guard leaves the outer block")
  void outerCheckpointLeavesOuterBlock() {
    List<String> reached = new ArrayList<>();

    Result<String> outer =
        evaluator.guard(
            outerCheckpoint -> {
              Result<String> inner =
                  evaluator.guard(
                      innerCheckpoint -> {
                        outerCheckpoint.check(Result.error("outer stop"));
                        reached.add("inner after check");
                        return Result.ok("inner");
                      });
              reached.add("outer after inner " + inner.describe());
              return Result.ok("outer");
            });

    assertThat(outer.cause()).hasMessage("outer stop");
    assertThat(reached).isEmpty();
  }

  @Test
  @DisplayName("GB-07: a checkpoint used inside a step sequence still leaves its own block")
  void checkpointInsideSequence() {
    List<String> reached = new ArrayList<>();

    Result<String> result =
        evaluator.guard(
            checkpoint -> {
              Result<String> nested =
                  evaluator.evaluate(
                      Steps.<String>builder()
                          .step(() -> checkpoint.check(Result.error("from step")))
                          .returning(() -> "unreached"));
              reached.add(nested.describe());
              return nested;
            });

    assertThat(result.cause()).hasMessage("from step");
    assertThat(reached).isEmpty();
  }

  @Test
  @DisplayName("GB-08: a checkpoint cannot be used after its block returned")
  void escapedCheckpoint() {
    AtomicReference<Checkpoint> escaped = new AtomicReference<>();

    Result<Boolean> result =
        evaluator.guard(
            checkpoint -> {
              escaped.set(checkpoint);
              return Result.ok();
            });

    assertThat(result).isEqualTo(Result.ok());
    assertThatThrownBy(() -> escaped.get().check(Result.ok(1)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("after its guarded block returned");
  }
}
