package fallible.api.evaluation;

/** A guarded block run only for its effects; completing normally means success. */
@FunctionalInterface
public interface GuardedAction {

  void run(Checkpoint checkpoint) throws Throwable;
}
