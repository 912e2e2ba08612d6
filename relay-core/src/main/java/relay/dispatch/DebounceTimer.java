package relay.dispatch;

import java.util.concurrent.ScheduledFuture;

/**
 * Handle over a scheduled flush. The generation identifies which arming of the lane's timer
 * this handle belongs to; a fire whose generation is no longer current is ignored.
 */
final class DebounceTimer {
  private final ScheduledFuture<?> future;
  private final long generation;

  DebounceTimer(ScheduledFuture<?> future, long generation) {
    this.future = future;
    this.generation = generation;
  }

  long generation() {
    return generation;
  }

  /** Idempotent; never interrupts a fire already in progress. */
  void cancel() {
    future.cancel(false);
  }
}
