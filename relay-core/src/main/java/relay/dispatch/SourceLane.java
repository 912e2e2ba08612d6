package relay.dispatch;

import java.util.ArrayDeque;

/**
 * Per-source dispatcher state: the accumulating batch, its timer, and the queue of popped
 * batches waiting for delivery.
 *
 * <p>Every method must be called while holding this lane's monitor. No method blocks or
 * performs I/O.
 */
final class SourceLane {
  private final long externalId;
  private PendingBatch pending;
  private DebounceTimer timer;
  private long generation;
  private final ArrayDeque<PendingBatch> outbound = new ArrayDeque<>();
  private boolean draining;

  SourceLane(long externalId) {
    this.externalId = externalId;
  }

  long externalId() {
    return externalId;
  }

  PendingBatch pending() {
    return pending;
  }

  void begin(PendingBatch batch) {
    this.pending = batch;
  }

  /** Starts a new timer generation; any fire from an earlier generation becomes stale. */
  long nextGeneration() {
    return ++generation;
  }

  boolean isCurrent(long timerGeneration) {
    return timer != null && timer.generation() == timerGeneration && generation == timerGeneration;
  }

  void replaceTimer(DebounceTimer next) {
    cancelTimer();
    this.timer = next;
  }

  void cancelTimer() {
    if (timer != null) {
      timer.cancel();
      timer = null;
    }
  }

  /**
   * Detaches the pending batch and queues it for delivery.
   *
   * @return the popped batch, or {@code null} if nothing was pending
   */
  PendingBatch popToOutbound() {
    cancelTimer();
    generation++;
    PendingBatch batch = pending;
    pending = null;
    if (batch != null) {
      outbound.addLast(batch);
    }
    return batch;
  }

  /**
   * Claims the drain role for this lane.
   *
   * @return {@code true} if the caller must start a drain task
   */
  boolean claimDrain() {
    if (draining || outbound.isEmpty()) {
      return false;
    }
    draining = true;
    return true;
  }

  /**
   * Takes the next batch for the active drain task, releasing the drain role when the queue
   * is empty.
   */
  PendingBatch nextOutbound() {
    PendingBatch next = outbound.pollFirst();
    if (next == null) {
      draining = false;
    }
    return next;
  }

  /**
   * Releases the drain role after a drain task exited abnormally.
   *
   * @return {@code true} if batches are still queued and the caller must start a new drain task
   */
  boolean releaseDrain() {
    draining = false;
    return claimDrain();
  }

  /** Drops queued batches after the drain task could not be scheduled. */
  int abandonOutbound() {
    int events = 0;
    for (PendingBatch batch : outbound) {
      events += batch.size();
    }
    outbound.clear();
    draining = false;
    return events;
  }
}
