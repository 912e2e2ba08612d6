package relay.dispatch;

import com.github.f4b6a3.ulid.UlidCreator;
import relay.model.ChannelEvent;
import relay.model.DeliveryTarget;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Events accumulated for one source since its last flush.
 *
 * <p>Mutated only while the owning {@link SourceLane}'s monitor is held. Once popped it is
 * handed to a delivery worker and no longer modified.
 */
public final class PendingBatch {
  private final String batchId;
  private final DeliveryTarget target;
  private final long startedAtNanos;
  private final List<ChannelEvent> events = new ArrayList<>();

  PendingBatch(DeliveryTarget target, long startedAtNanos) {
    this.batchId = UlidCreator.getMonotonicUlid().toString();
    this.target = Objects.requireNonNull(target, "target");
    this.startedAtNanos = startedAtNanos;
  }

  void add(ChannelEvent event) {
    events.add(event);
  }

  /** Time-sortable id used to correlate log lines and sink requests. */
  public String batchId() {
    return batchId;
  }

  /** Delivery metadata captured when the first event arrived. */
  public DeliveryTarget target() {
    return target;
  }

  long startedAtNanos() {
    return startedAtNanos;
  }

  /** Events in arrival order. */
  public List<ChannelEvent> events() {
    return Collections.unmodifiableList(events);
  }

  public int size() {
    return events.size();
  }

  long maxSequenceId() {
    long max = 0L;
    for (ChannelEvent event : events) {
      max = Math.max(max, event.sequenceId());
    }
    return max;
  }

  Instant latestDate() {
    Instant latest = null;
    for (ChannelEvent event : events) {
      if (latest == null || event.date().isAfter(latest)) {
        latest = event.date();
      }
    }
    return latest;
  }
}
