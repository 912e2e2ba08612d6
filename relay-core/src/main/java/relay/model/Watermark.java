package relay.model;

import java.time.Instant;

/**
 * Per-source delivery cursor: the highest sequence id handed to the sink.
 *
 * <p>The cursor only moves forward. {@link #merge} keeps the larger id, so applying updates
 * in any order yields the maximum.
 *
 * @param sourceId     internal source id
 * @param lastSeenId   highest delivered sequence id, {@link #NONE_ID} when nothing was seen
 * @param lastSeenTime timestamp of the latest update carrying a time, may be {@code null}
 */
public record Watermark(long sourceId, long lastSeenId, Instant lastSeenTime) {

    /** Sequence id used when a source has no stored cursor. */
    public static final long NONE_ID = 0L;

    /**
     * Empty cursor for a source that has never been delivered.
     */
    public static Watermark none(long sourceId) {
        return new Watermark(sourceId, NONE_ID, null);
    }

    /**
     * Merges an update into this cursor. The id becomes {@code max(lastSeenId, seenId)};
     * the time is replaced only when the update carries one.
     *
     * @param seenId   observed sequence id
     * @param seenTime observed time, may be {@code null}
     * @return the merged cursor
     */
    public Watermark merge(long seenId, Instant seenTime) {
        return new Watermark(sourceId, Math.max(lastSeenId, seenId),
                seenTime != null ? seenTime : lastSeenTime);
    }
}
