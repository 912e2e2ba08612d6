package relay.testing;

import relay.model.Watermark;
import relay.spi.WatermarkStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Watermark store held in memory, merging with {@link Watermark#merge}.
 */
public class InMemoryWatermarkStore implements WatermarkStore {
    private final Map<Long, Watermark> cursors = new ConcurrentHashMap<>();
    public volatile boolean failReads;

    public void put(long sourceId, long lastSeenId) {
        cursors.put(sourceId, new Watermark(sourceId, lastSeenId, null));
    }

    public long lastSeenId(long sourceId) {
        Watermark watermark = cursors.get(sourceId);
        return watermark == null ? Watermark.NONE_ID : watermark.lastSeenId();
    }

    @Override
    public Optional<Watermark> find(Connection conn, long sourceId) {
        if (failReads) {
            throw new IllegalStateException("watermark store unavailable");
        }
        return Optional.ofNullable(cursors.get(sourceId));
    }

    @Override
    public void upsert(Connection conn, long sourceId, long seenId, Instant seenTime) {
        cursors.merge(sourceId, new Watermark(sourceId, seenId, seenTime),
                (existing, update) -> existing.merge(update.lastSeenId(), update.lastSeenTime()));
    }
}
