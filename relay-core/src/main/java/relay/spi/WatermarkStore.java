package relay.spi;

import relay.model.Watermark;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable per-source delivery cursor.
 *
 * @see relay.jdbc.AbstractJdbcWatermarkStore
 */
public interface WatermarkStore {

    /**
     * Reads the cursor of a source.
     *
     * @param conn     the JDBC connection
     * @param sourceId internal source id
     * @return the stored cursor, or empty when the source was never delivered
     */
    Optional<Watermark> find(Connection conn, long sourceId);

    /**
     * Inserts or advances the cursor of a source.
     *
     * <p>Implementations <strong>must</strong> merge with {@code max(existing, seenId)} inside
     * the database statement; concurrent writers from the real-time and catch-up paths
     * rely on it to never move the cursor backwards.
     *
     * @param conn     the JDBC connection
     * @param sourceId internal source id
     * @param seenId   observed sequence id
     * @param seenTime observed time, may be {@code null} to keep the stored time
     */
    void upsert(Connection conn, long sourceId, long seenId, Instant seenTime);
}
