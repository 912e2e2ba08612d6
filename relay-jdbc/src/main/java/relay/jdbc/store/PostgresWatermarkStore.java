package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL watermark store.
 *
 * <p>Uses {@code INSERT ... ON CONFLICT DO UPDATE} for a single-statement max-merge.
 */
public final class PostgresWatermarkStore extends AbstractJdbcWatermarkStore {

  public PostgresWatermarkStore() {
    super();
  }

  public PostgresWatermarkStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public void upsert(Connection conn, long sourceId, long seenId, Instant seenTime) {
    String sql = "INSERT INTO " + tableName() +
        " (source_id, last_seen_id, last_seen_time, updated_at) VALUES (?, ?, ?, ?)" +
        " ON CONFLICT (source_id) DO UPDATE SET" +
        " last_seen_id = GREATEST(" + tableName() + ".last_seen_id, EXCLUDED.last_seen_id)," +
        " last_seen_time = COALESCE(EXCLUDED.last_seen_time, " + tableName() + ".last_seen_time)," +
        " updated_at = EXCLUDED.updated_at";
    JdbcTemplate.update(conn, sql, sourceId, seenId, timestampOrNull(seenTime), now());
  }
}
