package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * MySQL watermark store. Also compatible with MariaDB and TiDB.
 *
 * <p>Uses {@code INSERT ... ON DUPLICATE KEY UPDATE} for a single-statement max-merge.
 */
public final class MySqlWatermarkStore extends AbstractJdbcWatermarkStore {

  public MySqlWatermarkStore() {
    super();
  }

  public MySqlWatermarkStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  public void upsert(Connection conn, long sourceId, long seenId, Instant seenTime) {
    String sql = "INSERT INTO " + tableName() +
        " (source_id, last_seen_id, last_seen_time, updated_at) VALUES (?, ?, ?, ?)" +
        " ON DUPLICATE KEY UPDATE" +
        " last_seen_id = GREATEST(last_seen_id, VALUES(last_seen_id))," +
        " last_seen_time = COALESCE(VALUES(last_seen_time), last_seen_time)," +
        " updated_at = VALUES(updated_at)";
    JdbcTemplate.update(conn, sql, sourceId, seenId, timestampOrNull(seenTime), now());
  }
}
