package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;
import relay.jdbc.RelayStoreException;
import relay.jdbc.TableNames;
import relay.model.Watermark;
import relay.spi.WatermarkStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Base JDBC watermark store with standard SQL implementations.
 *
 * <p>The default {@link #upsert} is an {@code UPDATE} with {@code GREATEST}, falling back
 * to an {@code INSERT} and retrying the update if a concurrent writer inserted first.
 * Subclasses override it with a native single-statement upsert where the database has one.
 * Register custom implementations via
 * {@code META-INF/services/relay.jdbc.store.AbstractJdbcWatermarkStore}.
 *
 * @see JdbcWatermarkStores
 */
public abstract class AbstractJdbcWatermarkStore implements WatermarkStore {

  protected static final JdbcTemplate.RowMapper<Watermark> WATERMARK_ROW_MAPPER = rs -> {
    Timestamp seenTime = rs.getTimestamp("last_seen_time");
    return new Watermark(
        rs.getLong("source_id"),
        rs.getLong("last_seen_id"),
        seenTime == null ? null : seenTime.toInstant());
  };

  private final String tableName;

  protected AbstractJdbcWatermarkStore() {
    this(TableNames.WATERMARK);
  }

  protected AbstractJdbcWatermarkStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  protected String tableName() {
    return tableName;
  }

  @Override
  public Optional<Watermark> find(Connection conn, long sourceId) {
    String sql = "SELECT source_id, last_seen_id, last_seen_time FROM " + tableName() + " WHERE source_id = ?";
    return JdbcTemplate.queryOne(conn, sql, WATERMARK_ROW_MAPPER, sourceId);
  }

  @Override
  public void upsert(Connection conn, long sourceId, long seenId, Instant seenTime) {
    if (updateExisting(conn, sourceId, seenId, seenTime) > 0) {
      return;
    }
    String insertSql = "INSERT INTO " + tableName() +
        " (source_id, last_seen_id, last_seen_time, updated_at) VALUES (?, ?, ?, ?)";
    try {
      JdbcTemplate.update(conn, insertSql, sourceId, seenId, timestampOrNull(seenTime), now());
    } catch (RelayStoreException e) {
      if (!e.isConstraintViolation()) {
        throw e;
      }
      updateExisting(conn, sourceId, seenId, seenTime);
    }
  }

  private int updateExisting(Connection conn, long sourceId, long seenId, Instant seenTime) {
    String sql = "UPDATE " + tableName() +
        " SET last_seen_id = GREATEST(last_seen_id, ?)," +
        " last_seen_time = COALESCE(?, last_seen_time), updated_at = ?" +
        " WHERE source_id = ?";
    return JdbcTemplate.update(conn, sql, seenId, timestampOrNull(seenTime), now(), sourceId);
  }

  protected static Object timestampOrNull(Instant instant) {
    return instant == null ? new JdbcTemplate.SqlNull(Types.TIMESTAMP) : Timestamp.from(instant);
  }

  protected static Timestamp now() {
    return Timestamp.from(Instant.now());
  }
}
