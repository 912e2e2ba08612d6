package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;
import relay.jdbc.RelayStoreException;
import relay.jdbc.TableNames;
import relay.model.Source;
import relay.spi.SourceStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Source registry over three tables: sources, subscriptions to them, and a single-row
 * configuration table carrying the catch-up schedule override.
 *
 * <p>A source is active while at least one of its subscriptions is active. The SQL is
 * portable across H2, PostgreSQL and MySQL.
 */
public class JdbcSourceStore implements SourceStore {

  private static final JdbcTemplate.RowMapper<Source> SOURCE_ROW_MAPPER = rs -> {
    long externalId = rs.getLong("external_id");
    return new Source(
        rs.getLong("id"),
        rs.wasNull() ? null : externalId,
        rs.getString("handle"),
        rs.getString("url"));
  };

  private final String sourceTable;
  private final String subscriptionTable;
  private final String configTable;

  public JdbcSourceStore() {
    this(TableNames.SOURCE, TableNames.SUBSCRIPTION, TableNames.CONFIG);
  }

  public JdbcSourceStore(String sourceTable, String subscriptionTable, String configTable) {
    this.sourceTable = TableNames.validate(sourceTable);
    this.subscriptionTable = TableNames.validate(subscriptionTable);
    this.configTable = TableNames.validate(configTable);
  }

  @Override
  public List<Source> listActiveSubscribed(Connection conn) {
    String sql = "SELECT DISTINCT s.id, s.external_id, s.handle, s.url FROM " + sourceTable + " s" +
        " INNER JOIN " + subscriptionTable + " sub ON sub.source_id = s.id" +
        " WHERE sub.is_active = TRUE ORDER BY s.id";
    return JdbcTemplate.query(conn, sql, SOURCE_ROW_MAPPER);
  }

  /**
   * {@inheritDoc}
   *
   * <p>The handle is kept when {@code handle} is null. A concurrent writer claiming the
   * same external id surfaces as a unique key violation and is reported as a conflict.
   */
  @Override
  public boolean updateResolvedIdentity(Connection conn, long sourceId, long externalId, String handle) {
    String conflictSql = "SELECT id FROM " + sourceTable + " WHERE external_id = ? AND id <> ?";
    if (!JdbcTemplate.query(conn, conflictSql, rs -> rs.getLong(1), externalId, sourceId).isEmpty()) {
      return false;
    }
    String sql = "UPDATE " + sourceTable +
        " SET external_id = ?, handle = COALESCE(?, handle), updated_at = ? WHERE id = ?";
    try {
      return JdbcTemplate.update(conn, sql, externalId, handle, now(), sourceId) > 0;
    } catch (RelayStoreException e) {
      if (e.isConstraintViolation()) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public Optional<String> findSchedule(Connection conn) {
    String sql = "SELECT cron FROM " + configTable + " ORDER BY id LIMIT 1";
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getString("cron"));
  }

  /**
   * Stores or clears the schedule override.
   *
   * @param cron five-field cron expression, or {@code null} to fall back to the default
   */
  public void saveSchedule(Connection conn, String cron) {
    String updateSql = "UPDATE " + configTable + " SET cron = ?, updated_at = ? WHERE id = 1";
    if (JdbcTemplate.update(conn, updateSql, cron, now()) == 0) {
      String insertSql = "INSERT INTO " + configTable + " (id, cron, created_at, updated_at) VALUES (1, ?, ?, ?)";
      Timestamp now = now();
      JdbcTemplate.update(conn, insertSql, cron, now, now);
    }
  }

  /**
   * Inserts a source for {@code url} with no identity, or returns the existing one's id.
   */
  @Override
  public long register(Connection conn, String url) {
    Objects.requireNonNull(url, "url");
    Optional<Long> existing = findIdByUrl(conn, url);
    if (existing.isPresent()) {
      return existing.get();
    }
    String sql = "INSERT INTO " + sourceTable + " (url, created_at, updated_at) VALUES (?, ?, ?)";
    Timestamp now = now();
    try {
      return JdbcTemplate.insertReturningKey(conn, sql, url, now, now);
    } catch (RelayStoreException e) {
      if (e.isConstraintViolation()) {
        return findIdByUrl(conn, url).orElseThrow(() -> e);
      }
      throw e;
    }
  }

  /**
   * Creates an active subscription of {@code subscriber} to a source, or reactivates an
   * existing one.
   */
  public void subscribe(Connection conn, long sourceId, String subscriber) {
    Objects.requireNonNull(subscriber, "subscriber");
    String updateSql = "UPDATE " + subscriptionTable +
        " SET is_active = TRUE, updated_at = ? WHERE source_id = ? AND subscriber = ?";
    if (JdbcTemplate.update(conn, updateSql, now(), sourceId, subscriber) == 0) {
      String insertSql = "INSERT INTO " + subscriptionTable +
          " (source_id, subscriber, is_active, created_at, updated_at) VALUES (?, ?, TRUE, ?, ?)";
      Timestamp now = now();
      JdbcTemplate.update(conn, insertSql, sourceId, subscriber, now, now);
    }
  }

  @Override
  public int setSubscriptionActive(Connection conn, long sourceId, boolean active) {
    String sql = "UPDATE " + subscriptionTable + " SET is_active = ?, updated_at = ? WHERE source_id = ?";
    return JdbcTemplate.update(conn, sql, active, now(), sourceId);
  }

  private Optional<Long> findIdByUrl(Connection conn, String url) {
    String sql = "SELECT id FROM " + sourceTable + " WHERE url = ?";
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getLong(1), url);
  }

  private static Timestamp now() {
    return Timestamp.from(Instant.now());
  }
}
