/**
 * JDBC implementations of {@link relay.spi.SourceStore} and {@link relay.spi.WatermarkStore}.
 *
 * <p>{@link relay.jdbc.store.AbstractJdbcWatermarkStore} provides shared SQL; subclasses
 * supply database-specific upserts: H2 (update, then insert), PostgreSQL
 * ({@code ON CONFLICT}) and MySQL ({@code ON DUPLICATE KEY UPDATE}). Every variant keeps the
 * larger sequence id, so concurrent writers never move a cursor backwards.
 *
 * @see relay.jdbc.store.JdbcSourceStore
 * @see relay.jdbc.store.JdbcWatermarkStores
 */
package relay.jdbc.store;
