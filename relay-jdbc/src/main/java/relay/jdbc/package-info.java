/**
 * JDBC plumbing shared by the relay stores: {@link relay.jdbc.JdbcTemplate},
 * {@link relay.jdbc.DataSourceConnectionProvider} and table name validation.
 *
 * <p>Store implementations live in {@link relay.jdbc.store}. Schema scripts for H2,
 * PostgreSQL and MySQL ship as classpath resources under {@code schema/}.
 *
 * @see relay.jdbc.store.JdbcSourceStore
 * @see relay.jdbc.store.JdbcWatermarkStores
 */
package relay.jdbc;
