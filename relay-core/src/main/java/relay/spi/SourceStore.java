package relay.spi;

import relay.model.Source;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Source registry: channels, their delivery subscriptions and the schedule override.
 *
 * <p>All methods receive an explicit {@link Connection}; implementations live in the
 * {@code relay-jdbc} module and report failures as unchecked exceptions.
 *
 * @see relay.jdbc.JdbcSourceStore
 */
public interface SourceStore {

    /**
     * Lists every source that has at least one active delivery subscription.
     *
     * @param conn the JDBC connection
     * @return active sources, resolved or not, ordered by internal id
     */
    List<Source> listActiveSubscribed(Connection conn);

    /**
     * Persists the resolved external identity of a source.
     *
     * <p>When {@code externalId} already belongs to a different source the update is
     * skipped and {@code false} is returned; no exception is thrown.
     *
     * @param conn       the JDBC connection
     * @param sourceId   internal id of the source to update
     * @param externalId resolved external id
     * @param handle     resolved username, may be {@code null}
     * @return {@code true} if the row was updated
     */
    boolean updateResolvedIdentity(Connection conn, long sourceId, long externalId, String handle);

    /**
     * Reads the registry-provided schedule override.
     *
     * @param conn the JDBC connection
     * @return the five-field cron expression, or empty when none is configured
     */
    Optional<String> findSchedule(Connection conn);

    /**
     * Registers a channel URL with an active subscription.
     *
     * @param conn the JDBC connection
     * @param url  canonical channel URL
     * @return the internal id of the new source
     */
    long register(Connection conn, String url);

    /**
     * Activates or deactivates the delivery subscription of a source.
     *
     * @param conn     the JDBC connection
     * @param sourceId internal source id
     * @param active   new subscription state
     * @return the number of subscriptions updated
     */
    int setSubscriptionActive(Connection conn, long sourceId, boolean active);
}
