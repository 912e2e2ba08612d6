package relay.resolve;

import relay.model.ResolvedIdentity;
import relay.model.Source;
import relay.spi.ConnectionProvider;
import relay.spi.SourceClient;
import relay.spi.SourceStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps unresolved sources to their external identity and writes it back to the registry.
 *
 * <p>Used by both the authorization cache refresh and the catch-up reconciler. A failed
 * write-back is logged and the in-memory identity is still returned, so the source takes
 * part in the current cycle and is resolved again on the next one.
 */
public final class SourceResolver {
    private static final Logger logger = Logger.getLogger(SourceResolver.class.getName());

    private final ConnectionProvider connectionProvider;
    private final SourceStore sourceStore;
    private final SourceClient sourceClient;

    public SourceResolver(ConnectionProvider connectionProvider, SourceStore sourceStore,
            SourceClient sourceClient) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.sourceStore = Objects.requireNonNull(sourceStore, "sourceStore");
        this.sourceClient = Objects.requireNonNull(sourceClient, "sourceClient");
    }

    /**
     * Returns {@code source} with its external identity filled in.
     *
     * @param source registry source, resolved or not
     * @return the resolved source ({@code source} itself if already resolved)
     * @throws SourceResolutionException if the URL has no public username or the protocol
     *                                   client cannot resolve it
     */
    public Source resolve(Source source) {
        if (source.isResolved()) {
            return source;
        }
        String handle = ChannelUrls.extractHandle(source.url())
                .orElseThrow(() -> new SourceResolutionException(
                        "No public username in " + source.url() + " (source " + source.id() + ")"));

        ResolvedIdentity identity;
        try {
            identity = sourceClient.resolve(handle)
                    .orElseThrow(() -> new SourceResolutionException("@" + handle + " is not a channel"));
        } catch (SourceResolutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceResolutionException("Failed to resolve @" + handle, e);
        }

        String resolvedHandle = identity.handle() != null ? identity.handle() : handle;
        persist(source, identity.externalId(), resolvedHandle);
        logger.log(Level.INFO, "Resolved source {0} ({1}) to external id {2}",
                new Object[]{String.valueOf(source.id()), source.url(), String.valueOf(identity.externalId())});
        return source.withIdentity(identity.externalId(), resolvedHandle);
    }

    private void persist(Source source, long externalId, String handle) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            if (!sourceStore.updateResolvedIdentity(conn, source.id(), externalId, handle)) {
                logger.log(Level.WARNING,
                        "External id {0} already belongs to another source; skipped identity update for source {1}",
                        new Object[]{String.valueOf(externalId), String.valueOf(source.id())});
            }
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.WARNING, "Failed to persist resolved identity for source " + source.id(), e);
        }
    }
}
