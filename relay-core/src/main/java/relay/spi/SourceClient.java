package relay.spi;

import relay.model.ChannelEvent;
import relay.model.ResolvedIdentity;
import relay.model.Source;

import java.util.Optional;

/**
 * Protocol client for the upstream messaging network.
 *
 * <p>The wire protocol, authentication and session handling are outside this library; the
 * relay only needs identity resolution and history fetches.
 */
public interface SourceClient {

    /**
     * Resolves a public channel handle to its external identity.
     *
     * @param handle channel username
     * @return the identity, or empty when the handle does not name a channel
     * @throws RuntimeException on transport failure
     */
    Optional<ResolvedIdentity> resolve(String handle);

    /**
     * Streams channel history newer than {@code minId}, newest first.
     *
     * <p>The returned iterable may page lazily; callers stop iterating once they reach
     * events older than their cutoff.
     *
     * @param source resolved source
     * @param minId  exclusive lower bound on sequence ids, {@code 0} for no bound
     * @return events in descending sequence order
     * @throws RuntimeException on transport failure
     */
    Iterable<ChannelEvent> history(Source source, long minId);

    /**
     * Looks up the current username of a channel by external id.
     *
     * <p>Default returns empty.
     *
     * @param externalId external channel id
     * @return the username, or empty if the channel has none
     */
    default Optional<String> lookupHandle(long externalId) {
        return Optional.empty();
    }
}
