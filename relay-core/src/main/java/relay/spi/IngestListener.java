package relay.spi;

import relay.model.ChannelEvent;

/**
 * Callback surface the protocol client pushes every newly observed message into.
 *
 * <p>Implementations must not throw: the protocol client's receive loop calls this method
 * directly.
 *
 * @see relay.ingest.FilteringIngestListener
 */
@FunctionalInterface
public interface IngestListener {

    /**
     * Handles one inbound message.
     *
     * @param externalId external id of the channel the message was posted to
     * @param event      the normalized message
     * @param handleHint channel username seen on the wire, may be {@code null}
     */
    void onMessage(long externalId, ChannelEvent event, String handleHint);
}
