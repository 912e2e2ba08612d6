package relay.ingest;

import relay.cache.AuthorizationCache;
import relay.dispatch.BatchDispatcher;
import relay.model.ChannelEvent;
import relay.model.DeliveryTarget;
import relay.model.Source;
import relay.spi.IngestListener;
import relay.spi.MetricsExporter;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the real-time path. Drops events from sources that are not currently
 * subscribed and forwards the rest to the {@link BatchDispatcher}.
 *
 * <p>Never throws: the protocol client's receive loop must survive any failure here.
 */
public final class FilteringIngestListener implements IngestListener {
    private static final Logger logger = Logger.getLogger(FilteringIngestListener.class.getName());

    private final AuthorizationCache cache;
    private final BatchDispatcher dispatcher;
    private final MetricsExporter metrics;

    public FilteringIngestListener(AuthorizationCache cache, BatchDispatcher dispatcher) {
        this(cache, dispatcher, MetricsExporter.NOOP);
    }

    public FilteringIngestListener(AuthorizationCache cache, BatchDispatcher dispatcher,
            MetricsExporter metrics) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void onMessage(long externalId, ChannelEvent event, String handleHint) {
        try {
            if (!cache.activeSourceIds().contains(externalId)) {
                metrics.incrementIngestDropped();
                logger.log(Level.FINE, "Dropping event from inactive source {0}", String.valueOf(externalId));
                return;
            }
            Optional<Source> source = cache.find(externalId);
            if (source.isEmpty()) {
                // snapshot swapped between the two reads
                metrics.incrementIngestDropped();
                return;
            }
            dispatcher.onEvent(externalId, event, DeliveryTarget.of(source.get(), handleHint));
            metrics.incrementIngestAccepted();
        } catch (RuntimeException e) {
            metrics.incrementIngestErrors();
            logger.log(Level.SEVERE, "Error handling event " + (event == null ? null : event.sequenceId())
                    + " from source " + externalId, e);
        }
    }
}
