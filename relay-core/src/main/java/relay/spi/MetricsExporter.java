package relay.spi;

/**
 * Observability hook for exporting relay counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see relay.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of inbound events handed to the dispatcher.
     */
    void incrementIngestAccepted();

    /**
     * Increments the count of inbound events dropped because their source is not active.
     */
    void incrementIngestDropped();

    /**
     * Increments the count of inbound events whose handling threw.
     */
    default void incrementIngestErrors() {
    }

    /**
     * Increments the count of batches popped from the dispatcher.
     */
    void incrementBatchFlushed();

    /**
     * Increments the count of batches accepted by the sink.
     */
    void incrementDeliverySuccess();

    /**
     * Increments the count of batches rejected by the sink or lost to an exception.
     */
    void incrementDeliveryFailure();

    /**
     * Adds to the count of events fetched by catch-up runs.
     *
     * @param count events fetched for one source
     */
    default void incrementCatchUpEvents(int count) {
    }

    /**
     * Increments the count of grace-period retries taken by the reconciler.
     */
    default void incrementCatchUpRetry() {
    }

    /**
     * Increments the count of completed cache refreshes.
     */
    default void incrementCacheRefresh() {
    }

    /**
     * Increments the count of cache refreshes aborted by a registry failure.
     */
    default void incrementCacheRefreshFailure() {
    }

    /**
     * Records the number of events currently buffered across all sources.
     *
     * @param pending buffered events
     */
    void recordPendingEvents(int pending);

    /**
     * Records the number of sources in the current authorization snapshot.
     *
     * @param sources cached sources
     */
    default void recordCachedSources(int sources) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementIngestAccepted() {
        }

        @Override
        public void incrementIngestDropped() {
        }

        @Override
        public void incrementBatchFlushed() {
        }

        @Override
        public void incrementDeliverySuccess() {
        }

        @Override
        public void incrementDeliveryFailure() {
        }

        @Override
        public void recordPendingEvents(int pending) {
        }
    }
}
