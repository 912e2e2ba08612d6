package relay.spi;

import relay.DeliveryResult;
import relay.model.ChannelEvent;
import relay.model.DeliveryTarget;

import java.util.List;

/**
 * Downstream endpoint accepting event batches for one source.
 *
 * <p>Delivery is at-least-once; the sink must tolerate duplicates. Implementations should
 * return {@link DeliveryResult.Rejected} for expected failures. Unchecked exceptions are
 * caught by callers and treated as rejections.
 *
 * @see relay.http.HttpDeliverySink
 */
@FunctionalInterface
public interface DeliverySink {

    /**
     * Delivers one batch.
     *
     * @param target  delivery metadata of the source
     * @param events  events in delivery order, never empty
     * @param batchId correlation id of the batch, may be {@code null}
     * @return the sink's verdict
     */
    DeliveryResult deliver(DeliveryTarget target, List<ChannelEvent> events, String batchId);
}
