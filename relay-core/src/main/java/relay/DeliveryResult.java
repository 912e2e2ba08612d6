package relay;

import java.util.Objects;

/**
 * Outcome of a single {@link relay.spi.DeliverySink#deliver} call.
 *
 * <ul>
 *   <li>{@link Accepted}: the sink acknowledged the batch.</li>
 *   <li>{@link Rejected}: the sink refused the batch or could not be reached.</li>
 * </ul>
 */
public sealed interface DeliveryResult permits DeliveryResult.Accepted, DeliveryResult.Rejected {

    /** Non-2xx status or {@code ok=false} body. */
    String HTTP_ERROR = "HTTP_ERROR";

    /** Connection, timeout or other transport failure. */
    String HTTP_CLIENT_ERROR = "HTTP_CLIENT_ERROR";

    /** Anything else, including encoding failures. */
    String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";

    static Accepted accepted(int processed, int pending) {
        return new Accepted(processed, pending);
    }

    static Rejected rejected(String message, String code) {
        return new Rejected(message, code);
    }

    default boolean isAccepted() {
        return this instanceof Accepted;
    }

    /**
     * Batch acknowledged.
     *
     * @param processed events the sink processed
     * @param pending   events the sink still has queued
     */
    record Accepted(int processed, int pending) implements DeliveryResult {
    }

    /**
     * Batch refused.
     *
     * @param message human-readable reason
     * @param code    one of the error codes declared on {@link DeliveryResult}
     */
    record Rejected(String message, String code) implements DeliveryResult {
        public Rejected {
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(code, "code");
        }
    }
}
