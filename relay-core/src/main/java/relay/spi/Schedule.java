package relay.spi;

import java.time.Instant;
import java.util.Optional;

/**
 * Parsed recurring schedule.
 */
@FunctionalInterface
public interface Schedule {

    /**
     * Computes the next fire time strictly after {@code after}.
     *
     * @param after reference instant
     * @return the next fire time, or empty if the schedule never fires again
     */
    Optional<Instant> next(Instant after);
}
