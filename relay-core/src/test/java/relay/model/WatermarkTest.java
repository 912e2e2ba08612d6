package relay.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class WatermarkTest {

    private static final Instant T1 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-01T11:00:00Z");

    @Test
    void noneStartsAtZero() {
        Watermark none = Watermark.none(5L);
        assertEquals(Watermark.NONE_ID, none.lastSeenId());
        assertNull(none.lastSeenTime());
    }

    @Test
    void mergeNeverMovesBackwards() {
        Watermark watermark = new Watermark(5L, 100L, T1);

        assertEquals(100L, watermark.merge(90L, T2).lastSeenId());
        assertEquals(120L, watermark.merge(120L, T2).lastSeenId());
    }

    @Test
    void mergeKeepsTimeWhenUpdateHasNone() {
        Watermark watermark = new Watermark(5L, 100L, T1);

        assertEquals(T1, watermark.merge(120L, null).lastSeenTime());
        assertEquals(T2, watermark.merge(90L, T2).lastSeenTime());
    }

    @Test
    void mergeOrderDoesNotMatter() {
        Watermark a = Watermark.none(1L).merge(7L, T1).merge(3L, T2).merge(5L, null);
        Watermark b = Watermark.none(1L).merge(5L, null).merge(3L, T2).merge(7L, T1);

        assertEquals(a.lastSeenId(), b.lastSeenId());
    }
}
