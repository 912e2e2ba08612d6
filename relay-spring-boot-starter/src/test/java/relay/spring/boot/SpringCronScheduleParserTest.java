package relay.spring.boot;

import org.junit.jupiter.api.Test;
import relay.spi.Schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SpringCronScheduleParserTest {

  private final SpringCronScheduleParser parser = new SpringCronScheduleParser();

  @Test
  void everyTenMinutes() {
    Schedule schedule = parser.parse("*/10 * * * *");

    assertEquals(Optional.of(Instant.parse("2024-05-01T12:10:00Z")),
        schedule.next(Instant.parse("2024-05-01T12:03:17Z")));
    assertEquals(Optional.of(Instant.parse("2024-05-01T12:20:00Z")),
        schedule.next(Instant.parse("2024-05-01T12:10:00Z")));
  }

  @Test
  void dailyAtFixedTimeInUtc() {
    Schedule schedule = parser.parse("30 2 * * *");

    assertEquals(Optional.of(Instant.parse("2024-05-02T02:30:00Z")),
        schedule.next(Instant.parse("2024-05-01T03:00:00Z")));
  }

  @Test
  void surroundingWhitespaceIgnored() {
    Schedule schedule = parser.parse("  0 * * * *  ");

    assertEquals(Optional.of(Instant.parse("2024-05-01T13:00:00Z")),
        schedule.next(Instant.parse("2024-05-01T12:00:00Z")));
  }

  @Test
  void customZone() {
    Schedule schedule = new SpringCronScheduleParser(ZoneId.of("Europe/Berlin")).parse("0 9 * * *");

    // 09:00 CEST is 07:00 UTC
    assertEquals(Optional.of(Instant.parse("2024-07-01T07:00:00Z")),
        schedule.next(Instant.parse("2024-07-01T00:00:00Z")));
  }

  @Test
  void rejectsWrongFieldCount() {
    assertThrows(IllegalArgumentException.class, () -> parser.parse("0 */10 * * * *"));
    assertThrows(IllegalArgumentException.class, () -> parser.parse("* * * *"));
    assertThrows(IllegalArgumentException.class, () -> parser.parse(""));
  }

  @Test
  void rejectsMalformedField() {
    assertThrows(IllegalArgumentException.class, () -> parser.parse("61 * * * *"));
    assertThrows(IllegalArgumentException.class, () -> parser.parse("every ten minutes ok"));
  }

  @Test
  void nullExpressionThrows() {
    assertThrows(NullPointerException.class, () -> parser.parse(null));
  }
}
