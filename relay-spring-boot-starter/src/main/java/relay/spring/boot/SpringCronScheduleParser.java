package relay.spring.boot;

import org.springframework.scheduling.support.CronExpression;
import relay.spi.Schedule;
import relay.spi.ScheduleParser;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ScheduleParser} backed by Spring's {@link CronExpression}.
 *
 * <p>Accepts classic five-field expressions and evaluates them with a fixed seconds field
 * of {@code 0}.
 */
public final class SpringCronScheduleParser implements ScheduleParser {

  private final ZoneId zone;

  /**
   * Evaluates expressions in UTC.
   */
  public SpringCronScheduleParser() {
    this(ZoneOffset.UTC);
  }

  public SpringCronScheduleParser(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  @Override
  public Schedule parse(String expression) {
    Objects.requireNonNull(expression, "expression");
    String trimmed = expression.trim();
    if (trimmed.split("\\s+").length != 5) {
      throw new IllegalArgumentException("expected 5 cron fields: '" + expression + "'");
    }
    CronExpression cron = CronExpression.parse("0 " + trimmed);
    return after -> {
      ZonedDateTime next = cron.next(after.atZone(zone));
      return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    };
  }
}
