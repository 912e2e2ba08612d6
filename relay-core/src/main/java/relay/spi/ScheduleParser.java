package relay.spi;

/**
 * Parses five-field cron expressions ({@code minute hour day-of-month month day-of-week}).
 *
 * @see relay.spring.boot.SpringCronScheduleParser
 */
@FunctionalInterface
public interface ScheduleParser {

    /**
     * @param expression the cron expression
     * @return the parsed schedule
     * @throws IllegalArgumentException if the expression is malformed
     */
    Schedule parse(String expression);
}
