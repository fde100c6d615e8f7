package quest.gekko.iptv.service.scheduling;

import org.springframework.scheduling.support.CronExpression;
import quest.gekko.iptv.exception.ConfigInvalidException;

/**
 * Tenant schedules are classic 5-field cron ({@code minute hour day-of-month month day-of-week});
 * Spring's scheduler wants a leading seconds field.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    /** @throws ConfigInvalidException when the expression is not 5 valid fields */
    public static CronExpression parseCron(final String expression) {
        return CronExpression.parse(toSpringCron(expression));
    }

    public static String toSpringCron(final String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigInvalidException("Cron expression is empty");
        }
        final String[] fields = expression.strip().split("\\s+");
        if (fields.length != 5) {
            throw new ConfigInvalidException("Cron expression must have 5 fields, got " + fields.length + ": " + expression);
        }
        final String springCron = "0 " + String.join(" ", fields);
        try {
            CronExpression.parse(springCron);
        } catch (IllegalArgumentException e) {
            throw new ConfigInvalidException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
        return springCron;
    }

    public static boolean isValid(final String expression) {
        try {
            toSpringCron(expression);
            return true;
        } catch (ConfigInvalidException e) {
            return false;
        }
    }
}
