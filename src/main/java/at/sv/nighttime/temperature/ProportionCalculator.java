package at.sv.nighttime.temperature;

import at.sv.nighttime.time.SunTimeline;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.ZonedDateTime;

public final class ProportionCalculator {

    private ProportionCalculator() {
    }

    /**
     * t = (userTime - start) / duration, clamped to [0, 1]
     *
     * @throws DegenerateIntervalException if the duration is zero or negative
     */
    public static double calculate(ZonedDateTime userTime, ZonedDateTime start, Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            throw new DegenerateIntervalException("Interval starting at " + start + " has no positive length: " + duration);
        }
        BigDecimal proportion = BigDecimal.valueOf(Duration.between(start, userTime).toNanos())
                                          .divide(BigDecimal.valueOf(duration.toNanos()), 7, RoundingMode.HALF_UP);
        return clamp(proportion).doubleValue();
    }

    /**
     * @return the proportion of the user time within {@code [morningTwilight, sunrise]}
     */
    public static double getMorningProportion(SunTimeline timeline) {
        return calculate(timeline.getUserTime(), timeline.getMorningTwilight(),
                Duration.between(timeline.getMorningTwilight(), timeline.getSunrise()));
    }

    /**
     * @return the proportion of the user time within {@code [sunset, nightTwilight]}
     */
    public static double getNightProportion(SunTimeline timeline) {
        return calculate(timeline.getUserTime(), timeline.getSunset(),
                Duration.between(timeline.getSunset(), timeline.getNightTwilight()));
    }

    private static BigDecimal clamp(BigDecimal proportion) {
        if (proportion.signum() < 0) {
            return BigDecimal.ZERO;
        }
        if (proportion.compareTo(BigDecimal.ONE) > 0) {
            return BigDecimal.ONE;
        }
        return proportion;
    }
}
