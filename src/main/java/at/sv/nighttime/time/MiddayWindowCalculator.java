package at.sv.nighttime.time;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * Sets a window of {@code 2 * halfWidth} around solar noon, the midpoint between sunrise and sunset, kept within
 * {@code [sunrise, sunset]}.
 */
public final class MiddayWindowCalculator {

    private final Duration halfWidth;

    public MiddayWindowCalculator(Duration halfWidth) {
        if (halfWidth == null || halfWidth.isNegative()) {
            throw new IllegalArgumentException("Midday half-width must be >= 0, but was " + halfWidth);
        }
        this.halfWidth = halfWidth;
    }

    /**
     * @param timeline a timeline already processed by {@link DateNormalizer}
     * @return the same timeline with {@code middayBegin} and {@code middayEnd} set
     */
    public SunTimeline calculate(SunTimeline timeline) {
        ZonedDateTime solarNoon = getSolarNoon(timeline);
        timeline.setMiddayBegin(solarNoon.minus(halfWidth));
        timeline.setMiddayEnd(solarNoon.plus(halfWidth));
        return clampToDaylight(timeline);
    }

    public static ZonedDateTime getSolarNoon(SunTimeline timeline) {
        Duration daylight = Duration.between(timeline.getSunrise(), timeline.getSunset());
        return timeline.getSunrise().plus(daylight.dividedBy(2));
    }

    private static SunTimeline clampToDaylight(SunTimeline timeline) {
        if (timeline.getMiddayBegin().isBefore(timeline.getSunrise())) {
            timeline.setMiddayBegin(timeline.getSunrise());
        }
        if (timeline.getMiddayEnd().isAfter(timeline.getSunset())) {
            timeline.setMiddayEnd(timeline.getSunset());
        }
        return timeline;
    }

    public Duration getHalfWidth() {
        return halfWidth;
    }
}
