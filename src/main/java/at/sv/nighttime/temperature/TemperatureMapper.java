package at.sv.nighttime.temperature;

import at.sv.nighttime.time.SunTimeline;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps the solar phase of a timeline to a color temperature within {@code [loTemp, hiTemp]}.
 */
@Slf4j
@Getter
public final class TemperatureMapper {

    private final int loTemp;
    private final int hiTemp;

    public TemperatureMapper(int loTemp, int hiTemp) {
        if (loTemp >= hiTemp) {
            throw new IllegalArgumentException("Low temperature " + loTemp + " must be below high temperature " + hiTemp);
        }
        this.loTemp = loTemp;
        this.hiTemp = hiTemp;
    }

    /**
     * @param timeline a normalized timeline with its midday window set
     * @return the temperature for the user time of the timeline
     * @throws IncompleteSunTimelineException if the timeline misses any timestamp
     * @throws DegenerateIntervalException    if the user is in a twilight phase of zero length
     */
    public int getTemperature(SunTimeline timeline) {
        verifySunTimeline(timeline);
        SolarPhase phase = PhaseClassifier.classify(timeline);
        double proportion = switch (phase) {
            case MORNING_TWILIGHT -> ProportionCalculator.getMorningProportion(timeline);
            case NIGHT_TWILIGHT -> ProportionCalculator.getNightProportion(timeline);
            case NIGHT, MIDDAY -> 0.0;
        };
        int temperature = map(phase, proportion);
        log.debug("User time {} in {} ({}): {}K", timeline.getUserTime(), phase, proportion, temperature);
        return temperature;
    }

    /**
     * @param proportion the position within the twilight phase in [0, 1]; ignored for the other phases
     */
    public int map(SolarPhase phase, double proportion) {
        if (phase.isTransitional() && (proportion < 0.0 || proportion > 1.0)) {
            throw new IllegalArgumentException("Proportion must be within [0,1], but was " + proportion);
        }
        return switch (phase) {
            case NIGHT -> loTemp;
            case MIDDAY -> hiTemp;
            case MORNING_TWILIGHT -> interpolate(loTemp, hiTemp, proportion);
            case NIGHT_TWILIGHT -> interpolate(hiTemp, loTemp, proportion);
        };
    }

    /**
     * P = P0 + t(P1 - P0)
     */
    private static int interpolate(int from, int to, double proportion) {
        BigDecimal diff = BigDecimal.valueOf(to - from);
        return BigDecimal.valueOf(from)
                         .add(BigDecimal.valueOf(proportion).multiply(diff))
                         .setScale(0, RoundingMode.HALF_UP)
                         .intValue();
    }

    /**
     * @throws IncompleteSunTimelineException if any of the six sun timestamps or the user time is unset
     */
    public static void verifySunTimeline(SunTimeline timeline) {
        List<String> missing = new ArrayList<>();
        if (timeline.getSunrise() == null) missing.add("sunrise");
        if (timeline.getSunset() == null) missing.add("sunset");
        if (timeline.getMorningTwilight() == null) missing.add("morningTwilight");
        if (timeline.getNightTwilight() == null) missing.add("nightTwilight");
        if (timeline.getMiddayBegin() == null) missing.add("middayBegin");
        if (timeline.getMiddayEnd() == null) missing.add("middayEnd");
        if (timeline.getUserTime() == null) missing.add("userTime");
        if (!missing.isEmpty()) {
            throw new IncompleteSunTimelineException("Sun timeline is incomplete, missing: " + String.join(", ", missing));
        }
    }
}
