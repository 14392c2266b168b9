package at.sv.nighttime.temperature;

import at.sv.nighttime.time.SunTimeline;

import java.time.ZonedDateTime;

public final class PhaseClassifier {

    private PhaseClassifier() {
    }

    /**
     * Classifies the user time of a normalized timeline. Checked in this order, first match wins:
     * <ul>
     *     <li>{@link SolarPhase#NIGHT}: before morning twilight, or at/after night twilight</li>
     *     <li>{@link SolarPhase#MORNING_TWILIGHT}: {@code [morningTwilight, sunrise)}</li>
     *     <li>{@link SolarPhase#NIGHT_TWILIGHT}: {@code [sunset, nightTwilight)}</li>
     *     <li>{@link SolarPhase#MIDDAY}: everything else, i.e. {@code [sunrise, sunset)}</li>
     * </ul>
     * The midday window does not gate the midday phase.
     */
    public static SolarPhase classify(SunTimeline timeline) {
        ZonedDateTime userTime = timeline.getUserTime();
        if (userTime.isBefore(timeline.getMorningTwilight()) || !userTime.isBefore(timeline.getNightTwilight())) {
            return SolarPhase.NIGHT;
        }
        if (userTime.isBefore(timeline.getSunrise())) {
            return SolarPhase.MORNING_TWILIGHT;
        }
        if (!userTime.isBefore(timeline.getSunset())) {
            return SolarPhase.NIGHT_TWILIGHT;
        }
        return SolarPhase.MIDDAY;
    }
}
