package at.sv.nighttime.time;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * The sun events of one request. Created by {@link SunEventParser} with time-of-day values only, then completed in
 * place by {@link DateNormalizer} and {@link MiddayWindowCalculator}. Afterwards it is only read.
 * <p>
 * Once normalized: {@code morningTwilight <= sunrise < sunset <= nightTwilight} and
 * {@code sunrise <= middayBegin <= middayEnd <= sunset}. The {@code userTime} may lie anywhere. The one exception is
 * a sunrise and sunset with the same time of day: they are passed through unchanged as equal timestamps, which leaves
 * no daylight.
 */
@Data
@NoArgsConstructor
public final class SunTimeline {

    private LocalTime sunriseTimeOfDay;
    private LocalTime sunsetTimeOfDay;
    private LocalTime morningTwilightTimeOfDay;
    private LocalTime nightTwilightTimeOfDay;

    private ZonedDateTime sunrise;
    private ZonedDateTime sunset;
    private ZonedDateTime morningTwilight;
    private ZonedDateTime nightTwilight;
    private ZonedDateTime middayBegin;
    private ZonedDateTime middayEnd;
    private ZonedDateTime userTime;

    public static SunTimeline ofTimesOfDay(LocalTime sunrise, LocalTime sunset,
                                           LocalTime morningTwilight, LocalTime nightTwilight) {
        SunTimeline timeline = new SunTimeline();
        timeline.setSunriseTimeOfDay(sunrise);
        timeline.setSunsetTimeOfDay(sunset);
        timeline.setMorningTwilightTimeOfDay(morningTwilight);
        timeline.setNightTwilightTimeOfDay(nightTwilight);
        return timeline;
    }

    public LocalTime getTimeOfDay(SunEvent event) {
        return switch (event) {
            case SUNRISE -> sunriseTimeOfDay;
            case SUNSET -> sunsetTimeOfDay;
            case MORNING_TWILIGHT -> morningTwilightTimeOfDay;
            case NIGHT_TWILIGHT -> nightTwilightTimeOfDay;
        };
    }
}
