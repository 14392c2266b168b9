package at.sv.nighttime.time;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Anchors the time-of-day values of a {@link SunTimeline} to a calendar date and fixes the ordering of events that
 * belong to the next day. All timestamps are in UTC.
 */
@Slf4j
public final class DateNormalizer {

    private DateNormalizer() {
    }

    /**
     * Normalizes against the UTC date of the given user time.
     */
    public static SunTimeline normalize(SunTimeline timeline, ZonedDateTime userTime) {
        return normalize(timeline, toUtc(userTime).toLocalDate(), userTime);
    }

    /**
     * Combines every time of day with the given date and sets the user time. Then, in this order:
     * <ol>
     *     <li>sunrise before morning twilight: sunrise, sunset and night twilight move to the next day</li>
     *     <li>sunset before sunrise: sunset and night twilight move to the next day</li>
     *     <li>night twilight before sunset: night twilight moves to the next day</li>
     * </ol>
     * Each check sees the result of the previous one. Whenever a check moves night twilight, the user time moves along
     * if its time of day is before that of night twilight, so a user time after UTC midnight lands in the daylight or
     * twilight that started on the previous UTC day.
     *
     * @return the same, now normalized, timeline
     */
    public static SunTimeline normalize(SunTimeline timeline, LocalDate date, ZonedDateTime userTime) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(userTime, "userTime");

        timeline.setSunrise(combine(timeline, SunEvent.SUNRISE, date));
        timeline.setSunset(combine(timeline, SunEvent.SUNSET, date));
        timeline.setMorningTwilight(combine(timeline, SunEvent.MORNING_TWILIGHT, date));
        timeline.setNightTwilight(combine(timeline, SunEvent.NIGHT_TWILIGHT, date));
        timeline.setUserTime(toUtc(userTime));

        if (timeline.getSunrise().isBefore(timeline.getMorningTwilight())) {
            log.trace("Sunrise before morning twilight, moving sunrise, sunset and night twilight to next day");
            shiftUserTimeIfBeforeNightTwilight(timeline);
            timeline.setSunrise(timeline.getSunrise().plusDays(1));
            timeline.setSunset(timeline.getSunset().plusDays(1));
            timeline.setNightTwilight(timeline.getNightTwilight().plusDays(1));
        }
        if (timeline.getSunset().isBefore(timeline.getSunrise())) {
            log.trace("Sunset before sunrise, moving sunset and night twilight to next day");
            shiftUserTimeIfBeforeNightTwilight(timeline);
            timeline.setSunset(timeline.getSunset().plusDays(1));
            timeline.setNightTwilight(timeline.getNightTwilight().plusDays(1));
        }
        if (timeline.getNightTwilight().isBefore(timeline.getSunset())) {
            log.trace("Night twilight before sunset, moving night twilight to next day");
            shiftUserTimeIfBeforeNightTwilight(timeline);
            timeline.setNightTwilight(timeline.getNightTwilight().plusDays(1));
        }
        return timeline;
    }

    private static void shiftUserTimeIfBeforeNightTwilight(SunTimeline timeline) {
        LocalTime nightTwilight = timeline.getNightTwilightTimeOfDay();
        if (timeline.getUserTime().toLocalTime().isBefore(nightTwilight)) {
            log.trace("User time {} before night twilight {}, moving it to next day", timeline.getUserTime(), nightTwilight);
            timeline.setUserTime(timeline.getUserTime().plusDays(1));
        }
    }

    private static ZonedDateTime combine(SunTimeline timeline, SunEvent event, LocalDate date) {
        return ZonedDateTime.of(date, Objects.requireNonNull(timeline.getTimeOfDay(event), event.getEventName()),
                ZoneOffset.UTC);
    }

    private static ZonedDateTime toUtc(ZonedDateTime dateTime) {
        return dateTime.withZoneSameInstant(ZoneOffset.UTC);
    }
}
