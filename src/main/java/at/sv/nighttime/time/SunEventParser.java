package at.sv.nighttime.time;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the raw sun event strings into a {@link SunTimeline} holding time-of-day values only.
 */
public final class SunEventParser {

    private static final DateTimeFormatter TWELVE_HOUR_FORMATTER = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("h:mm:ss a")
            .toFormatter(Locale.ENGLISH);

    private static final List<DateTimeFormatter> FORMATTERS = List.of(TWELVE_HOUR_FORMATTER,
            DateTimeFormatter.ISO_LOCAL_TIME);

    private SunEventParser() {
    }

    /**
     * @param rawEvents the time strings of all four {@link SunEvent}s, either in the twelve-hour format of the sun
     *                  times service (e.g. {@code 6:00:00 AM}) or as {@link DateTimeFormatter#ISO_LOCAL_TIME}
     * @return a new timeline with the time-of-day fields set, all timestamps still unset
     * @throws SunEventParseException if an event is missing or its value is no valid time of day
     */
    public static SunTimeline parse(Map<SunEvent, String> rawEvents) {
        return SunTimeline.ofTimesOfDay(
                parseEvent(rawEvents, SunEvent.SUNRISE),
                parseEvent(rawEvents, SunEvent.SUNSET),
                parseEvent(rawEvents, SunEvent.MORNING_TWILIGHT),
                parseEvent(rawEvents, SunEvent.NIGHT_TWILIGHT));
    }

    private static LocalTime parseEvent(Map<SunEvent, String> rawEvents, SunEvent event) {
        String value = rawEvents.get(event);
        if (value == null || value.isBlank()) {
            throw new SunEventParseException("Missing time for sun event '" + event + "'");
        }
        return parseTimeOfDay(event, value.trim());
    }

    private static LocalTime parseTimeOfDay(SunEvent event, String value) {
        DateTimeParseException lastException = null;
        for (DateTimeFormatter formatter : FORMATTERS) {
            try {
                return LocalTime.parse(value, formatter);
            } catch (DateTimeParseException e) {
                lastException = e;
            }
        }
        throw new SunEventParseException("Invalid time '" + value + "' for sun event '" + event + "'", lastException);
    }
}
