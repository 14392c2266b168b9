package at.sv.nighttime;

import at.sv.nighttime.api.SunTimesApi;
import at.sv.nighttime.temperature.TemperatureMapper;
import at.sv.nighttime.time.DateNormalizer;
import at.sv.nighttime.time.MiddayWindowCalculator;
import at.sv.nighttime.time.SunEvent;
import at.sv.nighttime.time.SunEventParser;
import at.sv.nighttime.time.SunTimeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.ZonedDateTime;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Computes the color temperature for a location: fetch the sun events, parse, normalize, set the midday window and
 * map the user time to a temperature. Every call builds its own {@link SunTimeline}.
 */
@Slf4j
@RequiredArgsConstructor
public final class TemperatureService {

    private final SunTimesApi sunTimesApi;
    private final MiddayWindowCalculator middayWindowCalculator;
    private final TemperatureMapper temperatureMapper;
    private final Supplier<ZonedDateTime> currentTime;
    /**
     * Returned for every valid request instead of running the pipeline. Null if disabled.
     */
    private final Integer mockTemperature;

    public int calculateTemperature(double latitude, double longitude) {
        return calculateTemperature(latitude, longitude, currentTime.get());
    }

    /**
     * @param userTime the moment to compute the temperature for; the sun events are anchored to its UTC date
     * @throws InvalidCoordinatesException if the latitude or longitude is out of range
     */
    public int calculateTemperature(double latitude, double longitude, ZonedDateTime userTime) {
        assertCoordinates(latitude, longitude);
        if (mockTemperature != null) {
            log.debug("Mock values enabled, returning {}K", mockTemperature);
            return mockTemperature;
        }
        MDC.put("context", latitude + "," + longitude);
        try {
            Map<SunEvent, String> rawEvents = sunTimesApi.getSunEvents(latitude, longitude);
            SunTimeline timeline = SunEventParser.parse(rawEvents);
            DateNormalizer.normalize(timeline, userTime);
            middayWindowCalculator.calculate(timeline);
            log.debug("Normalized {}", timeline);
            return temperatureMapper.getTemperature(timeline);
        } finally {
            MDC.remove("context");
        }
    }

    public static void assertCoordinates(double latitude, double longitude) {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new InvalidCoordinatesException("Latitude must be between -90 and 90 degrees, but was " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new InvalidCoordinatesException("Longitude must be between -180 and 180 degrees, but was " + longitude);
        }
    }
}
