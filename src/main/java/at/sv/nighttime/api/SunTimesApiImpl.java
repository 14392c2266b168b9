package at.sv.nighttime.api;

import at.sv.nighttime.time.SunEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.net.URL;
import java.util.EnumMap;
import java.util.Map;

/**
 * Client for the <a href="https://sunrise-sunset.org/api">sunrise-sunset.org</a> API. Times are returned in UTC.
 */
@Slf4j
public final class SunTimesApiImpl implements SunTimesApi {

    public static final String DEFAULT_BASE_URL = "https://api.sunrise-sunset.org/json";

    private final HttpResourceProvider httpResourceProvider;
    private final HttpUrl baseUrl;
    private final ObjectMapper mapper;

    /**
     * @throws IllegalArgumentException if the base url is no valid http or https url
     */
    public SunTimesApiImpl(HttpResourceProvider httpResourceProvider, String baseUrl) {
        this.httpResourceProvider = httpResourceProvider;
        this.baseUrl = HttpUrl.get(baseUrl);
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT);
    }

    @Override
    public Map<SunEvent, String> getSunEvents(double latitude, double longitude) {
        String response = httpResourceProvider.getResource(createUrl(latitude, longitude));
        SunTimesResponse sunTimesResponse = parse(response);
        if (!sunTimesResponse.isOk()) {
            throw new InvalidSunTimesResponse("Sun times service returned status '" + sunTimesResponse.getStatus() + "'");
        }
        SunTimesResults results = sunTimesResponse.getResults();
        if (results == null) {
            throw new InvalidSunTimesResponse("Invalid sun times response: 'results' missing");
        }
        Map<SunEvent, String> events = new EnumMap<>(SunEvent.class);
        events.put(SunEvent.SUNRISE, require(results.getSunrise(), "sunrise"));
        events.put(SunEvent.SUNSET, require(results.getSunset(), "sunset"));
        events.put(SunEvent.MORNING_TWILIGHT, require(results.getCivil_twilight_begin(), "civil_twilight_begin"));
        events.put(SunEvent.NIGHT_TWILIGHT, require(results.getCivil_twilight_end(), "civil_twilight_end"));
        log.trace("Sun events for {},{}: {}", latitude, longitude, events);
        return events;
    }

    private URL createUrl(double latitude, double longitude) {
        return baseUrl.newBuilder()
                      .addQueryParameter("lat", String.valueOf(latitude))
                      .addQueryParameter("lng", String.valueOf(longitude))
                      .build()
                      .url();
    }

    private SunTimesResponse parse(String response) {
        try {
            SunTimesResponse sunTimesResponse = mapper.readValue(response, SunTimesResponse.class);
            if (sunTimesResponse == null) {
                throw new InvalidSunTimesResponse("Empty sun times response");
            }
            return sunTimesResponse;
        } catch (JsonProcessingException e) {
            throw new ApiFailure("Failed to parse sun times response '" + response + "': " + e.getLocalizedMessage(), e);
        }
    }

    private static String require(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new InvalidSunTimesResponse("Invalid sun times response: '" + key + "' missing");
        }
        return value;
    }
}
