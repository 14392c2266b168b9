package at.sv.nighttime;

import at.sv.nighttime.api.ApiFailure;
import at.sv.nighttime.api.InvalidSunTimesResponse;
import at.sv.nighttime.api.SunTimesApi;
import at.sv.nighttime.temperature.TemperatureMapper;
import at.sv.nighttime.time.MiddayWindowCalculator;
import at.sv.nighttime.time.SunEvent;
import at.sv.nighttime.time.SunEventParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TemperatureServiceTest {

    private static final double LAT = 48.2;
    private static final double LNG = 16.39;

    @Mock
    private SunTimesApi sunTimesApi;

    private ZonedDateTime now;
    private Map<SunEvent, String> events;
    private TemperatureService service;

    private ZonedDateTime today(int hour, int minute) {
        return now.withHour(hour).withMinute(minute);
    }

    private TemperatureService createService(Integer mockTemperature) {
        return new TemperatureService(sunTimesApi, new MiddayWindowCalculator(Duration.ofMinutes(90)),
                new TemperatureMapper(3000, 6500), () -> now, mockTemperature);
    }

    private void setEvents(String sunrise, String sunset, String morningTwilight, String nightTwilight) {
        events.put(SunEvent.SUNRISE, sunrise);
        events.put(SunEvent.SUNSET, sunset);
        events.put(SunEvent.MORNING_TWILIGHT, morningTwilight);
        events.put(SunEvent.NIGHT_TWILIGHT, nightTwilight);
    }

    private int calculateAt(int hour, int minute) {
        now = today(hour, minute);
        return service.calculateTemperature(LAT, LNG);
    }

    @BeforeEach
    void setUp() {
        now = ZonedDateTime.of(2024, 6, 1, 12, 0, 0, 0, ZoneOffset.UTC);
        events = new EnumMap<>(SunEvent.class);
        setEvents("6:00:00 AM", "6:00:00 PM", "5:30:00 AM", "6:30:00 PM");
        service = createService(null);
    }

    @Test
    void calculateTemperature_fetchesForCoordinates_mapsCurrentTime() {
        when(sunTimesApi.getSunEvents(LAT, LNG)).thenReturn(events);

        assertThat(calculateAt(12, 0)).isEqualTo(6500);
        assertThat(calculateAt(5, 45)).isEqualTo(4750);
        assertThat(calculateAt(18, 15)).isEqualTo(4750);
        assertThat(calculateAt(23, 0)).isEqualTo(3000);
    }

    @Test
    void calculateTemperature_explicitUserTime_currentTimeIgnored() {
        when(sunTimesApi.getSunEvents(LAT, LNG)).thenReturn(events);

        int temperature = service.calculateTemperature(LAT, LNG, today(5, 30));

        assertThat(temperature).isEqualTo(3000);
    }

    @Test
    void calculateTemperature_rolloverTimeline_twilightAcrossMidnight() {
        setEvents("12:10:00 AM", "11:00:00 AM", "11:50:00 PM", "11:30:00 AM");
        when(sunTimesApi.getSunEvents(LAT, LNG)).thenReturn(events);

        assertThat(calculateAt(23, 50)).isEqualTo(3000);
        assertThat(calculateAt(23, 55)).isEqualTo(3875);
        assertThat(calculateAt(0, 0)).isEqualTo(4750);
        assertThat(calculateAt(0, 5)).isEqualTo(5625);
        assertThat(calculateAt(0, 10)).isEqualTo(6500);
        assertThat(calculateAt(5, 0)).isEqualTo(6500);
        assertThat(calculateAt(11, 15)).isEqualTo(4750);
        assertThat(calculateAt(12, 0)).isEqualTo(3000);
    }

    @Test
    void calculateTemperature_eastOfUtc_daylightAcrossUtcMidnight() {
        // Tokyo in June, sunrise and sunset in UTC
        setEvents("7:25:00 PM", "10:00:00 AM", "7:00:00 PM", "10:30:00 AM");
        when(sunTimesApi.getSunEvents(LAT, LNG)).thenReturn(events);

        assertThat(calculateAt(3, 0)).isEqualTo(6500); // noon local time
        assertThat(calculateAt(10, 15)).isEqualTo(4750);
        assertThat(calculateAt(12, 0)).isEqualTo(3000);
        assertThat(calculateAt(19, 10)).isEqualTo(4400);
        assertThat(calculateAt(22, 0)).isEqualTo(6500);
    }

    @Test
    void calculateTemperature_westOfUtc_daylightAcrossUtcMidnight() {
        // Los Angeles in June, sunrise and sunset in UTC
        setEvents("12:45:00 PM", "3:05:00 AM", "12:15:00 PM", "3:35:00 AM");
        when(sunTimesApi.getSunEvents(LAT, LNG)).thenReturn(events);

        assertThat(calculateAt(0, 30)).isEqualTo(6500); // evening local time
        assertThat(calculateAt(3, 20)).isEqualTo(4750);
        assertThat(calculateAt(4, 0)).isEqualTo(3000);
        assertThat(calculateAt(20, 0)).isEqualTo(6500);
    }

    @Test
    void calculateTemperature_eachCallFetchesAgain() {
        when(sunTimesApi.getSunEvents(anyDouble(), anyDouble())).thenReturn(events);

        service.calculateTemperature(LAT, LNG);
        service.calculateTemperature(1.0, 2.0);

        verify(sunTimesApi).getSunEvents(LAT, LNG);
        verify(sunTimesApi).getSunEvents(1.0, 2.0);
    }

    @Test
    void calculateTemperature_mockValues_skipsPipeline() {
        service = createService(4200);

        assertThat(service.calculateTemperature(LAT, LNG)).isEqualTo(4200);
        verifyNoInteractions(sunTimesApi);
    }

    @Test
    void calculateTemperature_mockValues_stillValidatesCoordinates() {
        service = createService(4200);

        assertThatThrownBy(() -> service.calculateTemperature(91, 0)).isInstanceOf(InvalidCoordinatesException.class);
    }

    @Test
    void calculateTemperature_invalidLatitude_exception_noFetch() {
        assertThatThrownBy(() -> service.calculateTemperature(-90.5, LNG))
                .isInstanceOf(InvalidCoordinatesException.class)
                .hasMessageContaining("Latitude must be between -90 and 90 degrees");
        assertThatThrownBy(() -> service.calculateTemperature(Double.NaN, LNG))
                .isInstanceOf(InvalidCoordinatesException.class);
        verifyNoInteractions(sunTimesApi);
    }

    @Test
    void calculateTemperature_invalidLongitude_exception() {
        assertThatThrownBy(() -> service.calculateTemperature(LAT, 180.01))
                .isInstanceOf(InvalidCoordinatesException.class)
                .hasMessageContaining("Longitude must be between -180 and 180 degrees");
    }

    @Test
    void calculateTemperature_boundaryCoordinates_valid() {
        when(sunTimesApi.getSunEvents(anyDouble(), anyDouble())).thenReturn(events);

        assertThat(service.calculateTemperature(90, 180)).isEqualTo(6500);
        assertThat(service.calculateTemperature(-90, -180)).isEqualTo(6500);
    }

    @Test
    void calculateTemperature_unparsableEvent_parseException() {
        events.put(SunEvent.SUNSET, "sometime");
        when(sunTimesApi.getSunEvents(LAT, LNG)).thenReturn(events);

        assertThatThrownBy(() -> service.calculateTemperature(LAT, LNG)).isInstanceOf(SunEventParseException.class);
    }

    @Test
    void calculateTemperature_fetchFails_propagated() {
        when(sunTimesApi.getSunEvents(LAT, LNG)).thenThrow(new InvalidSunTimesResponse("status 'INVALID_REQUEST'"));

        assertThatThrownBy(() -> service.calculateTemperature(LAT, LNG))
                .isInstanceOf(ApiFailure.class)
                .hasMessage("status 'INVALID_REQUEST'");
    }

    @Test
    void calculateTemperature_zeroLengthTwilights_noTransition() {
        setEvents("6:00:00 AM", "6:00:00 PM", "6:00:00 AM", "6:00:00 PM");
        when(sunTimesApi.getSunEvents(LAT, LNG)).thenReturn(events);

        assertThat(calculateAt(6, 0)).isEqualTo(6500);
        assertThat(calculateAt(18, 0)).isEqualTo(3000);
    }
}
