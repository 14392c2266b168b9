package at.sv.nighttime.api;

import at.sv.nighttime.time.SunEvent;

import java.util.Map;

/**
 * Looks up the raw sun event times for a location.
 */
public interface SunTimesApi {
    /**
     * @param latitude  in degrees [-90..90]
     * @param longitude in degrees [-180..180]
     * @return the unparsed UTC time strings of all four {@link SunEvent}s. Not null.
     * @throws InvalidSunTimesResponse   if the service did not answer with status "OK" or an event is missing
     * @throws ApiFailure                if the service failed, or its response was no valid JSON
     * @throws SunTimesConnectionFailure if the service could not be reached
     */
    Map<SunEvent, String> getSunEvents(double latitude, double longitude);
}
