package at.sv.nighttime.api;

import java.net.URL;

public interface HttpResourceProvider {
    /**
     * @return the requested resource as string. Not null.
     * @throws SunTimesConnectionFailure if an IOException occurred, or the response code was unexpected
     * @throws ResourceNotFoundException if the response code is 404
     * @throws ApiFailure                if the response code is 5xx or 429
     */
    String getResource(URL url);
}
