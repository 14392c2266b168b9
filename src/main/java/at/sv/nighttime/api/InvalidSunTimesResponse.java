package at.sv.nighttime.api;

/**
 * The sun times service answered, but not with status "OK", or without one of the required sun events.
 */
public final class InvalidSunTimesResponse extends ApiFailure {
    public InvalidSunTimesResponse(String message) {
        super(message);
    }
}
