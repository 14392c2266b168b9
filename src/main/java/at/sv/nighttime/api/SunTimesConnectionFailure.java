package at.sv.nighttime.api;

/**
 * Exception to signal that the sun times service could not be reached.
 */
public final class SunTimesConnectionFailure extends RuntimeException {

    public SunTimesConnectionFailure(String message) {
        super(message);
    }

    public SunTimesConnectionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
