package at.sv.nighttime.time;

/**
 * Thrown if a sun event is missing or its time string could not be parsed.
 */
public final class SunEventParseException extends RuntimeException {
    public SunEventParseException(String message) {
        super(message);
    }

    public SunEventParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
