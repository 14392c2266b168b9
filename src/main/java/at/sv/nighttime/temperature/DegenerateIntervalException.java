package at.sv.nighttime.temperature;

/**
 * Thrown if a twilight interval has no positive length, which leaves the proportion within it undefined.
 */
public final class DegenerateIntervalException extends RuntimeException {
    public DegenerateIntervalException(String message) {
        super(message);
    }
}
