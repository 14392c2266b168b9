package at.sv.nighttime.temperature;

public final class IncompleteSunTimelineException extends RuntimeException {
    public IncompleteSunTimelineException(String message) {
        super(message);
    }
}
