package at.sv.nighttime;

public final class InvalidCoordinatesException extends IllegalArgumentException {
    public InvalidCoordinatesException(String message) {
        super(message);
    }
}
