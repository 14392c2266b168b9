package at.sv.nighttime.http;

public record ErrorResponse(String error) {
}
