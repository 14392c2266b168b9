package at.sv.nighttime.http;

public record TemperatureResponse(int temperature) {
}
