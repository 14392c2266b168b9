package at.sv.nighttime.http;

import at.sv.nighttime.InvalidCoordinatesException;
import at.sv.nighttime.TemperatureService;
import at.sv.nighttime.api.ApiFailure;
import at.sv.nighttime.api.SunTimesConnectionFailure;
import at.sv.nighttime.temperature.DegenerateIntervalException;
import at.sv.nighttime.temperature.IncompleteSunTimelineException;
import at.sv.nighttime.time.SunEventParseException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * {@code GET /night-time-temperature?lat=<lat>&lng=<lng>}, answering {@code {"temperature": <int>}}, or
 * {@code {"error": "<message>"}} with a non-success status.
 */
@Slf4j
@RequiredArgsConstructor
final class TemperatureHandler implements HttpHandler {

    private final TemperatureService temperatureService;

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            if (!TemperatureServer.TEMPERATURE_PATH.equals(exchange.getRequestURI().getPath())) {
                JsonResponseWriter.write(exchange, 404, new ErrorResponse("Not found: " + exchange.getRequestURI().getPath()));
                return;
            }
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "GET");
                JsonResponseWriter.write(exchange, 405, new ErrorResponse("Method not allowed: " + exchange.getRequestMethod()));
                return;
            }
            handleGet(exchange);
        } finally {
            exchange.close();
        }
    }

    private void handleGet(HttpExchange exchange) throws IOException {
        int temperature;
        try {
            Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
            double latitude = getCoordinate(query, "lat");
            double longitude = getCoordinate(query, "lng");
            temperature = temperatureService.calculateTemperature(latitude, longitude);
        } catch (RuntimeException e) {
            int status = getStatus(e);
            if (isUnexpected(e)) {
                log.error("Unexpected error for '{}'", exchange.getRequestURI(), e);
            } else {
                log.warn("Request '{}' failed with {}: {}", exchange.getRequestURI(), status, e.getMessage());
            }
            JsonResponseWriter.write(exchange, status, new ErrorResponse(e.getMessage()));
            return;
        }
        JsonResponseWriter.write(exchange, 200, new TemperatureResponse(temperature));
    }

    static int getStatus(RuntimeException e) {
        if (e instanceof InvalidCoordinatesException) {
            return 400;
        }
        if (e instanceof SunTimesConnectionFailure) {
            return 503;
        }
        if (e instanceof ApiFailure || e instanceof SunEventParseException) {
            return 502;
        }
        return 500;
    }

    private static boolean isUnexpected(RuntimeException e) {
        return getStatus(e) == 500 && !(e instanceof IncompleteSunTimelineException)
               && !(e instanceof DegenerateIntervalException);
    }

    private static double getCoordinate(Map<String, String> query, String name) {
        String value = query.get(name);
        if (value == null || value.isBlank()) {
            throw new InvalidCoordinatesException("Query parameter '" + name + "' is required");
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidCoordinatesException("Query parameter '" + name + "' must be a number, but was '" + value + "'");
        }
    }

    private static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> query = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return query;
        }
        for (String pair : rawQuery.split("&")) {
            int separator = pair.indexOf('=');
            String key = separator < 0 ? pair : pair.substring(0, separator);
            String value = separator < 0 ? "" : pair.substring(separator + 1);
            query.putIfAbsent(decode(key), decode(value));
        }
        return query;
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
