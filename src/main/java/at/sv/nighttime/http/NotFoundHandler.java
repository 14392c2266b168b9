package at.sv.nighttime.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import java.io.IOException;

final class NotFoundHandler implements HttpHandler {

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            JsonResponseWriter.write(exchange, 404, new ErrorResponse("Not found: " + exchange.getRequestURI().getPath()));
        } finally {
            exchange.close();
        }
    }
}
