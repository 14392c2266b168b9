package at.sv.nighttime.http;

import at.sv.nighttime.TemperatureService;
import com.sun.net.httpserver.HttpServer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
public final class TemperatureServer {

    public static final String TEMPERATURE_PATH = "/night-time-temperature";

    private final HttpServer server;
    private final ExecutorService executor;

    /**
     * @param port the port to listen on, 0 for an ephemeral port
     */
    public TemperatureServer(TemperatureService temperatureService, int port) {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind port " + port, e);
        }
        executor = Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors()));
        server.setExecutor(executor);
        server.createContext(TEMPERATURE_PATH, new TemperatureHandler(temperatureService));
        server.createContext("/", new NotFoundHandler());
    }

    public void start() {
        server.start();
        log.info("Listening on port {}: GET {}?lat=<lat>&lng=<lng>", getPort(), TEMPERATURE_PATH);
    }

    public void stop() {
        server.stop(0);
        executor.shutdown();
        log.info("Server stopped.");
    }

    public int getPort() {
        return server.getAddress().getPort();
    }
}
