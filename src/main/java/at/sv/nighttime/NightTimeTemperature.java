package at.sv.nighttime;

import at.sv.nighttime.api.HttpResourceProviderImpl;
import at.sv.nighttime.api.SunTimesApi;
import at.sv.nighttime.api.SunTimesApiImpl;
import at.sv.nighttime.http.ErrorResponse;
import at.sv.nighttime.http.TemperatureResponse;
import at.sv.nighttime.http.TemperatureServer;
import at.sv.nighttime.temperature.TemperatureMapper;
import at.sv.nighttime.time.MiddayWindowCalculator;
import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

@Command(name = "NightTimeTemperature", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Serves the display color temperature for a location, based on the current position of the sun.")
public final class NightTimeTemperature implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(NightTimeTemperature.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--port", paramLabel = "<port>",
            defaultValue = "${env:PORT:-8080}",
            description = "The port to serve GET /night-time-temperature on. Default: ${DEFAULT-VALUE}")
    int port;
    @Option(names = "--api-base-url", paramLabel = "<url>",
            defaultValue = "${env:SUNRISE_SUNSET_API_BASE_URL:-" + SunTimesApiImpl.DEFAULT_BASE_URL + "}",
            description = "The base url of the sunrise-sunset.org compatible sun times service. Default: ${DEFAULT-VALUE}")
    String apiBaseUrl;
    @Option(names = "--lo-temp", paramLabel = "<kelvin>",
            defaultValue = "${env:LO_TEMP:-2700}",
            description = "The temperature at night. Default: ${DEFAULT-VALUE}")
    int loTemp;
    @Option(names = "--hi-temp", paramLabel = "<kelvin>",
            defaultValue = "${env:HI_TEMP:-6000}",
            description = "The temperature during the day. Default: ${DEFAULT-VALUE}")
    int hiTemp;
    @Option(names = "--midday-half-width", paramLabel = "<minutes>", required = true,
            defaultValue = "${env:MIDDAY_HALF_WIDTH}",
            description = "Half the width of the midday window around solar noon, in minutes.")
    int middayHalfWidthInMinutes;
    @Option(names = "--request-timeout", paramLabel = "<seconds>",
            defaultValue = "${env:REQUEST_TIMEOUT:-20}",
            description = "The timeout for calls to the sun times service. Default: ${DEFAULT-VALUE} seconds.")
    int requestTimeoutInSeconds;
    @Option(names = "--profile", paramLabel = "<profile>",
            defaultValue = "${env:PROFILE:-pr}",
            description = "'pr' for production, or 'dev' to skip the calculation and always return the mock " +
                          "temperature, with debug logging. Default: ${DEFAULT-VALUE}")
    String profile;
    @Option(names = "--mock-temperature", paramLabel = "<kelvin>",
            defaultValue = "${env:MOCK_TEMPERATURE:-4500}",
            description = "The temperature returned by the 'dev' profile. Default: ${DEFAULT-VALUE}")
    int mockTemperature;
    @Option(names = "--lat",
            description = "Optional latitude [-90..90]. Together with --long, prints the temperature once instead of serving.")
    Double latitude;
    @Option(names = "--long",
            description = "Optional longitude [-180..180]. Together with --lat, prints the temperature once instead of serving.")
    Double longitude;

    private final Supplier<ZonedDateTime> currentTime;

    public NightTimeTemperature() {
        this(() -> ZonedDateTime.now(ZoneOffset.UTC));
    }

    NightTimeTemperature(Supplier<ZonedDateTime> currentTime) {
        this.currentTime = currentTime;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new NightTimeTemperature()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public Integer call() {
        assertConfigurationParameters();
        configureLogging();
        TemperatureService temperatureService = createTemperatureService();
        if (latitude != null && longitude != null) {
            return printTemperature(temperatureService);
        }
        startServer(temperatureService);
        return 0;
    }

    private void assertConfigurationParameters() {
        if (loTemp >= hiTemp) {
            fail("--lo-temp must be below --hi-temp");
        }
        if (port < 0 || port > 65535) {
            fail("--port must be within [0,65535]");
        }
        if (middayHalfWidthInMinutes < 0) {
            fail("--midday-half-width must be >= 0");
        }
        if (requestTimeoutInSeconds <= 0) {
            fail("--request-timeout must be > 0");
        }
        if (!isDevProfile() && !"pr".equalsIgnoreCase(profile)) {
            fail("--profile must be either 'pr' or 'dev'");
        }
        if ((latitude == null) != (longitude == null)) {
            fail("--lat and --long must be given together");
        }
    }

    private boolean isDevProfile() {
        return "dev".equalsIgnoreCase(profile);
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    private void configureLogging() {
        if (isDevProfile()) {
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }
    }

    private TemperatureService createTemperatureService() {
        return new TemperatureService(createSunTimesApi(),
                new MiddayWindowCalculator(Duration.ofMinutes(middayHalfWidthInMinutes)),
                new TemperatureMapper(loTemp, hiTemp), currentTime,
                isDevProfile() ? mockTemperature : null);
    }

    private SunTimesApi createSunTimesApi() {
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(requestTimeoutInSeconds))
                .build();
        try {
            return new SunTimesApiImpl(new HttpResourceProviderImpl(httpClient), apiBaseUrl);
        } catch (IllegalArgumentException e) {
            fail("--api-base-url is invalid: " + e.getMessage());
            return null;
        }
    }

    private int printTemperature(TemperatureService temperatureService) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            int temperature = temperatureService.calculateTemperature(latitude, longitude);
            LOG.info("Temperature for {},{}: {}K", latitude, longitude, temperature);
            spec.commandLine().getOut().println(mapper.writeValueAsString(new TemperatureResponse(temperature)));
            return 0;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        } catch (RuntimeException e) {
            LOG.warn("Failed to calculate temperature for {},{}: {}", latitude, longitude, e.getMessage());
            spec.commandLine().getErr().println(toErrorJson(mapper, e));
            return 1;
        }
    }

    private static String toErrorJson(ObjectMapper mapper, RuntimeException e) {
        try {
            return mapper.writeValueAsString(new ErrorResponse(e.getMessage()));
        } catch (JsonProcessingException jsonProcessingException) {
            throw new IllegalStateException(jsonProcessingException);
        }
    }

    private void startServer(TemperatureService temperatureService) {
        TemperatureServer server = new TemperatureServer(temperatureService, port);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "shutdown"));
        server.start();
        LOG.info("Profile '{}', temperatures {}K - {}K, midday half-width {} min",
                profile.toLowerCase(Locale.ENGLISH), loTemp, hiTemp, middayHalfWidthInMinutes);
    }
}
