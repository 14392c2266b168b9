package at.sv.nighttime.api;

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URL;

/**
 * Reads JSON documents from the sun times service. Error responses become {@link ApiFailure}s, while an unreachable
 * service, a timeout or an unexpected status code becomes a {@link SunTimesConnectionFailure}.
 */
@Slf4j
public class HttpResourceProviderImpl implements HttpResourceProvider {

    static final int MAX_BODY_LENGTH = 150;

    private final OkHttpClient httpClient;

    public HttpResourceProviderImpl(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String getResource(URL url) {
        log.trace("Get: {}", url);
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            log.debug("Sun times service answered {} in {} ms", response.code(),
                    response.receivedResponseAtMillis() - response.sentRequestAtMillis());
            String body = readBody(response);
            assertSuccessful(url, response.code(), body);
            return body;
        } catch (InterruptedIOException e) {
            log.warn("Sun times service timed out for '{}'", url);
            throw new SunTimesConnectionFailure("Sun times service timed out for '" + url + "'", e);
        } catch (IOException e) {
            log.error("Failed to reach sun times service at '{}': {}", url, e.getMessage());
            throw new SunTimesConnectionFailure("Failed to reach sun times service at '" + url + "'", e);
        }
    }

    private static void assertSuccessful(URL url, int code, String body) {
        if (code == 404) {
            throw new ResourceNotFoundException("Sun times service not found at '" + url + "': " + truncate(body));
        }
        if (code == 429) {
            throw new ApiFailure("Sun times service rate limit exceeded: " + truncate(body));
        }
        if (code >= 500) {
            throw new ApiFailure("Sun times service error " + code + ": " + truncate(body));
        }
        if (code < 200 || code >= 300) {
            throw new SunTimesConnectionFailure("Sun times service answered unexpected status " + code + " for '"
                                                + url + "': " + truncate(body));
        }
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            return "";
        }
        return body.string();
    }

    static String truncate(String body) {
        return body.length() > MAX_BODY_LENGTH ? body.substring(0, MAX_BODY_LENGTH) + "..." : body;
    }
}
