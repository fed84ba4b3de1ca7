package me.internalizable.sessionhub.servermanager.probe;

import me.internalizable.sessionhub.servermanager.registry.ServerKind;
import me.internalizable.sessionhub.servermanager.registry.ServerUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Probes a server by fetching the static script its web client loads.
 *
 * <p>A local server serves {@code jsapi/dh-core.js}, a remote gateway serves
 * {@code irisapi/irisapi.nocache.js}. Status 200 or 204 means reachable; any
 * other status, a timeout or an I/O error means not reachable.</p>
 */
public class HttpReachabilityProbe implements ReachabilityProbe {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpReachabilityProbe.class);

    static final String LOCAL_PROBE_PATH = "jsapi/dh-core.js";
    static final String REMOTE_PROBE_PATH = "irisapi/irisapi.nocache.js";

    private final HttpClient httpClient;
    private final Duration timeout;

    /**
     * Create a probe with its own HTTP client.
     *
     * @param timeout per-request timeout
     */
    public HttpReachabilityProbe(@Nonnull Duration timeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), timeout);
    }

    /**
     * Create a probe.
     *
     * @param httpClient HTTP client to send probes with
     * @param timeout per-request timeout
     */
    public HttpReachabilityProbe(@Nonnull HttpClient httpClient, @Nonnull Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    @Nonnull
    public CompletableFuture<Boolean> isReachable(@Nonnull URI serverUrl, @Nonnull ServerKind kind) {
        Objects.requireNonNull(serverUrl, "serverUrl");
        Objects.requireNonNull(kind, "kind");

        URI target = ServerUrls.resolve(serverUrl,
                kind == ServerKind.LOCAL ? LOCAL_PROBE_PATH : REMOTE_PROBE_PATH);

        HttpRequest request = HttpRequest.newBuilder(target)
                .timeout(timeout)
                .GET()
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    int status = response.statusCode();
                    LOGGER.debug("Probe {} returned {}", target, status);
                    return status == 200 || status == 204;
                })
                .exceptionally(e -> {
                    LOGGER.debug("Probe {} failed: {}", target, e.toString());
                    return false;
                });
    }
}
