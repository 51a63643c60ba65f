package cz.vut.fit.urlradar.engine.reachability;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.engine.Futures;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.evidence.DnsResolver;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Probes the target with the DNS, TCP and HTTP stages in sequence, each with its own timeout, and
 * classifies the observation with a {@link ReachabilityClassifier}. Redirects are followed manually up to
 * the configured limit, all of them within the one HTTP timeout, and the body read is capped.
 * <p>
 * The probes run on the executor passed in. DNS lookups run on a separate pool owned by the prober, so
 * a probe waiting for its lookup never waits for a thread of its own executor.
 *
 * @author URLRadar developers
 */
public class ReachabilityProber implements AutoCloseable {
    public static final String COMPONENT_NAME = "reachability";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(ReachabilityProber.class);

    protected static final String USER_AGENT =
            "Mozilla/5.0 (X11; Linux x86_64; rv:131.0) Gecko/20100101 Firefox/131.0";

    private final DnsResolver _resolver;
    private final ExecutorService _executor;
    private final ExecutorService _lookupExecutor;
    private HttpClient _httpClient;

    public ReachabilityProber(@NotNull DnsResolver resolver, @NotNull ExecutorService executor) {
        _resolver = resolver;
        _executor = executor;

        final var threadCounter = new AtomicInteger();
        _lookupExecutor = Executors.newCachedThreadPool(runnable -> {
            final var thread = new Thread(runnable, "probe-lookup-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    protected HttpClient buildHttpClient(@NotNull ConfigSnapshot config) {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(config.httpTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    protected Socket buildSocket() {
        return new Socket();
    }

    /**
     * Probes the URL on the executor. Cancelling the returned future interrupts the probe.
     */
    public @NotNull CompletableFuture<ReachabilityResult> probeAsync(@NotNull String url,
                                                                    @NotNull ConfigSnapshot config) {
        return Futures.submit(_executor, () -> probe(url, config));
    }

    /**
     * Probes the URL. Never throws for an unreachable target; failures are reported as OFFLINE results.
     *
     * @param url    The canonical URL.
     * @param config The configuration snapshot.
     * @return The reachability result.
     */
    public @NotNull ReachabilityResult probe(@NotNull String url, @NotNull ConfigSnapshot config) {
        final long start = System.nanoTime();
        final var classifier = ReachabilityClassifier.fromConfig(config);
        final var uri = URI.create(url);
        final var host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);

        final var observation = observe(uri, host, classifier, config);
        final var result = classifier.classify(observation, elapsedMs(start));
        Logger.debug("{} is {} (stage {}, ip {}, status {}, signals {})", url, result.status(),
                observation.stage(), result.resolvedIp(), result.httpStatus(), result.signals());
        return result;
    }

    private ProbeObservation observe(URI uri, String host, ReachabilityClassifier classifier,
                                     ConfigSnapshot config) {
        // DNS
        Logger.trace("[{}] Resolving", host);
        final List<String> addresses;
        final var lookup = Futures.submit(_lookupExecutor, () -> _resolver.resolveAddresses(host));
        try {
            addresses = lookup.get(config.dnsTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            lookup.cancel(true);
            return ProbeObservation.dnsFailure(host, "DNS timeout (%d ms)".formatted(config.dnsTimeout().toMillis()));
        } catch (ExecutionException e) {
            return ProbeObservation.dnsFailure(host, Futures.describe(e));
        } catch (InterruptedException e) {
            lookup.cancel(true);
            Thread.currentThread().interrupt();
            return ProbeObservation.dnsFailure(host, "Interrupted");
        }

        if (addresses.isEmpty())
            return ProbeObservation.dnsFailure(host, "No addresses");

        var observation = ProbeObservation.resolved(host, addresses);
        if (!classifier.addressSinkholeSignals(observation).isEmpty())
            return observation;

        // TCP
        final int port = uri.getPort() != -1 ? uri.getPort() : ("http".equalsIgnoreCase(uri.getScheme()) ? 80 : 443);
        final var tcpError = connect(observation.firstAddress(), port, config.tcpTimeout());
        if (tcpError != null)
            return observation.tcpFailure(tcpError);

        // HTTP
        return fetch(observation, uri, config);
    }

    private String connect(String address, int port, Duration timeout) {
        Logger.trace("Connecting to {}:{}", address, port);
        try (var socket = buildSocket()) {
            socket.connect(new InetSocketAddress(address, port), (int) timeout.toMillis());
            return null;
        } catch (SocketTimeoutException e) {
            return "Connection timed out (%d ms)".formatted(timeout.toMillis());
        } catch (IOException | IllegalArgumentException e) {
            return "Connection failed: " + e.getMessage();
        }
    }

    private ProbeObservation fetch(ProbeObservation observation, URI start, ConfigSnapshot config) {
        final var client = httpClient(config);
        final var timeoutReason = "HTTP timeout (%d ms)".formatted(config.httpTimeout().toMillis());
        final long deadline = System.nanoTime() + config.httpTimeout().toNanos();
        final var chain = new ArrayList<String>();
        var location = start;
        for (int counter = 0; ; counter++) {
            chain.add(location.toString());

            // Every hop gets only what is left of the stage timeout
            final long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0)
                return observation.httpFailure(timeoutReason, chain);

            final var request = HttpRequest.newBuilder(location)
                    .timeout(Duration.ofMillis(remainingMs))
                    .header("User-Agent", USER_AGENT)
                    .header("Accept", "text/html, application/xhtml+xml, */*")
                    .GET()
                    .build();

            final var pending = client.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream());
            final HttpResponse<InputStream> response;
            try {
                response = pending.get(remainingMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                pending.cancel(true);
                return observation.httpFailure(timeoutReason, chain);
            } catch (ExecutionException e) {
                return observation.httpFailure(describeHttpError(Futures.unwrap(e), timeoutReason), chain);
            } catch (InterruptedException e) {
                pending.cancel(true);
                Thread.currentThread().interrupt();
                return observation.httpFailure("Interrupted", chain);
            }

            final int status = response.statusCode();
            final var redirect = status >= 300 && status < 400
                    ? response.headers().firstValue("Location").orElse(null) : null;

            if (redirect != null && counter < config.maxRedirects()) {
                closeQuietly(response.body(), location);
                try {
                    location = location.resolve(new URI(redirect.trim()));
                } catch (URISyntaxException | IllegalArgumentException e) {
                    return observation.httpFailure("Invalid redirect location: " + redirect, chain);
                }
                Logger.trace("Redirecting to {}", location);
                continue;
            }

            final String body;
            try {
                body = readBody(response.body(), config.maxBodyBytes());
            } catch (IOException e) {
                return observation.httpFailure("Cannot read body: " + e.getMessage(), chain);
            }
            return observation.httpResponse(status, headersOf(response), body, chain, location.toString());
        }
    }

    /**
     * Stops the DNS lookup pool. The probe executor belongs to the caller and is left running.
     */
    @Override
    public void close() {
        _lookupExecutor.shutdownNow();
    }

    private synchronized HttpClient httpClient(ConfigSnapshot config) {
        if (_httpClient == null)
            _httpClient = this.buildHttpClient(config);
        return _httpClient;
    }

    private static String describeHttpError(Throwable cause, String timeoutReason) {
        if (cause instanceof HttpConnectTimeoutException)
            return "HTTP connect timeout";
        if (cause instanceof HttpTimeoutException)
            return timeoutReason;
        return "HTTP error: " + (cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
    }

    static String readBody(InputStream stream, int maxBytes) throws IOException {
        if (stream == null)
            return "";
        try (stream) {
            return new String(stream.readNBytes(maxBytes), StandardCharsets.UTF_8);
        }
    }

    private static void closeQuietly(InputStream stream, URI location) {
        if (stream == null)
            return;
        try {
            stream.close();
        } catch (IOException e) {
            Logger.trace("Cannot close the body of {}: {}", location, e.getMessage());
        }
    }

    static Map<String, String> headersOf(HttpResponse<?> response) {
        final var result = new HashMap<String, String>();
        if (response.headers() == null)
            return result;
        for (var entry : response.headers().map().entrySet()) {
            result.put(entry.getKey().toLowerCase(Locale.ROOT), String.join(", ", entry.getValue()));
        }
        return result;
    }

    private static long elapsedMs(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }
}
