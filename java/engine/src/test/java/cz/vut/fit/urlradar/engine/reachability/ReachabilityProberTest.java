package cz.vut.fit.urlradar.engine.reachability;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.engine.Fixtures;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.evidence.DnsResolver;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.reachability.ProbeStage;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ReachabilityProberTest {
    private static final int POOL_SIZE = 4;
    private static final String LOOPBACK = "127.0.0.1";

    private ExecutorService executor;
    private DnsResolver resolver;
    private HttpClient httpClient;
    private boolean refuseConnections;
    private HttpServer server;
    private ExecutorService serverExecutor;

    @BeforeEach
    void setUp() throws Exception {
        executor = Executors.newFixedThreadPool(POOL_SIZE);
        resolver = mock(DnsResolver.class);
        httpClient = mock(HttpClient.class);
        when(resolver.resolveAddresses("example.com")).thenReturn(List.of("93.184.216.34"));
        when(resolver.resolveAddresses(LOOPBACK)).thenReturn(List.of(LOOPBACK));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        if (server != null) {
            server.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    /**
     * Starts a local HTTP server and returns its base URL.
     */
    private String startServer(HttpHandler handler) throws IOException {
        serverExecutor = Executors.newCachedThreadPool();
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.setExecutor(serverExecutor);
        server.createContext("/", handler);
        server.start();
        return "http://" + LOOPBACK + ":" + server.getAddress().getPort() + "/";
    }

    private static void reply(HttpExchange exchange, int status, String location, String body) throws IOException {
        var bytes = body.getBytes(StandardCharsets.UTF_8);
        if (location != null)
            exchange.getResponseHeaders().add("Location", location);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (var out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    private static ConfigSnapshot loopbackConfig(String... keyValues) {
        var pairs = new ArrayList<>(List.of("reachability.sinkhole.ips", "0.0.0.0"));
        pairs.addAll(List.of(keyValues));
        return Fixtures.config(pairs.toArray(new String[0]));
    }

    private ReachabilityProber prober() {
        return new ReachabilityProber(resolver, executor) {
            @Override
            protected HttpClient buildHttpClient(ConfigSnapshot config) {
                return httpClient;
            }

            @Override
            protected Socket buildSocket() {
                return new Socket() {
                    @Override
                    public void connect(SocketAddress endpoint, int timeout) throws IOException {
                        if (refuseConnections)
                            throw new ConnectException("Connection refused");
                    }
                };
            }
        };
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<InputStream> response(int status, Map<String, List<String>> headers, String body) {
        HttpResponse<InputStream> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.headers()).thenReturn(HttpHeaders.of(headers, (name, value) -> true));
        when(response.body()).thenReturn(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
        return response;
    }

    private void respond(Map<String, HttpResponse<InputStream>> byUrl) {
        doAnswer(invocation -> {
            HttpRequest request = invocation.getArgument(0);
            var response = byUrl.get(request.uri().toString());
            return response == null
                    ? CompletableFuture.failedFuture(new ConnectException("no route"))
                    : CompletableFuture.completedFuture(response);
        }).when(httpClient).sendAsync(any(), any());
    }

    @Test
    void onlinePage() {
        respond(Map.of("https://example.com/", response(200, Map.of("Server", List.of("nginx")),
                "<html><body>Hello</body></html>")));

        var result = prober().probe("https://example.com/", Fixtures.config());

        assertEquals(ReachabilityStatus.ONLINE, result.status());
        assertEquals("93.184.216.34", result.resolvedIp());
        assertEquals(200, result.httpStatus());
        assertEquals(List.of("https://example.com/"), result.redirectChain());
    }

    @Test
    void followsRedirects() {
        respond(Map.of(
                "https://example.com/", response(301, Map.of("Location", List.of("/home")), ""),
                "https://example.com/home", response(302, Map.of("Location", List.of("https://www.example.com/")), ""),
                "https://www.example.com/", response(200, Map.of(), "<p>Welcome</p>")));

        var result = prober().probe("https://example.com/", Fixtures.config());

        assertEquals(ReachabilityStatus.ONLINE, result.status());
        assertEquals(List.of("https://example.com/", "https://example.com/home", "https://www.example.com/"),
                result.redirectChain());
        assertEquals("https://www.example.com/", result.finalUrl());
        assertEquals(2, result.redirectCount());
    }

    @Test
    void redirectLimitStopsFollowing() {
        respond(Map.of(
                "https://example.com/", response(301, Map.of("Location", List.of("/a")), ""),
                "https://example.com/a", response(301, Map.of("Location", List.of("/b")), "")));

        var result = prober().probe("https://example.com/", Fixtures.config("reachability.max.redirects", "1"));

        // The last response is the unfollowed redirect itself
        assertEquals(List.of("https://example.com/", "https://example.com/a"), result.redirectChain());
        assertEquals(301, result.httpStatus());
    }

    @Test
    void dnsFailure() throws Exception {
        when(resolver.resolveAddresses("nx.example.com"))
                .thenThrow(new CollaboratorException(ResultCodes.NOT_FOUND, "NXDOMAIN"));

        var result = prober().probe("https://nx.example.com/", Fixtures.config());

        assertEquals(ReachabilityStatus.OFFLINE, result.status());
        assertEquals(ProbeStage.DNS, result.failureStage());
        assertTrue(result.error().contains("NXDOMAIN"));
        verifyNoInteractions(httpClient);
    }

    @Test
    void sinkholeAddressSkipsTcpAndHttp() throws Exception {
        when(resolver.resolveAddresses("seized.example")).thenReturn(List.of("0.0.0.0"));

        var result = prober().probe("http://seized.example/", Fixtures.config());

        assertEquals(ReachabilityStatus.SINKHOLE, result.status());
        verifyNoInteractions(httpClient);
    }

    @Test
    void refusedConnection() {
        refuseConnections = true;

        var result = prober().probe("https://example.com/", Fixtures.config());

        assertEquals(ReachabilityStatus.OFFLINE, result.status());
        assertEquals(ProbeStage.TCP, result.failureStage());
        assertTrue(result.error().contains("refused"));
        verifyNoInteractions(httpClient);
    }

    @Test
    void httpError() {
        respond(Map.of());

        var result = prober().probe("https://example.com/", Fixtures.config());

        assertEquals(ReachabilityStatus.OFFLINE, result.status());
        assertEquals(ProbeStage.HTTP, result.failureStage());
    }

    @Test
    void bodyIsCapped() throws Exception {
        var body = ReachabilityProber.readBody(new ByteArrayInputStream("0123456789".getBytes(StandardCharsets.UTF_8)),
                4);
        assertEquals("0123", body);
    }

    @Test
    void wafChallenge() {
        respond(Map.of("https://example.com/", response(503, Map.of("CF-RAY", List.of("8a1b2c3d-PRG")),
                "<title>Just a moment...</title>")));

        var result = prober().probeAsync("https://example.com/", Fixtures.config()).join();

        assertEquals(ReachabilityStatus.WAF, result.status());
    }

    @Test
    void concurrentScansFillingThePoolStayOnline() throws Exception {
        var url = startServer(exchange -> reply(exchange, 200, null, "<html><body>Hello</body></html>"));
        var config = loopbackConfig();

        try (var prober = new ReachabilityProber(resolver, executor)) {
            var futures = new ArrayList<CompletableFuture<ReachabilityResult>>();
            for (int i = 0; i < POOL_SIZE; i++) {
                futures.add(prober.probeAsync(url, config));
            }

            for (var future : futures) {
                var result = future.get(10, TimeUnit.SECONDS);
                assertEquals(ReachabilityStatus.ONLINE, result.status(), result.error());
                assertEquals(200, result.httpStatus());
            }
        }
    }

    @Test
    void redirectsShareTheHttpTimeout() throws Exception {
        var url = startServer(exchange -> {
            var hop = Integer.parseInt(exchange.getRequestURI().getPath().substring("/hop/".length()));
            try {
                Thread.sleep(400);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (hop < 6)
                reply(exchange, 302, "/hop/" + (hop + 1), "");
            else
                reply(exchange, 200, null, "<p>Done</p>");
        });

        try (var prober = new ReachabilityProber(resolver, executor)) {
            long start = System.nanoTime();
            var result = prober.probe(url + "hop/0", loopbackConfig("reachability.http.timeout.ms", "1000"));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals(ReachabilityStatus.OFFLINE, result.status());
            assertEquals(ProbeStage.HTTP, result.failureStage());
            assertEquals("HTTP timeout (1000 ms)", result.error());
            assertTrue(elapsedMs < 2000, "The HTTP stage took " + elapsedMs + " ms");
        }
    }

    @Test
    void cancellingReachabilityInterruptsTheLookup() throws Exception {
        var started = new CountDownLatch(1);
        var interrupted = new CountDownLatch(1);
        when(resolver.resolveAddresses("slow.example")).thenAnswer(invocation -> {
            started.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return List.of();
        });

        var future = prober().probeAsync("https://slow.example/",
                Fixtures.config("reachability.dns.timeout.ms", "60000"));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(future.cancel(true));

        assertTrue(interrupted.await(5, TimeUnit.SECONDS), "The DNS lookup was not interrupted");
        verifyNoInteractions(httpClient);
    }
}
