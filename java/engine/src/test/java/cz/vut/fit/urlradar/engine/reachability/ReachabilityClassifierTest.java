package cz.vut.fit.urlradar.engine.reachability;

import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.reachability.ProbeStage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReachabilityClassifierTest {
    private static final String HOST = "example.com";
    private static final String URL = "https://example.com/";

    private final ReachabilityClassifier classifier = ReachabilityClassifier.fromConfig(ConfigSnapshot.defaults());

    private static ProbeObservation resolved() {
        return ProbeObservation.resolved(HOST, List.of("93.184.216.34"));
    }

    private static ProbeObservation response(int status, Map<String, String> headers, String body) {
        return resolved().httpResponse(status, headers, body, List.of(URL), URL);
    }

    @Test
    void dnsFailureIsOffline() {
        var result = classifier.classify(ProbeObservation.dnsFailure(HOST, "NXDOMAIN"), 5);

        assertEquals(ReachabilityStatus.OFFLINE, result.status());
        assertEquals(ProbeStage.DNS, result.failureStage());
        assertEquals("NXDOMAIN", result.error());
        assertNull(result.resolvedIp());
    }

    @ParameterizedTest
    @ValueSource(strings = {"0.0.0.0", "127.0.0.1", "146.112.61.106"})
    void sinkholeAddress(String address) {
        var result = classifier.classify(ProbeObservation.resolved(HOST, List.of(address)), 5);

        assertEquals(ReachabilityStatus.SINKHOLE, result.status());
        assertEquals(address, result.resolvedIp());
        assertTrue(result.signals().get(0).contains(address));
    }

    @Test
    void sinkholeHostName() {
        var observation = ProbeObservation.resolved("sinkhole.shadowserver.org", List.of("203.0.113.5"));

        assertEquals(ReachabilityStatus.SINKHOLE, classifier.classify(observation, 5).status());
    }

    @Test
    void tcpFailureIsOffline() {
        var result = classifier.classify(resolved().tcpFailure("Connection refused"), 5);

        assertEquals(ReachabilityStatus.OFFLINE, result.status());
        assertEquals(ProbeStage.TCP, result.failureStage());
        assertEquals("93.184.216.34", result.resolvedIp());
    }

    @Test
    void httpFailureIsOffline() {
        var result = classifier.classify(resolved().httpFailure("HTTP timeout", List.of(URL)), 5);

        assertEquals(ReachabilityStatus.OFFLINE, result.status());
        assertEquals(ProbeStage.HTTP, result.failureStage());
    }

    @Test
    void sinkholeContent() {
        var result = classifier.classify(response(200, Map.of(),
                "<h1>This domain has been seized</h1>"), 5);

        assertEquals(ReachabilityStatus.SINKHOLE, result.status());
    }

    @Test
    void vendorHeaderWithBlockingStatusIsWaf() {
        var result = classifier.classify(response(403, Map.of("cf-ray", "8a1b2c3d"), "Forbidden"), 5);

        assertEquals(ReachabilityStatus.WAF, result.status());
        assertEquals(403, result.httpStatus());
    }

    @Test
    void vendorHeaderAloneIsNotWaf() {
        var result = classifier.classify(response(200, Map.of("cf-ray", "8a1b2c3d"), "<p>Welcome</p>"), 5);

        assertEquals(ReachabilityStatus.ONLINE, result.status());
    }

    @Test
    void wafWinsOverParking() {
        var body = "<p>Checking your browser before accessing</p><p>This domain is parked</p>";

        assertEquals(ReachabilityStatus.WAF, classifier.classify(response(200, Map.of(), body), 5).status());
    }

    @Test
    void errorStatusIsOffline() {
        var result = classifier.classify(response(404, Map.of(), "Not found"), 5);

        assertEquals(ReachabilityStatus.OFFLINE, result.status());
        assertEquals(ProbeStage.HTTP, result.failureStage());
        assertEquals(404, result.httpStatus());
    }

    @Test
    void parkingPage() {
        var result = classifier.classify(response(200, Map.of(), "<h1>Buy this domain</h1> sedo.com"), 5);

        assertEquals(ReachabilityStatus.PARKED, result.status());
        assertEquals(2, result.signals().size());
    }

    @Test
    void regularPageIsOnline() {
        var result = classifier.classify(response(200, Map.of("server", "nginx"), "<p>Hello</p>"), 7);

        assertEquals(ReachabilityStatus.ONLINE, result.status());
        assertEquals(URL, result.finalUrl());
        assertEquals(7, result.latencyMs());
        assertTrue(result.signals().isEmpty());
    }

    @Test
    void customMarkers() {
        var custom = new ReachabilityClassifier(List.of("198.51.100.1"), List.of("takedown"), List.of("acme"),
                List.of("prove you are human"), List.of("under construction"));

        assertEquals(ReachabilityStatus.SINKHOLE,
                custom.classify(ProbeObservation.resolved(HOST, List.of("198.51.100.1")), 1).status());
        assertEquals(ReachabilityStatus.WAF,
                custom.classify(response(429, Map.of("server", "ACME Shield"), ""), 1).status());
        assertEquals(ReachabilityStatus.PARKED,
                custom.classify(response(200, Map.of(), "Under construction"), 1).status());
        assertEquals(ReachabilityStatus.ONLINE,
                custom.classify(ProbeObservation.resolved(HOST, List.of("0.0.0.0"))
                        .httpResponse(200, Map.of(), "", List.of(URL), URL), 1).status());
    }
}
