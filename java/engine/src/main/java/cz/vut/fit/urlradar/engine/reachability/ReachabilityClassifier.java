package cz.vut.fit.urlradar.engine.reachability;

import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.features.DomainNames;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.reachability.ProbeStage;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Classifies a probe observation. Priority order: DNS failure, sinkhole address or host, TCP failure,
 * HTTP failure, sinkhole content, WAF, parking page, regular response. A page that looks both like a
 * WAF challenge and a parking page is classified as WAF.
 *
 * @author URLRadar developers
 */
public class ReachabilityClassifier {
    /**
     * Response headers whose presence identifies a WAF or CDN vendor on their own.
     */
    static final Map<String, String> VENDOR_HEADERS = Map.of(
            "cf-ray", "cloudflare",
            "cf-mitigated", "cloudflare",
            "x-sucuri-id", "sucuri",
            "x-sucuri-block", "sucuri",
            "x-iinfo", "incapsula",
            "x-cdn", "incapsula",
            "akamai-grn", "akamai",
            "x-akamai-transformed", "akamai");

    /**
     * Response headers whose values are matched against the vendor markers.
     */
    static final List<String> VENDOR_VALUE_HEADERS = List.of("server", "via", "x-powered-by");

    static final Set<Integer> BLOCKING_STATUSES = Set.of(403, 429, 503);

    private final Set<String> _sinkholeIps;
    private final List<String> _sinkholeKeywords;
    private final List<String> _wafVendors;
    private final List<String> _wafChallenges;
    private final List<String> _parkedIndicators;

    public ReachabilityClassifier(@NotNull List<String> sinkholeIps, @NotNull List<String> sinkholeKeywords,
                                  @NotNull List<String> wafVendors, @NotNull List<String> wafChallenges,
                                  @NotNull List<String> parkedIndicators) {
        _sinkholeIps = Set.copyOf(sinkholeIps);
        _sinkholeKeywords = List.copyOf(sinkholeKeywords);
        _wafVendors = List.copyOf(wafVendors);
        _wafChallenges = List.copyOf(wafChallenges);
        _parkedIndicators = List.copyOf(parkedIndicators);
    }

    public static ReachabilityClassifier fromConfig(@NotNull ConfigSnapshot config) {
        return new ReachabilityClassifier(config.sinkholeIps(), config.sinkholeKeywords(), config.wafVendors(),
                config.wafChallenges(), config.parkedIndicators());
    }

    /**
     * Classifies the observation.
     *
     * @param observation The observation.
     * @param latencyMs   The time spent probing.
     * @return The reachability result.
     */
    public @NotNull ReachabilityResult classify(@NotNull ProbeObservation observation, long latencyMs) {
        final var ip = observation.firstAddress();

        if (observation.stage() == ProbeStage.DNS && observation.failed())
            return ReachabilityResult.offline(ProbeStage.DNS, null, null, List.of(), observation.error(),
                    latencyMs);

        final var addressSignals = addressSinkholeSignals(observation);
        if (!addressSignals.isEmpty())
            return result(ReachabilityStatus.SINKHOLE, observation, addressSignals, latencyMs);

        if (observation.failed())
            return ReachabilityResult.offline(observation.stage(), ip, observation.httpStatus(),
                    observation.redirectChain(), observation.error(), latencyMs);

        // A successful DNS or TCP stage without an HTTP response cannot be classified any further
        if (observation.httpStatus() == null)
            return ReachabilityResult.offline(observation.stage(), ip, null, observation.redirectChain(),
                    "No HTTP response", latencyMs);

        final int status = observation.httpStatus();
        final var body = observation.body() == null ? "" : observation.body().toLowerCase(Locale.ROOT);

        final var sinkholeSignals = contentSinkholeSignals(observation, body);
        if (!sinkholeSignals.isEmpty())
            return result(ReachabilityStatus.SINKHOLE, observation, sinkholeSignals, latencyMs);

        final var wafSignals = wafSignals(observation.headers(), status, body);
        if (!wafSignals.isEmpty())
            return result(ReachabilityStatus.WAF, observation, wafSignals, latencyMs);

        if (status >= 400)
            return ReachabilityResult.offline(ProbeStage.HTTP, ip, status, observation.redirectChain(),
                    "HTTP status " + status, latencyMs);

        final var parkedSignals = matches(_parkedIndicators, body, "parking page: ");
        if (!parkedSignals.isEmpty())
            return result(ReachabilityStatus.PARKED, observation, parkedSignals, latencyMs);

        return result(ReachabilityStatus.ONLINE, observation, List.of(), latencyMs);
    }

    /**
     * Sinkhole indicators available right after the DNS stage: a listed address or a keyword in the host.
     */
    public @NotNull List<String> addressSinkholeSignals(@NotNull ProbeObservation observation) {
        final var signals = new ArrayList<String>();
        for (var address : observation.addresses()) {
            if (_sinkholeIps.contains(address.toLowerCase(Locale.ROOT)))
                signals.add("sinkhole address: " + address);
        }
        signals.addAll(matches(_sinkholeKeywords, observation.hostname().toLowerCase(Locale.ROOT),
                "sinkhole host: "));
        return signals;
    }

    private List<String> contentSinkholeSignals(ProbeObservation observation, String body) {
        final var signals = new ArrayList<String>();
        for (var hop : observation.redirectChain()) {
            final var host = DomainNames.hostOf(hop);
            if (host != null && !host.equals(observation.hostname()))
                signals.addAll(matches(_sinkholeKeywords, host, "sinkhole redirect: "));
        }
        signals.addAll(matches(_sinkholeKeywords, body, "sinkhole content: "));
        return signals;
    }

    private List<String> wafSignals(Map<String, String> headers, int status, String body) {
        final var signals = new ArrayList<String>();
        final var vendor = vendorOf(headers);
        if (vendor != null && BLOCKING_STATUSES.contains(status))
            signals.add("waf vendor %s with status %d".formatted(vendor, status));

        signals.addAll(matches(_wafChallenges, body, "challenge: "));
        return signals;
    }

    private @Nullable String vendorOf(Map<String, String> headers) {
        for (var entry : VENDOR_HEADERS.entrySet()) {
            if (headers.containsKey(entry.getKey()) && _wafVendors.contains(entry.getValue()))
                return entry.getValue();
        }
        for (var name : VENDOR_VALUE_HEADERS) {
            final var value = headers.get(name);
            if (value == null)
                continue;
            final var lower = value.toLowerCase(Locale.ROOT);
            for (var vendor : _wafVendors) {
                if (lower.contains(vendor))
                    return vendor;
            }
        }
        return null;
    }

    private static List<String> matches(List<String> markers, String text, String prefix) {
        final var result = new ArrayList<String>();
        for (var marker : markers) {
            if (!marker.isEmpty() && text.contains(marker))
                result.add(prefix + marker);
        }
        return result;
    }

    private static ReachabilityResult result(ReachabilityStatus status, ProbeObservation observation,
                                             List<String> signals, long latencyMs) {
        return new ReachabilityResult(status, null, observation.firstAddress(), observation.httpStatus(),
                observation.redirectChain(), observation.finalUrl(), signals, null, latencyMs);
    }
}
