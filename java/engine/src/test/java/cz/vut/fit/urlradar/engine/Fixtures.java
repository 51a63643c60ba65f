package cz.vut.fit.urlradar.engine;

import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.features.FeatureExtractor;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.evidence.DnsEvidence;
import cz.vut.fit.urlradar.models.evidence.DomEvidence;
import cz.vut.fit.urlradar.models.evidence.EvidenceBundle;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import cz.vut.fit.urlradar.models.evidence.FormInfo;
import cz.vut.fit.urlradar.models.evidence.HttpEvidence;
import cz.vut.fit.urlradar.models.evidence.NetworkEvidence;
import cz.vut.fit.urlradar.models.evidence.TlsEvidence;
import cz.vut.fit.urlradar.models.evidence.WhoisEvidence;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.intel.TISummary;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Shared test data.
 */
public final class Fixtures {
    public static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private Fixtures() {
    }

    public static ConfigSnapshot config(String... keyValues) {
        return ConfigSnapshot.fromProperties(properties(keyValues));
    }

    public static Properties properties(String... keyValues) {
        final var properties = new Properties();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    public static WhoisEvidence whois(int ageDays) {
        return new WhoisEvidence(ageDays, "Example Registrar, Inc.", false, NOW.minus(Duration.ofDays(ageDays)),
                NOW.plus(Duration.ofDays(365)), List.of("ns1.example.net"));
    }

    public static DnsEvidence healthyDns() {
        return DnsEvidence.of(List.of("93.184.216.34"), List.of(), List.of("10 mail.example.com."),
                List.of("ns1.example.net."), List.of("\"v=spf1 -all\""), List.of(),
                List.of("v=DMARC1; p=reject"));
    }

    public static TlsEvidence validTls() {
        return new TlsEvidence(true, "CN=Example CA", "CN=example.com", false, NOW.minus(Duration.ofDays(30)),
                NOW.plus(Duration.ofDays(300)), "TLSv1.3", "TLS_AES_128_GCM_SHA256", List.of("example.com"), true);
    }

    public static NetworkEvidence network() {
        return new NetworkEvidence("93.184.216.34", 15133L, "Edgecast", false);
    }

    public static DomEvidence dom(String title, String text, List<FormInfo> forms) {
        return new DomEvidence(title, text, forms, 1, 0, false, List.of(), 3, 0, List.of(), 0, 0, 0, null,
                false, false, false);
    }

    public static FormInfo passwordForm(String targetHost, boolean external) {
        return new FormInfo("https://" + targetHost + "/post", "POST", targetHost, external, true,
                List.of("text", "password"), List.of("user", "pass"));
    }

    public static HttpEvidence http(String url, Map<String, String> headers) {
        return new HttpEvidence(url, 200, headers, List.of(), List.of(url));
    }

    public static EvidenceBundle bundle(ReachabilityStatus branch, WhoisEvidence whois, DnsEvidence dns,
                                        TlsEvidence tls, DomEvidence dom, HttpEvidence http,
                                        NetworkEvidence network) {
        return new EvidenceBundle(branch, whois, dns, tls, dom, http, network, null,
                Map.of(EvidenceKind.SCREENSHOT, "not requested"));
    }

    public static ReachabilityResult reachability(ReachabilityStatus status) {
        return ReachabilityResult.of(status);
    }

    public static FeatureVector features(String url, ReachabilityStatus branch, EvidenceBundle evidence,
                                         TISummary intel) {
        return new FeatureExtractor(CLOCK).extract(url, reachability(branch), evidence, intel);
    }

    public static FeatureVector urlOnlyFeatures(String url, ReachabilityStatus branch) {
        return features(url, branch, EvidenceBundle.empty(branch, Map.of()), TISummary.empty());
    }
}
