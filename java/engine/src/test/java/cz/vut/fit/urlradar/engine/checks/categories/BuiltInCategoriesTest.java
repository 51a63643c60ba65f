package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.Fixtures;
import cz.vut.fit.urlradar.engine.checks.CategoryCheckEngine;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.checks.CategoryResult;
import cz.vut.fit.urlradar.models.checks.CheckResult;
import cz.vut.fit.urlradar.models.checks.CheckStatus;
import cz.vut.fit.urlradar.models.evidence.DnsEvidence;
import cz.vut.fit.urlradar.models.evidence.EvidenceBundle;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import cz.vut.fit.urlradar.models.evidence.TlsEvidence;
import cz.vut.fit.urlradar.models.intel.Severity;
import cz.vut.fit.urlradar.models.intel.SourceStatus;
import cz.vut.fit.urlradar.models.intel.SourceTier;
import cz.vut.fit.urlradar.models.intel.TIFinding;
import cz.vut.fit.urlradar.models.intel.TISummary;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BuiltInCategoriesTest {
    private final CategoryCheckEngine engine = new CategoryCheckEngine();

    private List<CategoryResult> run(String url, ReachabilityStatus branch, EvidenceBundle evidence, TISummary intel) {
        var features = Fixtures.features(url, branch, evidence, intel);
        return engine.run(new CheckContext(Fixtures.reachability(branch), intel, evidence, features,
                ConfigSnapshot.defaults(), Fixtures.NOW));
    }

    private static CheckResult check(List<CategoryResult> results, String checkId) {
        return results.stream()
                .flatMap(category -> category.checks().stream())
                .filter(check -> check.checkId().equals(checkId))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no result for " + checkId));
    }

    private static CategoryResult category(List<CategoryResult> results, String id) {
        return results.stream().filter(c -> c.categoryId().equals(id)).findFirst().orElseThrow();
    }

    @Test
    void credentialPhishingPage() {
        var url = "https://paypal-login.xyz/";
        var dom = Fixtures.dom("PayPal", "Log in to your PayPal account",
                List.of(Fixtures.passwordForm("collector.example.net", true)));
        var evidence = Fixtures.bundle(ReachabilityStatus.ONLINE, Fixtures.whois(5), Fixtures.healthyDns(),
                Fixtures.validTls(), dom, Fixtures.http(url, Map.of()), Fixtures.network());

        var results = run(url, ReachabilityStatus.ONLINE, evidence, TISummary.empty());

        assertEquals(CheckStatus.FAIL, check(results, "phishing_login_form").status());
        assertEquals(CheckStatus.FAIL, check(results, "phishing_brand_mismatch").status());
        assertEquals(CheckStatus.FAIL, check(results, "domain_age").status());
        assertEquals(CheckStatus.FAIL, check(results, "tld_risk").status());
        assertEquals(CheckStatus.PASS, check(results, "email_spf").status());
        assertEquals(CheckStatus.PASS, check(results, "email_dmarc").status());
        assertEquals(CheckStatus.PASS, check(results, "tls_valid").status());
        assertEquals(50, category(results, PhishingCategory.ID).penaltyPoints());
    }

    @Test
    void establishedSite() {
        var url = "https://example.com/";
        var dom = Fixtures.dom("Example Domain", "This domain is for use in illustrative examples.", List.of());
        var evidence = Fixtures.bundle(ReachabilityStatus.ONLINE, Fixtures.whois(9000), Fixtures.healthyDns(),
                Fixtures.validTls(), dom, Fixtures.http(url, Map.of()), Fixtures.network());

        var results = run(url, ReachabilityStatus.ONLINE, evidence, TISummary.empty());

        assertEquals(CheckStatus.PASS, check(results, "phishing_login_form").status());
        assertEquals(CheckStatus.PASS, check(results, "phishing_brand_mismatch").status());
        assertEquals(CheckStatus.PASS, check(results, "domain_age").status());
        assertEquals(CheckStatus.PASS, check(results, "tld_risk").status());
        assertEquals(CheckStatus.PASS, check(results, "ti_hits").status());
        assertEquals(0, category(results, TlsCategory.ID).penaltyPoints());
        assertEquals(0, category(results, BrandImpersonationCategory.ID).penaltyPoints());
    }

    @Test
    void weakCertificateAndMailRecords() {
        var url = "https://shop.example.net/";
        var tls = new TlsEvidence(false, "CN=shop.example.net", "CN=shop.example.net", true,
                Fixtures.NOW.minus(Duration.ofDays(400)), Fixtures.NOW.minus(Duration.ofDays(3)), "TLSv1",
                "TLS_RSA_WITH_AES_128_CBC_SHA", List.of("shop.example.net"), true);
        var dns = DnsEvidence.of(List.of("203.0.113.10"), List.of(), List.of(), List.of("ns1.example.net."),
                List.of("\"v=spf1 +all\""), List.of(), List.of("v=DMARC1; p=none"));
        var evidence = Fixtures.bundle(ReachabilityStatus.ONLINE, Fixtures.whois(800), dns, tls,
                Fixtures.dom("Shop", "", List.of()), Fixtures.http(url, Map.of()), Fixtures.network());

        var results = run(url, ReachabilityStatus.ONLINE, evidence, TISummary.empty());

        assertEquals(CheckStatus.FAIL, check(results, "tls_valid").status());
        assertEquals(CheckStatus.FAIL, check(results, "tls_self_signed").status());
        assertEquals(CheckStatus.FAIL, check(results, "tls_expiry").status());
        assertEquals(CheckStatus.WARN, check(results, "tls_version").status());
        assertEquals(CheckStatus.FAIL, check(results, "email_spf").status());
        assertEquals(CheckStatus.WARN, check(results, "email_dmarc").status());
    }

    @Test
    void threatIntelHits() {
        var findings = List.of(
                new TIFinding("gsb", SourceTier.TIER_1, Severity.HIGH, Fixtures.NOW, "SOCIAL_ENGINEERING"),
                new TIFinding("virustotal", SourceTier.TIER_1, Severity.HIGH, Fixtures.NOW, null));
        var intel = TISummary.of(findings, List.of(), false, Fixtures.NOW, 90);

        var results = run("https://example.com/", ReachabilityStatus.OFFLINE,
                EvidenceBundle.empty(ReachabilityStatus.OFFLINE, Map.of()), intel);

        assertEquals(CheckStatus.FAIL, check(results, "ti_hits").status());
        var tier1 = check(results, "ti_tier1");
        assertEquals(CheckStatus.FAIL, tier1.status());
        assertEquals(List.of("gsb", "virustotal"), tier1.evidence().get("sources"));
    }

    @Test
    void silentIntelSourcesAreNotAPass() {
        var intel = TISummary.of(List.of(), List.of(new SourceStatus("gsb", 52, "timeout", 0, 2000)), false,
                Fixtures.NOW, 90);

        var results = run("https://example.com/", ReachabilityStatus.OFFLINE,
                EvidenceBundle.empty(ReachabilityStatus.OFFLINE, Map.of()), intel);

        assertTrue(check(results, "ti_hits").skipped());
    }

    @Test
    void offlineTargetSkipsPageCategories() {
        var evidence = new EvidenceBundle(ReachabilityStatus.OFFLINE, Fixtures.whois(400), Fixtures.healthyDns(),
                null, null, null, null, null, Map.of(EvidenceKind.TLS, "skipped: not collected for offline targets"));

        var results = run("https://example.com/", ReachabilityStatus.OFFLINE, evidence, TISummary.empty());

        for (var id : List.of(TlsCategory.ID, PhishingCategory.ID, MalwareCategory.ID, TrustCategory.ID)) {
            assertTrue(category(results, id).skipped(), id);
        }
        assertFalse(category(results, EmailSecurityCategory.ID).skipped());
        assertFalse(category(results, DomainCategory.ID).skipped());
        assertTrue(results.stream().mapToInt(CategoryResult::penaltyPoints).sum() >= 0);
    }
}
