package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.Fixtures;
import cz.vut.fit.urlradar.engine.checks.CategoryCheckEngine;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.checks.CategoryResult;
import cz.vut.fit.urlradar.models.checks.CheckStatus;
import cz.vut.fit.urlradar.models.evidence.EvidenceBundle;
import cz.vut.fit.urlradar.models.intel.TISummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrandImpersonationCategoryTest {
    private final CategoryCheckEngine engine = new CategoryCheckEngine(List.of(new BrandImpersonationCategory()));

    private CategoryResult run(String url) {
        var branch = ReachabilityStatus.OFFLINE;
        var evidence = EvidenceBundle.empty(branch, Map.of());
        var features = Fixtures.features(url, branch, evidence, TISummary.empty());
        var context = new CheckContext(Fixtures.reachability(branch), TISummary.empty(), evidence, features,
                ConfigSnapshot.defaults(), Fixtures.NOW);
        return engine.run(context).get(0);
    }

    private static CheckStatus status(CategoryResult result, String checkId) {
        return result.checks().stream()
                .filter(check -> check.checkId().equals(checkId))
                .findFirst().orElseThrow()
                .status();
    }

    @Test
    void brandOnFreeHosting() {
        var result = run("https://brand-com.vercel.app/paypal/login");

        assertFalse(result.skipped());
        assertEquals(CheckStatus.FAIL, status(result, "brand_subdomain_impersonation"));
        assertEquals(CheckStatus.FAIL, status(result, "brand_in_path"));
        assertEquals(CheckStatus.FAIL, status(result, "brand_free_hosting"));
        assertTrue(result.penaltyPoints() >= 35);
    }

    @Test
    void legitimateBrandSite() {
        var result = run("https://www.paypal.com/signin");

        assertEquals(CheckStatus.PASS, status(result, "brand_in_path"));
        assertEquals(CheckStatus.PASS, status(result, "brand_free_hosting"));
        assertEquals(CheckStatus.PASS, status(result, "brand_lookalike_domain"));
    }

    @Test
    void brandInSubdomainOfUnrelatedDomain() {
        var result = run("https://paypal.account-check.net/");

        assertEquals(CheckStatus.FAIL, status(result, "brand_subdomain_impersonation"));
    }

    @Test
    void plainFreeHostingOnlyWarns() {
        var result = run("https://my-portfolio.netlify.app/");

        assertEquals(CheckStatus.WARN, status(result, "brand_free_hosting"));
    }

    @Test
    void lookalikeDomain() {
        assertEquals(CheckStatus.FAIL, status(run("https://paypai.com/"), "brand_lookalike_domain"));
        assertEquals(CheckStatus.PASS, status(run("https://example.com/"), "brand_lookalike_domain"));
    }

    @ParameterizedTest
    @CsvSource({
            "paypai.com, com, paypal",
            "amazom.com, com, amazon",
            "paypal.com, com, ",
            "example.org, org, ",
    })
    void imitatedBrand(String domain, String tld, String expected) {
        assertEquals(expected, BrandImpersonationCategory.imitatedBrand(domain, tld));
    }

    @Test
    void editDistance() {
        assertEquals(0, BrandImpersonationCategory.distance("paypal", "paypal"));
        assertEquals(1, BrandImpersonationCategory.distance("paypai", "paypal"));
        assertEquals(3, BrandImpersonationCategory.distance("kitten", "sitting"));
        assertEquals(6, BrandImpersonationCategory.distance("", "google"));
    }
}
