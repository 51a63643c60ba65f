package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.engine.features.FreeHostingProviders;
import cz.vut.fit.urlradar.engine.features.UrlLexicon;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;

/**
 * Structure of the URL that imitates a well-known brand. Every check works on the URL alone, so the
 * category is evaluated on every branch.
 */
public class BrandImpersonationCategory extends BaseCategory {
    public static final String ID = "brand_impersonation";

    public BrandImpersonationCategory() {
        super(ID, "Brand Impersonation");
        urlCheck("brand_subdomain_impersonation", "Subdomain Impersonation", 15,
                BrandImpersonationCategory::subdomain);
        urlCheck("brand_in_path", "Brand in Path", 10, BrandImpersonationCategory::brandInPath);
        urlCheck("brand_free_hosting", "Free Hosting Abuse", 10, BrandImpersonationCategory::freeHosting);
        urlCheck("brand_lookalike_domain", "Look-alike Domain", 10, BrandImpersonationCategory::lookalike);
    }

    private static CheckOutcome subdomain(CheckContext context) {
        final var labels = context.ownerLabels();
        if (labels.isEmpty())
            return CheckOutcome.pass("No subdomain");

        final var findings = new ArrayList<String>();
        findings.addAll(UrlLexicon.matches(UrlLexicon.EMBEDDED_DOMAIN_MARKERS, labels));
        findings.addAll(UrlLexicon.foreignBrands(UrlLexicon.brandsIn(labels), context.registrableDomain()));
        findings.addAll(UrlLexicon.matches(UrlLexicon.SUSPICIOUS_SUBDOMAIN_KEYWORDS, labels));
        if (findings.isEmpty())
            return CheckOutcome.pass("Subdomain " + labels + " looks ordinary");
        return CheckOutcome.fail("Subdomain " + labels + " imitates another site")
                .with("subdomain", labels)
                .with("indicators", findings);
    }

    private static CheckOutcome brandInPath(CheckContext context) {
        final var brands = UrlLexicon.foreignBrands(UrlLexicon.brandsIn(context.pathAndQuery()),
                context.registrableDomain());
        if (brands.isEmpty())
            return CheckOutcome.pass("No foreign brand in the path");
        return CheckOutcome.fail("Path names " + String.join(", ", brands) + " on an unrelated domain")
                .with("brands", brands);
    }

    private static CheckOutcome freeHosting(CheckContext context) {
        final var provider = FreeHostingProviders.match(context.hostname());
        if (provider == null)
            return CheckOutcome.pass("Not hosted on a free hosting platform");

        final var lexical = context.features().lexical();
        if (!lexical.brandTokens().isEmpty() || !lexical.actionTokens().isEmpty())
            return CheckOutcome.fail("Brand or account wording on free hosting (" + provider + ")")
                    .with("provider", provider)
                    .with("brands", lexical.brandTokens())
                    .with("actions", lexical.actionTokens());
        return CheckOutcome.warn(5, "Hosted on free platform " + provider).with("provider", provider);
    }

    private static CheckOutcome lookalike(CheckContext context) {
        final var lexical = context.features().lexical();
        if (lexical.homoglyphs())
            return CheckOutcome.fail("Host contains look-alike Unicode characters");
        if (lexical.punycode())
            return CheckOutcome.fail("Host uses an internationalised (punycode) label");
        if (lexical.ipLiteralHost())
            return CheckOutcome.pass("Host is an IP address");

        final var imitated = imitatedBrand(context.registrableDomain(), context.features().tld());
        if (imitated == null)
            return CheckOutcome.pass("Domain does not resemble a known brand");
        return CheckOutcome.fail(context.registrableDomain() + " resembles " + imitated)
                .with("brand", imitated);
    }

    /**
     * Returns the brand whose name is within a small edit distance of the second-level label of a domain
     * the brand does not operate.
     */
    static @Nullable String imitatedBrand(String registrableDomain, String tld) {
        final var label = tld.isEmpty() || registrableDomain.length() <= tld.length()
                ? registrableDomain
                : registrableDomain.substring(0, registrableDomain.length() - tld.length() - 1);

        for (var brand : UrlLexicon.BRANDS.keySet()) {
            if (UrlLexicon.isBrandDomain(brand, registrableDomain))
                continue;
            final int tolerance = brand.length() < 5 ? 0 : brand.length() < 8 ? 1 : 2;
            if (distance(label, brand) <= tolerance)
                return brand;
        }
        return null;
    }

    static int distance(String a, String b) {
        final int[][] dp = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) dp[i][0] = i;
        for (int j = 0; j <= b.length(); j++) dp[0][j] = j;
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                final int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                dp[i][j] = Math.min(Math.min(dp[i - 1][j] + 1, dp[i][j - 1] + 1), dp[i - 1][j - 1] + cost);
            }
        }
        return dp[a.length()][b.length()];
    }
}
