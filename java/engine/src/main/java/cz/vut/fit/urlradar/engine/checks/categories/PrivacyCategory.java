package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.models.evidence.FormInfo;

import java.util.List;
import java.util.Locale;

/**
 * How the page treats personal data.
 */
public class PrivacyCategory extends BaseCategory {
    public static final String ID = "privacy";

    static final List<String> TRACKER_DOMAINS = List.of(
            "google-analytics.com", "googletagmanager.com", "facebook.net", "doubleclick.net", "hotjar.com",
            "scorecardresearch.com", "quantserve.com", "criteo.com", "taboola.com", "mixpanel.com");

    private static final List<String> SENSITIVE_FIELDS = List.of(
            "ssn", "social", "card", "cvv", "cvc", "passport", "birth", "dob", "pin", "tax", "iban");

    public PrivacyCategory() {
        super(ID, "Privacy");
        pageCheck("privacy_policy_link", "Privacy Policy", 15, PrivacyCategory::policy);
        pageCheck("privacy_sensitive_fields", "Sensitive Form Fields", 12, PrivacyCategory::sensitiveFields);
        pageCheck("privacy_cookie_security", "Cookie Security", 10, PrivacyCategory::cookies);
        pageCheck("privacy_tracking", "Third-Party Tracking", 8, PrivacyCategory::tracking);
        pageCheck("privacy_insecure_transmission", "Insecure Transmission", 5, PrivacyCategory::transmission);
    }

    private static CheckOutcome policy(CheckContext context) {
        final var text = context.pageText();
        if (text.contains("privacy policy") || text.contains("privacy notice") || text.contains("gdpr"))
            return CheckOutcome.pass("Privacy policy referenced");
        return CheckOutcome.warn(8, "No privacy policy found");
    }

    private static CheckOutcome sensitiveFields(CheckContext context) {
        final var fields = context.dom().forms().stream()
                .map(FormInfo::inputNames)
                .flatMap(List::stream)
                .map(name -> name.toLowerCase(Locale.ROOT))
                .filter(name -> SENSITIVE_FIELDS.stream().anyMatch(name::contains))
                .distinct()
                .toList();
        final CheckOutcome outcome;
        if (fields.size() >= 2)
            outcome = CheckOutcome.fail("Forms ask for " + fields.size() + " sensitive fields");
        else if (fields.size() == 1)
            outcome = CheckOutcome.warn(6, "Form asks for " + fields.get(0));
        else
            outcome = CheckOutcome.pass("No sensitive form fields");
        return outcome.with("fields", fields);
    }

    private static CheckOutcome cookies(CheckContext context) {
        final var http = context.http();
        if (http == null)
            return CheckOutcome.notEvaluated("no HTTP response recorded");
        if (http.cookies().isEmpty())
            return CheckOutcome.pass("No cookies set");

        final long insecure = http.cookies().stream()
                .map(cookie -> cookie.toLowerCase(Locale.ROOT))
                .filter(cookie -> !cookie.contains("secure") || !cookie.contains("httponly"))
                .count();
        if (insecure > 0)
            return CheckOutcome.warn(5, insecure + " of " + http.cookies().size()
                    + " cookie(s) lack Secure or HttpOnly").with("insecureCookies", insecure);
        return CheckOutcome.pass("All cookies are Secure and HttpOnly");
    }

    private static CheckOutcome tracking(CheckContext context) {
        final var trackers = context.dom().externalDomains().stream()
                .map(host -> host.toLowerCase(Locale.ROOT))
                .filter(host -> TRACKER_DOMAINS.stream().anyMatch(t -> host.equals(t) || host.endsWith("." + t)))
                .distinct()
                .toList();
        final var outcome = trackers.size() >= 3
                ? CheckOutcome.warn(4, trackers.size() + " third-party trackers")
                : CheckOutcome.pass(trackers.size() + " third-party tracker(s)");
        return outcome.with("trackers", trackers);
    }

    private static CheckOutcome transmission(CheckContext context) {
        final var dom = context.dom();
        if (!context.https() && !dom.forms().isEmpty())
            return CheckOutcome.fail("Form data is sent over plain HTTP");
        if (dom.mixedContent())
            return CheckOutcome.warn(2, "Secure page loads insecure resources");
        return CheckOutcome.pass("Data is transmitted securely");
    }
}
