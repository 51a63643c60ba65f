package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;

/**
 * Security headers of the final HTTP response.
 */
public class HeadersCategory extends BaseCategory {
    public static final String ID = "headers";

    public HeadersCategory() {
        super(ID, "Security Headers");
        check("headers_hsts", "Strict-Transport-Security", 8, HeadersCategory::hsts, EvidenceKind.HTML);
        check("headers_csp", "Content-Security-Policy", 7,
                context -> present(context, "content-security-policy", 3), EvidenceKind.HTML);
        check("headers_x_frame_options", "X-Frame-Options", 5,
                HeadersCategory::frameOptions, EvidenceKind.HTML);
        check("headers_x_content_type", "X-Content-Type-Options", 3,
                context -> present(context, "x-content-type-options", 1), EvidenceKind.HTML);
        check("headers_referrer_policy", "Referrer-Policy", 2,
                context -> present(context, "referrer-policy", 1), EvidenceKind.HTML);
    }

    private static CheckOutcome hsts(CheckContext context) {
        if (context.http() == null)
            return CheckOutcome.notEvaluated("no HTTP response recorded");
        if (!context.https())
            return CheckOutcome.info("HSTS does not apply to plain HTTP");
        return present(context, "strict-transport-security", 3);
    }

    private static CheckOutcome frameOptions(CheckContext context) {
        final var http = context.http();
        if (http == null)
            return CheckOutcome.notEvaluated("no HTTP response recorded");
        final var csp = http.header("content-security-policy");
        if (http.hasHeader("x-frame-options") || (csp != null && csp.contains("frame-ancestors")))
            return CheckOutcome.pass("Framing is restricted");
        return CheckOutcome.warn(2, "Page can be framed by any site");
    }

    private static CheckOutcome present(CheckContext context, String header, int missingPoints) {
        final var http = context.http();
        if (http == null)
            return CheckOutcome.notEvaluated("no HTTP response recorded");
        final var value = http.header(header);
        if (value == null)
            return CheckOutcome.warn(missingPoints, header + " header missing");
        return CheckOutcome.pass(header + " header present").with(header, value);
    }
}
