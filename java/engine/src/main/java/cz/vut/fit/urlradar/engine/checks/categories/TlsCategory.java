package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import cz.vut.fit.urlradar.models.evidence.TlsEvidence;

/**
 * The certificate and protocol of the TLS endpoint.
 */
public class TlsCategory extends BaseCategory {
    public static final String ID = "tls";

    private static final int EXPIRY_WARNING_DAYS = 30;

    public TlsCategory() {
        super(ID, "SSL/TLS Security");
        check("tls_valid", "SSL Certificate Validity", 15, TlsCategory::valid, EvidenceKind.TLS);
        check("tls_self_signed", "Self-Signed Certificate Check", 10, TlsCategory::selfSigned, EvidenceKind.TLS);
        check("tls_expiry", "Certificate Expiration", 10, TlsCategory::expiry, EvidenceKind.TLS);
        check("tls_version", "TLS Protocol Version", 10, TlsCategory::version, EvidenceKind.TLS);
    }

    private static TlsEvidence tls(CheckContext context) {
        return context.evidence().tls();
    }

    private static CheckOutcome valid(CheckContext context) {
        final var tls = tls(context);
        final CheckOutcome outcome;
        if (!tls.valid())
            outcome = CheckOutcome.fail("Invalid or untrusted SSL certificate");
        else if (!tls.hostnameMatches())
            outcome = CheckOutcome.warn(5, "Certificate does not cover " + context.hostname());
        else
            outcome = CheckOutcome.pass("Valid SSL certificate from " + tls.issuer());
        return outcome.with("issuer", tls.issuer()).with("subject", tls.subject());
    }

    private static CheckOutcome selfSigned(CheckContext context) {
        final var tls = tls(context);
        if (tls.selfSigned())
            return CheckOutcome.fail("Certificate is self-signed").with("issuer", tls.issuer());
        return CheckOutcome.pass("Certificate issued by a certificate authority");
    }

    private static CheckOutcome expiry(CheckContext context) {
        final var days = tls(context).daysUntilExpiry(context.now());
        if (days == null)
            return CheckOutcome.notEvaluated("expiration date unknown");

        final CheckOutcome outcome;
        if (days < 0)
            outcome = CheckOutcome.fail("Certificate expired " + Math.abs(days) + " days ago");
        else if (days < EXPIRY_WARNING_DAYS)
            outcome = CheckOutcome.warn(5, "Certificate expires in " + days + " days");
        else
            outcome = CheckOutcome.pass("Certificate valid for " + days + " more days");
        return outcome.with("daysUntilExpiry", days);
    }

    private static CheckOutcome version(CheckContext context) {
        final var tls = tls(context);
        if (tls.protocol() == null)
            return CheckOutcome.notEvaluated("protocol unknown");
        if (tls.modernProtocol())
            return CheckOutcome.pass("Using " + tls.protocol());
        return CheckOutcome.warn(5, "Using outdated " + tls.protocol()).with("protocol", tls.protocol());
    }
}
