package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;

import java.util.Locale;

/**
 * Anti-spoofing records of the domain. Only DNS is needed, so the category runs on offline targets too.
 */
public class EmailSecurityCategory extends BaseCategory {
    public static final String ID = "email_security";

    public EmailSecurityCategory() {
        super(ID, "Email Security");
        check("email_spf", "SPF Record", 10, EmailSecurityCategory::spf, EvidenceKind.DNS);
        check("email_dmarc", "DMARC Policy", 15, EmailSecurityCategory::dmarc, EvidenceKind.DNS);
    }

    private static CheckOutcome spf(CheckContext context) {
        final var dns = context.evidence().dns();
        if (!dns.spfPresent())
            return CheckOutcome.fail("No SPF record; anyone can send mail as this domain");

        final var record = dns.txt().stream()
                .map(txt -> txt.replace("\"", "").trim().toLowerCase(Locale.ROOT))
                .filter(txt -> txt.startsWith("v=spf1"))
                .findFirst()
                .orElse("");
        final CheckOutcome outcome;
        if (record.contains("+all"))
            outcome = CheckOutcome.fail("SPF record authorises every sender (+all)");
        else if (record.contains("~all") || record.contains("?all"))
            outcome = CheckOutcome.warn(5, "SPF record only soft-fails unknown senders");
        else
            outcome = CheckOutcome.pass("SPF record present");
        return outcome.with("spf", record);
    }

    private static CheckOutcome dmarc(CheckContext context) {
        final var dns = context.evidence().dns();
        if (!dns.dmarcPresent())
            return CheckOutcome.fail("No DMARC record");

        final var policy = dns.dmarcPolicy() == null ? "none" : dns.dmarcPolicy().toLowerCase(Locale.ROOT);
        final var outcome = "none".equals(policy)
                ? CheckOutcome.warn(7, "DMARC policy only monitors (p=none)")
                : CheckOutcome.pass("DMARC policy p=" + policy);
        return outcome.with("policy", policy);
    }
}
