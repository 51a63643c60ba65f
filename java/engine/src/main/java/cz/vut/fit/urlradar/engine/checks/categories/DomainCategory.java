package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.engine.features.TldRisk;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;

import java.util.List;
import java.util.Locale;

/**
 * Registration data and the top-level domain.
 */
public class DomainCategory extends BaseCategory {
    public static final String ID = "domain";

    private static final int ESTABLISHED_DAYS = 90;
    private static final List<String> ABUSED_REGISTRARS = List.of(
            "namecheap", "godaddy privacy", "whoisguard", "domains by proxy", "privacyguardian", "njalla");

    public DomainCategory() {
        super(ID, "Domain, WHOIS and TLD Analysis");
        check("domain_age", "Domain Age Analysis", 10, DomainCategory::domainAge, EvidenceKind.WHOIS);
        check("whois_privacy", "WHOIS Privacy Protection", 10, DomainCategory::privacy, EvidenceKind.WHOIS);
        urlCheck("tld_risk", "Top-Level Domain Risk", 10, DomainCategory::tldRisk);
        check("registrar_reputation", "Registrar Reputation", 10, DomainCategory::registrar, EvidenceKind.WHOIS);
    }

    private static CheckOutcome domainAge(CheckContext context) {
        final var whois = context.evidence().whois();
        if (whois == null || whois.domainAgeDays() == null)
            return CheckOutcome.notEvaluated("creation date unknown");

        final int age = whois.domainAgeDays();
        final CheckOutcome outcome;
        if (context.youngDomain())
            outcome = CheckOutcome.fail("Domain is " + age + " days old (very new)");
        else if (age < ESTABLISHED_DAYS)
            outcome = CheckOutcome.warn(5, "Domain is " + age + " days old (relatively new)");
        else
            outcome = CheckOutcome.pass("Domain is " + age + " days old (established)");
        return outcome.with("domainAgeDays", age).with("createdAt", whois.createdAt());
    }

    private static CheckOutcome privacy(CheckContext context) {
        final var whois = context.evidence().whois();
        if (whois != null && whois.privacyProtected())
            return CheckOutcome.warn(5, "Registrant identity is hidden by a privacy service")
                    .with("registrar", whois.registrar());
        return CheckOutcome.pass("Registration information is public");
    }

    private static CheckOutcome tldRisk(CheckContext context) {
        final var tld = context.features().tld();
        if (tld.isEmpty())
            return CheckOutcome.info("The host is an IP address");

        final double score = context.features().tabular().tldRiskScore();
        final CheckOutcome outcome;
        if (score >= TldRisk.HIGH)
            outcome = CheckOutcome.fail("High-risk TLD ." + tld + " (commonly used for abuse)");
        else if (score >= context.config().highRiskTldScore())
            outcome = CheckOutcome.warn(5, "Elevated-risk TLD ." + tld);
        else
            outcome = CheckOutcome.pass("Standard TLD ." + tld);
        return outcome.with("tld", tld).with("score", score);
    }

    private static CheckOutcome registrar(CheckContext context) {
        final var whois = context.evidence().whois();
        final var registrar = whois == null ? null : whois.registrar();
        if (registrar == null || registrar.isBlank())
            return CheckOutcome.info("Registrar unknown");

        final var lower = registrar.toLowerCase(Locale.ROOT);
        if (ABUSED_REGISTRARS.stream().anyMatch(lower::contains))
            return CheckOutcome.warn(5, "Registrar frequently used for abusive registrations: " + registrar)
                    .with("registrar", registrar);
        return CheckOutcome.info("Registrar: " + registrar).with("registrar", registrar);
    }
}
