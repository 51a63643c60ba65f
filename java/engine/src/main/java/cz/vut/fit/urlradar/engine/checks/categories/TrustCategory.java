package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;

/**
 * The network the site is served from.
 */
public class TrustCategory extends BaseCategory {
    public static final String ID = "trust";

    public TrustCategory() {
        super(ID, "Trust Signals");
        check("trust_asn_reputation", "ASN Reputation", 15, TrustCategory::asn, EvidenceKind.NETWORK);
        check("trust_hosting_type", "Hosting Type", 15, TrustCategory::hosting, EvidenceKind.NETWORK);
    }

    private static CheckOutcome asn(CheckContext context) {
        final var network = context.evidence().network();
        if (network.asn() == null)
            return CheckOutcome.warn(10, "Address " + network.ip() + " has no known autonomous system")
                    .with("ip", network.ip());
        return CheckOutcome.pass("Served from AS" + network.asn()
                        + (network.organization() == null ? "" : " (" + network.organization() + ")"))
                .with("asn", network.asn())
                .with("organization", network.organization());
    }

    private static CheckOutcome hosting(CheckContext context) {
        final var network = context.evidence().network();
        if (network.hosting())
            return CheckOutcome.warn(7, "Served from shared hosting or cloud infrastructure")
                    .with("organization", network.organization());
        return CheckOutcome.pass("Served from dedicated infrastructure");
    }
}
