package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;

/**
 * Reputation of the URL in the threat-intelligence sources. Runs on every branch.
 */
public class ThreatIntelCategory extends BaseCategory {
    public static final String ID = "threat_intel";

    public ThreatIntelCategory() {
        super(ID, "Threat Intelligence");
        urlCheck("ti_hits", "Threat Intelligence Database Lookup", 10, ThreatIntelCategory::hits);
        urlCheck("ti_tier1", "Premium Threat Intelligence Sources", 15, ThreatIntelCategory::tier1);
    }

    private static CheckOutcome hits(CheckContext context) {
        final var intel = context.intel();
        if (intel.hasHits())
            return CheckOutcome.fail("Found in " + intel.totalHits() + " threat database(s)")
                    .with("totalHits", intel.totalHits())
                    .with("tier1Hits", intel.tier1Hits());
        if (!intel.sources().isEmpty() && intel.unavailableSources().size() == intel.sources().size())
            return CheckOutcome.notEvaluated("no threat intelligence source answered");

        return CheckOutcome.pass("No threat intelligence hits found")
                .with("unavailableSources", intel.unavailableSources());
    }

    private static CheckOutcome tier1(CheckContext context) {
        final var intel = context.intel();
        if (intel.tier1Hits() > 0)
            return CheckOutcome.fail("Flagged by " + intel.tier1Hits() + " tier-1 source(s): "
                            + String.join(", ", intel.tier1Sources()))
                    .with("sources", intel.tier1Sources());
        return CheckOutcome.pass("No tier-1 threat intelligence hits");
    }
}
