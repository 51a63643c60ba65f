package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.engine.features.DomainNames;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;

/**
 * What the page does without user interaction.
 */
public class BehavioralCategory extends BaseCategory {
    public static final String ID = "behavioral";

    private static final int MAX_REDIRECTS = 3;

    public BehavioralCategory() {
        super(ID, "Behavioral Analysis");
        pageCheck("behavioral_auto_download", "Automatic Downloads", 15, BehavioralCategory::autoDownload);
        check("behavioral_redirect", "Redirect Behavior", 10, BehavioralCategory::redirects, EvidenceKind.HTML);
    }

    private static CheckOutcome autoDownload(CheckContext context) {
        if (context.dom().autoDownload())
            return CheckOutcome.fail("Page starts a download without user interaction");
        return CheckOutcome.pass("No automatic download");
    }

    private static CheckOutcome redirects(CheckContext context) {
        final int redirects = context.features().tabular().redirectCount();
        final var refresh = context.dom().metaRefreshTarget();
        final var refreshHost = DomainNames.hostOf(refresh);
        final boolean externalRefresh = refreshHost != null
                && !DomainNames.registrableDomain(refreshHost).equals(context.registrableDomain());

        final CheckOutcome outcome;
        if (redirects > MAX_REDIRECTS)
            outcome = CheckOutcome.warn(5, "Followed " + redirects + " redirects");
        else if (externalRefresh)
            outcome = CheckOutcome.warn(5, "Meta refresh sends visitors to " + refreshHost);
        else
            outcome = CheckOutcome.pass("No suspicious redirects");
        return outcome.with("redirects", redirects).with("metaRefresh", refresh);
    }
}
