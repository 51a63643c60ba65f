package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;

/**
 * Indicators of malware delivery in the page.
 */
public class MalwareCategory extends BaseCategory {
    public static final String ID = "malware";

    public MalwareCategory() {
        super(ID, "Malware Detection");
        pageCheck("malware_hidden_iframes", "Hidden Frames", 15, MalwareCategory::hiddenIframes);
        pageCheck("malware_suspicious_apis", "Suspicious Script APIs", 15, MalwareCategory::suspiciousApis);
        pageCheck("malware_drive_by", "Drive-by Download", 15, MalwareCategory::driveBy);
    }

    private static CheckOutcome hiddenIframes(CheckContext context) {
        final int hidden = context.dom().hiddenIframeCount();
        if (hidden > 0)
            return CheckOutcome.fail(hidden + " hidden frame(s)").with("hiddenIframes", hidden);
        return CheckOutcome.pass("No hidden frames");
    }

    private static CheckOutcome suspiciousApis(CheckContext context) {
        final var apis = context.dom().suspiciousScriptApis();
        return graded(apis.size(), 3, 8, "No sensitive script APIs",
                "Inline scripts use " + String.join(", ", apis))
                .with("apis", apis);
    }

    private static CheckOutcome driveBy(CheckContext context) {
        if (!context.dom().autoDownload())
            return CheckOutcome.pass("No drive-by download");
        if (context.youngDomain() || !context.https())
            return CheckOutcome.fail("Automatic download from a "
                    + (context.youngDomain() ? "newly registered" : "plain-HTTP") + " site");
        return CheckOutcome.warn(5, "Automatic download");
    }
}
