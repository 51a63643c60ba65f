package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.engine.features.UrlLexicon;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import cz.vut.fit.urlradar.models.evidence.FormInfo;

import java.util.Objects;

/**
 * Credential harvesting on the page.
 */
public class PhishingCategory extends BaseCategory {
    public static final String ID = "phishing";

    public PhishingCategory() {
        super(ID, "Phishing Detection");
        check("phishing_login_form", "Login Form Analysis", 25, PhishingCategory::loginForm, EvidenceKind.HTML);
        check("phishing_brand_mismatch", "Brand Mismatch", 25, PhishingCategory::brandMismatch, EvidenceKind.HTML);
    }

    private static CheckOutcome loginForm(CheckContext context) {
        final var dom = context.dom();
        if (!dom.hasPasswordForm())
            return CheckOutcome.pass("No password form");

        final var targets = dom.forms().stream()
                .filter(FormInfo::hasPasswordField)
                .map(FormInfo::targetHost)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        final boolean external = dom.forms().stream()
                .anyMatch(form -> form.hasPasswordField() && form.submitsToExternal());
        if (external)
            return CheckOutcome.fail("Password form submits to another site").with("targets", targets);
        return CheckOutcome.warn(15, "Page collects a password").with("targets", targets);
    }

    private static CheckOutcome brandMismatch(CheckContext context) {
        final var dom = context.dom();
        final var domain = context.registrableDomain();
        final var inTitle = UrlLexicon.foreignBrands(UrlLexicon.brandsIn(dom.title()), domain);
        final var inPage = UrlLexicon.foreignBrands(UrlLexicon.brandsIn(context.pageText()), domain);

        if (!inPage.isEmpty() && dom.hasPasswordForm())
            return CheckOutcome.fail("Page asks for a password on behalf of " + String.join(", ", inPage)
                            + " but is hosted on " + domain)
                    .with("brands", inPage);
        if (!inTitle.isEmpty())
            return CheckOutcome.warn(15, "Title names " + String.join(", ", inTitle) + " but the site is " + domain)
                    .with("brands", inTitle);
        return CheckOutcome.pass("No foreign brand presented");
    }
}
