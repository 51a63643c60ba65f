package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.engine.features.PersuasionTactics;
import cz.vut.fit.urlradar.engine.features.UrlLexicon;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;

/**
 * Page content: credential prompts, outbound links, frames and scripts.
 */
public class ContentCategory extends BaseCategory {
    public static final String ID = "content";

    private static final int MAX_EXTERNAL_LINKS = 20;

    public ContentCategory() {
        super(ID, "Content Analysis");
        check("content_keywords", "Credential Keywords", 10, ContentCategory::keywords, EvidenceKind.HTML);
        pageCheck("content_external_links", "External Links", 10, ContentCategory::externalLinks);
        pageCheck("content_iframes", "Embedded Frames", 10, ContentCategory::iframes);
        pageCheck("content_scripts", "Script Analysis", 10, ContentCategory::scripts);
    }

    private static CheckOutcome keywords(CheckContext context) {
        final var found = UrlLexicon.matches(PersuasionTactics.CREDENTIAL_KEYWORDS, context.pageText());
        return graded(found.size(), 2, 5, "No credential prompts in the page text",
                "Page asks for " + String.join(", ", found))
                .with("keywords", found);
    }

    private static CheckOutcome externalLinks(CheckContext context) {
        final var dom = context.dom();
        final int external = dom.externalLinkCount();
        final var outcome = external > MAX_EXTERNAL_LINKS
                ? CheckOutcome.warn(5, external + " of " + dom.linkCount() + " links leave the site")
                : CheckOutcome.pass(external + " of " + dom.linkCount() + " links leave the site");
        return outcome.with("externalLinks", external).with("externalDomains", dom.externalDomains());
    }

    private static CheckOutcome iframes(CheckContext context) {
        final var dom = context.dom();
        if (dom.iframeCount() == 0)
            return CheckOutcome.pass("No embedded frames");
        return CheckOutcome.warn(5, dom.iframeCount() + " embedded frame(s)")
                .with("iframes", dom.iframeCount());
    }

    private static CheckOutcome scripts(CheckContext context) {
        final var dom = context.dom();
        final CheckOutcome outcome;
        if (dom.obfuscatedScripts())
            outcome = CheckOutcome.fail("Obfuscated inline JavaScript detected");
        else
            outcome = CheckOutcome.pass(dom.scriptCount() + " script(s), none obfuscated");
        return outcome.with("scripts", dom.scriptCount()).with("externalScripts", dom.externalScriptCount());
    }
}
