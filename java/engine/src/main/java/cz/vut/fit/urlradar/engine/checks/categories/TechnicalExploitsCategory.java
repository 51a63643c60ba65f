package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.engine.features.UrlLexicon;

public class TechnicalExploitsCategory extends BaseCategory {
    public static final String ID = "technical_exploits";

    public TechnicalExploitsCategory() {
        super(ID, "Technical Exploits");
        urlCheck("technical_ip_literal_host", "IP Address Host", 5, TechnicalExploitsCategory::ipLiteral);
        urlCheck("technical_suspicious_path", "Suspicious Path", 5, TechnicalExploitsCategory::suspiciousPath);
        pageCheck("technical_mixed_content", "Mixed Content", 5, TechnicalExploitsCategory::mixedContent);
    }

    private static CheckOutcome ipLiteral(CheckContext context) {
        if (context.features().lexical().ipLiteralHost())
            return CheckOutcome.fail("URL uses a raw IP address instead of a domain name");
        return CheckOutcome.pass("URL uses a domain name");
    }

    private static CheckOutcome suspiciousPath(CheckContext context) {
        final var found = UrlLexicon.matches(UrlLexicon.SUSPICIOUS_PATH_KEYWORDS, context.pathAndQuery());
        return graded(found.size(), 2, 2, "Path looks ordinary",
                "Path contains " + String.join(", ", found))
                .with("patterns", found);
    }

    private static CheckOutcome mixedContent(CheckContext context) {
        if (context.dom().mixedContent())
            return CheckOutcome.fail("Secure page loads resources over plain HTTP");
        return CheckOutcome.pass("No mixed content");
    }
}
