package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.engine.features.UrlLexicon;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;

import java.util.List;

/**
 * Legal disclosures an operator of a legitimate site usually publishes.
 */
public class LegalCategory extends BaseCategory {
    public static final String ID = "legal";

    private static final List<String> TERMS = List.of("terms of service", "terms of use", "terms and conditions");
    private static final List<String> CONTACT = List.of("contact us", "contact", "imprint", "impressum", "about us");
    private static final List<String> RESTRICTED = List.of("casino", "betting", "poker", "slots", "xxx", "porn", "adult");
    private static final List<String> AGE_GATE = List.of("18+", "over 18", "age verification", "verify your age");

    public LegalCategory() {
        super(ID, "Legal and Compliance");
        check("legal_terms_of_service", "Terms of Service", 10,
                context -> disclosure(context, TERMS, "Terms of service"), EvidenceKind.HTML);
        check("legal_contact_info", "Contact Information", 10,
                context -> disclosure(context, CONTACT, "Contact information"), EvidenceKind.HTML);
        check("legal_gambling_adult", "Restricted Content", 15, LegalCategory::restricted, EvidenceKind.HTML);
    }

    private static CheckOutcome disclosure(CheckContext context, List<String> phrases, String label) {
        if (UrlLexicon.matches(phrases, context.pageText()).isEmpty())
            return CheckOutcome.warn(5, label + " not found");
        return CheckOutcome.pass(label + " present");
    }

    private static CheckOutcome restricted(CheckContext context) {
        final var found = UrlLexicon.matches(RESTRICTED, context.pageText());
        if (found.isEmpty())
            return CheckOutcome.pass("No gambling or adult content");
        if (UrlLexicon.matches(AGE_GATE, context.pageText()).isEmpty())
            return CheckOutcome.fail("Gambling or adult content without age verification").with("terms", found);
        return CheckOutcome.info("Gambling or adult content behind an age gate").with("terms", found);
    }
}
