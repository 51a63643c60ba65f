package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.engine.features.UrlLexicon;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;

import java.util.List;

public class IdentityTheftCategory extends BaseCategory {
    public static final String ID = "identity_theft";

    private static final List<String> PII_TERMS = List.of(
            "social security", "ssn", "passport", "driver's license", "drivers license", "national id",
            "date of birth", "mother's maiden", "maiden name");
    private static final List<String> ID_DOCUMENT_TERMS = List.of(
            "upload your id", "photo of your id", "id card", "identity document", "selfie", "passport scan",
            "verify your identity");

    public IdentityTheftCategory() {
        super(ID, "Identity Theft");
        check("identity_pii_collection", "Personal Data Requests", 10, IdentityTheftCategory::pii, EvidenceKind.HTML);
        check("identity_document_upload", "Identity Document Upload", 10, IdentityTheftCategory::documentUpload,
                EvidenceKind.HTML);
    }

    private static CheckOutcome pii(CheckContext context) {
        final var found = UrlLexicon.matches(PII_TERMS, context.pageText());
        return graded(found.size(), 2, 5, "No requests for identity data",
                "Page asks for " + String.join(", ", found))
                .with("terms", found);
    }

    private static CheckOutcome documentUpload(CheckContext context) {
        final var terms = UrlLexicon.matches(ID_DOCUMENT_TERMS, context.pageText());
        final boolean fileInput = context.dom().forms().stream()
                .anyMatch(form -> form.inputTypes().contains("file"));
        if (terms.isEmpty())
            return CheckOutcome.pass("No identity document requests");
        if (fileInput)
            return CheckOutcome.fail("Page asks to upload an identity document").with("terms", terms);
        return CheckOutcome.warn(5, "Page mentions identity verification").with("terms", terms);
    }
}
