package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.engine.features.UrlLexicon;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import cz.vut.fit.urlradar.models.evidence.FormInfo;

import java.util.List;
import java.util.Locale;

public class FinancialFraudCategory extends BaseCategory {
    public static final String ID = "financial_fraud";

    private static final List<String> PAYMENT_FIELDS = List.of(
            "card", "cc-number", "ccnum", "cvv", "cvc", "expiry", "exp-date", "cc-exp", "iban");

    public FinancialFraudCategory() {
        super(ID, "Financial Fraud");
        urlCheck("financial_banking_keywords", "Financial Terms in URL", 10, FinancialFraudCategory::urlKeywords);
        check("financial_payment_form", "Payment Form", 15, FinancialFraudCategory::paymentForm, EvidenceKind.HTML);
    }

    private static CheckOutcome urlKeywords(CheckContext context) {
        final var subject = context.ownerLabels() + " " + context.pathAndQuery();
        final var found = UrlLexicon.matches(UrlLexicon.FINANCIAL_KEYWORDS, subject).stream()
                .filter(keyword -> !UrlLexicon.isBrandDomain(keyword, context.registrableDomain()))
                .toList();
        return graded(found.size(), 2, 5, "No financial terms in the URL",
                "URL mentions " + String.join(", ", found))
                .with("keywords", found);
    }

    private static CheckOutcome paymentForm(CheckContext context) {
        final var paymentForms = context.dom().forms().stream()
                .filter(FinancialFraudCategory::collectsPayment)
                .toList();
        if (paymentForms.isEmpty())
            return CheckOutcome.pass("No payment card fields");

        final boolean external = paymentForms.stream().anyMatch(FormInfo::submitsToExternal);
        if (!context.https() || external)
            return CheckOutcome.fail("Card details are sent " + (external ? "to another site" : "over plain HTTP"));
        return CheckOutcome.warn(10, "Page collects payment card details");
    }

    private static boolean collectsPayment(FormInfo form) {
        return form.inputNames().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .anyMatch(name -> PAYMENT_FIELDS.stream().anyMatch(name::contains));
    }
}
