package cz.vut.fit.urlradar.engine.checks;

import cz.vut.fit.urlradar.engine.checks.categories.BehavioralCategory;
import cz.vut.fit.urlradar.engine.checks.categories.BrandImpersonationCategory;
import cz.vut.fit.urlradar.engine.checks.categories.ContentCategory;
import cz.vut.fit.urlradar.engine.checks.categories.DomainCategory;
import cz.vut.fit.urlradar.engine.checks.categories.EmailSecurityCategory;
import cz.vut.fit.urlradar.engine.checks.categories.FinancialFraudCategory;
import cz.vut.fit.urlradar.engine.checks.categories.HeadersCategory;
import cz.vut.fit.urlradar.engine.checks.categories.IdentityTheftCategory;
import cz.vut.fit.urlradar.engine.checks.categories.LegalCategory;
import cz.vut.fit.urlradar.engine.checks.categories.MalwareCategory;
import cz.vut.fit.urlradar.engine.checks.categories.PhishingCategory;
import cz.vut.fit.urlradar.engine.checks.categories.PrivacyCategory;
import cz.vut.fit.urlradar.engine.checks.categories.SocialEngineeringCategory;
import cz.vut.fit.urlradar.engine.checks.categories.TechnicalExploitsCategory;
import cz.vut.fit.urlradar.engine.checks.categories.ThreatIntelCategory;
import cz.vut.fit.urlradar.engine.checks.categories.TlsCategory;
import cz.vut.fit.urlradar.engine.checks.categories.TrustCategory;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * The built-in check categories, in report order.
 *
 * @author URLRadar developers
 */
public final class CategoryRegistry {
    private CategoryRegistry() {
    }

    public static @NotNull List<Category> defaults() {
        return List.of(
                new ThreatIntelCategory(),
                new DomainCategory(),
                new TlsCategory(),
                new ContentCategory(),
                new PhishingCategory(),
                new BehavioralCategory(),
                new TrustCategory(),
                new MalwareCategory(),
                new SocialEngineeringCategory(),
                new HeadersCategory(),
                new EmailSecurityCategory(),
                new PrivacyCategory(),
                new FinancialFraudCategory(),
                new IdentityTheftCategory(),
                new TechnicalExploitsCategory(),
                new LegalCategory(),
                new BrandImpersonationCategory());
    }
}
