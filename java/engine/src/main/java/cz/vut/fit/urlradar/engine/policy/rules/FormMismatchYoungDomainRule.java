package cz.vut.fit.urlradar.engine.policy.rules;

import cz.vut.fit.urlradar.engine.policy.PolicyContext;
import cz.vut.fit.urlradar.engine.policy.PolicyRule;
import cz.vut.fit.urlradar.models.RiskLevel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A form submitting to another origin on a freshly registered domain.
 */
public class FormMismatchYoungDomainRule implements PolicyRule {
    public static final String ID = "FORM_MISMATCH_YOUNG_DOMAIN";

    @Override
    public @NotNull String id() {
        return ID;
    }

    @Override
    public @NotNull RiskLevel defaultLevel() {
        return RiskLevel.E;
    }

    @Override
    public @Nullable String evaluate(@NotNull PolicyContext context) {
        final var features = context.features();
        if (features == null || !features.causal().formOriginMismatch() || !context.youngDomain())
            return null;
        return "A form submits to a different origin on a domain registered %d days ago"
                .formatted(features.tabular().domainAgeDays());
    }
}
