package cz.vut.fit.urlradar.engine.policy.rules;

import cz.vut.fit.urlradar.engine.policy.PolicyContext;
import cz.vut.fit.urlradar.engine.policy.PolicyRule;
import cz.vut.fit.urlradar.models.RiskLevel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A brand named outside the brand's own infrastructure, on a young domain under a high-risk TLD.
 */
public class BrandDivergenceRule implements PolicyRule {
    public static final String ID = "BRAND_DIVERGENCE_YOUNG_RISKY_TLD";

    @Override
    public @NotNull String id() {
        return ID;
    }

    @Override
    public @NotNull RiskLevel defaultLevel() {
        return RiskLevel.D;
    }

    @Override
    public @Nullable String evaluate(@NotNull PolicyContext context) {
        final var features = context.features();
        if (features == null || !features.causal().brandInfraDivergence() || !context.youngDomain())
            return null;
        if (features.tabular().tldRiskScore() < context.config().highRiskTldScore())
            return null;

        return "Brand %s referenced on a young domain under the high-risk TLD .%s"
                .formatted(features.lexical().brandTokens(), features.tld());
    }
}
