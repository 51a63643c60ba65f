package cz.vut.fit.urlradar.engine.policy.rules;

import cz.vut.fit.urlradar.engine.policy.PolicyContext;
import cz.vut.fit.urlradar.engine.policy.PolicyRule;
import cz.vut.fit.urlradar.models.RiskLevel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class DualTier1Rule implements PolicyRule {
    public static final String ID = "DUAL_TIER1_HITS";

    @Override
    public @NotNull String id() {
        return ID;
    }

    @Override
    public @NotNull RiskLevel defaultLevel() {
        return RiskLevel.F;
    }

    @Override
    public @Nullable String evaluate(@NotNull PolicyContext context) {
        final var intel = context.intel();
        if (!intel.dualTier1())
            return null;
        return "Reported by %d tier-1 threat intelligence sources (%s)"
                .formatted(intel.tier1Hits(), String.join(", ", intel.tier1Sources()));
    }
}
