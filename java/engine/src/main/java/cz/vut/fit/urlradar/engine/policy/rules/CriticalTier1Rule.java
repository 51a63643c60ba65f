package cz.vut.fit.urlradar.engine.policy.rules;

import cz.vut.fit.urlradar.engine.policy.PolicyContext;
import cz.vut.fit.urlradar.engine.policy.PolicyRule;
import cz.vut.fit.urlradar.models.RiskLevel;
import cz.vut.fit.urlradar.models.intel.Severity;
import cz.vut.fit.urlradar.models.intel.SourceTier;
import cz.vut.fit.urlradar.models.intel.TIFinding;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class CriticalTier1Rule implements PolicyRule {
    public static final String ID = "CRITICAL_TIER1_HIT";

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
        if (!context.intel().criticalTier1())
            return null;

        final var source = context.intel().findings().stream()
                .filter(f -> f.tier() == SourceTier.TIER_1 && f.severity() == Severity.CRITICAL)
                .map(TIFinding::source)
                .findFirst()
                .orElse("tier-1 source");
        return "Critical threat reported by " + source;
    }
}
