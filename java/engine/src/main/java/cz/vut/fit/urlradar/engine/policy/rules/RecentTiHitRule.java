package cz.vut.fit.urlradar.engine.policy.rules;

import cz.vut.fit.urlradar.engine.policy.PolicyContext;
import cz.vut.fit.urlradar.engine.policy.PolicyRule;
import cz.vut.fit.urlradar.models.RiskLevel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class RecentTiHitRule implements PolicyRule {
    public static final String ID = "RECENT_TI_HIT";

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
        if (!context.intel().recentHit())
            return null;
        return "Reported by threat intelligence within the last %d days"
                .formatted(context.config().recencyWindowDays());
    }
}
