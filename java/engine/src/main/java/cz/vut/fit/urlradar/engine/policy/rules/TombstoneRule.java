package cz.vut.fit.urlradar.engine.policy.rules;

import cz.vut.fit.urlradar.engine.policy.PolicyContext;
import cz.vut.fit.urlradar.engine.policy.PolicyRule;
import cz.vut.fit.urlradar.models.RiskLevel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class TombstoneRule implements PolicyRule {
    public static final String ID = "TOMBSTONE";

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
        final boolean tombstoned = context.intel().tombstoned()
                || (context.features() != null && context.features().causal().tombstone());
        return tombstoned ? "The target was previously confirmed malicious and taken down" : null;
    }
}
