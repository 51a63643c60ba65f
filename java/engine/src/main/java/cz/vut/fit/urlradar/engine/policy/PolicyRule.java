package cz.vut.fit.urlradar.engine.policy;

import cz.vut.fit.urlradar.models.RiskLevel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A hard override rule. Rules are evaluated in a fixed order and the first matching rule wins.
 */
public interface PolicyRule {
    /**
     * The stable rule identifier, also used in the configuration keys.
     */
    @NotNull String id();

    /**
     * The risk level the rule overrides to unless configured otherwise.
     */
    @NotNull RiskLevel defaultLevel();

    /**
     * Evaluates the rule.
     *
     * @param context The inputs.
     * @return A human-readable reason when the rule matches, null otherwise.
     */
    @Nullable String evaluate(@NotNull PolicyContext context);
}
