package cz.vut.fit.urlradar.models.ml;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * One step of the decision graph.
 *
 * @param component    The contributing component (e.g. "stage1", "causal", "branch-correction").
 * @param weight       The weight applied to the component's value (1 for additive adjustments).
 * @param value        The raw value of the component.
 * @param contribution The signed contribution to the final probability.
 * @param timestamp    When the step was recorded.
 * @param note         An optional human-readable note.
 */
public record DecisionGraphEntry(@NotNull String component,
                                 double weight,
                                 double value,
                                 double contribution,
                                 @NotNull Instant timestamp,
                                 @Nullable String note) {
}
