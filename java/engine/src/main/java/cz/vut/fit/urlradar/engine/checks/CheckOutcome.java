package cz.vut.fit.urlradar.engine.checks;

import cz.vut.fit.urlradar.models.checks.CheckStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The result of evaluating a check, before it is scored against the check's maximum.
 *
 * @param status        The status; null when the check could not evaluate its subject.
 * @param points        The earned points; null means the maximum of the check.
 * @param description   The human-readable description.
 * @param evidence      The evidence snapshot.
 */
public record CheckOutcome(@Nullable CheckStatus status,
                           @Nullable Integer points,
                           @NotNull String description,
                           @NotNull Map<String, Object> evidence) {

    public CheckOutcome {
        evidence = Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }

    public static CheckOutcome pass(@NotNull String description) {
        return new CheckOutcome(CheckStatus.PASS, null, description, Map.of());
    }

    public static CheckOutcome warn(int points, @NotNull String description) {
        return new CheckOutcome(CheckStatus.WARN, points, description, Map.of());
    }

    public static CheckOutcome fail(@NotNull String description) {
        return new CheckOutcome(CheckStatus.FAIL, 0, description, Map.of());
    }

    /**
     * A neutral fact that costs no points.
     */
    public static CheckOutcome info(@NotNull String description) {
        return new CheckOutcome(CheckStatus.INFO, null, description, Map.of());
    }

    /**
     * The subject of the check is unknown although the evidence was collected (e.g. a missing creation date).
     * Reported as a skipped check.
     */
    public static CheckOutcome notEvaluated(@NotNull String reason) {
        return new CheckOutcome(null, 0, reason, Map.of());
    }

    public boolean evaluated() {
        return status != null;
    }

    /**
     * Returns a copy with the entry added to the evidence snapshot.
     */
    public CheckOutcome with(@NotNull String key, @Nullable Object value) {
        final var copy = new LinkedHashMap<>(evidence);
        copy.put(key, value);
        return new CheckOutcome(status, points, description, copy);
    }
}
