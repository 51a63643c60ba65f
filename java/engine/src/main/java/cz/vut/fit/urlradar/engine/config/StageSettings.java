package cz.vut.fit.urlradar.engine.config;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.List;

/**
 * The models of an ensemble stage with their weights and the stage time budget.
 *
 * @param models  The model identifiers, in invocation order.
 * @param weights The weights, in the same order, summing to 1.
 * @param budget  The time budget of the whole stage.
 */
public record StageSettings(@NotNull List<String> models,
                            @NotNull List<Double> weights,
                            @NotNull Duration budget) {

    public StageSettings {
        models = List.copyOf(models);
        weights = List.copyOf(weights);
    }

    public double weightOf(int index) {
        return weights.get(index);
    }
}
