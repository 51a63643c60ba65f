package cz.vut.fit.urlradar.models.ml;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * A structured explanation attached to a prediction.
 *
 * @param featureImportances Contribution of named inputs to the probability.
 * @param detectedTactics    Persuasion tactics or indicators the model detected.
 */
public record ModelExplanation(@NotNull Map<String, Double> featureImportances,
                               @NotNull List<String> detectedTactics) {

    public ModelExplanation {
        featureImportances = Map.copyOf(featureImportances);
        detectedTactics = List.copyOf(detectedTactics);
    }
}
