package cz.vut.fit.urlradar.models.ml;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * The outcome of an ensemble stage.
 *
 * @param stage       The stage name ("stage1" or "stage2").
 * @param predictions The individual model predictions, in configuration order.
 * @param probability The weighted probability.
 * @param confidence  The combined confidence.
 * @param shouldExit  True if the stage is confident enough to skip the following stage.
 * @param timedOut    True if the stage budget expired before all models answered.
 * @param latencyMs   The time spent on the stage.
 */
public record StageResult(@NotNull String stage,
                          @NotNull List<ModelPrediction> predictions,
                          double probability,
                          double confidence,
                          boolean shouldExit,
                          boolean timedOut,
                          long latencyMs) {

    public StageResult {
        predictions = List.copyOf(predictions);
    }
}
