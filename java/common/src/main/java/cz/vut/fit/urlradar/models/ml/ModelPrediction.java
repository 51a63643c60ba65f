package cz.vut.fit.urlradar.models.ml;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The output of a single model invocation.
 *
 * @param modelId     The model identifier.
 * @param kind        The predictor variant that produced the prediction.
 * @param probability Probability of malicious intent (0-1).
 * @param confidence  Confidence of the model in the probability (0-1).
 * @param explanation Optional structured explanation.
 * @param latencyMs   The time spent on the invocation.
 * @param error       The failure reason when the model could not produce a real prediction.
 */
public record ModelPrediction(@NotNull String modelId,
                              @NotNull PredictorKind kind,
                              double probability,
                              double confidence,
                              @Nullable ModelExplanation explanation,
                              long latencyMs,
                              @Nullable String error) {

    /**
     * Creates a neutral zero-confidence prediction standing in for a failed invocation.
     */
    public static ModelPrediction failed(@NotNull String modelId, @NotNull PredictorKind kind,
                                         @NotNull String error, long latencyMs) {
        return new ModelPrediction(modelId, kind, 0.5, 0.0, null, latencyMs, error);
    }

    public ModelPrediction withLatency(long newLatencyMs) {
        return new ModelPrediction(modelId, kind, probability, confidence, explanation, newLatencyMs, error);
    }
}
