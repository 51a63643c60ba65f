package cz.vut.fit.urlradar.models.ml;

import org.jetbrains.annotations.NotNull;

/**
 * The variant of a model predictor.
 */
public enum PredictorKind {
    /**
     * Inference on a trained model served by an endpoint.
     */
    TRAINED("trained"),
    /**
     * Rule-based heuristics standing in for a trained model.
     */
    HEURISTIC_FALLBACK("heuristic-fallback");

    private final String _configName;

    PredictorKind(String configName) {
        _configName = configName;
    }

    public String configName() {
        return _configName;
    }

    /**
     * Parses the configuration name of a variant.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static PredictorKind fromConfig(@NotNull String value) {
        for (var kind : values()) {
            if (kind._configName.equalsIgnoreCase(value.trim()))
                return kind;
        }
        throw new IllegalArgumentException("Unknown model predictor variant: " + value);
    }
}
