package cz.vut.fit.urlradar.engine.ml;

import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.config.ConfigurationException;
import cz.vut.fit.urlradar.models.ml.PredictorKind;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The available predictor variants. The variant used by a scan is chosen by the configuration.
 *
 * @author URLRadar developers
 */
public class PredictorRegistry {
    private final Map<PredictorKind, ModelPredictor> _predictors;

    public PredictorRegistry(@NotNull ModelPredictor... predictors) {
        final var map = new EnumMap<PredictorKind, ModelPredictor>(PredictorKind.class);
        for (var predictor : predictors) {
            map.put(predictor.kind(), predictor);
        }
        _predictors = Collections.unmodifiableMap(map);
    }

    /**
     * A registry with only the heuristic variant.
     */
    public static PredictorRegistry heuristicOnly() {
        return new PredictorRegistry(new HeuristicModelPredictor());
    }

    /**
     * Returns the predictor selected by the configuration.
     *
     * @throws ConfigurationException if the selected variant is not registered
     */
    public @NotNull ModelPredictor forConfig(@NotNull ConfigSnapshot config) {
        final var predictor = _predictors.get(config.predictorKind());
        if (predictor == null)
            throw new ConfigurationException("No model predictor registered for the '"
                    + config.predictorKind().configName() + "' variant");
        return predictor;
    }
}
