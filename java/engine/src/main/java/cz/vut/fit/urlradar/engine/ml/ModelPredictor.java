package cz.vut.fit.urlradar.engine.ml;

import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.ml.ModelPrediction;
import cz.vut.fit.urlradar.models.ml.PredictorKind;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Invokes a classification model. The same interface serves the Stage-1 and Stage-2 models regardless of
 * how they are served. Implementations must be safe to call concurrently.
 */
public interface ModelPredictor {
    /**
     * The variant of this predictor.
     */
    @NotNull PredictorKind kind();

    /**
     * Invokes the model.
     *
     * @param modelId  The model identifier (e.g. {@code lexical-a}).
     * @param features The feature vector.
     * @return A future of the prediction, completed exceptionally with a
     * {@link cz.vut.fit.urlradar.engine.CollaboratorException} when the model cannot answer.
     */
    @NotNull CompletableFuture<ModelPrediction> predict(@NotNull String modelId, @NotNull FeatureVector features);
}
