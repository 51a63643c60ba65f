package cz.vut.fit.urlradar.engine.ml;

import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.engine.Fixtures;
import cz.vut.fit.urlradar.engine.config.ConfigurationException;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.ml.ModelPrediction;
import cz.vut.fit.urlradar.models.ml.PredictorKind;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HeuristicModelPredictorTest {
    private final HeuristicModelPredictor predictor = new HeuristicModelPredictor();

    private ModelPrediction predict(String model, String url) {
        return predictor.predict(model, Fixtures.urlOnlyFeatures(url, ReachabilityStatus.OFFLINE)).join();
    }

    @Test
    void benignUrlScoresAtTheFloor() {
        var prediction = predict(HeuristicModelPredictor.LEXICAL_A, "https://example.com/");

        assertEquals(HeuristicModelPredictor.FLOOR, prediction.probability(), 1e-9);
        assertEquals(0.96, prediction.confidence(), 1e-9);
        assertEquals(PredictorKind.HEURISTIC_FALLBACK, prediction.kind());
        assertTrue(prediction.explanation().featureImportances().isEmpty());
    }

    @Test
    void brandWithActionTokensOnRiskyTld() {
        var prediction = predict(HeuristicModelPredictor.LEXICAL_A,
                "https://secure-login.paypal.account-verify.xyz/signin");

        assertEquals(0.62, prediction.probability(), 1e-9);
        assertTrue(prediction.explanation().featureImportances().containsKey("brand_action"));
        assertTrue(prediction.explanation().featureImportances().containsKey("tld"));
    }

    @Test
    void tabularConfidenceDropsForMissingInputs() {
        var prediction = predict(HeuristicModelPredictor.TABULAR, "https://example.com/");

        // whois, dns, tls and network are unavailable
        assertEquals(0.035, prediction.probability(), 1e-9);
        assertEquals(0.93 - 4 * 0.05, prediction.confidence(), 1e-9);
    }

    @Test
    void stage2ModelsNeedTheirInputs() {
        var text = predict(HeuristicModelPredictor.TEXT_PERSUASION, "https://example.com/");
        var screenshot = predict(HeuristicModelPredictor.SCREENSHOT, "https://example.com/");

        assertNotNull(text.error());
        assertEquals(0.0, text.confidence());
        assertNotNull(screenshot.error());
    }

    @Test
    void confidenceFormula() {
        assertEquals(1.0, HeuristicModelPredictor.confidence(0.0, 0, 1.0), 1e-9);
        assertEquals(0.0, HeuristicModelPredictor.confidence(0.5, 0, 1.0), 1e-9);
        assertEquals(0.6, HeuristicModelPredictor.confidence(0.95, 0, 0.6), 1e-9);
        assertEquals(0.0, HeuristicModelPredictor.confidence(0.55, 3, 1.0), 1e-9);
    }

    @Test
    void unknownModelFails() {
        var future = predictor.predict("no-such-model",
                Fixtures.urlOnlyFeatures("https://example.com/", ReachabilityStatus.OFFLINE));

        var error = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(CollaboratorException.class, error.getCause());
    }

    @Test
    void registrySelectsTheConfiguredVariant() {
        var trained = mock(ModelPredictor.class);
        when(trained.kind()).thenReturn(PredictorKind.TRAINED);
        var registry = new PredictorRegistry(new HeuristicModelPredictor(), trained);

        assertInstanceOf(HeuristicModelPredictor.class, registry.forConfig(Fixtures.config()));
        assertSame(trained, registry.forConfig(Fixtures.config("models.mode", "trained",
                "models.endpoint", "http://localhost:8500/v1/models")));
    }

    @Test
    void missingVariantIsAConfigurationError() {
        var config = Fixtures.config("models.mode", "trained", "models.endpoint", "http://localhost:8500/v1/models");

        assertThrows(ConfigurationException.class, () -> PredictorRegistry.heuristicOnly().forConfig(config));
    }
}
