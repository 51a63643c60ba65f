package cz.vut.fit.urlradar.collectors.ml;

import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.Futures;
import cz.vut.fit.urlradar.engine.features.FeatureExtractor;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.evidence.EvidenceBundle;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.intel.TISummary;
import cz.vut.fit.urlradar.models.ml.PredictorKind;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HttpModelPredictorTest {
    private static final String URL = "https://paypal-account-verify.top/signin";

    private HttpClient httpClient;
    private FeatureVector features;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        features = new FeatureExtractor().extract(URL, ReachabilityResult.of(ReachabilityStatus.OFFLINE),
                EvidenceBundle.empty(ReachabilityStatus.OFFLINE, Map.of()), TISummary.empty());
    }

    private HttpModelPredictor predictor(String endpoint) {
        return new HttpModelPredictor(endpoint, "model-token", Duration.ofSeconds(2)) {
            @Override
            protected HttpClient buildHttpClient() {
                return httpClient;
            }
        };
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        when(httpClient.<String>sendAsync(any(HttpRequest.class), any()))
                .thenReturn(CompletableFuture.completedFuture(response));
    }

    @Test
    void parsesThePrediction() throws Exception {
        respond(200, """
                {"probability": 0.91, "confidence": 0.8,
                 "explanation": {"featureImportances": {"brand_token": 0.4}, "detectedTactics": ["urgency"]}}
                """);

        var prediction = predictor("https://models.internal/").predict("lexical-a", features)
                .get(5, TimeUnit.SECONDS);

        assertEquals("lexical-a", prediction.modelId());
        assertEquals(PredictorKind.TRAINED, prediction.kind());
        assertEquals(0.91, prediction.probability(), 1e-9);
        assertEquals(0.8, prediction.confidence(), 1e-9);
        assertNotNull(prediction.explanation());
        assertEquals(0.4, prediction.explanation().featureImportances().get("brand_token"), 1e-9);
        assertNull(prediction.error());
    }

    @Test
    void postsTheFeaturesWithTheToken() throws Exception {
        respond(200, "{\"probability\": 0.2}");

        predictor("https://models.internal").predict("tabular", features).get(5, TimeUnit.SECONDS);

        var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).sendAsync(captor.capture(), any());
        var request = captor.getValue();
        assertEquals("https://models.internal/models/tabular/predict", request.uri().toString());
        assertEquals("POST", request.method());
        assertEquals("Bearer model-token", request.headers().firstValue("Authorization").orElseThrow());
        assertTrue(request.bodyPublisher().orElseThrow().contentLength() > 0);
    }

    @Test
    void missingConfidenceDefaultsToFull() throws Exception {
        respond(200, "{\"probability\": 0.2}");

        var prediction = predictor("https://models.internal").predict("tabular", features).get(5, TimeUnit.SECONDS);

        assertEquals(1.0, prediction.confidence(), 1e-9);
        assertNull(prediction.explanation());
    }

    @Test
    void probabilityOutsideTheUnitIntervalIsRejected() {
        respond(200, "{\"probability\": 1.7, \"confidence\": 0.5}");

        var error = assertThrows(ExecutionException.class,
                () -> predictor("https://models.internal").predict("tabular", features).get(5, TimeUnit.SECONDS));
        assertEquals(ResultCodes.INVALID_FORMAT, Futures.codeOf(error));
    }

    @Test
    void unknownModelIsNotFound() {
        respond(404, "");

        var error = assertThrows(ExecutionException.class,
                () -> predictor("https://models.internal").predict("nope", features).get(5, TimeUnit.SECONDS));
        assertEquals(ResultCodes.NOT_FOUND, Futures.codeOf(error));
    }

    @Test
    void withoutAnEndpointThePredictorIsDisabled() {
        var error = assertThrows(ExecutionException.class,
                () -> predictor("").predict("tabular", features).get(5, TimeUnit.SECONDS));
        assertEquals(ResultCodes.DISABLED, Futures.codeOf(error));
        verifyNoInteractions(httpClient);
    }
}
