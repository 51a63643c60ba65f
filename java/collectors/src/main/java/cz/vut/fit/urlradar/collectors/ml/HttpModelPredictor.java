package cz.vut.fit.urlradar.collectors.ml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.ml.ModelPredictor;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.ml.ModelExplanation;
import cz.vut.fit.urlradar.models.ml.ModelPrediction;
import cz.vut.fit.urlradar.models.ml.PredictorKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Invokes trained models served behind an HTTP endpoint. The feature vector is posted as JSON to
 * {@code <endpoint>/models/<modelId>/predict}; the endpoint answers with the probability, the confidence
 * and an optional explanation.
 *
 * @author URLRadar developers
 */
public class HttpModelPredictor implements ModelPredictor {
    public static final String COMPONENT_NAME = "model-endpoint";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(HttpModelPredictor.class);

    record PredictionRequest(@NotNull String model, @NotNull FeatureVector features) {
    }

    record PredictionResponse(@Nullable Double probability, @Nullable Double confidence,
                              @Nullable ModelExplanation explanation) {
    }

    private final String _endpoint;
    private final String _token;
    private final Duration _timeout;
    private final ObjectMapper _mapper;
    private final HttpClient _client;

    public HttpModelPredictor(@NotNull ConfigSnapshot config) {
        this(config.modelsEndpoint(), config.modelsToken(), config.modelsTimeout());
    }

    public HttpModelPredictor(@NotNull String endpoint, @NotNull String token, @NotNull Duration timeout) {
        _endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        _token = token;
        _timeout = timeout;
        _mapper = Common.makeMapper().build();
        _client = this.buildHttpClient();
    }

    protected HttpClient buildHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(_timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Override
    public @NotNull PredictorKind kind() {
        return PredictorKind.TRAINED;
    }

    @Override
    public @NotNull CompletableFuture<ModelPrediction> predict(@NotNull String modelId,
                                                               @NotNull FeatureVector features) {
        if (_endpoint.isBlank())
            return CompletableFuture.failedFuture(new CollaboratorException(ResultCodes.DISABLED,
                    "No model endpoint configured"));

        final byte[] body;
        try {
            body = _mapper.writeValueAsBytes(new PredictionRequest(modelId, features));
        } catch (JsonProcessingException e) {
            Logger.warn("Cannot serialize the features of {}", features.url(), e);
            return CompletableFuture.failedFuture(new CollaboratorException(ResultCodes.INTERNAL_ERROR,
                    e.getMessage(), e));
        }

        final var requestBuilder = HttpRequest.newBuilder()
                .uri(URI.create(_endpoint + "/models/" + modelId + "/predict"))
                .timeout(_timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        if (!_token.isBlank())
            requestBuilder.header("Authorization", "Bearer " + _token);

        final long start = System.nanoTime();
        return _client.sendAsync(requestBuilder.build(), HttpResponse.BodyHandlers.ofString())
                .orTimeout(_timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null)
                        throw new CompletionException(mapError(modelId, error));

                    final long latency = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                    if (response.statusCode() == 429)
                        throw new CompletionException(new CollaboratorException(ResultCodes.RATE_LIMITED,
                                "Model endpoint is rate limited"));
                    if (response.statusCode() == 404)
                        throw new CompletionException(new CollaboratorException(ResultCodes.NOT_FOUND,
                                "Unknown model: " + modelId));
                    if (response.statusCode() != 200)
                        throw new CompletionException(new CollaboratorException(ResultCodes.CANNOT_FETCH,
                                "Model endpoint response " + response.statusCode()));

                    return parse(modelId, response.body(), latency);
                });
    }

    private ModelPrediction parse(String modelId, String body, long latency) {
        final PredictionResponse parsed;
        try {
            parsed = _mapper.readValue(body, PredictionResponse.class);
        } catch (JsonProcessingException e) {
            Logger.debug("Invalid response for {}: {}", modelId, e.getOriginalMessage());
            throw new CompletionException(new CollaboratorException(ResultCodes.INVALID_FORMAT,
                    "Invalid model response: " + e.getOriginalMessage(), e));
        }

        if (parsed.probability() == null || !isUnit(parsed.probability())
                || (parsed.confidence() != null && !isUnit(parsed.confidence())))
            throw new CompletionException(new CollaboratorException(ResultCodes.INVALID_FORMAT,
                    "Model " + modelId + " returned values outside [0, 1]"));

        final double confidence = parsed.confidence() == null ? 1.0 : parsed.confidence();
        return new ModelPrediction(modelId, PredictorKind.TRAINED, parsed.probability(), confidence,
                parsed.explanation(), latency, null);
    }

    private static boolean isUnit(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    private CollaboratorException mapError(String modelId, Throwable error) {
        final Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;

        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            Logger.debug("Model {} timed out", modelId);
            return new CollaboratorException(ResultCodes.TIMEOUT,
                    "Model request timed out (%d ms)".formatted(_timeout.toMillis()), cause);
        } else if (cause instanceof IOException) {
            Logger.debug("Model {} request failed: {}", modelId, cause.getMessage());
            return new CollaboratorException(ResultCodes.CANNOT_FETCH, cause.getMessage(), cause);
        } else {
            Logger.warn("Unexpected error invoking model {}", modelId, cause);
            return new CollaboratorException(ResultCodes.INTERNAL_ERROR, cause.getMessage(), cause);
        }
    }
}
