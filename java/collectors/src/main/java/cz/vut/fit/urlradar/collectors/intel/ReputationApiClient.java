package cz.vut.fit.urlradar.collectors.intel;

import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Sends requests to a remote reputation API and maps the JSON responses.
 * <p>
 * The returned futures complete exceptionally with a {@link CollaboratorException} carrying the result code:
 * {@code DISABLED} without a token, {@code RATE_LIMITED} for HTTP 429, {@code NOT_FOUND} for HTTP 404,
 * {@code CANNOT_FETCH} for other non-200 responses and I/O errors, {@code TIMEOUT} when the request or the
 * whole exchange exceeds the timeout, and {@code INVALID_FORMAT} when the response cannot be mapped.
 *
 * @param <TData> The data type that the response is mapped to.
 *
 * @author URLRadar developers
 */
public class ReputationApiClient<TData> {
    private final String _token;
    private final Duration _httpTimeout;
    private final boolean _disabled;
    private final HttpClient _client;

    public ReputationApiClient(@NotNull String token, @NotNull Duration timeout) {
        this(token, timeout, HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build());
    }

    public ReputationApiClient(@NotNull String token, @NotNull Duration timeout, @NotNull HttpClient client) {
        _token = token;
        _httpTimeout = timeout;
        _disabled = _token.isBlank() || _token.equals("Bearer ");
        _client = client;
    }

    /**
     * Checks if the client is disabled because no authentication token is configured.
     */
    public boolean isDisabled() {
        return _disabled;
    }

    public @NotNull String getToken() {
        return _token;
    }

    /**
     * Executes an asynchronous request.
     *
     * @param url            The request URL; null if the target cannot be queried.
     * @param authHeaderName The name of the header carrying the token, or null if the token is sent otherwise.
     * @param postData       JSON data to POST, or null for a GET request.
     * @param responseMapper Maps the JSON body of a successful response.
     * @param sourceName     The name of the source, used in error messages.
     * @param logger         The logger of the calling source.
     * @return A future of the mapped data.
     */
    public CompletableFuture<TData> execute(@Nullable String url,
                                            @Nullable String authHeaderName,
                                            @Nullable String postData,
                                            @NotNull Function<JSONObject, TData> responseMapper,
                                            @NotNull String sourceName,
                                            @NotNull org.slf4j.Logger logger) {
        if (_disabled)
            return CompletableFuture.failedFuture(new CollaboratorException(ResultCodes.DISABLED, "No token"));

        if (url == null) {
            logger.debug("Discarding unsupported target");
            return CompletableFuture.failedFuture(new CollaboratorException(ResultCodes.UNSUPPORTED_ADDRESS,
                    sourceName + " cannot query this target"));
        }

        final var requestBuilder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(_httpTimeout)
                .header("Accept", "application/json");

        if (authHeaderName != null)
            requestBuilder.header(authHeaderName, _token);

        if (postData != null) {
            requestBuilder.header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(postData));
        }

        return _client.sendAsync(requestBuilder.build(), HttpResponse.BodyHandlers.ofString())
                .orTimeout(_httpTimeout.toMillis() * 2, TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null)
                        throw new CompletionException(mapError(error, logger));

                    final int status = response.statusCode();
                    if (status == 200) {
                        try {
                            return responseMapper.apply(new JSONObject(response.body()));
                        } catch (JSONException | ClassCastException e) {
                            logger.debug("Invalid response from {}: {}", sourceName, e.getMessage());
                            throw new CompletionException(new CollaboratorException(ResultCodes.INVALID_FORMAT,
                                    "Invalid " + sourceName + " response: " + e.getMessage(), e));
                        }
                    } else if (status == 429) {
                        throw new CompletionException(new CollaboratorException(ResultCodes.RATE_LIMITED,
                                sourceName + " is rate limited"));
                    } else if (status == 404) {
                        throw new CompletionException(new CollaboratorException(ResultCodes.NOT_FOUND,
                                sourceName + " has no record"));
                    } else {
                        throw new CompletionException(new CollaboratorException(ResultCodes.CANNOT_FETCH,
                                sourceName + " response " + status));
                    }
                });
    }

    private CollaboratorException mapError(Throwable error, org.slf4j.Logger logger) {
        final Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;

        if (cause instanceof HttpConnectTimeoutException) {
            logger.debug("Connection timeout");
            return new CollaboratorException(ResultCodes.TIMEOUT,
                    "Connection timed out (%d ms)".formatted(_httpTimeout.toMillis()), cause);
        } else if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            logger.debug("Request timeout");
            return new CollaboratorException(ResultCodes.TIMEOUT,
                    "Request timed out (%d ms)".formatted(_httpTimeout.toMillis()), cause);
        } else if (cause instanceof IOException) {
            logger.debug("I/O exception: {}", cause.getMessage());
            return new CollaboratorException(ResultCodes.CANNOT_FETCH, cause.getMessage(), cause);
        } else {
            logger.warn("Unexpected error", cause);
            return new CollaboratorException(ResultCodes.INTERNAL_ERROR, cause.getMessage(), cause);
        }
    }
}
