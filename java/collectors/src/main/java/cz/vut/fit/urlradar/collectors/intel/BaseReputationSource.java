package cz.vut.fit.urlradar.collectors.intel;

import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.Futures;
import cz.vut.fit.urlradar.engine.intel.ThreatIntelSource;
import cz.vut.fit.urlradar.models.intel.Severity;
import cz.vut.fit.urlradar.models.intel.SourceTier;
import cz.vut.fit.urlradar.models.intel.TIFinding;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONObject;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * A base class for threat-intel sources backed by a remote reputation API. Subclasses define the request
 * and how the response maps to findings.
 *
 * @param <TData> The type the API response is mapped to.
 *
 * @author URLRadar developers
 */
public abstract class BaseReputationSource<TData> implements ThreatIntelSource {
    protected final ReputationApiClient<TData> client;
    protected final Clock clock;

    protected BaseReputationSource(@NotNull ReputationApiClient<TData> client, @NotNull Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    /**
     * Gets the logger defined by the child class.
     */
    protected abstract org.slf4j.Logger getLogger();

    /**
     * Builds the request URL for the scanned URL.
     *
     * @return The request URL, or null if the source cannot query this URL.
     */
    protected abstract @Nullable String getRequestUrl(@NotNull String url);

    /**
     * Gets the name of the HTTP header that carries the token, or null if the token is not sent in a header.
     */
    protected abstract @Nullable String getAuthTokenHeaderName();

    /**
     * Maps the JSON response to the source's data type.
     */
    protected abstract TData mapResponseToData(@NotNull JSONObject jsonResponse);

    /**
     * Converts the response data to findings; an empty list if the URL is not listed.
     */
    protected abstract @NotNull List<TIFinding> toFindings(@NotNull TData data);

    /**
     * Optionally provides JSON data to POST. By default, a GET request is sent.
     */
    protected @Nullable String getPOSTData(@NotNull String url) {
        return null;
    }

    @Override
    public @NotNull CompletableFuture<List<TIFinding>> query(@NotNull String url) {
        getLogger().trace("Querying {}", url);
        return client.execute(getRequestUrl(url), getAuthTokenHeaderName(), getPOSTData(url),
                        this::mapResponseToData, name(), getLogger())
                .thenApply(this::toFindings)
                .exceptionally(error -> {
                    // The API answers 404 for targets it has never seen
                    if (Futures.codeOf(error) == ResultCodes.NOT_FOUND)
                        return List.of();
                    throw error instanceof CompletionException completionException
                            ? completionException
                            : new CompletionException(error);
                });
    }

    protected TIFinding finding(@NotNull Severity severity,
                                @Nullable String threatType) {
        return new TIFinding(name(), tier(), severity, clock.instant(), threatType);
    }

    @Override
    public @NotNull SourceTier tier() {
        return SourceTier.TIER_1;
    }

    /**
     * Whether the source is disabled because no token is configured.
     */
    public boolean isDisabled() {
        return client.isDisabled();
    }
}
