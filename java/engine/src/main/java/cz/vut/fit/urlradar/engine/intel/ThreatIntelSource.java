package cz.vut.fit.urlradar.engine.intel;

import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.models.intel.SourceTier;
import cz.vut.fit.urlradar.models.intel.TIFinding;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A reputation source queried for every scanned URL. Implementations must be safe to call concurrently
 * from multiple scans.
 */
public interface ThreatIntelSource {
    /**
     * The source identifier, used in findings and source statuses.
     */
    @NotNull String name();

    /**
     * The reliability tier of the source.
     */
    @NotNull SourceTier tier();

    /**
     * Queries the source. The future completes with the findings (empty when the URL is not listed), or
     * exceptionally with a {@link CollaboratorException} describing the failure.
     *
     * @param url The canonical URL.
     * @return A future of the findings.
     */
    @NotNull CompletableFuture<List<TIFinding>> query(@NotNull String url);
}
