package cz.vut.fit.urlradar.engine.evidence;

import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.models.evidence.HttpEvidence;
import cz.vut.fit.urlradar.models.evidence.ScreenshotEvidence;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;

/**
 * Fetches (and possibly renders) a page.
 */
public interface PageRenderer {
    /**
     * Options of a single render call.
     *
     * @param captureScreenshot True if a screenshot should be captured.
     * @param timeout           The time budget of the call.
     * @param maxBodyBytes      The maximum number of body bytes to read.
     */
    record RenderOptions(boolean captureScreenshot, @NotNull Duration timeout, int maxBodyBytes) {
    }

    /**
     * The rendered page.
     *
     * @param html       The HTML source (possibly truncated).
     * @param http       The HTTP response metadata.
     * @param screenshot The screenshot, when requested and supported.
     */
    record RenderedPage(@NotNull String html, @NotNull HttpEvidence http, @Nullable ScreenshotEvidence screenshot) {
    }

    @NotNull RenderedPage render(@NotNull String url, @NotNull RenderOptions options) throws CollaboratorException;
}
