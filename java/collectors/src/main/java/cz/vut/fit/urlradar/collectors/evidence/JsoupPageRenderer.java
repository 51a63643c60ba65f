package cz.vut.fit.urlradar.collectors.evidence;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.ScannerConfig;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.evidence.PageRenderer;
import cz.vut.fit.urlradar.models.evidence.HttpEvidence;
import org.jetbrains.annotations.NotNull;
import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fetches the page source with jsoup, following redirects manually so that the chain can be reported.
 * Scripts are not executed and no screenshot is produced; the scan reports the screenshot as unavailable.
 *
 * @author URLRadar developers
 */
public class JsoupPageRenderer implements PageRenderer {
    public static final String COMPONENT_NAME = "renderer";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(JsoupPageRenderer.class);

    private final String _userAgent;
    private final int _maxRedirects;

    public JsoupPageRenderer(@NotNull ConfigSnapshot config) {
        this(config.property(ScannerConfig.RENDER_USER_AGENT_CONFIG, ScannerConfig.RENDER_USER_AGENT_DEFAULT),
                config.maxRedirects());
    }

    public JsoupPageRenderer(@NotNull String userAgent, int maxRedirects) {
        _userAgent = userAgent;
        _maxRedirects = maxRedirects;
    }

    protected Connection connect(@NotNull String url) {
        return Jsoup.connect(url);
    }

    @Override
    public @NotNull RenderedPage render(@NotNull String url, @NotNull RenderOptions options)
            throws CollaboratorException {
        final long deadline = System.nanoTime() + options.timeout().toNanos();
        final var chain = new ArrayList<String>();
        var location = url;

        for (int counter = 0; ; counter++) {
            chain.add(location);
            final int remainingMs = (int) Math.max(1, (deadline - System.nanoTime()) / 1_000_000);

            final Connection.Response response;
            try {
                Logger.trace("Fetching {}", location);
                response = connect(location)
                        .userAgent(_userAgent)
                        .header("Accept", "text/html, application/xhtml+xml, */*")
                        .timeout(remainingMs)
                        .maxBodySize(options.maxBodyBytes())
                        .followRedirects(false)
                        .ignoreHttpErrors(true)
                        .ignoreContentType(true)
                        .execute();
            } catch (SocketTimeoutException e) {
                throw new CollaboratorException(ResultCodes.TIMEOUT,
                        "Page fetch timed out (%d ms)".formatted(options.timeout().toMillis()), e);
            } catch (IOException e) {
                Logger.debug("Cannot fetch {}: {}", location, e.getMessage());
                throw new CollaboratorException(ResultCodes.CANNOT_FETCH, e.getMessage(), e);
            } catch (IllegalArgumentException e) {
                throw new CollaboratorException(ResultCodes.INVALID_FORMAT, "Invalid URL: " + location, e);
            }

            final int status = response.statusCode();
            final var redirect = status >= 300 && status < 400 ? response.header("Location") : null;
            if (redirect != null && counter < _maxRedirects) {
                location = resolve(location, redirect);
                continue;
            }

            if (options.captureScreenshot())
                Logger.trace("Screenshots are not supported, {} is rendered without one", url);

            final var http = new HttpEvidence(location, status, headersOf(response),
                    response.headers("Set-Cookie"), chain);
            return new RenderedPage(response.body(), http, null);
        }
    }

    private static String resolve(String base, String redirect) throws CollaboratorException {
        try {
            return new URI(base).resolve(new URI(redirect.trim())).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new CollaboratorException(ResultCodes.INVALID_FORMAT, "Invalid redirect location: " + redirect, e);
        }
    }

    static Map<String, String> headersOf(Connection.Response response) {
        final var result = new HashMap<String, String>();
        for (Map.Entry<String, List<String>> entry : response.multiHeaders().entrySet()) {
            result.put(entry.getKey().toLowerCase(Locale.ROOT), String.join(", ", entry.getValue()));
        }
        return result;
    }
}
