package cz.vut.fit.urlradar.models;

import org.jetbrains.annotations.NotNull;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * An immutable request to scan a single URL.
 *
 * @param scanId   The unique scan identifier.
 * @param url      The canonical URL.
 * @param hostname The lower-case host name of the URL.
 * @param options  The per-scan options.
 */
public record ScanRequest(@NotNull String scanId,
                          @NotNull String url,
                          @NotNull String hostname,
                          @NotNull ScanOptions options) {

    public ScanRequest {
        Objects.requireNonNull(scanId, "scanId");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(hostname, "hostname");
        Objects.requireNonNull(options, "options");
    }

    /**
     * Creates a request with default options and a random scan identifier.
     *
     * @param rawUrl The URL to scan. A missing scheme defaults to https.
     * @return The request.
     * @throws IllegalArgumentException if the URL cannot be parsed or uses an unsupported scheme.
     */
    public static ScanRequest of(@NotNull String rawUrl) {
        return of(rawUrl, ScanOptions.defaults());
    }

    public static ScanRequest of(@NotNull String rawUrl, @NotNull ScanOptions options) {
        final var uri = canonicalize(rawUrl);
        return new ScanRequest(UUID.randomUUID().toString(), uri.toString(), uri.getHost(), options);
    }

    /**
     * Canonicalizes a URL: adds the https scheme when missing, lower-cases the scheme and the host,
     * drops the fragment and uses "/" for an empty path.
     *
     * @param rawUrl The URL.
     * @return The canonical URI.
     * @throws IllegalArgumentException if the URL cannot be parsed or uses an unsupported scheme.
     */
    public static URI canonicalize(@NotNull String rawUrl) {
        var trimmed = rawUrl.trim();
        if (trimmed.isEmpty())
            throw new IllegalArgumentException("Empty URL");

        if (!trimmed.contains("://"))
            trimmed = "https://" + trimmed;

        try {
            final var parsed = new URI(trimmed);
            final var scheme = parsed.getScheme() == null ? "https" : parsed.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https"))
                throw new IllegalArgumentException("Unsupported scheme: " + scheme);

            final var host = parsed.getHost();
            if (host == null || host.isBlank())
                throw new IllegalArgumentException("URL has no host: " + rawUrl);

            var path = parsed.getRawPath();
            if (path == null || path.isEmpty())
                path = "/";

            final var builder = new StringBuilder()
                    .append(scheme).append("://")
                    .append(host.toLowerCase(Locale.ROOT));
            if (parsed.getPort() != -1)
                builder.append(':').append(parsed.getPort());
            builder.append(path);
            if (parsed.getRawQuery() != null)
                builder.append('?').append(parsed.getRawQuery());

            return new URI(builder.toString());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL: " + rawUrl, e);
        }
    }
}
