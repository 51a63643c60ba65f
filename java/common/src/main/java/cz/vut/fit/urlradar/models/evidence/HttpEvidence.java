package cz.vut.fit.urlradar.models.evidence;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP response metadata of the rendered page.
 *
 * @param finalUrl      The URL of the final response.
 * @param statusCode    The final status code.
 * @param headers       The response headers, names lower-cased, multiple values joined with ", ".
 * @param cookies       The raw Set-Cookie values.
 * @param redirectChain The URLs visited by the renderer.
 */
public record HttpEvidence(@NotNull String finalUrl,
                           int statusCode,
                           @NotNull Map<String, String> headers,
                           @NotNull List<String> cookies,
                           @NotNull List<String> redirectChain) {

    public HttpEvidence {
        headers = Map.copyOf(headers);
        cookies = List.copyOf(cookies);
        redirectChain = List.copyOf(redirectChain);
    }

    public @Nullable String header(@NotNull String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public boolean hasHeader(@NotNull String name) {
        return headers.containsKey(name.toLowerCase(Locale.ROOT));
    }
}
