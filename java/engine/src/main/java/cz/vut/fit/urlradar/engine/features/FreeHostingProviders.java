package cz.vut.fit.urlradar.engine.features;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Free hosting and site-builder platforms that let anyone publish content under their domain.
 *
 * @author URLRadar developers
 */
public final class FreeHostingProviders {
    public static final List<String> PROVIDERS = List.of(
            "vercel.app", "netlify.app", "github.io", "herokuapp.com", "azurewebsites.net", "web.app",
            "firebaseapp.com", "glitch.me", "repl.co", "webflow.io", "wixsite.com", "weebly.com",
            "wordpress.com", "blogspot.com", "000webhostapp.com", "freehosting.com", "freehostia.com",
            "infinityfree.net", "byet.host", "pages.dev", "workers.dev", "sites.google.com");

    private FreeHostingProviders() {
    }

    /**
     * Returns the provider domain the host belongs to, or null.
     */
    public static @Nullable String match(@NotNull String host) {
        final var normalized = host.toLowerCase(Locale.ROOT);
        for (var provider : PROVIDERS) {
            if (normalized.equals(provider) || normalized.endsWith("." + provider))
                return provider;
        }
        return null;
    }
}
