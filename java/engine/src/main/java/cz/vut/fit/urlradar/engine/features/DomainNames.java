package cz.vut.fit.urlradar.engine.features;

import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.util.Locale;

/**
 * Host name helpers based on the public suffix list bundled with Guava.
 *
 * @author URLRadar developers
 */
public final class DomainNames {
    private DomainNames() {
    }

    /**
     * Returns true if the host is an IPv4 or IPv6 literal (IPv6 may be enclosed in brackets).
     */
    public static boolean isIpLiteral(@NotNull String host) {
        return InetAddresses.isInetAddress(stripBrackets(host));
    }

    /**
     * Returns the registrable domain (public suffix plus one label) of the host. IP literals, public
     * suffixes themselves and names that are not valid domain names are returned unchanged.
     */
    public static @NotNull String registrableDomain(@NotNull String host) {
        final var normalized = host.toLowerCase(Locale.ROOT);
        if (isIpLiteral(normalized))
            return normalized;

        try {
            final var name = InternetDomainName.from(normalized);
            if (name.isUnderPublicSuffix())
                return name.topPrivateDomain().toString();
        } catch (IllegalArgumentException | IllegalStateException e) {
            // not a valid domain name, use the host as is
            return normalized;
        }
        return normalized;
    }

    /**
     * Returns the last label of the host, or an empty string for IP literals.
     */
    public static @NotNull String tld(@NotNull String host) {
        if (isIpLiteral(host))
            return "";
        final var normalized = host.toLowerCase(Locale.ROOT);
        final int dot = normalized.lastIndexOf('.');
        return dot < 0 ? normalized : normalized.substring(dot + 1);
    }

    /**
     * Returns the labels of the host in front of its registrable domain.
     */
    public static @NotNull String subdomainPart(@NotNull String host) {
        final var normalized = host.toLowerCase(Locale.ROOT);
        final var registrable = registrableDomain(normalized);
        if (normalized.length() <= registrable.length())
            return "";
        return normalized.substring(0, normalized.length() - registrable.length() - 1);
    }

    /**
     * Returns the lower-cased host of a URL, or null if the URL cannot be parsed.
     */
    public static @Nullable String hostOf(@Nullable String url) {
        if (url == null)
            return null;
        try {
            final var host = URI.create(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String stripBrackets(String host) {
        if (host.length() > 2 && host.startsWith("[") && host.endsWith("]"))
            return host.substring(1, host.length() - 1);
        return host;
    }
}
