package cz.vut.fit.urlradar.engine.checks;

import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.features.FreeHostingProviders;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.evidence.DomEvidence;
import cz.vut.fit.urlradar.models.evidence.EvidenceBundle;
import cz.vut.fit.urlradar.models.evidence.HttpEvidence;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.intel.TISummary;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.time.Instant;
import java.util.Locale;

/**
 * The immutable inputs of the category checks of one scan.
 *
 * @param reachability The reachability result.
 * @param intel        The threat-intel summary.
 * @param evidence     The collected evidence.
 * @param features     The feature vector.
 * @param config       The configuration snapshot of the scan.
 * @param now          The reference time of the scan.
 */
public record CheckContext(@NotNull ReachabilityResult reachability,
                           @NotNull TISummary intel,
                           @NotNull EvidenceBundle evidence,
                           @NotNull FeatureVector features,
                           @NotNull ConfigSnapshot config,
                           @NotNull Instant now) {

    public @NotNull ReachabilityStatus branch() {
        return reachability.status();
    }

    public @NotNull String url() {
        return features.url();
    }

    public @NotNull String hostname() {
        return features.hostname();
    }

    public @NotNull String registrableDomain() {
        return features.registrableDomain();
    }

    /**
     * The lower-cased path and query of the URL.
     */
    public @NotNull String pathAndQuery() {
        final var uri = URI.create(features.url());
        final var path = uri.getRawPath() == null ? "" : uri.getRawPath();
        final var query = uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery();
        return (path + query).toLowerCase(Locale.ROOT);
    }

    /**
     * The host labels chosen by whoever registered the name: the labels in front of the registrable domain,
     * or in front of the provider domain for hosts on a free hosting platform.
     */
    public @NotNull String ownerLabels() {
        final var host = features.hostname();
        final var provider = FreeHostingProviders.match(host);
        if (provider != null)
            return host.length() > provider.length() ? host.substring(0, host.length() - provider.length() - 1) : "";

        final var registrable = features.registrableDomain();
        if (host.length() <= registrable.length())
            return "";
        return host.substring(0, host.length() - registrable.length() - 1);
    }

    public boolean https() {
        return features.lexical().httpsScheme();
    }

    /**
     * Returns true if the registration is known to be younger than the young-domain threshold.
     */
    public boolean youngDomain() {
        final var whois = evidence.whois();
        return whois != null && whois.domainAgeDays() != null
                && whois.domainAgeDays() < config.youngDomainDays();
    }

    public @Nullable DomEvidence dom() {
        return evidence.dom();
    }

    public @Nullable HttpEvidence http() {
        return evidence.http();
    }

    /**
     * The page title and visible text, lower-cased; empty when the page was not rendered.
     */
    public @NotNull String pageText() {
        final var text = features.pageText();
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
