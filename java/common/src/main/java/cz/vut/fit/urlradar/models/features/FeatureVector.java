package cz.vut.fit.urlradar.models.features;

import cz.vut.fit.urlradar.models.ReachabilityStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The model-ready view of a scan, derived deterministically from the evidence and the intel summary.
 *
 * @param url               The canonical URL.
 * @param hostname          The host name.
 * @param registrableDomain The registrable domain (public suffix + one label), or the host when unknown.
 * @param tld               The public suffix.
 * @param branch            The reachability branch.
 * @param lexical           The lexical features.
 * @param tabular           The tabular features.
 * @param causal            The causal signals.
 * @param freeHosting       True if the host is a subdomain of a free hosting provider.
 * @param unavailableInputs The evidence kinds (lower case) replaced by neutral defaults.
 * @param pageText          The page title and visible text, if the page was rendered.
 * @param screenshotRef     The screenshot reference, if captured.
 */
public record FeatureVector(@NotNull String url,
                            @NotNull String hostname,
                            @NotNull String registrableDomain,
                            @NotNull String tld,
                            @NotNull ReachabilityStatus branch,
                            @NotNull LexicalFeatures lexical,
                            @NotNull TabularFeatures tabular,
                            @NotNull CausalSignals causal,
                            boolean freeHosting,
                            @NotNull List<String> unavailableInputs,
                            @Nullable String pageText,
                            @Nullable String screenshotRef) {

    public FeatureVector {
        unavailableInputs = List.copyOf(unavailableInputs);
    }

    /**
     * Returns true if the named input (e.g. "whois") was unavailable.
     */
    public boolean unavailable(@NotNull String input) {
        return unavailableInputs.contains(input);
    }
}
