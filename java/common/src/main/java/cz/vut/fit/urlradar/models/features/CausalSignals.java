package cz.vut.fit.urlradar.models.features;

import java.util.ArrayList;
import java.util.List;

/**
 * Boolean hard indicators evaluated directly against the evidence.
 *
 * @param formOriginMismatch   A form submits to a different origin than the page.
 * @param brandInfraDivergence A brand is named in the URL but the registrable domain is not the brand's.
 * @param autoDownload         The page triggers a download without interaction.
 * @param tombstone            The URL was previously confirmed malicious and taken down.
 * @param sinkhole             The target resolves or redirects to takedown infrastructure.
 * @param dualTier1            At least two tier-1 intel sources reported the URL.
 * @param redirectHomoglyph    A redirect target host uses look-alike characters.
 */
public record CausalSignals(boolean formOriginMismatch,
                            boolean brandInfraDivergence,
                            boolean autoDownload,
                            boolean tombstone,
                            boolean sinkhole,
                            boolean dualTier1,
                            boolean redirectHomoglyph) {

    public static CausalSignals none() {
        return new CausalSignals(false, false, false, false, false, false, false);
    }

    /**
     * Returns true if the given signal is set.
     */
    public boolean isSet(CausalSignal signal) {
        return switch (signal) {
            case FORM_ORIGIN_MISMATCH -> formOriginMismatch;
            case BRAND_INFRA_DIVERGENCE -> brandInfraDivergence;
            case AUTO_DOWNLOAD -> autoDownload;
            case TOMBSTONE -> tombstone;
            case SINKHOLE -> sinkhole;
            case DUAL_TIER1 -> dualTier1;
            case REDIRECT_HOMOGLYPH -> redirectHomoglyph;
        };
    }

    /**
     * Returns the set signals in declaration order.
     */
    public List<CausalSignal> active() {
        final var result = new ArrayList<CausalSignal>();
        for (var signal : CausalSignal.values()) {
            if (isSet(signal))
                result.add(signal);
        }
        return result;
    }
}
