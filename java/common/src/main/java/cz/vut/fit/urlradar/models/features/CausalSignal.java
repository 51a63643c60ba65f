package cz.vut.fit.urlradar.models.features;

import java.util.Locale;

/**
 * Identifiers of the boolean hard indicators.
 */
public enum CausalSignal {
    FORM_ORIGIN_MISMATCH,
    BRAND_INFRA_DIVERGENCE,
    AUTO_DOWNLOAD,
    TOMBSTONE,
    SINKHOLE,
    DUAL_TIER1,
    REDIRECT_HOMOGLYPH;

    /**
     * The configuration key fragment of the signal (lower case, hyphenated).
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
