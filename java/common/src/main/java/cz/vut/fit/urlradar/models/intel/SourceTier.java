package cz.vut.fit.urlradar.models.intel;

/**
 * The reliability tier of a threat-intelligence source.
 */
public enum SourceTier {
    /**
     * Premium or authoritative feeds. Tier-1 hits can end a scan at the intel gate.
     */
    TIER_1,
    /**
     * Community feeds.
     */
    TIER_2,
    /**
     * Supplementary feeds.
     */
    TIER_3;

    public int level() {
        return this.ordinal() + 1;
    }
}
