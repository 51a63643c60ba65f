package cz.vut.fit.urlradar.models.intel.repsystems;

/**
 * The threat matches reported by Google Safe Browsing for a URL, counted per threat type.
 *
 * @author URLRadar developers
 */
public record GoogleSafeBrowsingData(
        int threatTypeUnspecifiedCnt,
        int malwareCnt,
        int socialEngineeringCnt,
        int unwantedSoftwareCnt,
        int potentiallyHarmfulApplicationCnt
) {
    public boolean hasMatches() {
        return threatTypeUnspecifiedCnt + malwareCnt + socialEngineeringCnt + unwantedSoftwareCnt
                + potentiallyHarmfulApplicationCnt > 0;
    }
}
