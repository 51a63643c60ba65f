package cz.vut.fit.urlradar.models.features;

/**
 * Numeric features derived from evidence and threat intelligence. Unknown inputs are replaced by the
 * neutral defaults documented on each component; the feature vector lists the unavailable inputs.
 *
 * @param domainAgeDays       Domain age in days (neutral default 365).
 * @param tldRiskScore        TLD risk score (0-100).
 * @param asnReputationScore  ASN reputation score (0-100, higher is worse; neutral default 50).
 * @param tiTotalHits         Number of intel sources with a finding.
 * @param tiTier1Hits         Number of tier-1 intel sources with a finding.
 * @param tiTier2Hits         Number of tier-2 intel sources with a finding.
 * @param tlsScore            TLS score (0-100, higher is better; neutral default 50).
 * @param dnsHealthScore      DNS health score (0-100, higher is better; neutral default 50).
 * @param externalDomainCount Number of distinct external domains referenced by the page.
 * @param formCount           Number of forms on the page.
 * @param redirectCount       Number of redirects followed by the prober.
 */
public record TabularFeatures(int domainAgeDays,
                              double tldRiskScore,
                              double asnReputationScore,
                              int tiTotalHits,
                              int tiTier1Hits,
                              int tiTier2Hits,
                              double tlsScore,
                              double dnsHealthScore,
                              int externalDomainCount,
                              int formCount,
                              int redirectCount) {
}
