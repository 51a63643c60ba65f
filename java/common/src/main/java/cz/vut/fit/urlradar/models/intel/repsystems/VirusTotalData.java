package cz.vut.fit.urlradar.models.intel.repsystems;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The last analysis of a URL reported by VirusTotal.
 *
 * @param malicious   Engines that flagged the URL as malicious.
 * @param suspicious  Engines that flagged the URL as suspicious.
 * @param harmless    Engines that flagged the URL as harmless.
 * @param undetected  Engines with no verdict.
 * @param reputation  The community reputation score (negative is bad).
 * @param threatNames Threat names assigned by the engines, most common first.
 *
 * @author URLRadar developers
 */
public record VirusTotalData(int malicious,
                             int suspicious,
                             int harmless,
                             int undetected,
                             int reputation,
                             @NotNull List<String> threatNames) {

    public VirusTotalData {
        threatNames = List.copyOf(threatNames);
    }

    public int flagged() {
        return malicious + suspicious;
    }

    public @Nullable String primaryThreatName() {
        return threatNames.isEmpty() ? null : threatNames.get(0);
    }
}
