package cz.vut.fit.urlradar.models.evidence;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Network ownership data of the resolved address.
 *
 * @param ip           The address.
 * @param asn          The autonomous system number, if known.
 * @param organization The autonomous system organisation, if known.
 * @param hosting      True if the organisation is a hosting or cloud provider.
 */
public record NetworkEvidence(@NotNull String ip,
                              @Nullable Long asn,
                              @Nullable String organization,
                              boolean hosting) {
}
