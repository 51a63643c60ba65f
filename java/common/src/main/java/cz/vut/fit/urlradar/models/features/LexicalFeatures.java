package cz.vut.fit.urlradar.models.features;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Features computed from the URL string alone.
 *
 * @param urlLength        The length of the whole URL.
 * @param hostLength       The length of the host name.
 * @param pathLength       The length of the path.
 * @param queryLength      The length of the query string.
 * @param subdomainDepth   The number of labels left of the registrable domain.
 * @param hyphenCount      The number of hyphens in the host name.
 * @param digitRatio       The share of digits in the URL.
 * @param specialCharRatio The share of characters other than letters, digits and {@code ./:}.
 * @param hostEntropy      The Shannon entropy of the host name.
 * @param urlEntropy       The Shannon entropy of the URL.
 * @param bigramDiversity  Distinct character bigrams divided by all bigrams of the host name.
 * @param ipLiteralHost    True if the host is an IP address literal.
 * @param punycode         True if a host label is punycode-encoded.
 * @param homoglyphs       True if the URL contains Cyrillic look-alike letters.
 * @param httpsScheme      True if the scheme is https.
 * @param brandTokens      The well-known brand names found in the URL.
 * @param actionTokens     The credential/action words found in the URL.
 */
public record LexicalFeatures(int urlLength,
                              int hostLength,
                              int pathLength,
                              int queryLength,
                              int subdomainDepth,
                              int hyphenCount,
                              double digitRatio,
                              double specialCharRatio,
                              double hostEntropy,
                              double urlEntropy,
                              double bigramDiversity,
                              boolean ipLiteralHost,
                              boolean punycode,
                              boolean homoglyphs,
                              boolean httpsScheme,
                              @NotNull List<String> brandTokens,
                              @NotNull List<String> actionTokens) {

    public LexicalFeatures {
        brandTokens = List.copyOf(brandTokens);
        actionTokens = List.copyOf(actionTokens);
    }
}
