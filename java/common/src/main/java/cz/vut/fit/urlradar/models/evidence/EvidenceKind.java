package cz.vut.fit.urlradar.models.evidence;

/**
 * The kinds of evidence gathered by the evidence collector. {@link #HTML} covers both the DOM and the HTTP
 * response metadata obtained by the page renderer.
 */
public enum EvidenceKind {
    WHOIS,
    DNS,
    TLS,
    HTML,
    SCREENSHOT,
    NETWORK
}
