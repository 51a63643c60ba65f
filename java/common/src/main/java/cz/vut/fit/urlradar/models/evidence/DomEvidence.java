package cz.vut.fit.urlradar.models.evidence;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Facts extracted from the page HTML.
 *
 * @param title                 The document title.
 * @param text                  The visible text, truncated.
 * @param forms                 The forms.
 * @param scriptCount           The number of script elements.
 * @param externalScriptCount   The number of scripts loaded from another registrable domain.
 * @param obfuscatedScripts     True if an inline script looks obfuscated.
 * @param suspiciousScriptApis  Sensitive APIs referenced by inline scripts (cookies, storage, form submission...).
 * @param linkCount             The number of anchors.
 * @param externalLinkCount     The number of anchors pointing to another registrable domain.
 * @param externalDomains       The distinct external hosts referenced by links, scripts and forms.
 * @param iframeCount           The number of iframes.
 * @param hiddenIframeCount     The number of iframes hidden with styles or zero size.
 * @param logoImageCount        The number of images whose class, id or alt mentions a logo.
 * @param metaRefreshTarget     The target of a meta refresh, if any.
 * @param autoDownload          True if the page triggers a download without interaction.
 * @param mixedContent          True if an https page loads http resources.
 * @param lightweight           True if only the template check was performed (parked branch).
 */
public record DomEvidence(@Nullable String title,
                          @NotNull String text,
                          @NotNull List<FormInfo> forms,
                          int scriptCount,
                          int externalScriptCount,
                          boolean obfuscatedScripts,
                          @NotNull List<String> suspiciousScriptApis,
                          int linkCount,
                          int externalLinkCount,
                          @NotNull List<String> externalDomains,
                          int iframeCount,
                          int hiddenIframeCount,
                          int logoImageCount,
                          @Nullable String metaRefreshTarget,
                          boolean autoDownload,
                          boolean mixedContent,
                          boolean lightweight) {

    public DomEvidence {
        forms = List.copyOf(forms);
        suspiciousScriptApis = List.copyOf(suspiciousScriptApis);
        externalDomains = List.copyOf(externalDomains);
    }

    /**
     * Returns true if any form contains a password field.
     */
    public boolean hasPasswordForm() {
        return forms.stream().anyMatch(FormInfo::hasPasswordField);
    }

    /**
     * Returns true if any form submits to a different origin.
     */
    public boolean formOriginMismatch() {
        return forms.stream().anyMatch(FormInfo::submitsToExternal);
    }
}
