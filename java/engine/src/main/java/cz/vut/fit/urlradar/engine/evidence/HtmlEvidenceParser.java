package cz.vut.fit.urlradar.engine.evidence;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.engine.features.DomainNames;
import cz.vut.fit.urlradar.models.evidence.DomEvidence;
import cz.vut.fit.urlradar.models.evidence.FormInfo;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts {@link DomEvidence} from page HTML using jsoup.
 *
 * @author URLRadar developers
 */
public class HtmlEvidenceParser {
    public static final int MAX_TEXT_LENGTH = 10_000;
    public static final double OBFUSCATION_ENTROPY = 4.5;

    private static final int MIN_OBFUSCATION_LENGTH = 200;
    private static final Pattern ESCAPE_RUN = Pattern.compile("(\\\\x[0-9a-fA-F]{2}|\\\\u[0-9a-fA-F]{4}|%[0-9a-fA-F]{2}){12,}");
    private static final List<String> OBFUSCATION_MARKERS = List.of("eval(", "unescape(", "fromcharcode", "atob(");
    private static final List<String> SENSITIVE_APIS = List.of("document.cookie", "localstorage", "sessionstorage",
            "navigator.clipboard", "xmlhttprequest", "fetch(", "window.location", "document.forms", ".submit(");
    private static final List<String> DOWNLOAD_EXTENSIONS = List.of(".exe", ".msi", ".apk", ".scr", ".bat", ".cmd",
            ".dmg", ".iso", ".jar", ".vbs", ".zip", ".rar", ".7z");

    /**
     * Parses the HTML.
     *
     * @param html        The HTML source.
     * @param pageUrl     The URL the HTML was served from, used to resolve relative references.
     * @param lightweight If true, only the title, text and forms are extracted.
     * @return The DOM evidence.
     */
    public @NotNull DomEvidence parse(@NotNull String html, @NotNull String pageUrl, boolean lightweight) {
        final Document document = Jsoup.parse(html, pageUrl);
        final var pageHost = DomainNames.hostOf(pageUrl);
        final var pageDomain = pageHost == null ? "" : DomainNames.registrableDomain(pageHost);

        final var title = document.title().isBlank() ? null : document.title().trim();
        final var bodyText = document.body() == null ? "" : document.body().text();
        final var text = bodyText.length() > MAX_TEXT_LENGTH ? bodyText.substring(0, MAX_TEXT_LENGTH) : bodyText;

        final var externalDomains = new LinkedHashSet<String>();
        final var forms = forms(document, pageDomain, externalDomains);

        if (lightweight)
            return new DomEvidence(title, text, forms, 0, 0, false, List.of(), 0, 0,
                    List.copyOf(externalDomains), 0, 0, 0, null, false, false, true);

        // Scripts
        final var scripts = document.select("script");
        int externalScripts = 0;
        boolean obfuscated = false;
        final var apis = new LinkedHashSet<String>();
        for (var script : scripts) {
            if (script.hasAttr("src")) {
                if (isExternal(script.absUrl("src"), pageDomain, externalDomains))
                    externalScripts++;
                continue;
            }
            final var code = script.data();
            obfuscated |= looksObfuscated(code);
            final var lower = code.toLowerCase(Locale.ROOT);
            for (var api : SENSITIVE_APIS) {
                if (lower.contains(api))
                    apis.add(api);
            }
        }

        // Links
        final var links = document.select("a[href]");
        int externalLinks = 0;
        boolean downloadLink = false;
        for (var link : links) {
            if (isExternal(link.absUrl("href"), pageDomain, externalDomains))
                externalLinks++;
            if (link.hasAttr("download"))
                downloadLink = true;
        }

        // Frames
        final var iframes = document.select("iframe");
        int hiddenIframes = 0;
        for (var iframe : iframes) {
            isExternal(iframe.absUrl("src"), pageDomain, externalDomains);
            if (isHidden(iframe))
                hiddenIframes++;
        }

        int logos = 0;
        for (var image : document.select("img")) {
            final var descriptor = (image.className() + " " + image.id() + " " + image.attr("alt") + " "
                    + image.attr("src")).toLowerCase(Locale.ROOT);
            if (descriptor.contains("logo"))
                logos++;
        }

        final var refresh = metaRefreshTarget(document);
        final boolean autoDownload = downloadLink || (refresh != null && isDownload(refresh));

        return new DomEvidence(title, text, forms, scripts.size(), externalScripts, obfuscated,
                List.copyOf(apis), links.size(), externalLinks, List.copyOf(externalDomains),
                iframes.size(), hiddenIframes, logos, refresh, autoDownload,
                mixedContent(document, pageUrl), false);
    }

    private static List<FormInfo> forms(Document document, String pageDomain, Set<String> externalDomains) {
        final var result = new ArrayList<FormInfo>();
        for (var form : document.select("form")) {
            final var action = form.hasAttr("action") ? form.attr("action") : null;
            final var method = form.attr("method").isBlank() ? "GET" : form.attr("method").toUpperCase(Locale.ROOT);

            String targetHost;
            boolean external;
            if (action != null && action.trim().toLowerCase(Locale.ROOT).startsWith("mailto:")) {
                targetHost = null;
                external = true;
            } else {
                final var target = action == null || action.isBlank() ? form.baseUri() : form.absUrl("action");
                targetHost = DomainNames.hostOf(target);
                external = targetHost != null && !DomainNames.registrableDomain(targetHost).equals(pageDomain);
                if (external)
                    externalDomains.add(targetHost);
            }

            final var types = new ArrayList<String>();
            final var names = new ArrayList<String>();
            boolean password = false;
            for (var input : form.select("input")) {
                final var type = input.attr("type").isBlank() ? "text" : input.attr("type").toLowerCase(Locale.ROOT);
                types.add(type);
                if (!input.attr("name").isBlank())
                    names.add(input.attr("name"));
                password |= type.equals("password");
            }
            result.add(new FormInfo(action, method, targetHost, external, password, types, names));
        }
        return result;
    }

    private static boolean isExternal(String absoluteUrl, String pageDomain, Set<String> externalDomains) {
        if (absoluteUrl == null || absoluteUrl.isEmpty())
            return false;
        final var lower = absoluteUrl.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://"))
            return false;

        final var host = DomainNames.hostOf(absoluteUrl);
        if (host == null || DomainNames.registrableDomain(host).equals(pageDomain))
            return false;
        externalDomains.add(host);
        return true;
    }

    private static boolean isHidden(Element iframe) {
        final var style = iframe.attr("style").replace(" ", "").toLowerCase(Locale.ROOT);
        if (style.contains("display:none") || style.contains("visibility:hidden"))
            return true;
        return isTiny(iframe.attr("width")) || isTiny(iframe.attr("height"));
    }

    private static boolean isTiny(String dimension) {
        final var value = dimension.trim().replace("px", "");
        return value.equals("0") || value.equals("1");
    }

    static boolean looksObfuscated(@Nullable String code) {
        if (code == null || code.isBlank())
            return false;
        final var lower = code.toLowerCase(Locale.ROOT);
        for (var marker : OBFUSCATION_MARKERS) {
            if (lower.contains(marker))
                return true;
        }
        if (ESCAPE_RUN.matcher(code).find())
            return true;
        return code.length() >= MIN_OBFUSCATION_LENGTH && Common.shannonEntropy(code) > OBFUSCATION_ENTROPY;
    }

    private static @Nullable String metaRefreshTarget(Document document) {
        final var meta = document.selectFirst("meta[http-equiv~=(?i)refresh]");
        if (meta == null)
            return null;
        final var content = meta.attr("content");
        final int index = content.toLowerCase(Locale.ROOT).indexOf("url=");
        if (index < 0)
            return null;
        var target = content.substring(index + 4).trim();
        if (target.startsWith("'") || target.startsWith("\""))
            target = target.substring(1);
        if (target.endsWith("'") || target.endsWith("\""))
            target = target.substring(0, target.length() - 1);
        return target.isEmpty() ? null : target;
    }

    private static boolean isDownload(String target) {
        var lower = target.toLowerCase(Locale.ROOT);
        final int query = lower.indexOf('?');
        if (query >= 0)
            lower = lower.substring(0, query);
        for (var extension : DOWNLOAD_EXTENSIONS) {
            if (lower.endsWith(extension))
                return true;
        }
        return false;
    }

    private static boolean mixedContent(Document document, String pageUrl) {
        if (!pageUrl.toLowerCase(Locale.ROOT).startsWith("https://"))
            return false;
        for (var element : document.select("script[src], img[src], iframe[src], link[rel=stylesheet][href]")) {
            final var reference = element.hasAttr("src") ? element.attr("src") : element.attr("href");
            if (reference.trim().toLowerCase(Locale.ROOT).startsWith("http://"))
                return true;
        }
        return false;
    }
}
