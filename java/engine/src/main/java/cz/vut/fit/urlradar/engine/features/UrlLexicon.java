package cz.vut.fit.urlradar.engine.features;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Keyword lists used by the feature extractor, the heuristic models and the URL-structure checks.
 *
 * @author URLRadar developers
 */
public final class UrlLexicon {
    /**
     * Brands commonly impersonated, with the registrable domains they legitimately operate.
     */
    public static final Map<String, Set<String>> BRANDS;

    static {
        var brands = new LinkedHashMap<String, Set<String>>();
        brands.put("paypal", Set.of("paypal.com", "paypal.me", "paypalobjects.com"));
        brands.put("amazon", Set.of("amazon.com", "amazon.co.uk", "amazon.de", "amazonaws.com"));
        brands.put("ebay", Set.of("ebay.com", "ebay.co.uk", "ebay.de"));
        brands.put("apple", Set.of("apple.com", "icloud.com"));
        brands.put("microsoft", Set.of("microsoft.com", "live.com", "office.com", "microsoftonline.com"));
        brands.put("google", Set.of("google.com", "googleusercontent.com", "gmail.com"));
        brands.put("facebook", Set.of("facebook.com", "fb.com"));
        brands.put("instagram", Set.of("instagram.com"));
        brands.put("netflix", Set.of("netflix.com"));
        brands.put("chase", Set.of("chase.com"));
        brands.put("wellsfargo", Set.of("wellsfargo.com"));
        brands.put("citibank", Set.of("citibank.com", "citi.com"));
        brands.put("americanexpress", Set.of("americanexpress.com"));
        brands.put("visa", Set.of("visa.com"));
        BRANDS = Collections.unmodifiableMap(brands);
    }

    public static final List<String> ACTION_TOKENS = List.of(
            "login", "signin", "sign-in", "verify", "account", "update", "secure", "confirm", "validate",
            "authenticate", "suspended", "locked", "unlock", "password", "recover");

    public static final List<String> SUSPICIOUS_SUBDOMAIN_KEYWORDS = List.of(
            "ingresa", "inicio", "login", "signin", "sign-in", "secure", "security", "account", "verify",
            "verification", "update", "confirm", "validate", "auth", "suspended", "locked", "alert",
            "banking", "payment", "billing", "support", "customer", "cliente", "acceso", "entrar", "portal");

    public static final List<String> SOCIAL_ENGINEERING_KEYWORDS = List.of(
            "urgent", "verify", "suspended", "limited", "confirm", "secure", "account", "update", "alert",
            "warning", "action", "required", "expire", "locked", "unauthorized", "aumento", "premio",
            "ganador", "reclamo", "bonus", "prize", "winner", "claim", "reward", "gift", "congratulations",
            "selected", "exclusive");

    public static final List<String> FINANCIAL_KEYWORDS = List.of(
            "bank", "banking", "credit", "debit", "card", "wallet", "payment", "paypal", "invoice", "refund",
            "transfer", "iban", "swift", "loan", "crypto", "bitcoin", "btc", "invest", "tax", "billing");

    public static final List<String> SUSPICIOUS_PATH_KEYWORDS = List.of(
            "wp-admin", "wp-includes", "admin", "webscr", "cmd=", "dispatch", ".php", "redirect=", "url=",
            "token=", "session=", "login.html", "signin.html", "verify.html");

    /**
     * Embedded domain fragments that make a subdomain look like another domain (e.g. "paypal-com").
     */
    public static final List<String> EMBEDDED_DOMAIN_MARKERS = List.of(
            "-com", "com-", "-net", "-org", ".com.", "-co-uk", "www-");

    private UrlLexicon() {
    }

    /**
     * Returns the keywords contained in the text, in list order.
     */
    public static @NotNull List<String> matches(@NotNull List<String> keywords, @Nullable String text) {
        final var result = new ArrayList<String>();
        if (text == null || text.isEmpty())
            return result;

        final var normalized = text.toLowerCase(Locale.ROOT);
        for (var keyword : keywords) {
            if (normalized.contains(keyword) && !result.contains(keyword))
                result.add(keyword);
        }
        return result;
    }

    /**
     * Returns the brands named in the text.
     */
    public static @NotNull List<String> brandsIn(@Nullable String text) {
        return matches(List.copyOf(BRANDS.keySet()), text);
    }

    /**
     * Returns true if the registrable domain is operated by the brand.
     */
    public static boolean isBrandDomain(@NotNull String brand, @NotNull String registrableDomain) {
        final var domains = BRANDS.get(brand);
        return domains != null && domains.contains(registrableDomain.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the named brands whose legitimate domains do not include the registrable domain.
     */
    public static @NotNull List<String> foreignBrands(@NotNull List<String> brands, @NotNull String registrableDomain) {
        return brands.stream()
                .filter(brand -> !isBrandDomain(brand, registrableDomain))
                .toList();
    }
}
