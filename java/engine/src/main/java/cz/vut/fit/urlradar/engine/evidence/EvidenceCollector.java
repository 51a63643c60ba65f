package cz.vut.fit.urlradar.engine.evidence;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.engine.Futures;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.features.DomainNames;
import cz.vut.fit.urlradar.models.ScanOptions;
import cz.vut.fit.urlradar.models.evidence.DnsEvidence;
import cz.vut.fit.urlradar.models.evidence.DomEvidence;
import cz.vut.fit.urlradar.models.evidence.EvidenceBundle;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import cz.vut.fit.urlradar.models.evidence.HttpEvidence;
import cz.vut.fit.urlradar.models.evidence.NetworkEvidence;
import cz.vut.fit.urlradar.models.evidence.ScreenshotEvidence;
import cz.vut.fit.urlradar.models.evidence.TlsEvidence;
import cz.vut.fit.urlradar.models.evidence.WhoisEvidence;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Collects the evidence allowed by the reachability branch. The collaborators run concurrently, each with
 * its own timeout; a failing collaborator leaves its evidence absent and records the reason.
 *
 * @author URLRadar developers
 */
public class EvidenceCollector {
    public static final String COMPONENT_NAME = "evidence";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(EvidenceCollector.class);

    /**
     * A blocking collaborator call.
     */
    @FunctionalInterface
    private interface Call<T> {
        T run() throws CollaboratorException;
    }

    /**
     * The value of a collaborator call, or the reason it is missing.
     */
    private record Outcome<T>(@Nullable T value, @Nullable String reason) {
    }

    /**
     * The parsed page.
     */
    private record Page(DomEvidence dom, HttpEvidence http, @Nullable ScreenshotEvidence screenshot) {
    }

    private final DomainRegistryLookup _registry;
    private final DnsResolver _resolver;
    private final TlsInspector _tlsInspector;
    private final PageRenderer _renderer;
    private final @Nullable NetworkLookup _networkLookup;
    private final ExecutorService _executor;
    private final HtmlEvidenceParser _parser = new HtmlEvidenceParser();

    public EvidenceCollector(@NotNull DomainRegistryLookup registry, @NotNull DnsResolver resolver,
                             @NotNull TlsInspector tlsInspector, @NotNull PageRenderer renderer,
                             @Nullable NetworkLookup networkLookup, @NotNull ExecutorService executor) {
        _registry = registry;
        _resolver = resolver;
        _tlsInspector = tlsInspector;
        _renderer = renderer;
        _networkLookup = networkLookup;
        _executor = executor;
    }

    /**
     * Collects the evidence.
     *
     * @param url          The canonical URL.
     * @param reachability The reachability result that scopes the collection.
     * @param options      The scan options.
     * @param config       The configuration snapshot.
     * @return A future that always completes normally with the bundle.
     */
    public @NotNull CompletableFuture<EvidenceBundle> collect(@NotNull String url,
                                                              @NotNull ReachabilityResult reachability,
                                                              @NotNull ScanOptions options,
                                                              @NotNull ConfigSnapshot config) {
        final var branch = reachability.status();
        final var scope = EvidenceScope.kindsFor(branch);
        final var uri = URI.create(url);
        final var host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);

        final var skipped = new EnumMap<EvidenceKind, String>(EvidenceKind.class);
        for (var kind : EvidenceKind.values()) {
            if (!scope.contains(kind))
                skipped.put(kind, ResultCodes.nameOf(ResultCodes.SKIPPED) + ": not collected for "
                        + branch.name().toLowerCase(Locale.ROOT) + " targets");
        }
        final boolean captureScreenshot = scope.contains(EvidenceKind.SCREENSHOT) && !options.skipScreenshot();
        if (scope.contains(EvidenceKind.SCREENSHOT) && options.skipScreenshot())
            skipped.put(EvidenceKind.SCREENSHOT, ResultCodes.nameOf(ResultCodes.SKIPPED) + ": disabled by scan options");

        final CompletableFuture<Outcome<WhoisEvidence>> whois = scope.contains(EvidenceKind.WHOIS)
                ? whois(host, config) : CompletableFuture.completedFuture(new Outcome<>(null, null));
        final CompletableFuture<Outcome<DnsEvidence>> dns = scope.contains(EvidenceKind.DNS)
                ? run(EvidenceKind.DNS, () -> _resolver.collect(host), config)
                : CompletableFuture.completedFuture(new Outcome<>(null, null));
        final CompletableFuture<Outcome<TlsEvidence>> tls = scope.contains(EvidenceKind.TLS)
                ? run(EvidenceKind.TLS, () -> _tlsInspector.inspect(host, tlsPort(uri)), config)
                : CompletableFuture.completedFuture(new Outcome<>(null, null));
        final CompletableFuture<Outcome<NetworkEvidence>> network = scope.contains(EvidenceKind.NETWORK)
                ? network(reachability.resolvedIp(), config)
                : CompletableFuture.completedFuture(new Outcome<>(null, null));
        final CompletableFuture<Outcome<Page>> page = scope.contains(EvidenceKind.HTML)
                ? page(url, captureScreenshot, EvidenceScope.lightweightHtml(branch), config)
                : CompletableFuture.completedFuture(new Outcome<>(null, null));

        final var all = List.<CompletableFuture<?>>of(whois, dns, tls, network, page);
        final var result = CompletableFuture.allOf(all.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    final var reasons = new EnumMap<EvidenceKind, String>(skipped);
                    noteReason(reasons, EvidenceKind.WHOIS, whois.join());
                    noteReason(reasons, EvidenceKind.DNS, dns.join());
                    noteReason(reasons, EvidenceKind.TLS, tls.join());
                    noteReason(reasons, EvidenceKind.NETWORK, network.join());
                    noteReason(reasons, EvidenceKind.HTML, page.join());

                    final var pageValue = page.join().value();
                    if (captureScreenshot) {
                        if (pageValue == null)
                            reasons.put(EvidenceKind.SCREENSHOT, "page not rendered");
                        else if (pageValue.screenshot() == null)
                            reasons.put(EvidenceKind.SCREENSHOT, ResultCodes.nameOf(ResultCodes.NOT_FOUND)
                                    + ": renderer produced no screenshot");
                    }

                    final var bundle = new EvidenceBundle(branch, whois.join().value(), dns.join().value(),
                            tls.join().value(),
                            pageValue == null ? null : pageValue.dom(),
                            pageValue == null ? null : pageValue.http(),
                            network.join().value(),
                            pageValue == null || !captureScreenshot ? null : pageValue.screenshot(),
                            reasons);
                    Logger.debug("Evidence for {} ({}): missing {}", url, branch, reasons.keySet());
                    return bundle;
                });

        result.whenComplete((value, error) -> {
            if (result.isCancelled())
                Futures.cancelAll(all);
        });
        return result;
    }

    private CompletableFuture<Outcome<WhoisEvidence>> whois(String host, ConfigSnapshot config) {
        if (DomainNames.isIpLiteral(host))
            return CompletableFuture.completedFuture(new Outcome<>(null,
                    ResultCodes.nameOf(ResultCodes.UNSUPPORTED_ADDRESS) + ": IP literal host"));
        final var domain = DomainNames.registrableDomain(host);
        return run(EvidenceKind.WHOIS, () -> _registry.lookup(domain), config);
    }

    private CompletableFuture<Outcome<NetworkEvidence>> network(@Nullable String ip, ConfigSnapshot config) {
        if (_networkLookup == null)
            return CompletableFuture.completedFuture(new Outcome<>(null,
                    ResultCodes.nameOf(ResultCodes.DISABLED) + ": no network lookup configured"));
        if (ip == null)
            return CompletableFuture.completedFuture(new Outcome<>(null, "no resolved address"));
        return run(EvidenceKind.NETWORK, () -> _networkLookup.lookup(ip), config);
    }

    private CompletableFuture<Outcome<Page>> page(String url, boolean captureScreenshot, boolean lightweight,
                                                  ConfigSnapshot config) {
        final Duration timeout = captureScreenshot
                ? max(config.evidenceTimeout(EvidenceKind.HTML), config.evidenceTimeout(EvidenceKind.SCREENSHOT))
                : config.evidenceTimeout(EvidenceKind.HTML);
        final var options = new PageRenderer.RenderOptions(captureScreenshot, timeout, config.maxBodyBytes());

        return run(timeout, EvidenceKind.HTML, () -> {
            final var rendered = _renderer.render(url, options);
            final var dom = _parser.parse(rendered.html(), rendered.http().finalUrl(), lightweight);
            return new Page(dom, rendered.http(), rendered.screenshot());
        });
    }

    private <T> CompletableFuture<Outcome<T>> run(EvidenceKind kind, Call<T> call, ConfigSnapshot config) {
        return run(config.evidenceTimeout(kind), kind, call);
    }

    private <T> CompletableFuture<Outcome<T>> run(Duration timeout, EvidenceKind kind, Call<T> call) {
        final CompletableFuture<T> task = Futures.submit(_executor, call::run)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        final var outcome = task.handle((value, error) -> {
            if (error == null)
                return new Outcome<T>(value, null);

            final var reason = Futures.describe(error);
            Logger.debug("{} evidence unavailable: {}", kind, reason);
            return new Outcome<T>(null, reason);
        });
        // Cancelling the outcome interrupts the collaborator call
        outcome.whenComplete((value, error) -> {
            if (outcome.isCancelled())
                task.cancel(true);
        });
        return outcome;
    }

    private static void noteReason(Map<EvidenceKind, String> reasons, EvidenceKind kind, Outcome<?> outcome) {
        if (outcome.reason() != null)
            reasons.put(kind, outcome.reason());
    }

    private static int tlsPort(URI uri) {
        return "https".equalsIgnoreCase(uri.getScheme()) && uri.getPort() != -1 ? uri.getPort() : 443;
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
