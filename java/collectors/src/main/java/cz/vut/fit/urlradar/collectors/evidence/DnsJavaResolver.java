package cz.vut.fit.urlradar.collectors.evidence;

import com.google.common.net.InternetDomainName;
import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.ScannerConfig;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.evidence.DnsResolver;
import cz.vut.fit.urlradar.models.evidence.DnsEvidence;
import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.CAARecord;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.NSRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;
import org.xbill.DNS.lookup.LookupSession;
import org.xbill.DNS.lookup.NoSuchDomainException;
import org.xbill.DNS.lookup.NoSuchRRSetException;

import java.io.IOException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves host names and collects DNS records with dnsjava. The configured DNS servers are used, or the
 * system resolvers when none are configured.
 *
 * @author URLRadar developers
 */
public class DnsJavaResolver implements DnsResolver {
    public static final String COMPONENT_NAME = "dns";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(DnsJavaResolver.class);

    private final LookupSession _session;
    private final Duration _timeout;

    public DnsJavaResolver(@NotNull Resolver resolver, @NotNull Duration timeout) {
        _session = LookupSession.builder().resolver(resolver).build();
        _timeout = timeout;
    }

    /**
     * Creates the resolver from the configured server list and the DNS timeout.
     */
    public static DnsJavaResolver fromConfig(@NotNull ConfigSnapshot config) throws UnknownHostException {
        final var servers = Common.splitList(config.property(ScannerConfig.DNS_SERVERS_CONFIG,
                ScannerConfig.DNS_SERVERS_DEFAULT));
        final var resolver = servers.isEmpty()
                ? new ExtendedResolver()
                : new ExtendedResolver(servers.toArray(String[]::new));
        resolver.setTimeout(config.dnsTimeout());
        resolver.setRetries(2);
        return new DnsJavaResolver(resolver, config.dnsTimeout().multipliedBy(3));
    }

    @Override
    public @NotNull List<String> resolveAddresses(@NotNull String hostname) throws CollaboratorException {
        final var name = toName(hostname);
        final var addresses = new ArrayList<String>(resolveA(name));
        addresses.addAll(resolveAAAA(name));
        if (addresses.isEmpty())
            throw new CollaboratorException(ResultCodes.NOT_FOUND, "No address records for " + hostname);
        return addresses;
    }

    @Override
    public @NotNull DnsEvidence collect(@NotNull String hostname) throws CollaboratorException {
        final var name = toName(hostname);
        Logger.trace("Collecting records of {}", hostname);

        final var a = resolveA(name);
        final var aaaa = resolveAAAA(name);
        final var mx = records(name, Type.MX, MXRecord.class,
                record -> record.getPriority() + " " + record.getTarget().toString());
        final var ns = records(name, Type.NS, NSRecord.class, record -> record.getTarget().toString());
        final var txt = records(name, Type.TXT, TXTRecord.class, DnsJavaResolver::joinStrings);
        final var caa = records(name, Type.CAA, CAARecord.class,
                record -> record.getFlags() + " " + record.getTag() + " \"" + record.getValue() + "\"");

        List<String> dmarc;
        try {
            dmarc = records(toName("_dmarc." + organizationalDomain(hostname)), Type.TXT, TXTRecord.class,
                    DnsJavaResolver::joinStrings);
        } catch (CollaboratorException e) {
            if (e.getCode() != ResultCodes.NOT_FOUND)
                throw e;
            dmarc = List.of();
        }

        return DnsEvidence.of(a, aaaa, mx, ns, txt, caa, dmarc);
    }

    private List<String> resolveA(Name name) throws CollaboratorException {
        return records(name, Type.A, ARecord.class, record -> record.getAddress().getHostAddress());
    }

    private List<String> resolveAAAA(Name name) throws CollaboratorException {
        return records(name, Type.AAAA, AAAARecord.class, record -> record.getAddress().getHostAddress());
    }

    private <T extends Record> List<String> records(Name name, int type, Class<T> recordClass,
                                                    Function<T, String> mapper) throws CollaboratorException {
        return lookup(name, type).stream()
                // Sanity check: the answer may contain other types (e.g. the CNAME chain)
                .filter(record -> record.getType() == type)
                .map(recordClass::cast)
                .map(mapper)
                .distinct()
                .collect(Collectors.toList());
    }

    /**
     * Looks up the records of the given type. A name without records of the type yields an empty list.
     *
     * @throws CollaboratorException with {@code NOT_FOUND} for a non-existent name, {@code TIMEOUT} when
     *                               the lookup exceeds the timeout, {@code OTHER_DNS_ERROR} otherwise
     */
    protected List<Record> lookup(@NotNull Name name, int type) throws CollaboratorException {
        try {
            return _session.lookupAsync(name, type)
                    .toCompletableFuture()
                    .get(_timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .getRecords();
        } catch (ExecutionException e) {
            final var cause = e.getCause();
            if (cause instanceof NoSuchRRSetException)
                return List.of();
            if (cause instanceof NoSuchDomainException)
                throw new CollaboratorException(ResultCodes.NOT_FOUND, "NXDOMAIN: " + name);
            if (cause instanceof IOException) {
                Logger.debug("DNS query failed: {} {}: {}", name, Type.string(type), cause.getMessage());
                throw new CollaboratorException(ResultCodes.OTHER_DNS_ERROR, cause.getMessage(), cause);
            }
            Logger.warn("Unexpected DNS error: {} {}", name, Type.string(type), cause);
            throw new CollaboratorException(ResultCodes.OTHER_DNS_ERROR, String.valueOf(cause), cause);
        } catch (TimeoutException e) {
            Logger.debug("DNS query timed out: {} {}", name, Type.string(type));
            throw new CollaboratorException(ResultCodes.TIMEOUT,
                    "DNS query timed out (%d ms)".formatted(_timeout.toMillis()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(ResultCodes.INTERNAL_ERROR, "Interrupted", e);
        }
    }

    /**
     * The registrable domain under which the DMARC record is published; the host itself when it has no
     * public suffix.
     */
    static String organizationalDomain(@NotNull String hostname) {
        try {
            final var domain = InternetDomainName.from(hostname);
            if (domain.isUnderPublicSuffix())
                return domain.topPrivateDomain().toString();
        } catch (IllegalArgumentException e) {
            Logger.trace("Not a domain name: {}", hostname);
        }
        return hostname;
    }

    private static String joinStrings(TXTRecord record) {
        return String.join("", record.getStrings());
    }

    private static Name toName(String hostname) throws CollaboratorException {
        try {
            return Name.fromString(hostname, Name.root);
        } catch (TextParseException e) {
            throw new CollaboratorException(ResultCodes.INVALID_FORMAT, "Invalid host name: " + hostname, e);
        }
    }
}
