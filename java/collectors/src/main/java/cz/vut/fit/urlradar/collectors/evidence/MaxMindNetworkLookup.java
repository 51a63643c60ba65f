package cz.vut.fit.urlradar.collectors.evidence;

import com.google.common.net.InetAddresses;
import com.maxmind.db.CHMCache;
import com.maxmind.geoip2.DatabaseReader;
import com.maxmind.geoip2.exception.GeoIp2Exception;
import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.ScannerConfig;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.evidence.NetworkLookup;
import cz.vut.fit.urlradar.models.evidence.NetworkEvidence;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Maps addresses to autonomous systems using a local GeoLite2 ASN database.
 *
 * @author URLRadar developers
 */
public class MaxMindNetworkLookup implements NetworkLookup, Closeable {
    public static final String COMPONENT_NAME = "geoip-asn";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(MaxMindNetworkLookup.class);

    // Organisation name fragments of hosting and cloud providers
    private static final List<String> HOSTING_MARKERS = List.of("amazon", "aws", "google", "microsoft", "azure",
            "digitalocean", "linode", "akamai", "ovh", "hetzner", "contabo", "vultr", "choopa", "cloudflare",
            "fastly", "alibaba", "tencent", "oracle", "hostinger", "godaddy", "namecheap", "leaseweb", "scaleway",
            "hosting", "server", "cloud", "datacenter", "data center", "vps");

    private final DatabaseReader _asnReader;

    public MaxMindNetworkLookup(@NotNull File asnDatabase) throws IOException {
        this(new DatabaseReader.Builder(asnDatabase).withCache(new CHMCache()).build());
        Logger.info("GeoIP ASN database loaded: {}", asnDatabase);
    }

    public MaxMindNetworkLookup(@NotNull DatabaseReader asnReader) {
        _asnReader = asnReader;
    }

    /**
     * Creates the lookup from the configured database path.
     *
     * @return The lookup, or null if no database is configured.
     */
    public static @Nullable MaxMindNetworkLookup fromConfig(@NotNull ConfigSnapshot config) throws IOException {
        final var path = config.property(ScannerConfig.GEOIP_ASN_DB_CONFIG, ScannerConfig.GEOIP_ASN_DB_DEFAULT);
        if (path.isBlank()) {
            Logger.info("No GeoIP ASN database configured, network evidence disabled");
            return null;
        }
        return new MaxMindNetworkLookup(new File(path));
    }

    @Override
    public @NotNull NetworkEvidence lookup(@NotNull String ip) throws CollaboratorException {
        try {
            final var address = InetAddresses.forString(ip);
            final var asn = _asnReader.tryAsn(address);
            if (asn.isEmpty())
                throw new CollaboratorException(ResultCodes.NOT_FOUND, "No ASN data for " + ip);

            final var organization = asn.get().getAutonomousSystemOrganization();
            return new NetworkEvidence(ip, asn.get().getAutonomousSystemNumber(), organization,
                    isHostingProvider(organization));
        } catch (IllegalArgumentException e) {
            Logger.debug("Invalid IP address: {}", ip);
            throw new CollaboratorException(ResultCodes.INVALID_FORMAT, e.getMessage(), e);
        } catch (IOException | GeoIp2Exception e) {
            Logger.error("Error while reading ASN data for {}", ip, e);
            throw new CollaboratorException(ResultCodes.INTERNAL_ERROR, e.getMessage(), e);
        }
    }

    static boolean isHostingProvider(@Nullable String organization) {
        if (organization == null)
            return false;
        final var lower = organization.toLowerCase(Locale.ROOT);
        return HOSTING_MARKERS.stream().anyMatch(lower::contains);
    }

    @Override
    public void close() throws IOException {
        _asnReader.close();
    }
}
