package cz.vut.fit.urlradar.engine.intel;

import cz.vut.fit.urlradar.engine.features.DomainNames;
import cz.vut.fit.urlradar.models.ScanRequest;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link TombstoneStore} holding canonical URLs and host names in memory. An entry without a scheme is
 * treated as a host name and matches every URL on that host.
 *
 * @author URLRadar developers
 */
public class InMemoryTombstoneStore implements TombstoneStore {
    private final Set<String> _urls = ConcurrentHashMap.newKeySet();
    private final Set<String> _hosts = ConcurrentHashMap.newKeySet();

    public InMemoryTombstoneStore() {
    }

    public InMemoryTombstoneStore(@NotNull Collection<String> entries) {
        entries.forEach(this::add);
    }

    /**
     * Adds a URL or a host name.
     *
     * @throws IllegalArgumentException if the URL cannot be canonicalized
     */
    public void add(@NotNull String entry) {
        final var trimmed = entry.trim();
        if (trimmed.contains("://"))
            _urls.add(ScanRequest.canonicalize(trimmed).toString());
        else
            _hosts.add(trimmed.toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean isTombstoned(@NotNull String url) {
        if (_urls.contains(url))
            return true;
        final var host = DomainNames.hostOf(url);
        return host != null && _hosts.contains(host);
    }
}
