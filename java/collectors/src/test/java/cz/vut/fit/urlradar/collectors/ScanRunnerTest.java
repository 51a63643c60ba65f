package cz.vut.fit.urlradar.collectors;

import cz.vut.fit.urlradar.collectors.intel.BaseReputationSource;
import cz.vut.fit.urlradar.collectors.intel.GoogleSafeBrowsingSource;
import cz.vut.fit.urlradar.collectors.intel.VirusTotalSource;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.intel.ThreatIntelSource;
import org.apache.commons.cli.MissingOptionException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ScanRunnerTest {

    @Test
    void urlOptionIsRepeatable() throws Exception {
        var cmd = ScanRunner.parseCommandLine(
                new String[]{"-u", "https://example.com", "--url", "http://login-example.top/x", "--pretty"},
                ScanRunner.makeOptions());

        assertArrayEquals(new String[]{"https://example.com", "http://login-example.top/x"},
                cmd.getOptionValues("url"));
        assertTrue(cmd.hasOption("pretty"));
    }

    @Test
    void urlOptionIsRequired() {
        assertThrows(MissingOptionException.class,
                () -> ScanRunner.parseCommandLine(new String[]{"--pretty"}, ScanRunner.makeOptions()));
    }

    @Test
    void skipFlagsEndUpInTheScanOptions() throws Exception {
        var cmd = ScanRunner.parseCommandLine(
                new String[]{"-u", "https://example.com", "--skip-screenshot", "--skip-stage2"},
                ScanRunner.makeOptions());

        var options = ScanRunner.scanOptions(cmd);

        assertTrue(options.skipScreenshot());
        assertTrue(options.skipStage2());
        assertNull(options.deadline());
    }

    @Test
    void withoutFlagsEverythingRuns() throws Exception {
        var cmd = ScanRunner.parseCommandLine(new String[]{"-u", "https://example.com"}, ScanRunner.makeOptions());

        var options = ScanRunner.scanOptions(cmd);

        assertFalse(options.skipScreenshot());
        assertFalse(options.skipStage2());
    }

    @Test
    void overridesAreParsedAsKeyValuePairs() throws Exception {
        var cmd = ScanRunner.parseCommandLine(new String[]{
                "-u", "https://example.com",
                "-o", "models.mode = heuristic-only",
                "-o", "collectors.virustotal.token=abc=def",
                "-o", "not-a-pair"
        }, ScanRunner.makeOptions());

        var props = ScanRunner.overrides(cmd);

        assertEquals(2, props.size());
        assertEquals("heuristic-only", props.getProperty("models.mode"));
        assertEquals("abc=def", props.getProperty("collectors.virustotal.token"));
    }

    @Test
    void noOverridesGiveEmptyProperties() throws Exception {
        var cmd = ScanRunner.parseCommandLine(new String[]{"-u", "https://example.com"}, ScanRunner.makeOptions());

        assertTrue(ScanRunner.overrides(cmd).isEmpty());
    }

    @Test
    void sourcesWithoutTokensAreRegisteredAsDisabled() {
        List<ThreatIntelSource> sources = ScanRunner.intelSources(ConfigSnapshot.defaults(), Clock.systemUTC());

        assertEquals(List.of(GoogleSafeBrowsingSource.NAME, VirusTotalSource.NAME),
                sources.stream().map(ThreatIntelSource::name).toList());
        assertTrue(sources.stream().allMatch(source -> ((BaseReputationSource<?>) source).isDisabled()));
    }

    @Test
    void configuredTokenEnablesTheSource() {
        var props = new Properties();
        props.setProperty("collectors.virustotal.token", "vt-key");

        var sources = ScanRunner.intelSources(ConfigSnapshot.fromProperties(props), Clock.systemUTC());

        var virusTotal = (BaseReputationSource<?>) sources.get(1);
        assertFalse(virusTotal.isDisabled());
        assertTrue(((BaseReputationSource<?>) sources.get(0)).isDisabled());
    }
}
