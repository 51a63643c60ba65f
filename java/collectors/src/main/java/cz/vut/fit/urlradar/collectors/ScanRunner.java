package cz.vut.fit.urlradar.collectors;

import cz.vut.fit.urlradar.collectors.evidence.DnsJavaResolver;
import cz.vut.fit.urlradar.collectors.evidence.JsoupPageRenderer;
import cz.vut.fit.urlradar.collectors.evidence.MaxMindNetworkLookup;
import cz.vut.fit.urlradar.collectors.evidence.RdapRegistryLookup;
import cz.vut.fit.urlradar.collectors.evidence.SocketTlsInspector;
import cz.vut.fit.urlradar.collectors.intel.BaseReputationSource;
import cz.vut.fit.urlradar.collectors.intel.GoogleSafeBrowsingSource;
import cz.vut.fit.urlradar.collectors.intel.VirusTotalSource;
import cz.vut.fit.urlradar.collectors.ml.HttpModelPredictor;
import cz.vut.fit.urlradar.engine.ScanOrchestrator;
import cz.vut.fit.urlradar.engine.config.ConfigProvider;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.config.ConfigurationException;
import cz.vut.fit.urlradar.engine.config.PropertiesConfigProvider;
import cz.vut.fit.urlradar.engine.intel.ThreatIntelSource;
import cz.vut.fit.urlradar.engine.ml.HeuristicModelPredictor;
import cz.vut.fit.urlradar.engine.ml.PredictorRegistry;
import cz.vut.fit.urlradar.models.ScanOptions;
import cz.vut.fit.urlradar.models.ScanRequest;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import cz.vut.fit.urlradar.serialization.ScanResultJson;
import org.apache.commons.cli.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * The command-line entry point. Scans the given URLs one by one and prints each result as JSON.
 *
 * @author URLRadar developers
 */
public class ScanRunner {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(ScanRunner.class);

    public static void main(String[] args) {
        final var options = makeOptions();

        final CommandLine cmd;
        try {
            cmd = parseCommandLine(args, options);
        } catch (ParseException e) {
            if (Arrays.stream(args).anyMatch(arg -> arg.equals("-h") || arg.equals("--help"))) {
                printHelpAndExit(options, 0);
                return;
            }
            System.err.println(e.getMessage());
            printHelpAndExit(options, 1);
            return;
        }

        if (cmd.hasOption("h")) {
            printHelpAndExit(options, 0);
            return;
        }

        final PropertiesConfigProvider configProvider;
        try {
            final var file = cmd.hasOption("properties") ? Path.of(cmd.getOptionValue("properties")) : null;
            configProvider = PropertiesConfigProvider.load(file, overrides(cmd));
        } catch (IOException e) {
            Logger.error("Failed to load properties: {}", e.getMessage());
            System.exit(2);
            return;
        } catch (ConfigurationException e) {
            Logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(3);
            return;
        }

        final var json = new ScanResultJson();
        final var pretty = cmd.hasOption("pretty");
        final var scanOptions = scanOptions(cmd);

        MaxMindNetworkLookup networkLookup = null;
        try {
            networkLookup = MaxMindNetworkLookup.fromConfig(configProvider.snapshot());
            try (var orchestrator = buildOrchestrator(configProvider, networkLookup, Clock.systemUTC())) {
                for (var url : cmd.getOptionValues("url")) {
                    final ScanRequest request;
                    try {
                        request = ScanRequest.of(url, scanOptions);
                    } catch (IllegalArgumentException e) {
                        Logger.error("Invalid URL {}: {}", url, e.getMessage());
                        continue;
                    }

                    Logger.info("Scanning {} ({})", request.url(), request.scanId());
                    final var result = orchestrator.scan(request);
                    System.out.println(json.toJson(result, pretty));
                }
            }
        } catch (IOException e) {
            Logger.error("Failed to initialize a collaborator", e);
            System.exit(4);
        } finally {
            closeLookup(networkLookup);
        }
    }

    /**
     * Builds the orchestrator with the adapters configured by the current snapshot.
     *
     * @param networkLookup The ASN lookup, or null when it is disabled.
     */
    static ScanOrchestrator buildOrchestrator(@NotNull ConfigProvider configProvider,
                                              @Nullable MaxMindNetworkLookup networkLookup,
                                              @NotNull Clock clock) throws IOException {
        final var config = configProvider.snapshot();

        return ScanOrchestrator.builder(configProvider)
                .intelSources(intelSources(config, clock))
                .dnsResolver(DnsJavaResolver.fromConfig(config))
                .registryLookup(new RdapRegistryLookup(config, clock))
                .tlsInspector(new SocketTlsInspector(config.evidenceTimeout(EvidenceKind.TLS)))
                .pageRenderer(new JsoupPageRenderer(config))
                .networkLookup(networkLookup)
                .predictors(new PredictorRegistry(new HeuristicModelPredictor(), new HttpModelPredictor(config)))
                .clock(clock)
                .build();
    }

    /**
     * Creates the reputation sources. Sources without a token are still registered so that they are
     * reported as disabled in the results.
     */
    static List<ThreatIntelSource> intelSources(@NotNull ConfigSnapshot config, @NotNull Clock clock) {
        final var sources = new ArrayList<BaseReputationSource<?>>();
        sources.add(new GoogleSafeBrowsingSource(config, clock));
        sources.add(new VirusTotalSource(config, clock));

        for (var source : sources) {
            if (source.isDisabled())
                Logger.info("Threat-intel source {} is disabled (no token)", source.name());
            else
                Logger.info("Using threat-intel source {}", source.name());
        }
        return List.<ThreatIntelSource>copyOf(sources);
    }

    static ScanOptions scanOptions(@NotNull CommandLine cmd) {
        return new ScanOptions(cmd.hasOption("skip-screenshot"), cmd.hasOption("skip-stage2"), null);
    }

    /**
     * Collects the {@code --option key=value} pairs.
     */
    static Properties overrides(@NotNull CommandLine cmd) {
        final var props = new Properties();
        final var cmdLineProperties = cmd.getOptionValues("option");
        if (cmdLineProperties != null) {
            for (var option : cmdLineProperties) {
                if (option.contains("=")) {
                    final var parts = option.split("=", 2);
                    props.put(parts[0].trim(), parts[1].trim());
                } else {
                    Logger.warn("Ignoring invalid command-line option: {}", option);
                }
            }
        }
        return props;
    }

    static CommandLine parseCommandLine(String[] args, Options options) throws ParseException {
        return new DefaultParser().parse(options, args);
    }

    static Options makeOptions() {
        final var options = new Options();
        options.addOption("h", "help", false, "Print this help message");
        options.addOption(null, "skip-screenshot", false, "Do not capture a screenshot");
        options.addOption(null, "skip-stage2", false, "Never run the deep Stage-2 models");
        options.addOption(null, "pretty", false, "Pretty-print the JSON results");

        options.addOption(Option.builder("u")
                .longOpt("url")
                .desc("A URL to scan (repeatable, required)")
                .argName("url")
                .hasArg()
                .required()
                .build());
        options.addOption(Option.builder("p")
                .longOpt("properties")
                .desc("Path to a configuration file")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder("o")
                .longOpt("option")
                .desc("A properties key/value to add to the configuration")
                .argName("key=value")
                .hasArg()
                .build());

        return options;
    }

    private static void closeLookup(@Nullable MaxMindNetworkLookup lookup) {
        if (lookup == null)
            return;
        try {
            lookup.close();
        } catch (IOException e) {
            Logger.warn("Failed to close the GeoIP database", e);
        }
    }

    private static void printHelpAndExit(Options options, int exitCode) {
        final var formatter = new HelpFormatter();
        formatter.printHelp("scan-runner", options);
        System.exit(exitCode);
    }
}
