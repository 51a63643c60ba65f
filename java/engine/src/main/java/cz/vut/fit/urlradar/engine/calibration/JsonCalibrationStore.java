package cz.vut.fit.urlradar.engine.calibration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.engine.config.ConfigurationException;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads per-branch calibration data from JSON documents named {@code <branch>.json}, e.g.
 * <pre>{"branch": "ONLINE", "scores": [0.02, 0.05, ...]}</pre>
 * The documents are read either from a directory or from the {@code calibration/} classpath folder.
 * All documents are read and validated when the store is created.
 *
 * @author URLRadar developers
 */
public class JsonCalibrationStore implements CalibrationStore {
    public static final String COMPONENT_NAME = "calibration-store";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(JsonCalibrationStore.class);

    public static final String CLASSPATH_FOLDER = "calibration/";

    private final Map<ReachabilityStatus, CalibrationSet> _sets;

    private JsonCalibrationStore(Map<ReachabilityStatus, CalibrationSet> sets) {
        _sets = Collections.unmodifiableMap(sets);
    }

    /**
     * Loads the bundled calibration data from the classpath.
     *
     * @throws ConfigurationException if a document is malformed
     */
    public static JsonCalibrationStore fromClasspath() {
        final var mapper = Common.makeMapper().build();
        final var loader = JsonCalibrationStore.class.getClassLoader();
        final var sets = new EnumMap<ReachabilityStatus, CalibrationSet>(ReachabilityStatus.class);

        for (var branch : ReachabilityStatus.values()) {
            final var name = CLASSPATH_FOLDER + fileName(branch);
            try (var stream = loader.getResourceAsStream(name)) {
                if (stream == null) {
                    Logger.debug("No bundled calibration data for {}", branch);
                    continue;
                }
                sets.put(branch, read(mapper, stream, branch, name));
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read " + name, e);
            }
        }

        Logger.info("Loaded bundled calibration data for {}", sets.keySet());
        return new JsonCalibrationStore(sets);
    }

    /**
     * Loads the calibration data from a directory. Branches without a document have no calibration data.
     *
     * @throws ConfigurationException if the directory does not exist or a document is malformed
     */
    public static JsonCalibrationStore fromDirectory(@NotNull Path directory) {
        if (!Files.isDirectory(directory))
            throw new ConfigurationException("Calibration directory does not exist: " + directory);

        final var mapper = Common.makeMapper().build();
        final var sets = new EnumMap<ReachabilityStatus, CalibrationSet>(ReachabilityStatus.class);
        for (var branch : ReachabilityStatus.values()) {
            final var file = directory.resolve(fileName(branch));
            if (!Files.isRegularFile(file))
                continue;
            try (var stream = Files.newInputStream(file)) {
                sets.put(branch, read(mapper, stream, branch, file.toString()));
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read " + file, e);
            }
        }

        Logger.info("Loaded calibration data for {} from {}", sets.keySet(), directory);
        return new JsonCalibrationStore(sets);
    }

    /**
     * Loads from the configured directory, or from the classpath when the setting is blank.
     */
    public static JsonCalibrationStore load(@NotNull String directory) {
        return directory.isBlank() ? fromClasspath() : fromDirectory(Path.of(directory));
    }

    @Override
    public @Nullable CalibrationSet forBranch(@NotNull ReachabilityStatus branch) {
        return _sets.get(branch);
    }

    private static String fileName(ReachabilityStatus branch) {
        return branch.name().toLowerCase(Locale.ROOT) + ".json";
    }

    private static CalibrationSet read(ObjectMapper mapper, InputStream stream, ReachabilityStatus branch,
                                       String source) throws IOException {
        final Document document;
        try {
            document = mapper.readValue(stream, Document.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed calibration data in " + source + ": "
                    + e.getOriginalMessage(), e);
        }

        if (document.branch() != null && document.branch() != branch)
            throw new ConfigurationException(source + " contains data of " + document.branch());
        final var scores = document.scores() == null ? List.<Double>of() : document.scores();
        for (var score : scores) {
            if (score == null || score < 0.0 || score > 1.0)
                throw new ConfigurationException(source + " contains a score outside [0, 1]: " + score);
        }
        return new CalibrationSet(branch, scores);
    }

    record Document(@Nullable ReachabilityStatus branch, @Nullable List<Double> scores) {
    }
}
