package cz.vut.fit.urlradar;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.MapperBuilder;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Common utility functions and constants.
 *
 * @author URLRadar developers
 */
public final class Common {
    private Common() {
    }

    /**
     * Creates a new Jackson JSON {@link ObjectMapper} builder with the following settings:
     * <ul>
     *     <li>Include the JavaTimeModule to support Java 8 date/time datatypes.</li>
     *     <li>Include source locations in exceptions.</li>
     *     <li>Read/write date timestamps as milliseconds.</li>
     *     <li>Do not fail on unknown properties.</li>
     * </ul>
     *
     * @return a new {@link MapperBuilder} instance
     */
    public static MapperBuilder<? extends ObjectMapper, ?> makeMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .configure(JsonParser.Feature.INCLUDE_SOURCE_IN_LOCATION, true)
                .configure(SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS, false)
                .configure(DeserializationFeature.READ_DATE_TIMESTAMPS_AS_NANOSECONDS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Creates a logger for a specific pipeline component. The logger name will be created by concatenating
     * the class name, a dot, and the value of the static field {@code COMPONENT_NAME} in the class.
     *
     * @param clazz the class to get the logger for
     * @return a SLF4J {@link Logger} instance
     */
    public static Logger getComponentLogger(Class<?> clazz) {
        try {
            final String componentName = clazz.getField("COMPONENT_NAME")
                    .get(null).toString();
            return org.slf4j.LoggerFactory.getLogger(clazz.getName() + "." + componentName);
        } catch (IllegalAccessException | NoSuchFieldException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Clamps a value into the closed interval [0, 1]. NaN is mapped to 0.
     *
     * @param value the value to clamp
     * @return the clamped value
     */
    public static double clamp01(double value) {
        if (Double.isNaN(value) || value < 0.0)
            return 0.0;
        return Math.min(value, 1.0);
    }

    /**
     * Computes the Shannon entropy (in bits per character) of the specified string.
     *
     * @param input the string to analyse; may be null
     * @return the entropy, 0 for a null or empty string
     */
    public static double shannonEntropy(@Nullable String input) {
        if (input == null || input.isEmpty())
            return 0.0;

        final var counts = new java.util.HashMap<Character, Integer>();
        for (int i = 0; i < input.length(); i++) {
            counts.merge(input.charAt(i), 1, Integer::sum);
        }

        double entropy = 0.0;
        final double length = input.length();
        for (var count : counts.values()) {
            double p = count / length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    /**
     * Splits a comma-separated list, trimming the items and dropping empty ones.
     *
     * @param value the comma-separated list; may be null
     * @return the list of non-empty items
     */
    public static @NotNull List<String> splitList(@Nullable String value) {
        final var result = new ArrayList<String>();
        if (value == null)
            return result;

        for (var item : value.split(",")) {
            var trimmed = item.trim();
            if (!trimmed.isEmpty())
                result.add(trimmed);
        }
        return result;
    }
}
