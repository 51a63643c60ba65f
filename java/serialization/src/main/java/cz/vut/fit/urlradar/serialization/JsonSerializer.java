package cz.vut.fit.urlradar.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Writes values of a single type as JSON, either compact (for caching) or indented (for people).
 *
 * @param <T> The type of the serialized value.
 *
 * @author URLRadar developers
 */
public class JsonSerializer<T> {
    private final ObjectWriter _compact;
    private final ObjectWriter _indented;

    public JsonSerializer(@NotNull ObjectMapper objectMapper, @NotNull Class<T> forType) {
        _compact = objectMapper.writerFor(forType);
        _indented = _compact.withDefaultPrettyPrinter();
    }

    public byte @Nullable [] serialize(@Nullable T value) {
        if (value == null)
            return null;

        try {
            return _compact.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public @Nullable String serializeToString(@Nullable T value, boolean pretty) {
        if (value == null)
            return null;

        try {
            return (pretty ? _indented : _compact).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
