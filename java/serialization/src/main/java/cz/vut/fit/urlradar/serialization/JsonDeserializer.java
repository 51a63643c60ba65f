package cz.vut.fit.urlradar.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/**
 * Reads values of a single type from JSON. Empty input yields null.
 *
 * @param <T> The type of the deserialized value.
 *
 * @author URLRadar developers
 */
public class JsonDeserializer<T> {
    private final ObjectReader _reader;
    private final Class<T> _forType;

    public JsonDeserializer(@NotNull ObjectMapper objectMapper, @NotNull Class<T> forType) {
        _reader = objectMapper.readerFor(forType);
        _forType = forType;
    }

    public @Nullable T deserialize(byte @Nullable [] bytes) {
        if (bytes == null || bytes.length == 0)
            return null;

        try {
            return _reader.readValue(bytes);
        } catch (IOException e) {
            throw new SerializationException("Invalid " + _forType.getSimpleName() + " JSON", e);
        }
    }

    public @Nullable T deserialize(@Nullable String json) {
        if (json == null || json.isBlank())
            return null;

        try {
            return _reader.readValue(json);
        } catch (IOException e) {
            throw new SerializationException("Invalid " + _forType.getSimpleName() + " JSON", e);
        }
    }
}
