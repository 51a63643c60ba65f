package cz.vut.fit.urlradar.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;

/**
 * A serializer and a deserializer for the same type sharing one {@link ObjectMapper}.
 *
 * @param <T> The type of the (de)serialized value.
 */
public record JsonCodec<T>(@NotNull JsonSerializer<T> serializer, @NotNull JsonDeserializer<T> deserializer) {

    public static <T> JsonCodec<T> of(@NotNull ObjectMapper objectMapper, @NotNull Class<T> forType) {
        return new JsonCodec<>(new JsonSerializer<>(objectMapper, forType),
                new JsonDeserializer<>(objectMapper, forType));
    }
}
