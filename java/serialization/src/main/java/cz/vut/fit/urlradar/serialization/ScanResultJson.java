package cz.vut.fit.urlradar.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.models.results.ScanResult;

/**
 * JSON form of a {@link ScanResult}, used for result caching and by the command-line runner.
 * The decision graph and the category order are kept as they are in the result.
 *
 * @author URLRadar developers
 */
public class ScanResultJson {
    private final JsonCodec<ScanResult> _codec;

    public ScanResultJson() {
        this(Common.makeMapper().build());
    }

    public ScanResultJson(ObjectMapper objectMapper) {
        _codec = JsonCodec.of(objectMapper, ScanResult.class);
    }

    public byte[] serialize(ScanResult result) {
        return _codec.serializer().serialize(result);
    }

    public ScanResult deserialize(byte[] bytes) {
        return _codec.deserializer().deserialize(bytes);
    }

    public ScanResult deserialize(String json) {
        return _codec.deserializer().deserialize(json);
    }

    /**
     * Renders the result as a JSON string.
     *
     * @param result The result.
     * @param pretty Whether to indent the output.
     * @return The JSON text.
     */
    public String toJson(ScanResult result, boolean pretty) {
        return _codec.serializer().serializeToString(result, pretty);
    }
}
