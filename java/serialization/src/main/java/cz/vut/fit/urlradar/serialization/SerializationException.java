package cz.vut.fit.urlradar.serialization;

/**
 * Thrown when an object cannot be converted to or from its JSON representation.
 *
 * @author URLRadar developers
 */
public class SerializationException extends RuntimeException {
    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
