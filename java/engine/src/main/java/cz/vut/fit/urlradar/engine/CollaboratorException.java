package cz.vut.fit.urlradar.engine;

import cz.vut.fit.urlradar.ResultCodes;

/**
 * Thrown by a collaborator (reputation source, resolver, registry lookup, renderer...) when it cannot
 * provide its result. The pipeline never propagates it; the code is recorded as the reason of the
 * missing data.
 *
 * @author URLRadar developers
 */
public class CollaboratorException extends Exception {
    private final int _code;

    public CollaboratorException(int code, String message) {
        super(message);
        _code = code;
    }

    public CollaboratorException(int code, String message, Throwable cause) {
        super(message, cause);
        _code = code;
    }

    /**
     * The result code, one of the {@link ResultCodes} constants.
     */
    public int getCode() {
        return _code;
    }

    /**
     * A short description of the failure, including the result code name.
     */
    public String describe() {
        final var message = getMessage();
        return message == null || message.isBlank()
                ? ResultCodes.nameOf(_code)
                : ResultCodes.nameOf(_code) + ": " + message;
    }
}
