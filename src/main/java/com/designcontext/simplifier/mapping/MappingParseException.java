package com.designcontext.simplifier.mapping;

/**
 * Raised when a mapping or design-token document is not valid JSON or has the wrong shape.
 */
public class MappingParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MappingParseException(String message) {
        super(message);
    }

    public MappingParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
