package com.designcontext.simplifier.resolver.source;

/**
 * A mapping source that is configured but could not deliver.
 */
public class MappingSourceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MappingSourceException(String message) {
        super(message);
    }

    public MappingSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
