package com.designcontext.simplifier.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * The shared Jackson configuration: unknown fields tolerated on read, no failure on
 * empty beans on write.
 */
public class JsonMappers {

    private static final ObjectMapper SHARED = create();

    private JsonMappers() {
        // Utility class
    }

    public static ObjectMapper shared() {
        return SHARED;
    }

    public static ObjectMapper create() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public static ObjectMapper prettyPrinting() {
        return create().enable(SerializationFeature.INDENT_OUTPUT);
    }
}
