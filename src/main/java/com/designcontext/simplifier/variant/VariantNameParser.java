package com.designcontext.simplifier.variant;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses variant names of the form {@code "Layout=Default, Title=true"}.
 */
public final class VariantNameParser {

    private VariantNameParser() {
    }

    /**
     * Splits on commas, then on the first {@code =}; keys and values are trimmed. Only the
     * literal values {@code true} and {@code false} become booleans. Segments without a key
     * or a value are skipped.
     */
    public static Map<String, Object> parse(String variantName) {
        Map<String, Object> properties = new LinkedHashMap<>();
        if (variantName == null || variantName.isBlank()) {
            return properties;
        }
        for (String part : variantName.split(",")) {
            int separator = part.indexOf('=');
            if (separator < 0) {
                continue;
            }
            String key = part.substring(0, separator).trim();
            String value = part.substring(separator + 1).trim();
            if (key.isEmpty() || value.isEmpty()) {
                continue;
            }
            if ("true".equals(value) || "false".equals(value)) {
                properties.put(key, Boolean.valueOf(value));
            } else {
                properties.put(key, value);
            }
        }
        return properties;
    }
}
