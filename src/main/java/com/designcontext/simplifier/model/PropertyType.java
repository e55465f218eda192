package com.designcontext.simplifier.model;

import java.util.Locale;

/**
 * Kinds of component property the platform knows about.
 */
public enum PropertyType {
    BOOLEAN,
    TEXT,
    VARIANT,
    INSTANCE_SWAP;

    /**
     * Lenient parse of the platform's property type string; unknown values map to null.
     */
    public static PropertyType fromPlatform(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return PropertyType.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
