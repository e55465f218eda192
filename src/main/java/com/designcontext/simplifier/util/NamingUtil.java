package com.designcontext.simplifier.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Naming conventions used when deriving semantic names and comparing layer names.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts "surface-inverse", "surface_inverse" or "surface inverse" to PascalCase.
     * Existing inner capitals are kept ("onSurface" -> "OnSurface").
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.trim().split("[-_\\s]+"))
                .filter(part -> !part.isEmpty())
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    /**
     * Converts a word sequence to camelCase.
     */
    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal == null || pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase(Locale.ROOT) + pascal.substring(1);
    }

    /**
     * Joins path segments into a single camelCase identifier:
     * ["surface", "on-inverse"] -> "surfaceOnInverse".
     */
    public static String joinCamelCase(List<String> segments) {
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            String pascal = toPascalCase(segment);
            if (pascal == null || pascal.isEmpty()) {
                continue;
            }
            sb.append(pascal);
        }
        if (sb.length() == 0) {
            return "";
        }
        return sb.substring(0, 1).toLowerCase(Locale.ROOT) + sb.substring(1);
    }

    /**
     * Lower-cases and drops whitespace, so "SF Pro Text" and "sfprotext" compare equal.
     */
    public static String normalizeFamily(String family) {
        if (family == null) {
            return "";
        }
        return family.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive, whitespace-collapsed form of a layer or property name.
     */
    public static String normalizeLabel(String label) {
        if (label == null) {
            return "";
        }
        return label.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1);
    }
}
