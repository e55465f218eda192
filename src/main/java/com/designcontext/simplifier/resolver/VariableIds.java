package com.designcontext.simplifier.resolver;

import java.util.regex.Pattern;

/**
 * Normalisation of variable identifiers.
 *
 * The canonical form is {@code VariableID:50:7}; {@code 50:7} is the bare form and
 * {@code Variable[50:7]} the placeholder shown when no name could be found.
 */
public final class VariableIds {

    public static final String PREFIX = "VariableID:";

    private static final String PLACEHOLDER_START = "Variable[";
    private static final Pattern BARE_ID = Pattern.compile("([0-9a-fA-F]+/)?\\d+:\\d+");

    private VariableIds() {
    }

    /**
     * Canonical form of a namespaced, bare or placeholder id; null for null or blank input.
     */
    public static String canonical(String id) {
        if (id == null || id.isBlank()) {
            return null;
        }
        String trimmed = id.trim();
        if (isPlaceholder(trimmed)) {
            trimmed = trimmed.substring(PLACEHOLDER_START.length(), trimmed.length() - 1);
        }
        return trimmed.startsWith(PREFIX) ? trimmed : PREFIX + trimmed;
    }

    public static String bare(String id) {
        String canonical = canonical(id);
        return canonical == null ? null : canonical.substring(PREFIX.length());
    }

    public static String placeholder(String id) {
        String bare = bare(id);
        return PLACEHOLDER_START + (bare == null ? "" : bare) + "]";
    }

    public static boolean isPlaceholder(String value) {
        return value != null && value.startsWith(PLACEHOLDER_START) && value.endsWith("]");
    }

    /**
     * True for strings that are identifiers rather than names: the namespaced form or a
     * bare {@code 12:34}. Placeholders are not raw ids.
     */
    public static boolean isRawId(String value) {
        if (value == null) {
            return false;
        }
        return value.startsWith(PREFIX) || BARE_ID.matcher(value).matches();
    }
}
