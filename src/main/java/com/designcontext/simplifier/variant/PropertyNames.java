package com.designcontext.simplifier.variant;

import java.util.regex.Pattern;

public final class PropertyNames {

    private static final Pattern POSITIONAL_SUFFIX = Pattern.compile("#\\d+:\\d+$");
    private static final String CHILD_ARROW = "↪ ";

    private PropertyNames() {
    }

    /**
     * Drops the platform's {@code #187:1} suffix and the leading arrow of nested properties:
     * {@code "↪ Icon 1#187:1"} -> {@code "Icon 1"}.
     */
    public static String clean(String name) {
        if (name == null) {
            return null;
        }
        String cleaned = POSITIONAL_SUFFIX.matcher(name.trim()).replaceFirst("").trim();
        if (cleaned.startsWith(CHILD_ARROW)) {
            cleaned = cleaned.substring(CHILD_ARROW.length()).trim();
        }
        return cleaned;
    }
}
