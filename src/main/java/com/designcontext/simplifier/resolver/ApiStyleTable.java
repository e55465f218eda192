package com.designcontext.simplifier.resolver;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Text style names from the document's {@code styles} table (style id -> {@code {name, styleType}}).
 */
public class ApiStyleTable {

    private static final ApiStyleTable EMPTY = new ApiStyleTable(Collections.emptyMap());

    private final Map<String, String> textStyleNames;

    private ApiStyleTable(Map<String, String> textStyleNames) {
        this.textStyleNames = textStyleNames;
    }

    public static ApiStyleTable empty() {
        return EMPTY;
    }

    public static ApiStyleTable of(JsonNode styles) {
        if (styles == null || !styles.isObject() || styles.size() == 0) {
            return EMPTY;
        }
        Map<String, String> names = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = styles.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String styleType = entry.getValue().path("styleType").asText("TEXT");
            String name = entry.getValue().path("name").asText("");
            if ("TEXT".equals(styleType) && !name.isBlank()) {
                names.put(entry.getKey(), name);
            }
        }
        return new ApiStyleTable(names);
    }

    public Optional<String> lookup(String styleId) {
        if (styleId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(textStyleNames.get(styleId));
    }

    public int size() {
        return textStyleNames.size();
    }
}
