package com.designcontext.simplifier.resolver;

import com.designcontext.simplifier.mapping.VariableMapping;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Variable names delivered with the current fetch, keyed by canonical id. A variable
 * that belongs to a known collection is named {@code Collection/Variable}.
 */
public class ApiVariableTable {

    private static final ApiVariableTable EMPTY = new ApiVariableTable(Collections.emptyMap(), Collections.emptyMap());

    private final Map<String, String> names;
    private final Map<String, String> descriptions;

    private ApiVariableTable(Map<String, String> names, Map<String, String> descriptions) {
        this.names = names;
        this.descriptions = descriptions;
    }

    public static ApiVariableTable empty() {
        return EMPTY;
    }

    /**
     * @param variables   variable id -> {@code {name, variableCollectionId, description}}; may be missing
     * @param collections collection id -> {@code {name}}; may be missing
     */
    public static ApiVariableTable of(JsonNode variables, JsonNode collections) {
        if (variables == null || !variables.isObject() || variables.size() == 0) {
            return EMPTY;
        }
        Map<String, String> names = new LinkedHashMap<>();
        Map<String, String> descriptions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = variables.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode variable = entry.getValue();
            String name = variable.path("name").asText("");
            if (name.isBlank()) {
                continue;
            }
            String collectionId = variable.path("variableCollectionId").asText("");
            if (!collectionId.isEmpty() && collections != null) {
                String collectionName = collections.path(collectionId).path("name").asText("");
                if (!collectionName.isBlank()) {
                    name = collectionName + "/" + name;
                }
            }
            String id = VariableIds.canonical(variable.path("id").asText(entry.getKey()));
            names.put(id, name);
            String description = variable.path("description").asText("");
            if (!description.isBlank()) {
                descriptions.put(id, description);
            }
        }
        return new ApiVariableTable(names, descriptions);
    }

    public Optional<String> lookup(String id) {
        String canonical = VariableIds.canonical(id);
        if (canonical == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(names.get(canonical));
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public int size() {
        return names.size();
    }

    /**
     * The table as mapping entries sorted by name, the layout of a mapping file.
     */
    public List<VariableMapping> toMappings(String origin) {
        List<VariableMapping> mappings = new ArrayList<>();
        names.forEach((id, name) -> mappings.add(VariableMapping.builder()
                .id(id)
                .name(name)
                .description(descriptions.get(id))
                .origin(origin)
                .build()));
        mappings.sort(Comparator.comparing(VariableMapping::getName));
        return mappings;
    }
}
