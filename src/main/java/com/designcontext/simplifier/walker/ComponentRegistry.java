package com.designcontext.simplifier.walker;

import com.designcontext.simplifier.model.SimplifiedComponentDefinition;
import com.designcontext.simplifier.model.SimplifiedComponentSetDefinition;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.Getter;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Components and component sets met during a walk, optionally seeded from the document's
 * metadata tables. Entries from metadata keep their fields; nodes seen in the tree fill
 * in what is missing.
 */
@Getter
public class ComponentRegistry {

    private final Map<String, SimplifiedComponentDefinition> components = new LinkedHashMap<>();
    private final Map<String, SimplifiedComponentSetDefinition> componentSets = new LinkedHashMap<>();

    public void seed(JsonNode componentMetadata, JsonNode componentSetMetadata) {
        forEachEntry(componentMetadata, (id, meta) -> components.put(id, SimplifiedComponentDefinition.builder()
                .id(id)
                .key(text(meta, "key"))
                .name(text(meta, "name"))
                .componentSetId(text(meta, "componentSetId"))
                .description(text(meta, "description"))
                .documentationLinks(links(meta))
                .remote(meta.has("remote") ? meta.get("remote").asBoolean() : null)
                .build()));
        forEachEntry(componentSetMetadata, (id, meta) -> componentSets.put(id, SimplifiedComponentSetDefinition.builder()
                .id(id)
                .key(text(meta, "key"))
                .name(text(meta, "name"))
                .description(text(meta, "description"))
                .documentationLinks(links(meta))
                .remote(meta.has("remote") ? meta.get("remote").asBoolean() : null)
                .build()));
    }

    public void registerComponent(String id, String key, String name, String componentSetId, String description) {
        SimplifiedComponentDefinition existing = components.get(id);
        if (existing == null) {
            components.put(id, SimplifiedComponentDefinition.builder()
                    .id(id).key(key).name(name).componentSetId(componentSetId).description(description)
                    .build());
            return;
        }
        components.put(id, existing.toBuilder()
                .key(firstNonNull(existing.getKey(), key))
                .name(firstNonNull(existing.getName(), name))
                .componentSetId(firstNonNull(existing.getComponentSetId(), componentSetId))
                .description(firstNonNull(existing.getDescription(), description))
                .build());
    }

    public void registerComponentSet(String id, String key, String name, String description) {
        SimplifiedComponentSetDefinition existing = componentSets.get(id);
        if (existing == null) {
            componentSets.put(id, SimplifiedComponentSetDefinition.builder()
                    .id(id).key(key).name(name).description(description)
                    .build());
            return;
        }
        componentSets.put(id, existing.toBuilder()
                .key(firstNonNull(existing.getKey(), key))
                .name(firstNonNull(existing.getName(), name))
                .description(firstNonNull(existing.getDescription(), description))
                .build());
    }

    /**
     * Component-set id recorded for a component, from metadata or an earlier registration.
     */
    public String componentSetOf(String componentId) {
        SimplifiedComponentDefinition definition = components.get(componentId);
        return definition != null ? definition.getComponentSetId() : null;
    }

    private static void forEachEntry(JsonNode table, BiConsumer<String, JsonNode> action) {
        if (table == null || !table.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = table.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getValue().isObject()) {
                action.accept(entry.getKey(), entry.getValue());
            }
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.textValue().isEmpty() ? value.textValue() : null;
    }

    private static JsonNode links(JsonNode meta) {
        JsonNode links = meta.get("documentationLinks");
        return links != null && links.isArray() && links.size() > 0 ? links.deepCopy() : null;
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
