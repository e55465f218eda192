package com.designcontext.simplifier.walker.extractor;

import com.designcontext.simplifier.model.ComponentProperty;
import com.designcontext.simplifier.model.PreferredValue;
import com.designcontext.simplifier.model.PropertyType;
import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.model.SimplifiedComponentDefinition;
import com.designcontext.simplifier.model.SimplifiedComponentSetDefinition;
import com.designcontext.simplifier.model.SimplifiedNode;
import com.designcontext.simplifier.walker.ComponentRegistry;
import com.designcontext.simplifier.walker.NodeExtractor;
import com.designcontext.simplifier.walker.TraversalContext;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Instance, component and component-set fields. Components and sets are also recorded in
 * the walk's registry.
 */
public class ComponentExtractor implements NodeExtractor {

    @Override
    public void extract(RawNode node, SimplifiedNode result, TraversalContext context) {
        switch (node.getType()) {
            case "INSTANCE" -> extractInstance(node, result);
            case "COMPONENT" -> extractComponent(node, result, context);
            case "COMPONENT_SET" -> extractComponentSet(node, result, context.getRegistry());
            default -> {
            }
        }
    }

    private void extractInstance(RawNode node, SimplifiedNode result) {
        node.text("componentId").ifPresent(result::setComponentId);
        JsonNode properties = node.get("componentProperties");
        if (!properties.isObject() || properties.size() == 0) {
            return;
        }
        List<ComponentProperty> simplified = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode property = entry.getValue();
            simplified.add(ComponentProperty.builder()
                    .name(entry.getKey())
                    .value(property.path("value").asText(""))
                    .type(PropertyType.fromPlatform(property.path("type").asText(null)))
                    .preferredValues(preferredValues(property.path("preferredValues")))
                    .build());
        }
        result.setComponentProperties(simplified);
    }

    private void extractComponent(RawNode node, SimplifiedNode result, TraversalContext context) {
        ComponentRegistry registry = context.getRegistry();
        String setId = null;
        RawNode parent = context.getParent();
        if (parent != null && parent.isType("COMPONENT_SET")) {
            setId = parent.getId();
        }
        if (setId == null) {
            setId = registry.componentSetOf(node.getId());
        }
        registry.registerComponent(node.getId(), node.text("key").orElse(null), node.getName(), setId,
                node.text("description").filter(d -> !d.isEmpty()).orElse(null));

        SimplifiedComponentDefinition definition = registry.getComponents().get(node.getId());
        result.setKey(definition.getKey());
        result.setDescription(definition.getDescription());
        result.setComponentSetId(definition.getComponentSetId());
    }

    private void extractComponentSet(RawNode node, SimplifiedNode result, ComponentRegistry registry) {
        registry.registerComponentSet(node.getId(), node.text("key").orElse(null), node.getName(),
                node.text("description").filter(d -> !d.isEmpty()).orElse(null));

        SimplifiedComponentSetDefinition definition = registry.getComponentSets().get(node.getId());
        result.setKey(definition.getKey());
        result.setDescription(definition.getDescription());
    }

    private static List<PreferredValue> preferredValues(JsonNode values) {
        if (!values.isArray() || values.size() == 0) {
            return null;
        }
        List<PreferredValue> preferred = new ArrayList<>();
        for (JsonNode value : values) {
            String key = value.path("key").asText("");
            if (!key.isEmpty()) {
                preferred.add(new PreferredValue(value.path("type").asText(null), key));
            }
        }
        return preferred.isEmpty() ? null : preferred;
    }
}
