package com.designcontext.simplifier.variant;

import com.designcontext.simplifier.model.ComponentProperty;
import com.designcontext.simplifier.model.ComponentPropertyDefinition;
import com.designcontext.simplifier.model.PreferredValue;
import com.designcontext.simplifier.model.PropertyType;
import com.designcontext.simplifier.model.SimplifiedNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconstructs a component set's property definitions from its variants.
 *
 * Variant-name properties are VARIANT (with their options) unless every observed value is a
 * boolean, which makes them BOOLEAN; either way the first observed value is the default.
 * INSTANCE_SWAP and TEXT properties are collected from component properties anywhere in the
 * variants' subtrees.
 */
public class PropertyDefinitionExtractor {

    public List<ComponentPropertyDefinition> extract(List<SimplifiedNode> variants) {
        Map<String, ComponentPropertyDefinition> definitions = new LinkedHashMap<>();
        Map<String, Boolean> allBoolean = new LinkedHashMap<>();

        for (SimplifiedNode variant : variants) {
            VariantNameParser.parse(variant.getName()).forEach((name, value) -> {
                ComponentPropertyDefinition definition = definitions.computeIfAbsent(name,
                        key -> ComponentPropertyDefinition.builder()
                                .name(key)
                                .type(PropertyType.VARIANT)
                                .defaultValue(value)
                                .build());
                allBoolean.merge(name, value instanceof Boolean, Boolean::logicalAnd);
                definition.addVariantOption(String.valueOf(value));
            });
        }

        allBoolean.forEach((name, booleansOnly) -> {
            ComponentPropertyDefinition definition = definitions.get(name);
            if (booleansOnly) {
                definition.setType(PropertyType.BOOLEAN);
                definition.setVariantOptions(null);
            } else {
                definition.setDefaultValue(String.valueOf(definition.getDefaultValue()));
            }
        });

        for (SimplifiedNode variant : variants) {
            collectComponentProperties(variant, PropertyType.INSTANCE_SWAP, definitions);
        }
        for (SimplifiedNode variant : variants) {
            collectComponentProperties(variant, PropertyType.TEXT, definitions);
        }
        return new ArrayList<>(definitions.values());
    }

    private void collectComponentProperties(SimplifiedNode node, PropertyType type,
                                            Map<String, ComponentPropertyDefinition> definitions) {
        boolean eligible = type != PropertyType.INSTANCE_SWAP || node.isType("INSTANCE");
        if (eligible && node.getComponentProperties() != null) {
            for (ComponentProperty property : node.getComponentProperties()) {
                if (property.getType() != type) {
                    continue;
                }
                String name = PropertyNames.clean(property.getName());
                ComponentPropertyDefinition existing = definitions.get(name);
                if (existing == null) {
                    definitions.put(name, ComponentPropertyDefinition.builder()
                            .name(name)
                            .type(type)
                            .defaultValue(property.getValue())
                            .preferredValues(type == PropertyType.INSTANCE_SWAP
                                    ? copyOf(property.getPreferredValues()) : null)
                            .build());
                } else if (existing.getType() == PropertyType.INSTANCE_SWAP
                        && (existing.getPreferredValues() == null || existing.getPreferredValues().isEmpty())) {
                    existing.setPreferredValues(copyOf(property.getPreferredValues()));
                }
            }
        }
        if (node.getChildren() != null) {
            for (SimplifiedNode child : node.getChildren()) {
                collectComponentProperties(child, type, definitions);
            }
        }
    }

    private static List<PreferredValue> copyOf(List<PreferredValue> values) {
        List<PreferredValue> copy = new ArrayList<>();
        if (values != null) {
            values.forEach(value -> copy.add(new PreferredValue(value.getType(), value.getKey())));
        }
        return copy;
    }
}
