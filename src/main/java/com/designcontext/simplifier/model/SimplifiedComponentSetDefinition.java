package com.designcontext.simplifier.model;

import com.designcontext.simplifier.variant.model.PropertyRule;
import com.designcontext.simplifier.variant.model.SlotInfo;
import com.designcontext.simplifier.variant.model.VariantInfo;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * A component set together with the property metadata recovered from its variants.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class SimplifiedComponentSetDefinition {
    private String id;
    private String key;
    private String name;
    private String description;
    private JsonNode documentationLinks;
    private Boolean remote;

    private String defaultVariantId;
    private List<ComponentPropertyDefinition> propertyDefinitions;
    private List<VariantInfo> variants;
    private List<PropertyRule> propertyRules;
    private Map<String, SlotInfo> slotDefinitions;
}
