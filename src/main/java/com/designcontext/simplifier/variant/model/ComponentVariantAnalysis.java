package com.designcontext.simplifier.variant.model;

import com.designcontext.simplifier.model.ComponentPropertyDefinition;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class ComponentVariantAnalysis {
    private String componentSetId;
    private String componentSetName;

    @Builder.Default
    private List<ComponentPropertyDefinition> propertyDefinitions = new ArrayList<>();

    @Builder.Default
    private List<VariantInfo> variants = new ArrayList<>();

    @Builder.Default
    private List<PropertyRule> propertyRules = new ArrayList<>();

    @Builder.Default
    private Map<String, SlotInfo> slotDefinitions = new LinkedHashMap<>();

    public static ComponentVariantAnalysis empty(String id, String name) {
        return ComponentVariantAnalysis.builder()
                .componentSetId(id)
                .componentSetName(name)
                .build();
    }

    public String getDefaultVariantId() {
        return variants.isEmpty() ? null : variants.get(0).getId();
    }
}
