package com.designcontext.simplifier.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A property exposed by a component set, reconstructed from its variants.
 * {@code defaultValue} is a {@link String} or a {@link Boolean}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComponentPropertyDefinition {
    private String name;
    private PropertyType type;
    private Object defaultValue;
    private List<String> variantOptions;
    private List<PreferredValue> preferredValues;

    public void addVariantOption(String option) {
        if (variantOptions == null) {
            variantOptions = new ArrayList<>();
        }
        if (!variantOptions.contains(option)) {
            variantOptions.add(option);
        }
    }
}
