package com.designcontext.simplifier.variant.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One variant of a component set. Property values are {@link String} or {@link Boolean}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class VariantInfo {
    private String id;
    private String name;
    private Map<String, Object> properties;
    private List<SlotInfo> structure;
}
