package com.designcontext.simplifier.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the simplification pipeline, handed to whatever transport exposes it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "lastModified", "thumbnailUrl", "nodes", "components", "componentSets", "globalVars"})
public class SimplifiedDesign {
    private String name;
    private String lastModified;
    private String thumbnailUrl;
    private List<SimplifiedNode> nodes;

    @Builder.Default
    private Map<String, SimplifiedComponentDefinition> components = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, SimplifiedComponentSetDefinition> componentSets = new LinkedHashMap<>();

    @Builder.Default
    private GlobalVars globalVars = new GlobalVars();
}
