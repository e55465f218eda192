package com.designcontext.simplifier.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SimplifiedComponentDefinition {
    private String id;
    private String key;
    private String name;
    private String componentSetId;
    private String description;
    private JsonNode documentationLinks;
    private Boolean remote;
}
