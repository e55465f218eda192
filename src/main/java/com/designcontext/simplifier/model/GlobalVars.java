package com.designcontext.simplifier.model;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared style values referenced by key from simplified nodes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GlobalVars {
    private Map<String, JsonNode> styles = new LinkedHashMap<>();
}
