package com.designcontext.simplifier.variant;

import com.designcontext.simplifier.variant.model.PropertyRule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Design-system knowledge the variant analyzer cannot infer on its own.
 *
 * <pre>
 * {
 *   "slotPatterns": ["slot"],
 *   "primaryDimension": "Layout",
 *   "structurallyDependentProperties": ["Title", "Image"],
 *   "propertyGroups": {"Trailing icons": ["Icon 1", "Icon 2"]},
 *   "rules": [{"property": "Image", "visibleWhen": [{"property": "Layout", "equals": "Default"}]}]
 * }
 * </pre>
 * Everything configured here wins over what is inferred.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HeuristicsConfig {

    /** Case-insensitive substrings marking a layer as a slot. */
    @Builder.Default
    private List<String> slotPatterns = new ArrayList<>(List.of("slot"));

    /** Dimension used for conservative rules; the first multi-valued variant property when unset. */
    private String primaryDimension;

    /**
     * Properties known to exist only in the primary dimension's default value; they get a rule
     * even when no sampled variant shows them.
     */
    @Builder.Default
    private List<String> structurallyDependentProperties = new ArrayList<>();

    /** Parent property -> child properties it gates. */
    @Builder.Default
    private Map<String, List<String>> propertyGroups = new LinkedHashMap<>();

    /** Explicit rules; replace inferred rules for the same property. */
    @Builder.Default
    private List<PropertyRule> rules = new ArrayList<>();

    public static HeuristicsConfig defaults() {
        return HeuristicsConfig.builder().build();
    }
}
