package com.designcontext.simplifier.variant;

import com.designcontext.simplifier.model.ComponentPropertyDefinition;
import com.designcontext.simplifier.model.PropertyType;
import com.designcontext.simplifier.model.SimplifiedNode;
import com.designcontext.simplifier.variant.model.ComponentVariantAnalysis;
import com.designcontext.simplifier.variant.model.PropertyRule;
import com.designcontext.simplifier.variant.model.SlotInfo;
import com.designcontext.simplifier.variant.model.VariantInfo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recovers property definitions, variants, visibility rules and slots of a component set
 * from its variant components. The platform does not expose these for sets from external
 * libraries, so everything here is read off names and structure.
 */
public class VariantAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(VariantAnalyzer.class);

    private final PropertyDefinitionExtractor definitionExtractor = new PropertyDefinitionExtractor();
    private final SlotExtractor slotExtractor;
    private final PropertyRuleInferrer ruleInferrer;

    public VariantAnalyzer() {
        this(HeuristicsConfig.defaults());
    }

    public VariantAnalyzer(HeuristicsConfig config) {
        this.slotExtractor = new SlotExtractor(config.getSlotPatterns());
        this.ruleInferrer = new PropertyRuleInferrer(config);
    }

    public ComponentVariantAnalysis analyze(SimplifiedNode componentSet) {
        return analyze(componentSet, List.of());
    }

    /**
     * @param allNodes further nodes to search for variants that reference the set by
     *                 {@code componentSetId}
     */
    public ComponentVariantAnalysis analyze(SimplifiedNode componentSet, List<SimplifiedNode> allNodes) {
        if (componentSet == null || !componentSet.isType("COMPONENT_SET")) {
            return ComponentVariantAnalysis.empty(
                    componentSet != null ? componentSet.getId() : null,
                    componentSet != null ? componentSet.getName() : null);
        }
        try {
            List<SimplifiedNode> variantNodes = findVariants(componentSet, allNodes);
            List<ComponentPropertyDefinition> definitions = definitionExtractor.extract(variantNodes);

            List<VariantInfo> variants = new ArrayList<>();
            for (SimplifiedNode variantNode : variantNodes) {
                variants.add(variantInfo(variantNode, definitions));
            }
            List<PropertyRule> rules = ruleInferrer.infer(variantNodes, variants, definitions);

            Map<String, SlotInfo> slotDefinitions = new LinkedHashMap<>();
            for (VariantInfo variant : variants) {
                if (variant.getStructure() != null) {
                    variant.getStructure().forEach(slot -> slotDefinitions.putIfAbsent(slot.getSlot(), slot));
                }
            }

            log.debug("Analyzed {}: {} variants, {} properties, {} rules",
                    componentSet.getName(), variants.size(), definitions.size(), rules.size());
            return ComponentVariantAnalysis.builder()
                    .componentSetId(componentSet.getId())
                    .componentSetName(componentSet.getName())
                    .propertyDefinitions(definitions)
                    .variants(variants)
                    .propertyRules(rules)
                    .slotDefinitions(slotDefinitions)
                    .build();
        } catch (RuntimeException e) {
            log.warn("Variant analysis failed for {} ({}): {}", componentSet.getName(), componentSet.getId(), e.getMessage());
            return ComponentVariantAnalysis.empty(componentSet.getId(), componentSet.getName());
        }
    }

    private VariantInfo variantInfo(SimplifiedNode variantNode, List<ComponentPropertyDefinition> definitions) {
        Map<String, Object> properties = VariantNameParser.parse(variantNode.getName());
        for (ComponentPropertyDefinition definition : definitions) {
            if (definition.getType() == PropertyType.BOOLEAN && !properties.containsKey(definition.getName())) {
                properties.put(definition.getName(), definition.getDefaultValue());
            }
        }
        List<SlotInfo> structure = slotExtractor.extract(variantNode);
        return VariantInfo.builder()
                .id(variantNode.getId())
                .name(variantNode.getName())
                .properties(properties)
                .structure(structure.isEmpty() ? null : structure)
                .build();
    }

    /**
     * Direct COMPONENT children, plus components elsewhere that name this set as theirs.
     */
    static List<SimplifiedNode> findVariants(SimplifiedNode componentSet, List<SimplifiedNode> allNodes) {
        Map<String, SimplifiedNode> variants = new LinkedHashMap<>();
        if (componentSet.getChildren() != null) {
            for (SimplifiedNode child : componentSet.getChildren()) {
                if (child.isType("COMPONENT")) {
                    variants.putIfAbsent(child.getId(), child);
                }
            }
        }
        for (SimplifiedNode node : allNodes) {
            if (node.isType("COMPONENT") && componentSet.getId().equals(node.getComponentSetId())) {
                variants.putIfAbsent(node.getId(), node);
            }
        }
        return new ArrayList<>(variants.values());
    }
}
