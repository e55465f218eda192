package com.designcontext.simplifier.walker;

import com.designcontext.simplifier.model.RawDesign;
import com.designcontext.simplifier.model.SimplifiedComponentSetDefinition;
import com.designcontext.simplifier.model.SimplifiedDesign;
import com.designcontext.simplifier.model.SimplifiedNode;
import com.designcontext.simplifier.resolver.ApiVariableTable;
import com.designcontext.simplifier.variant.VariantAnalyzer;
import com.designcontext.simplifier.variant.model.ComponentVariantAnalysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a fetched design into a {@link SimplifiedDesign}: walks every root, collects the
 * shared style values and component registries, and merges the variant analysis of each
 * component set into its definition.
 */
public class DesignSimplifier {
    private static final Logger log = LoggerFactory.getLogger(DesignSimplifier.class);

    private final TreeWalker walker;
    private final VariantAnalyzer analyzer;

    public DesignSimplifier() {
        this(new VariantAnalyzer());
    }

    public DesignSimplifier(VariantAnalyzer analyzer) {
        this(new TreeWalker(), analyzer);
    }

    public DesignSimplifier(TreeWalker walker, VariantAnalyzer analyzer) {
        this.walker = walker;
        this.analyzer = analyzer;
    }

    public SimplifiedDesign simplify(RawDesign design, TraversalOptions options) {
        TraversalOptions effective = options;
        if (options.getVariables().isEmpty()) {
            ApiVariableTable fromDesign = ApiVariableTable.of(design.getVariables(), design.getVariableCollections());
            if (!fromDesign.isEmpty()) {
                effective = options.toBuilder().variables(fromDesign).build();
            }
        }

        ComponentRegistry registry = new ComponentRegistry();
        registry.seed(design.getComponents(), design.getComponentSets());

        WalkResult walk = walker.walk(design.getRoots(), effective, registry);
        SimplifiedDesign simplified = SimplifiedDesign.builder()
                .name(design.getName())
                .lastModified(design.getLastModified())
                .thumbnailUrl(design.getThumbnailUrl())
                .nodes(walk.getNodes())
                .components(new LinkedHashMap<>(walk.getComponents()))
                .componentSets(new LinkedHashMap<>(walk.getComponentSets()))
                .globalVars(walk.getGlobalVars())
                .build();

        int analyzed = mergeVariantAnalyses(simplified);
        log.info("Simplified {}: {} root nodes, {} shared values, {} component sets analyzed",
                design.getName(), walk.getNodes().size(), walk.getGlobalVars().getStyles().size(), analyzed);
        return simplified;
    }

    private int mergeVariantAnalyses(SimplifiedDesign design) {
        List<SimplifiedNode> allNodes = new ArrayList<>();
        flatten(design.getNodes(), allNodes);

        Map<String, SimplifiedComponentSetDefinition> componentSets = design.getComponentSets();
        int analyzed = 0;
        for (SimplifiedNode node : allNodes) {
            if (!node.isType("COMPONENT_SET")) {
                continue;
            }
            ComponentVariantAnalysis analysis = analyzer.analyze(node, allNodes);
            SimplifiedComponentSetDefinition existing = componentSets.get(node.getId());
            SimplifiedComponentSetDefinition.SimplifiedComponentSetDefinitionBuilder builder = existing != null
                    ? existing.toBuilder()
                    : SimplifiedComponentSetDefinition.builder().id(node.getId()).name(node.getName());
            componentSets.put(node.getId(), builder
                    .defaultVariantId(analysis.getDefaultVariantId())
                    .propertyDefinitions(analysis.getPropertyDefinitions())
                    .variants(analysis.getVariants())
                    .propertyRules(analysis.getPropertyRules())
                    .slotDefinitions(analysis.getSlotDefinitions())
                    .build());
            analyzed++;
        }
        return analyzed;
    }

    private static void flatten(List<SimplifiedNode> nodes, List<SimplifiedNode> into) {
        if (nodes == null) {
            return;
        }
        for (SimplifiedNode node : nodes) {
            into.add(node);
            flatten(node.getChildren(), into);
        }
    }
}
