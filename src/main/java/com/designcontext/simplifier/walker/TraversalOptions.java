package com.designcontext.simplifier.walker;

import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.resolver.ApiVariableTable;
import com.designcontext.simplifier.walker.extractor.ExtractorPreset;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.function.Predicate;

@Value
@Builder(toBuilder = true)
public class TraversalOptions {

    /** Children of nodes at this depth are not visited; null for no limit. Roots are depth 0. */
    Integer maxDepth;

    /** Nodes rejected here are dropped with their subtree. */
    @Builder.Default
    Predicate<RawNode> nodeFilter = RawNode::isVisible;

    /**
     * Applied in list order, so a later extractor sees and may overwrite what an earlier one
     * wrote. Presets list the built-in extractors as layout, text, visuals, component.
     */
    @Builder.Default
    List<NodeExtractor> extractors = ExtractorPreset.ALL.extractors();

    @Builder.Default
    ApiVariableTable variables = ApiVariableTable.empty();

    public static TraversalOptions defaults() {
        return TraversalOptions.builder().build();
    }

    public boolean descendInto(int depth) {
        return maxDepth == null || depth < maxDepth;
    }
}
