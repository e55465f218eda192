package com.designcontext.simplifier.walker.extractor;

import com.designcontext.simplifier.walker.NodeExtractor;

import java.util.List;

/**
 * Ready-made extractor combinations, always in the order layout, text, visuals, component.
 */
public enum ExtractorPreset {
    /** Everything. */
    ALL(Extractors.LAYOUT, Extractors.TEXT, Extractors.VISUALS, Extractors.COMPONENT),
    /** Content analysis and layout planning. */
    LAYOUT_AND_TEXT(Extractors.LAYOUT, Extractors.TEXT),
    /** Copy only. */
    CONTENT_ONLY(Extractors.TEXT),
    /** Style extraction for design-system work. */
    VISUALS_ONLY(Extractors.VISUALS),
    /** Structure only. */
    LAYOUT_ONLY(Extractors.LAYOUT);

    private final List<NodeExtractor> extractors;

    ExtractorPreset(NodeExtractor... extractors) {
        this.extractors = List.of(extractors);
    }

    public List<NodeExtractor> extractors() {
        return extractors;
    }
}
