package com.designcontext.simplifier.walker.extractor;

import com.designcontext.simplifier.walker.NodeExtractor;

/**
 * Shared extractor instances; all of them are stateless.
 */
public final class Extractors {

    public static final NodeExtractor LAYOUT = new LayoutExtractor();
    public static final NodeExtractor TEXT = new TextExtractor();
    public static final NodeExtractor VISUALS = new VisualsExtractor();
    public static final NodeExtractor COMPONENT = new ComponentExtractor();

    private Extractors() {
    }
}
