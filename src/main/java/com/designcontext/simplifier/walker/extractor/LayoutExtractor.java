package com.designcontext.simplifier.walker.extractor;

import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.model.SimplifiedNode;
import com.designcontext.simplifier.model.style.SimplifiedLayout;
import com.designcontext.simplifier.transform.LayoutTransformer;
import com.designcontext.simplifier.util.JsonMappers;
import com.designcontext.simplifier.walker.NodeExtractor;
import com.designcontext.simplifier.walker.TraversalContext;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Stores the node's layout as a {@code layout_N} value. A layout that says nothing beyond
 * its mode is left out.
 */
public class LayoutExtractor implements NodeExtractor {

    @Override
    public void extract(RawNode node, SimplifiedNode result, TraversalContext context) {
        SimplifiedLayout layout = LayoutTransformer.buildLayout(node, context.getParent());
        JsonNode tree = JsonMappers.shared().valueToTree(layout);
        if (tree.size() > 1) {
            result.setLayout(context.getStore().intern("layout", tree));
        }
    }
}
