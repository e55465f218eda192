package com.designcontext.simplifier.walker.extractor;

import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.model.SimplifiedNode;
import com.designcontext.simplifier.transform.TextTransformer;
import com.designcontext.simplifier.walker.NodeExtractor;
import com.designcontext.simplifier.walker.TraversalContext;

public class TextExtractor implements NodeExtractor {

    @Override
    public void extract(RawNode node, SimplifiedNode result, TraversalContext context) {
        if (TextTransformer.isTextNode(node)) {
            TextTransformer.extractText(node).ifPresent(result::setText);
        }
        if (TextTransformer.hasTextStyle(node)) {
            result.setTextStyle(context.getStore().intern("style", TextTransformer.extractTextStyle(node)));
        }
    }
}
