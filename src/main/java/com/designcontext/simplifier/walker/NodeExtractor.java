package com.designcontext.simplifier.walker;

import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.model.SimplifiedNode;

/**
 * Fills one aspect of a simplified node from its raw counterpart.
 *
 * An extractor writes only its own fields of {@code result}; shared values go through the
 * context's store and component registry.
 */
@FunctionalInterface
public interface NodeExtractor {

    void extract(RawNode node, SimplifiedNode result, TraversalContext context);
}
