package com.designcontext.simplifier.walker;

import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.model.SimplifiedNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first walk of a raw node tree, parent before children.
 *
 * Every accepted node runs through the configured extractors in the order the options list them. A failing extractor
 * is logged and skipped so one odd node cannot spoil the rest of the tree.
 */
public class TreeWalker {
    private static final Logger log = LoggerFactory.getLogger(TreeWalker.class);

    public WalkResult walk(List<RawNode> roots, TraversalOptions options) {
        return walk(roots, options, new ComponentRegistry());
    }

    public WalkResult walk(List<RawNode> roots, TraversalOptions options, ComponentRegistry registry) {
        ValueStore store = new ValueStore();
        TraversalContext context = TraversalContext.root(store, registry, options.getVariables());

        List<SimplifiedNode> nodes = new ArrayList<>();
        for (RawNode root : roots) {
            SimplifiedNode simplified = processNode(root, context, options);
            if (simplified != null) {
                nodes.add(simplified);
            }
        }
        log.debug("Walked {} root nodes, {} shared values", nodes.size(), store.size());
        return new WalkResult(nodes, store.toGlobalVars(), registry.getComponents(), registry.getComponentSets());
    }

    private SimplifiedNode processNode(RawNode node, TraversalContext context, TraversalOptions options) {
        if (!options.getNodeFilter().test(node)) {
            return null;
        }

        SimplifiedNode result = new SimplifiedNode(node.getId(), node.getName(), node.getType());
        for (NodeExtractor extractor : options.getExtractors()) {
            try {
                extractor.extract(node, result, context);
            } catch (RuntimeException e) {
                log.warn("Extractor {} failed on {}: {}", extractor.getClass().getSimpleName(), node, e.getMessage());
            }
        }

        if (node.hasChildren() && options.descendInto(context.getDepth())) {
            TraversalContext childContext = context.child(node);
            List<SimplifiedNode> children = new ArrayList<>();
            for (RawNode child : node.getChildren()) {
                SimplifiedNode simplifiedChild = processNode(child, childContext, options);
                if (simplifiedChild != null) {
                    children.add(simplifiedChild);
                }
            }
            if (!children.isEmpty()) {
                result.setChildren(children);
            }
        }
        return result;
    }
}
