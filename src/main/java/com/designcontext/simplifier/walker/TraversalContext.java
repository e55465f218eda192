package com.designcontext.simplifier.walker;

import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.resolver.ApiVariableTable;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Per-walk state handed to every extractor. The store and registry are shared by all
 * contexts of one walk; depth and parent change per node.
 */
@Getter
@Builder(toBuilder = true)
public class TraversalContext {

    @NonNull
    private final ValueStore store;

    @NonNull
    private final ComponentRegistry registry;

    @NonNull
    @Builder.Default
    private final ApiVariableTable variables = ApiVariableTable.empty();

    private final int depth;

    /** Null for root nodes. */
    private final RawNode parent;

    public static TraversalContext root(ValueStore store, ComponentRegistry registry, ApiVariableTable variables) {
        return TraversalContext.builder()
                .store(store)
                .registry(registry)
                .variables(variables)
                .depth(0)
                .build();
    }

    public TraversalContext child(RawNode parentNode) {
        return toBuilder()
                .depth(depth + 1)
                .parent(parentNode)
                .build();
    }
}
