package com.designcontext.simplifier.resolver;

import com.designcontext.simplifier.mapping.MappingDocument;
import com.designcontext.simplifier.mapping.TextStyleMapping;
import com.designcontext.simplifier.mapping.VariableMapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable merge of mapping documents. Documents are given in priority order; for a
 * duplicated id the first document wins.
 */
public final class MappingSet {

    private static final MappingSet EMPTY = new MappingSet(Collections.emptyMap(), Collections.emptyList());

    private final Map<String, VariableMapping> variables;
    private final List<TextStyleMapping> textStyles;

    private MappingSet(Map<String, VariableMapping> variables, List<TextStyleMapping> textStyles) {
        this.variables = variables;
        this.textStyles = textStyles;
    }

    public static MappingSet empty() {
        return EMPTY;
    }

    public static MappingSet of(MappingDocument... documents) {
        return of(List.of(documents));
    }

    public static MappingSet of(List<MappingDocument> documents) {
        Map<String, VariableMapping> variables = new LinkedHashMap<>();
        List<TextStyleMapping> textStyles = new ArrayList<>();
        for (MappingDocument document : documents) {
            if (document == null) {
                continue;
            }
            for (VariableMapping mapping : document.getVariableMappings()) {
                String id = VariableIds.canonical(mapping.getId());
                if (id != null) {
                    variables.putIfAbsent(id, mapping);
                }
            }
            textStyles.addAll(document.getTextStyleMappings());
        }
        if (variables.isEmpty() && textStyles.isEmpty()) {
            return EMPTY;
        }
        return new MappingSet(Collections.unmodifiableMap(variables), Collections.unmodifiableList(textStyles));
    }

    /**
     * Looks up a variable by id; bare and namespaced ids are equivalent.
     */
    public Optional<VariableMapping> lookup(String id) {
        String canonical = VariableIds.canonical(id);
        if (canonical == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(variables.get(canonical));
    }

    public Optional<TextStyleMapping> textStyleById(String styleId) {
        if (styleId == null) {
            return Optional.empty();
        }
        return textStyles.stream()
                .filter(style -> styleId.equals(style.getId()))
                .findFirst();
    }

    public List<TextStyleMapping> getTextStyles() {
        return textStyles;
    }

    public int variableCount() {
        return variables.size();
    }

    public boolean isEmpty() {
        return variables.isEmpty() && textStyles.isEmpty();
    }
}
