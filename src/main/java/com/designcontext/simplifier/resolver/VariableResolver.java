package com.designcontext.simplifier.resolver;

import com.designcontext.simplifier.mapping.TextStyleMapping;
import com.designcontext.simplifier.mapping.VariableMapping;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Resolves variable and text-style identifiers to design-system names.
 *
 * Variables: the fetch's own variable table first, then the cached external mappings.
 * Text styles: the document's style table, mapping text styles by id, then the nearest
 * match on font properties. {@link #resolve(String)} never returns null; an unknown
 * variable comes back as its placeholder.
 */
public class VariableResolver {
    private static final Logger log = LoggerFactory.getLogger(VariableResolver.class);

    @Getter
    private final ApiVariableTable apiVariables;
    private final ApiStyleTable apiStyles;
    private final MappingCache cache;
    private final TextStyleMatcher matcher = new TextStyleMatcher();

    public VariableResolver(ApiVariableTable apiVariables, ApiStyleTable apiStyles, MappingCache cache) {
        this.apiVariables = apiVariables != null ? apiVariables : ApiVariableTable.empty();
        this.apiStyles = apiStyles != null ? apiStyles : ApiStyleTable.empty();
        this.cache = cache;
    }

    public Optional<String> lookup(String variableId) {
        if (VariableIds.canonical(variableId) == null) {
            return Optional.empty();
        }
        Optional<String> fromApi = apiVariables.lookup(variableId);
        if (fromApi.isPresent()) {
            return fromApi;
        }
        return mappings().lookup(variableId).map(VariableMapping::getName);
    }

    public String resolve(String variableId) {
        return lookup(variableId).orElseGet(() -> VariableIds.placeholder(variableId));
    }

    /**
     * @param styleId    the bound style id; may be null when only properties are known
     * @param fontFamily font properties for the similarity fallback; any may be null
     */
    public Optional<String> resolveTextStyle(String styleId, String fontFamily, Double fontSize, Double fontWeight) {
        Optional<String> fromApi = apiStyles.lookup(styleId);
        if (fromApi.isPresent()) {
            return fromApi;
        }
        MappingSet mappings = mappings();
        Optional<String> byId = mappings.textStyleById(styleId).map(TextStyleMapping::getName);
        if (byId.isPresent()) {
            return byId;
        }
        return matcher.nearest(fontFamily, fontSize, fontWeight, mappings.getTextStyles())
                .map(TextStyleMapping::getName);
    }

    private MappingSet mappings() {
        if (cache == null) {
            return MappingSet.empty();
        }
        try {
            return cache.current();
        } catch (RuntimeException e) {
            log.warn("Mapping cache unavailable: {}", e.getMessage());
            return MappingSet.empty();
        }
    }
}
