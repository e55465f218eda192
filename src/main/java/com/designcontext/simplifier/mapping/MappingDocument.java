package com.designcontext.simplifier.mapping;

import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed content of one mapping source: variable and text-style mappings plus any
 * problems found while reading individual entries.
 */
@Data
public class MappingDocument {
    private String lastSynced;
    private String sourceFile;
    private final List<VariableMapping> variableMappings = new ArrayList<>();
    private final List<TextStyleMapping> textStyleMappings = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public static MappingDocument empty() {
        return new MappingDocument();
    }

    public void addVariableMapping(VariableMapping mapping) {
        variableMappings.add(mapping);
    }

    public void addTextStyleMapping(TextStyleMapping mapping) {
        textStyleMappings.add(mapping);
    }

    public List<VariableMapping> getVariableMappings() {
        return Collections.unmodifiableList(variableMappings);
    }

    public List<TextStyleMapping> getTextStyleMappings() {
        return Collections.unmodifiableList(textStyleMappings);
    }

    public boolean isEmpty() {
        return variableMappings.isEmpty() && textStyleMappings.isEmpty();
    }

    public int size() {
        return variableMappings.size() + textStyleMappings.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }
}
