package com.designcontext.simplifier.pipeline;

import com.designcontext.simplifier.model.SimplifiedDesign;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a simplification run.
 */
@Data
@Builder
public class PipelineResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;
    private SimplifiedDesign design;

    private int rootNodes;
    private int sharedValues;
    private int components;
    private int componentSetsAnalyzed;

    private int referencesFound;
    private int referencesResolved;
    private int textStylesResolved;
    private List<String> unresolved;

    private int mappingsExported;

    public static PipelineResult failure(String errorMessage) {
        return PipelineResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
