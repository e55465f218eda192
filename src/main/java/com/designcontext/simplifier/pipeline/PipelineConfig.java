package com.designcontext.simplifier.pipeline;

import com.designcontext.simplifier.resolver.ResolverConfig;
import com.designcontext.simplifier.walker.extractor.ExtractorPreset;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Configuration for one simplification run.
 */
@Data
@Builder
public class PipelineConfig {
    private Path designFile;
    private Path variablesFile;

    /** Platform key of the design file; recorded as the source of exported mappings. */
    private String fileKey;
    private Path outputFile;

    private Integer maxDepth;

    @Builder.Default
    private ExtractorPreset extractorPreset = ExtractorPreset.ALL;

    @Builder.Default
    private ResolverConfig resolverConfig = ResolverConfig.defaults();

    private Path heuristicsFile;
    private boolean skipResolution;
    private boolean prettyPrint;

    /** When set, the variables table of the run is also written here as a mapping file. */
    private Path exportMappingsFile;
}
