package com.designcontext.simplifier.pipeline;

import com.designcontext.simplifier.mapping.MappingFileWriter;
import com.designcontext.simplifier.mapping.VariableMapping;
import com.designcontext.simplifier.model.RawDesign;
import com.designcontext.simplifier.model.SimplifiedDesign;
import com.designcontext.simplifier.resolver.ApiStyleTable;
import com.designcontext.simplifier.resolver.ApiVariableTable;
import com.designcontext.simplifier.resolver.MappingCache;
import com.designcontext.simplifier.resolver.ReferenceResolutionPass;
import com.designcontext.simplifier.resolver.ResolutionOutcome;
import com.designcontext.simplifier.resolver.VariableResolver;
import com.designcontext.simplifier.util.JsonMappers;
import com.designcontext.simplifier.variant.HeuristicsConfig;
import com.designcontext.simplifier.variant.HeuristicsConfigLoader;
import com.designcontext.simplifier.variant.VariantAnalyzer;
import com.designcontext.simplifier.walker.DesignSimplifier;
import com.designcontext.simplifier.walker.RawDesignReader;
import com.designcontext.simplifier.walker.TraversalOptions;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Reads a fetched design from disk, simplifies it, resolves variable and text-style
 * references and writes the result.
 */
public class SimplificationPipeline {
    private static final Logger log = LoggerFactory.getLogger(SimplificationPipeline.class);

    private final PipelineConfig config;
    private final MappingCache mappingCache;
    private final Clock clock;
    private final RawDesignReader reader = new RawDesignReader();

    public SimplificationPipeline(PipelineConfig config) {
        this(config, MappingCache.shared(config.getResolverConfig()), Clock.systemUTC());
    }

    public SimplificationPipeline(PipelineConfig config, MappingCache mappingCache, Clock clock) {
        this.config = config;
        this.mappingCache = mappingCache;
        this.clock = clock;
    }

    public PipelineResult run() {
        try {
            log.info("Reading design from {}", config.getDesignFile());
            RawDesign raw = reader.read(config.getDesignFile(), config.getVariablesFile());

            ApiVariableTable variables = ApiVariableTable.of(raw.getVariables(), raw.getVariableCollections());
            HeuristicsConfig heuristics = new HeuristicsConfigLoader().load(config.getHeuristicsFile());

            TraversalOptions options = TraversalOptions.builder()
                    .maxDepth(config.getMaxDepth())
                    .extractors(config.getExtractorPreset().extractors())
                    .variables(variables)
                    .build();

            SimplifiedDesign design = new DesignSimplifier(new VariantAnalyzer(heuristics)).simplify(raw, options);
            PipelineResult.PipelineResultBuilder result = PipelineResult.builder()
                    .rootNodes(design.getNodes() == null ? 0 : design.getNodes().size())
                    .sharedValues(design.getGlobalVars().getStyles().size())
                    .components(design.getComponents().size())
                    .componentSetsAnalyzed(analyzedComponentSets(design))
                    .unresolved(List.of());

            if (config.isSkipResolution()) {
                log.info("Reference resolution skipped");
            } else {
                VariableResolver resolver = new VariableResolver(variables, ApiStyleTable.of(raw.getStyles()), mappingCache);
                ResolutionOutcome outcome = new ReferenceResolutionPass(resolver).resolve(design);
                design = outcome.getDesign();
                result.referencesFound(outcome.getReferencesFound())
                        .referencesResolved(outcome.getResolvedCount())
                        .textStylesResolved(outcome.getTextStylesResolved())
                        .unresolved(outcome.getUnresolved());
            }

            if (config.getExportMappingsFile() != null) {
                result.mappingsExported(exportMappings(variables, sourceFile()));
            }

            if (config.getOutputFile() != null) {
                writeDesign(design, config.getOutputFile());
            }

            return result.success(true)
                    .design(design)
                    .outputPath(config.getOutputFile())
                    .build();

        } catch (IOException e) {
            log.error("Simplification failed", e);
            return PipelineResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Simplification failed with unexpected error", e);
            return PipelineResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public String toJson(SimplifiedDesign design) throws IOException {
        return mapper().writeValueAsString(design);
    }

    private int exportMappings(ApiVariableTable variables, String sourceFile) throws IOException {
        if (variables.isEmpty()) {
            log.warn("No variables in the fetched design, nothing to export to {}", config.getExportMappingsFile());
            return 0;
        }
        List<VariableMapping> mappings = variables.toMappings(sourceFile);
        new MappingFileWriter().write(config.getExportMappingsFile(), mappings, sourceFile, clock.instant());
        return mappings.size();
    }

    /**
     * Sets seeded only from the metadata tables never reached the analyzer and carry no variants.
     */
    private static int analyzedComponentSets(SimplifiedDesign design) {
        return (int) design.getComponentSets().values().stream()
                .filter(set -> set.getVariants() != null)
                .count();
    }

    /**
     * The platform file key when configured, otherwise the name of the design file on disk.
     */
    private String sourceFile() {
        if (config.getFileKey() != null && !config.getFileKey().isBlank()) {
            return config.getFileKey();
        }
        return config.getDesignFile().getFileName().toString();
    }

    private void writeDesign(SimplifiedDesign design, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper().writeValue(target.toFile(), design);
        log.info("Wrote simplified design to {}", target);
    }

    private ObjectMapper mapper() {
        return config.isPrettyPrint() ? JsonMappers.prettyPrinting() : JsonMappers.shared();
    }
}
