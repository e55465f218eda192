package com.designcontext.simplifier.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designcontext.simplifier.cli.model.SimplifyOptions;
import com.designcontext.simplifier.cli.model.ValidatedSimplifyOptions;
import com.designcontext.simplifier.pipeline.PipelineResult;

/**
 * Responsible only for printing CLI output for the "simplify" command.
 * Everything goes through the logger so standard output stays free for the design JSON.
 */
public class SimplifyResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(SimplifyResultsPrinter.class);

    private static final int MAX_UNRESOLVED_LISTED = 10;

    public void printBanner(SimplifyOptions o, ValidatedSimplifyOptions v) {
        log.info("=================================================");
        log.info("Design Context Simplifier");
        log.info("=================================================");
        log.info("Design Document: {}", v.getInput());
        log.info("Variables Document: {}", o.getVariables() != null ? o.getVariables().toAbsolutePath() : "None");
        log.info("Output: {}", v.getOutputFile() != null ? v.getOutputFile() : "standard output");
        log.info("Extractors: {}", o.getExtractors());
        log.info("Max Depth: {}", o.getMaxDepth() != null ? o.getMaxDepth() : "unlimited");
        if (o.isSkipResolution()) {
            log.info("Reference Resolution: skipped");
        } else {
            log.info("Mapping Search Path: {}", v.getMappingSearchDirectories());
            log.info("Mapping URL: {}", o.getMappingUrl() != null && !o.getMappingUrl().isBlank() ? o.getMappingUrl() : "None");
            log.info("Design Tokens: {}", o.getTokens() != null ? o.getTokens().toAbsolutePath() : "None");
        }
        log.info("Heuristics: {}", o.getHeuristics() != null ? o.getHeuristics().toAbsolutePath() : "built-in defaults");
        log.info("=================================================");
    }

    public void printSuccess(SimplifyOptions o, PipelineResult result) {
        log.info("");
        log.info("=================================================");
        log.info("SIMPLIFICATION SUCCESSFUL");
        log.info("=================================================");
        if (result.getOutputPath() != null) {
            log.info("Output Path: {}", result.getOutputPath().toAbsolutePath());
        }
        log.info("Root Nodes: {}", result.getRootNodes());
        log.info("Shared Style Values: {}", result.getSharedValues());
        log.info("Components: {}", result.getComponents());
        log.info("Component Sets Analyzed: {}", result.getComponentSetsAnalyzed());

        if (!o.isSkipResolution()) {
            log.info("");
            log.info("Reference Resolution Summary:");
            log.info("  Variable References: {}", result.getReferencesFound());
            log.info("  Resolved: {}", result.getReferencesResolved());
            log.info("  Text Styles Named: {}", result.getTextStylesResolved());
            printUnresolved(result);
        }

        if (o.getExportMappings() != null) {
            log.info("");
            log.info("Mappings Exported: {} to {}", result.getMappingsExported(), o.getExportMappings().toAbsolutePath());
        }
        log.info("=================================================");
    }

    public void printFailure(PipelineResult result) {
        log.error("Simplification failed: {}", result.getErrorMessage());
    }

    private void printUnresolved(PipelineResult result) {
        if (result.getUnresolved() == null || result.getUnresolved().isEmpty()) {
            return;
        }
        log.warn("  Unresolved: {}", result.getUnresolved().size());
        result.getUnresolved().stream()
                .limit(MAX_UNRESOLVED_LISTED)
                .forEach(id -> log.warn("    {}", id));
        if (result.getUnresolved().size() > MAX_UNRESOLVED_LISTED) {
            log.warn("    ... and {} more", result.getUnresolved().size() - MAX_UNRESOLVED_LISTED);
        }
        log.warn("  Add them to a mapping file or sync the library variables to name them.");
    }
}
