package com.designcontext.simplifier.pipeline;

import com.designcontext.simplifier.Fixtures;
import com.designcontext.simplifier.mapping.MappingDocument;
import com.designcontext.simplifier.mapping.MappingFileParser;
import com.designcontext.simplifier.mapping.VariableMapping;
import com.designcontext.simplifier.model.SimplifiedDesign;
import com.designcontext.simplifier.model.SimplifiedNode;
import com.designcontext.simplifier.resolver.MappingCache;
import com.designcontext.simplifier.resolver.ResolverConfig;
import com.designcontext.simplifier.util.JsonMappers;
import com.designcontext.simplifier.walker.extractor.ExtractorPreset;
import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SimplificationPipeline.
 */
class SimplificationPipelineTest {

    @TempDir
    Path tempDir;

    private Path designFile;
    private Path variablesFile;
    private Path mappingDir;

    @BeforeEach
    void setUp() throws IOException {
        designFile = Fixtures.copy(Fixtures.DESIGN, tempDir);
        variablesFile = Fixtures.copy(Fixtures.VARIABLES, tempDir);
        mappingDir = tempDir.resolve("mappings");
        Fixtures.copy(Fixtures.MAPPINGS, mappingDir, ResolverConfig.DEFAULT_FILE_NAME);
    }

    @Test
    void testRunResolvesVariablesAndTextStyles() throws IOException {
        Path output = tempDir.resolve("out/design.json");

        PipelineResult result = new SimplificationPipeline(config().outputFile(output).build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRootNodes()).isEqualTo(2);
        assertThat(result.getComponentSetsAnalyzed()).isEqualTo(1);
        assertThat(result.getReferencesFound()).isEqualTo(2);
        assertThat(result.getReferencesResolved()).isEqualTo(2);
        assertThat(result.getTextStylesResolved()).isEqualTo(1);
        assertThat(result.getUnresolved()).isEmpty();
        assertThat(result.getOutputPath()).isEqualTo(output);

        SimplifiedDesign design = result.getDesign();
        SimplifiedNode compose = screen(design).getChildren().get(0);
        JsonNode fill = design.getGlobalVars().getStyles().get(compose.getFills()).get(0);
        assertThat(fill.path("variable").asText()).isEqualTo("Brand/Primary");
        assertThat(fill.path("variableId").asText()).isEqualTo("VariableID:99:1");

        SimplifiedNode greeting = screen(design).getChildren().get(1);
        assertThat(design.getGlobalVars().getStyles().get(greeting.getTextStyle()).asText()).isEqualTo("Body/Large");

        JsonNode written = JsonMappers.shared().readTree(output.toFile());
        assertThat(written.path("name").asText()).isEqualTo("Mail App");
        assertThat(written.path("componentSets").path("1:0").path("variants").size()).isEqualTo(2);
    }

    @Test
    void testSkipResolutionLeavesPlaceholders() {
        PipelineResult result = new SimplificationPipeline(config().skipResolution(true).build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getReferencesFound()).isZero();
        SimplifiedDesign design = result.getDesign();
        SimplifiedNode compose = screen(design).getChildren().get(0);
        assertThat(design.getGlobalVars().getStyles().get(compose.getFills()).get(0).path("variable").asText())
                .isEqualTo("Variable[99:1]");
    }

    @Test
    void testUnknownVariableIsReported() throws IOException {
        Files.delete(mappingDir.resolve(ResolverConfig.DEFAULT_FILE_NAME));

        PipelineResult result = new SimplificationPipeline(config().build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getReferencesResolved()).isEqualTo(1);
        assertThat(result.getUnresolved()).containsExactly("VariableID:99:1");
    }

    @Test
    void testExportMappingsWritesApiVariables() throws IOException {
        Path export = tempDir.resolve("export/.figma-variables.json");

        PipelineResult result = new SimplificationPipeline(config()
                .fileKey("AbC123xYz")
                .exportMappingsFile(export)
                .build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMappingsExported()).isEqualTo(2);
        MappingDocument exported = new MappingFileParser().parse(export);
        assertThat(exported.getSourceFile()).isEqualTo("AbC123xYz");
        assertThat(exported.getVariableMappings()).extracting(VariableMapping::getName)
                .containsExactly("Surface/Container", "Surface/Inverse");
    }

    @Test
    void testExportWithoutFileKeyNamesDesignFile() throws IOException {
        Path export = tempDir.resolve("export/.figma-variables.json");

        new SimplificationPipeline(config().exportMappingsFile(export).build()).run();

        MappingDocument exported = new MappingFileParser().parse(export);
        assertThat(exported.getSourceFile()).isEqualTo(Fixtures.DESIGN);
    }

    @Test
    void testExportWithoutVariablesWritesNothing() {
        Path export = tempDir.resolve(".figma-variables.json");

        PipelineResult result = new SimplificationPipeline(config()
                .variablesFile(null)
                .exportMappingsFile(export)
                .build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMappingsExported()).isZero();
        assertThat(Files.exists(export)).isFalse();
    }

    @Test
    void testLayoutOnlyPresetHasNoFills() {
        PipelineResult result = new SimplificationPipeline(config()
                .extractorPreset(ExtractorPreset.LAYOUT_ONLY)
                .build()).run();

        assertThat(result.isSuccess()).isTrue();
        SimplifiedNode screen = screen(result.getDesign());
        assertThat(screen.getFills()).isNull();
        assertThat(screen.getLayout()).isNotNull();
    }

    @Test
    void testMaxDepthLimitsTree() {
        PipelineResult result = new SimplificationPipeline(config().maxDepth(1).build()).run();

        assertThat(result.isSuccess()).isTrue();
        SimplifiedNode screen = screen(result.getDesign());
        assertThat(screen.getChildren()).isNull();
    }

    @Test
    void testSeededComponentSetsAreNotCountedAsAnalyzed() {
        PipelineResult result = new SimplificationPipeline(config().maxDepth(0).skipResolution(true).build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDesign().getComponentSets()).containsKey("1:0");
        assertThat(result.getComponentSetsAnalyzed()).isZero();
    }

    @Test
    void testRunsWithEqualResolverConfigShareMappingCache() throws IOException {
        PipelineConfig pipelineConfig = config().build();
        PipelineResult first = new SimplificationPipeline(pipelineConfig).run();

        Path mappingFile = mappingDir.resolve(ResolverConfig.DEFAULT_FILE_NAME);
        Files.writeString(mappingFile, Files.readString(mappingFile).replace("Brand/Primary", "Brand/Renamed"));
        PipelineResult second = new SimplificationPipeline(config().build()).run();

        assertThat(MappingCache.shared(pipelineConfig.getResolverConfig()))
                .isSameAs(MappingCache.shared(config().build().getResolverConfig()));
        assertThat(fillVariable(first)).isEqualTo("Brand/Primary");
        // Still inside the local check interval, so the cached mappings are served.
        assertThat(fillVariable(second)).isEqualTo("Brand/Primary");
    }

    @Test
    void testUnreadableDesignFails() throws IOException {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{\"status\": 403, \"err\": \"Forbidden\"}");

        PipelineResult result = new SimplificationPipeline(config().designFile(broken).build()).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("Unrecognised design document");
        assertThat(result.getDesign()).isNull();
    }

    @Test
    void testToJsonPrettyPrints() throws IOException {
        SimplificationPipeline pipeline = new SimplificationPipeline(config().prettyPrint(true).build());
        PipelineResult result = pipeline.run();

        String json = pipeline.toJson(result.getDesign());

        assertThat(json).contains("\n").contains("\"globalVars\"");
    }

    private PipelineConfig.PipelineConfigBuilder config() {
        return PipelineConfig.builder()
                .designFile(designFile)
                .variablesFile(variablesFile)
                .resolverConfig(ResolverConfig.builder().searchDirectories(List.of(mappingDir)).build());
    }

    private static String fillVariable(PipelineResult result) {
        SimplifiedDesign design = result.getDesign();
        SimplifiedNode compose = screen(design).getChildren().get(0);
        return design.getGlobalVars().getStyles().get(compose.getFills()).get(0).path("variable").asText();
    }

    private static SimplifiedNode screen(SimplifiedDesign design) {
        return design.getNodes().get(1).getChildren().get(0);
    }
}
