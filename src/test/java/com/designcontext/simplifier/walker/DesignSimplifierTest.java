package com.designcontext.simplifier.walker;

import com.designcontext.simplifier.Fixtures;
import com.designcontext.simplifier.model.ComponentPropertyDefinition;
import com.designcontext.simplifier.model.RawDesign;
import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.model.SimplifiedComponentSetDefinition;
import com.designcontext.simplifier.model.SimplifiedDesign;
import com.designcontext.simplifier.model.SimplifiedNode;
import com.designcontext.simplifier.resolver.ApiVariableTable;
import com.designcontext.simplifier.util.JsonMappers;
import com.designcontext.simplifier.variant.model.PropertyRule;
import com.designcontext.simplifier.variant.model.VariantInfo;
import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DesignSimplifier.
 */
class DesignSimplifierTest {

    @TempDir
    Path tempDir;

    private RawDesign raw;

    @BeforeEach
    void setUp() throws IOException {
        raw = new RawDesignReader().read(Fixtures.copy(Fixtures.DESIGN, tempDir), Fixtures.copy(Fixtures.VARIABLES, tempDir));
    }

    @Test
    void testDocumentMetadataIsCarried() {
        SimplifiedDesign design = new DesignSimplifier().simplify(raw, TraversalOptions.defaults());

        assertThat(design.getName()).isEqualTo("Mail App");
        assertThat(design.getLastModified()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(design.getNodes()).extracting(SimplifiedNode::getName).containsExactly("Components", "Screens");
    }

    @Test
    void testVariablesFromDesignNameBoundFills() {
        SimplifiedDesign design = new DesignSimplifier().simplify(raw, TraversalOptions.defaults());

        SimplifiedNode screen = design.getNodes().get(1).getChildren().get(0);
        JsonNode fill = design.getGlobalVars().getStyles().get(screen.getFills()).get(0);
        assertThat(fill.path("variable").asText()).isEqualTo("Surface/Inverse");
        assertThat(fill.path("value").asText()).isEqualTo("#1A1A1A");

        SimplifiedNode compose = screen.getChildren().get(0);
        JsonNode unknown = design.getGlobalVars().getStyles().get(compose.getFills()).get(0);
        assertThat(unknown.path("variable").asText()).isEqualTo("Variable[99:1]");
    }

    @Test
    void testHiddenNodesAreLeftOut() {
        SimplifiedDesign design = new DesignSimplifier().simplify(raw, TraversalOptions.defaults());

        SimplifiedNode screen = design.getNodes().get(1).getChildren().get(0);
        assertThat(screen.getChildren()).extracting(SimplifiedNode::getName)
                .containsExactly("Compose Button", "Greeting");
    }

    @Test
    void testComponentSetGetsVariantAnalysis() {
        SimplifiedDesign design = new DesignSimplifier().simplify(raw, TraversalOptions.defaults());

        SimplifiedComponentSetDefinition bar = design.getComponentSets().get("1:0");
        assertThat(bar.getKey()).isEqualTo("top-app-bar");
        assertThat(bar.getDescription()).isEqualTo("Primary navigation bar");
        assertThat(bar.getDefaultVariantId()).isEqualTo("1:1");
        assertThat(bar.getVariants()).extracting(VariantInfo::getId).containsExactly("1:1", "1:2");
        assertThat(bar.getPropertyDefinitions()).extracting(ComponentPropertyDefinition::getName)
                .contains("Layout", "Title");
        assertThat(bar.getPropertyRules()).extracting(PropertyRule::getProperty).contains("Title");

        assertThat(design.getComponents().get("1:2").getComponentSetId()).isEqualTo("1:0");
    }

    @Test
    void testExplicitVariableTableIsKept() throws IOException {
        TraversalOptions options = TraversalOptions.builder()
                .variables(ApiVariableTable.of(
                        JsonMappers.shared().readTree("{\"VariableID:99:1\": {\"name\": \"Brand/Primary\"}}"), null))
                .build();

        SimplifiedDesign design = new DesignSimplifier().simplify(raw, options);

        SimplifiedNode compose = design.getNodes().get(1).getChildren().get(0).getChildren().get(0);
        JsonNode fill = design.getGlobalVars().getStyles().get(compose.getFills()).get(0);
        assertThat(fill.path("variable").asText()).isEqualTo("Brand/Primary");
    }

    @Test
    void testRootComponentSetIsAnalysed() throws IOException {
        RawDesign single = RawDesign.builder()
                .root(RawNode.of(JsonMappers.shared().readTree("""
                        {
                          "id": "5:0", "name": "Chip", "type": "COMPONENT_SET",
                          "children": [
                            {"id": "5:1", "name": "Selected=true", "type": "COMPONENT"},
                            {"id": "5:2", "name": "Selected=false", "type": "COMPONENT"}
                          ]
                        }
                        """)))
                .build();

        SimplifiedDesign design = new DesignSimplifier().simplify(single, TraversalOptions.defaults());

        SimplifiedComponentSetDefinition chip = design.getComponentSets().get("5:0");
        assertThat(chip.getName()).isEqualTo("Chip");
        assertThat(chip.getVariants()).hasSize(2);
    }
}
