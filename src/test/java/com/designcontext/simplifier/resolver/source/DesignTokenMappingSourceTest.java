package com.designcontext.simplifier.resolver.source;

import com.designcontext.simplifier.mapping.MappingDocument;
import com.designcontext.simplifier.resolver.FileStat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DesignTokenMappingSource.
 */
class DesignTokenMappingSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadsTokenFile() throws IOException {
        Path tokens = tempDir.resolve("tokens.json");
        Files.writeString(tokens, """
                {"color": {"brand": {"type": "color", "value": "#FF0000",
                  "extensions": {"org.lukasoppermann.figmaDesignTokens": {"variableId": "VariableID:7:1"}}}}}
                """);
        DesignTokenMappingSource source = new DesignTokenMappingSource(tokens, FileStat.system());

        MappingDocument doc = source.load();

        assertThat(doc.getVariableMappings()).hasSize(1);
        assertThat(doc.getVariableMappings().get(0).getName()).isEqualTo("Colors/brand");
    }

    @Test
    void testMissingTokenFileGivesEmptyDocument() {
        DesignTokenMappingSource source = new DesignTokenMappingSource(tempDir.resolve("absent.json"), FileStat.system());

        assertThat(source.load().isEmpty()).isTrue();
    }
}
