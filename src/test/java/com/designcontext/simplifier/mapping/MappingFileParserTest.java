package com.designcontext.simplifier.mapping;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MappingFileParser.
 */
class MappingFileParserTest {

    private final MappingFileParser parser = new MappingFileParser();

    @Test
    void testParseMappingFile() {
        MappingDocument doc = parser.parse("""
                {
                  "lastSynced": "2024-03-01T12:00:00.000Z",
                  "sourceFile": "LIB123",
                  "variableMappings": [
                    {"id": "VariableID:50:7", "name": "Surface/Inverse", "description": "Inverted surface"},
                    {"id": "VariableID:50:8", "name": "Surface/Default", "description": ""}
                  ]
                }
                """, "test");

        assertThat(doc.getLastSynced()).isEqualTo("2024-03-01T12:00:00.000Z");
        assertThat(doc.getSourceFile()).isEqualTo("LIB123");
        assertThat(doc.getVariableMappings()).hasSize(2);
        VariableMapping first = doc.getVariableMappings().get(0);
        assertThat(first.getId()).isEqualTo("VariableID:50:7");
        assertThat(first.getName()).isEqualTo("Surface/Inverse");
        assertThat(first.getDescription()).isEqualTo("Inverted surface");
        assertThat(first.getOrigin()).isEqualTo("test");
        assertThat(doc.getVariableMappings().get(1).getDescription()).isNull();
    }

    @Test
    void testParseBareArray() {
        MappingDocument doc = parser.parse("""
                [{"id": "1:2", "name": "Text/Primary"}]
                """, "remote");

        assertThat(doc.getVariableMappings()).extracting(VariableMapping::getName).containsExactly("Text/Primary");
    }

    @Test
    void testParseMappingsKey() {
        MappingDocument doc = parser.parse("""
                {"mappings": [{"id": "1:2", "name": "Text/Primary"}]}
                """, "remote");

        assertThat(doc.size()).isEqualTo(1);
    }

    @Test
    void testEntriesWithoutIdOrNameAreReported() {
        MappingDocument doc = parser.parse("""
                {"variableMappings": [
                  {"id": "1:2"},
                  {"name": "Orphan/Name"},
                  {"id": "3:4", "name": "Kept/Name"}
                ]}
                """, "test");

        assertThat(doc.getVariableMappings()).extracting(VariableMapping::getName).containsExactly("Kept/Name");
        assertThat(doc.hasErrors()).isTrue();
        assertThat(doc.getErrors()).containsExactly("Entry 1: missing id or name", "Entry 2: missing id or name");
    }

    @Test
    void testParseTextStyleMappings() {
        MappingDocument doc = parser.parse("""
                {
                  "variableMappings": [],
                  "textStyleMappings": [
                    {"id": "S:abc,", "name": "Body/Large", "fontFamily": "Roboto", "fontWeight": 400, "fontSize": "16px", "lineHeight": 24}
                  ]
                }
                """, "test");

        assertThat(doc.getTextStyleMappings()).hasSize(1);
        TextStyleMapping style = doc.getTextStyleMappings().get(0);
        assertThat(style.getName()).isEqualTo("Body/Large");
        assertThat(style.getFontSize()).isEqualTo(16.0);
        assertThat(style.getFontWeight()).isEqualTo(400.0);
        assertThat(style.getLineHeight()).isEqualTo(24.0);
    }

    @Test
    void testInvalidJsonThrows() {
        assertThatThrownBy(() -> parser.parse("{ nope", "broken.json"))
                .isInstanceOf(MappingParseException.class)
                .hasMessageContaining("broken.json");
    }

    @Test
    void testObjectWithoutMappingsThrows() {
        assertThatThrownBy(() -> parser.parse("{\"lastSynced\": \"x\"}", "empty.json"))
                .isInstanceOf(MappingParseException.class)
                .hasMessageContaining("variableMappings");
    }
}
