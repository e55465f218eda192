package com.designcontext.simplifier.resolver;

import com.designcontext.simplifier.mapping.TextStyleMapping;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TextStyleMatcher.
 */
class TextStyleMatcherTest {

    private final TextStyleMatcher matcher = new TextStyleMatcher();

    private final List<TextStyleMapping> styles = List.of(
            style("Body/Medium", "Roboto", 14.0, 400.0),
            style("Body/Large", "Roboto", 16.0, 400.0),
            style("Title/Medium", "Roboto", 16.0, 500.0),
            style("Display/Small", "SF Pro Display", 36.0, 400.0));

    @Test
    void testExactPropertiesMatch() {
        Optional<TextStyleMapping> match = matcher.nearest("Roboto", 16.0, 500.0, styles);

        assertThat(match).map(TextStyleMapping::getName).contains("Title/Medium");
    }

    @Test
    void testFamilyComparisonIgnoresCaseAndSpaces() {
        Optional<TextStyleMapping> match = matcher.nearest("sfprodisplay", 36.0, 400.0, styles);

        assertThat(match).map(TextStyleMapping::getName).contains("Display/Small");
    }

    @Test
    void testNearestWithinTolerance() {
        Optional<TextStyleMapping> match = matcher.nearest("Roboto", 15.5, 420.0, styles);

        assertThat(match).map(TextStyleMapping::getName).contains("Body/Large");
    }

    @Test
    void testOutsideToleranceGivesNothing() {
        assertThat(matcher.nearest("Roboto", 20.0, 400.0, styles)).isEmpty();
        assertThat(matcher.nearest("Roboto", 14.0, 700.0, styles)).isEmpty();
        assertThat(matcher.nearest("Inter", 14.0, 400.0, styles)).isEmpty();
    }

    @Test
    void testUnknownWeightMatchesOnSize() {
        Optional<TextStyleMapping> match = matcher.nearest("Roboto", 14.0, null, styles);

        assertThat(match).map(TextStyleMapping::getName).contains("Body/Medium");
    }

    private static TextStyleMapping style(String name, String family, double size, double weight) {
        return TextStyleMapping.builder()
                .id("S:" + name)
                .name(name)
                .fontFamily(family)
                .fontSize(size)
                .fontWeight(weight)
                .build();
    }
}
