package com.designcontext.simplifier.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CssUtil.
 */
class CssUtilTest {

    @ParameterizedTest
    @CsvSource({
            "16.0, 16",
            "0.5, 0.5",
            "-2.0, -2",
            "1.25, 1.25"
    })
    void testFormatNumber(double value, String expected) {
        assertThat(CssUtil.formatNumber(value)).isEqualTo(expected);
    }

    @Test
    void testBoxShorthand() {
        assertThat(CssUtil.boxShorthand(0, 0, 0, 0)).isNull();
        assertThat(CssUtil.boxShorthand(8, 8, 8, 8)).isEqualTo("8px");
        assertThat(CssUtil.boxShorthand(8, 16, 8, 16)).isEqualTo("8px 16px");
        assertThat(CssUtil.boxShorthand(4, 16, 8, 16)).isEqualTo("4px 16px 8px");
        assertThat(CssUtil.boxShorthand(1, 2, 3, 4)).isEqualTo("1px 2px 3px 4px");
    }

    @Test
    void testPixelRound() {
        assertThat(CssUtil.pixelRound(16.333)).isEqualTo(16.33);
        assertThat(CssUtil.pixelRound(2.0 / 3.0)).isEqualTo(0.67);
    }
}
