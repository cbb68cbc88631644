package com.airlinesim.flight.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StringUtils Tests")
class StringUtilsTest {

    @Test
    @DisplayName("Airport and flight codes upper-case the same under a Turkish default locale")
    void normalizeCode_TurkishDefaultLocale_AsciiResult() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));

            assertThat(StringUtils.normalizeCode(" ist ")).isEqualTo("IST");
            assertThat(StringUtils.normalizeCode("ai101")).isEqualTo("AI101");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("Blank text has no content")
    void hasText_Blank_False() {
        assertThat(StringUtils.hasText("  ")).isFalse();
        assertThat(StringUtils.hasText(null)).isFalse();
        assertThat(StringUtils.hasText("JFK")).isTrue();
    }
}
