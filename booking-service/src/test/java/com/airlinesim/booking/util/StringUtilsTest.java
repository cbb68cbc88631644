package com.airlinesim.booking.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StringUtils Tests")
class StringUtilsTest {

    @Test
    @DisplayName("Should trim and upper-case codes")
    void normalizeCode_TrimsAndUpperCases() {
        assertThat(StringUtils.normalizeCode(" abc123 ")).isEqualTo("ABC123");
        assertThat(StringUtils.normalizeCode(null)).isNull();
    }

    @Test
    @DisplayName("Upper-casing does not follow the default locale")
    void normalizeCode_TurkishDefaultLocale_AsciiResult() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));

            assertThat(StringUtils.normalizeCode(" 14i ")).isEqualTo("14I");
            assertThat(StringUtils.normalizeCode("kqzi48213")).isEqualTo("KQZI48213");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
