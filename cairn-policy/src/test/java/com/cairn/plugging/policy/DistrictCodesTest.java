package com.cairn.plugging.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class DistrictCodesTest {

    @ParameterizedTest
    @ValueSource(strings = {"8", "08", "8A", "08A", "8a", " 08a ", "District 8A"})
    @DisplayName("All spellings of district 8A normalize to 08a")
    void normalizesDistrictEight(String spelling) {
        assertThat(DistrictCodes.normalize(spelling)).isEqualTo("08a");
    }

    @Test
    @DisplayName("Explicit letter suffixes and two-digit districts are preserved")
    void keepsExplicitSuffix() {
        assertThat(DistrictCodes.normalize("7C")).isEqualTo("07c");
        assertThat(DistrictCodes.normalize("10")).isEqualTo("10a");
        assertThat(DistrictCodes.normalize("6E")).isEqualTo("06e");
    }

    @Test
    @DisplayName("Blank input yields null, unrecognized input is only lower-cased")
    void handlesOddInput() {
        assertThat(DistrictCodes.normalize(null)).isNull();
        assertThat(DistrictCodes.normalize("  ")).isNull();
        assertThat(DistrictCodes.normalize("Offshore")).isEqualTo("offshore");
    }
}
