package com.nomen.iupac.naming.stem;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HantzschWidmanTest {

    @Test
    @DisplayName("Saturated rings by size")
    void saturated() {
        assertThat(HantzschWidman.name(5, List.of("O"), false)).isEqualTo("oxolane");
        assertThat(HantzschWidman.name(6, List.of("O"), false)).isEqualTo("oxane");
        assertThat(HantzschWidman.name(4, List.of("N"), false)).isEqualTo("azetidine");
        assertThat(HantzschWidman.name(7, List.of("N"), false)).isEqualTo("azepane");
    }

    @Test
    @DisplayName("Mancude rings by size")
    void mancude() {
        assertThat(HantzschWidman.name(7, List.of("N"), true)).isEqualTo("azepine");
        assertThat(HantzschWidman.name(6, List.of("N"), true)).isEqualTo("azine");
        assertThat(HantzschWidman.name(3, List.of("O"), true)).isEqualTo("oxirene");
    }

    @Test
    @DisplayName("Prefixes are cited by seniority and elided before vowels")
    void seniorityAndElision() {
        assertThat(HantzschWidman.name(5, List.of("N", "O"), true)).isEqualTo("oxazole");
        assertThat(HantzschWidman.name(5, List.of("O", "O"), false)).isEqualTo("dioxolane");
        assertThat(HantzschWidman.prefixes(List.of("N", "S", "N"))).isEqualTo("thiadiaza");
    }

    @Test
    @DisplayName("Unsupported sizes and elements are rejected")
    void unsupported() {
        assertThat(HantzschWidman.supports(11, List.of("N"))).isFalse();
        assertThat(HantzschWidman.supports(5, List.of())).isFalse();
        assertThatThrownBy(() -> HantzschWidman.name(12, List.of("O"), true))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
