package com.prospectenhancer.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnhancementKindTest {

    @Test
    @DisplayName("wire names map to kinds, case-insensitively")
    void fromValue() {
        assertThat(EnhancementKind.fromValue("set_asides")).isEqualTo(EnhancementKind.SET_ASIDES);
        assertThat(EnhancementKind.fromValue("NAICS")).isEqualTo(EnhancementKind.NAICS);
        assertThatThrownBy(() -> EnhancementKind.fromValue("prices")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("all includes every concrete kind")
    void includes() {
        assertThat(EnhancementKind.values()).allMatch(EnhancementKind.ALL::includes);
        assertThat(EnhancementKind.TITLES.includes(EnhancementKind.NAICS)).isFalse();
        assertThat(EnhancementKind.TITLES.includes(EnhancementKind.TITLES)).isTrue();
    }
}
