package com.nomen.iupac.infra.config;

import com.nomen.iupac.api.model.TraceLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NamingConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(NamingConfig.PROP_TRACE_LEVEL);
        System.clearProperty(NamingConfig.PROP_MAX_CYCLE_LENGTH);
    }

    @Test
    @DisplayName("Builder values override defaults")
    void builderValues() {
        NamingConfig config = NamingConfig.builder()
                .traceLevel(TraceLevel.FULL)
                .maxCycleLength(24)
                .retainedAlkylNames(true)
                .build();

        assertThat(config.traceLevel()).isEqualTo(TraceLevel.FULL);
        assertThat(config.maxCycleLength()).isEqualTo(24);
        assertThat(config.retainedAlkylNames()).isTrue();
        assertThat(config.maxAtoms()).isEqualTo(200);
    }

    @Test
    @DisplayName("System properties are read by a fresh builder")
    void systemPropertyOverride() {
        System.setProperty(NamingConfig.PROP_TRACE_LEVEL, "standard");
        System.setProperty(NamingConfig.PROP_MAX_CYCLE_LENGTH, "not-a-number");

        NamingConfig config = NamingConfig.builder().build();

        assertThat(config.traceLevel()).isEqualTo(TraceLevel.STANDARD);
        assertThat(config.maxCycleLength()).isEqualTo(40);
    }

    @Test
    @DisplayName("Classpath properties file is loaded")
    void loadsPropertiesFile() {
        NamingConfig config = NamingConfig.loadFromProperties("nomen-test.properties");

        assertThat(config.retainedAlkylNames()).isTrue();
        assertThat(config.maxCycleLength()).isEqualTo(30);
    }

    @Test
    @DisplayName("toBuilder copies values")
    void toBuilderCopies() {
        NamingConfig original = NamingConfig.builder().maxAtoms(50).build();

        assertThat(original.toBuilder().build().maxAtoms()).isEqualTo(50);
    }

    @Test
    @DisplayName("Out-of-range values are rejected")
    void validation() {
        assertThatThrownBy(() -> NamingConfig.builder().maxCycleLength(2).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NamingConfig.builder().maxAtoms(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
