package com.ivamare.messagebus.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RuntimeEnvironment")
class RuntimeEnvironmentTest {

    @ParameterizedTest
    @CsvSource({
        "dev, DEVELOPMENT",
        "Development, DEVELOPMENT",
        "staging, STAGING",
        "test, TEST",
        "prod, PRODUCTION",
        "' PRODUCTION ', PRODUCTION",
        "qa, UNKNOWN"
    })
    @DisplayName("should resolve names ignoring case and whitespace")
    void shouldResolveNames(String name, RuntimeEnvironment expected) {
        assertThat(RuntimeEnvironment.fromName(name)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should treat a missing name as unknown")
    void shouldTreatMissingNameAsUnknown() {
        assertThat(RuntimeEnvironment.fromName(null)).isEqualTo(RuntimeEnvironment.UNKNOWN);
    }

    @Test
    @DisplayName("should flag only production")
    void shouldFlagOnlyProduction() {
        assertThat(RuntimeEnvironment.PRODUCTION.isProduction()).isTrue();
        assertThat(RuntimeEnvironment.STAGING.isProduction()).isFalse();
        assertThat(RuntimeEnvironment.UNKNOWN.isProduction()).isFalse();
    }
}
