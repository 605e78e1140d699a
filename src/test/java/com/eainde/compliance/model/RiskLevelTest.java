package com.eainde.compliance.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class RiskLevelTest {

    @Nested
    @DisplayName("fromScore")
    class FromScore {

        @Test
        @DisplayName("should be high exactly at the threshold")
        void thresholdIsInclusive() {
            assertThat(RiskLevel.fromScore(0.6)).isEqualTo(RiskLevel.HIGH);
            assertThat(RiskLevel.fromScore(0.5999)).isEqualTo(RiskLevel.LOW);
        }

        @Test
        @DisplayName("should cover the whole score range with two levels only")
        void onlyTwoLevels() {
            for (int i = 0; i <= 100; i++) {
                double score = i / 100.0;
                RiskLevel expected = score >= RiskLevel.HIGH_RISK_THRESHOLD ? RiskLevel.HIGH : RiskLevel.LOW;
                assertThat(RiskLevel.fromScore(score)).as("score %s", score).isEqualTo(expected);
            }
        }
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("should accept low and high in any case")
        void acceptsKnownValues() {
            assertThat(RiskLevel.parse(" HIGH ")).contains(RiskLevel.HIGH);
            assertThat(RiskLevel.parse("low")).contains(RiskLevel.LOW);
        }

        @ParameterizedTest
        @ValueSource(strings = {"medium", "critical", "", "unknown"})
        @DisplayName("should reject values outside low/high")
        void rejectsStrayValues(String value) {
            assertThat(RiskLevel.parse(value)).isEmpty();
        }

        @Test
        @DisplayName("should reject null")
        void rejectsNull() {
            assertThat(RiskLevel.parse(null)).isEmpty();
        }
    }
}
