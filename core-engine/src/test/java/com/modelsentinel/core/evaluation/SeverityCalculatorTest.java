package com.modelsentinel.core.evaluation;

import com.modelsentinel.core.model.AlertSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeverityCalculator}.
 */
class SeverityCalculatorTest {

    @ParameterizedTest(name = "value={0}, threshold={1} -> {2}")
    @CsvSource({
            "105, 100, LOW",
            "110, 100, MEDIUM",
            "124, 100, MEDIUM",
            "125, 100, HIGH",
            "150, 100, CRITICAL",
            "0.70, 0.8, MEDIUM",
            "0.30, 0.8, CRITICAL",
            "0.2, 0, MEDIUM",
            "0.04, 0, LOW"
    })
    @DisplayName("Should map deviation to severity bands")
    void shouldMapBands(double value, double threshold, AlertSeverity expected) {
        assertThat(SeverityCalculator.severityOf(value, threshold)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Severity should never decrease as deviation grows")
    void severityIsMonotonic() {
        AlertSeverity previous = AlertSeverity.LOW;
        for (int i = 0; i <= 1_000; i++) {
            AlertSeverity current = SeverityCalculator.severityForDeviation(i / 500.0);
            assertThat(current.ordinal()).isGreaterThanOrEqualTo(previous.ordinal());
            previous = current;
        }
        assertThat(previous).isEqualTo(AlertSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Deviation should be symmetric around the threshold")
    void deviationIsSymmetric() {
        assertThat(SeverityCalculator.relativeDeviation(80, 100))
                .isEqualTo(SeverityCalculator.relativeDeviation(120, 100));
    }
}
