package com.modelsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the immutability of {@link Alert} and {@link AlertDraft}.
 */
class AlertTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("Alert metadata should not share nested containers with the builder's source")
    @SuppressWarnings("unchecked")
    void alertMetadataIsDeepCopied() {
        Map<String, Object> source = new HashMap<>();
        List<Object> owners = new ArrayList<>(List.of("ml-team"));
        source.put("owners", owners);

        Alert alert = Alert.builder()
                .alertId("a-1")
                .modelId("m-1")
                .alertType(AlertType.LATENCY_INCREASE)
                .severity(AlertSeverity.LOW)
                .status(AlertStatus.OPEN)
                .triggeredAt(T0)
                .version(1)
                .metadata(source)
                .build();
        owners.add("someone-else");

        assertThat((List<Object>) alert.getMetadata().get("owners")).containsExactly("ml-team");
        Alert next = alert.toBuilder().version(2).build();
        assertThat(next.getMetadata()).isEqualTo(alert.getMetadata());
        assertThatThrownBy(() -> ((List<Object>) next.getMetadata().get("owners")).clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Draft metadata should not share nested containers with the caller")
    @SuppressWarnings("unchecked")
    void draftMetadataIsDeepCopied() {
        Map<String, Object> inner = new HashMap<>(Map.of("k", "v"));
        Map<String, Object> source = new HashMap<>(Map.of("context", inner));

        AlertDraft draft = AlertDraft.builder()
                .modelId("m-1")
                .alertType(AlertType.DRIFT_DETECTED)
                .metricType(MetricType.DRIFT_SCORE)
                .severity(AlertSeverity.HIGH)
                .thresholdValue(0.05)
                .currentValue(0.4)
                .observationId("o-1")
                .observedAt(T0)
                .metadata(source)
                .build();
        inner.put("k", "changed");

        assertThat((Map<String, Object>) draft.getMetadata().get("context")).containsEntry("k", "v");
    }
}
