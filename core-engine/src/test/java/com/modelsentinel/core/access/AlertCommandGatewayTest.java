package com.modelsentinel.core.access;

import com.modelsentinel.core.config.EngineSettings;
import com.modelsentinel.core.engine.MonitoringEngine;
import com.modelsentinel.core.error.AccessDeniedException;
import com.modelsentinel.core.error.AuthenticationException;
import com.modelsentinel.core.model.Alert;
import com.modelsentinel.core.model.AlertStatus;
import com.modelsentinel.core.model.MetricObservation;
import com.modelsentinel.core.model.MetricType;
import com.modelsentinel.core.model.MonitoringConfig;
import com.modelsentinel.core.notification.ChannelNotificationDispatcher;
import com.modelsentinel.core.store.InMemoryAlertStore;
import com.modelsentinel.core.store.InMemoryMetricRecordStore;
import com.modelsentinel.core.store.InMemoryModelRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AlertCommandGateway} in front of a real engine.
 */
class AlertCommandGatewayTest {

    private MonitoringEngine engine;
    private AlertCommandGateway gateway;
    private String alertId;

    @BeforeEach
    void setUp() {
        InMemoryModelRegistry registry = new InMemoryModelRegistry(List.of(new MonitoringConfig("m-1")));
        engine = new MonitoringEngine(registry, new InMemoryMetricRecordStore(), new InMemoryAlertStore(),
                new ChannelNotificationDispatcher(List.of()), EngineSettings.defaults(), Clock.systemUTC());

        InMemoryAccessControl access = new InMemoryAccessControl();
        access.register("eng-token", Principal.active("erin", Role.ML_ENGINEER));
        access.register("viewer-token", Principal.active("vic", Role.VIEWER));
        access.register("gone-token", new Principal("gus", Role.ADMIN, false));
        gateway = new AlertCommandGateway(access, engine);

        alertId = engine.submitMetric(MetricObservation.builder()
                .modelId("m-1").metricType(MetricType.LATENCY).value(500).timestamp(Instant.now()).build())
                .getAlertId().orElseThrow();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("A principal with manage_alerts should act under their own id")
    void engineerAcknowledges() {
        Alert acked = gateway.acknowledge("eng-token", alertId, "checking");

        assertThat(acked.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(acked.getAcknowledgedBy()).isEqualTo("erin");
    }

    @Test
    @DisplayName("A viewer may read but not mutate")
    void viewerIsReadOnly() {
        assertThat(gateway.get("viewer-token", alertId).getAlertId()).isEqualTo(alertId);
        assertThat(gateway.listForModel("viewer-token", "m-1")).hasSize(1);

        assertThatThrownBy(() -> gateway.close("viewer-token", alertId))
                .isInstanceOf(AccessDeniedException.class)
                .hasMessageContaining("manage_alerts");
        assertThat(engine.getAlert(alertId).getStatus()).isEqualTo(AlertStatus.OPEN);
    }

    @Test
    @DisplayName("Unknown, blank and inactive credentials should fail authentication")
    void rejectsBadCredentials() {
        assertThatThrownBy(() -> gateway.resolve("nope", alertId, "fix", null))
                .isInstanceOf(AuthenticationException.class);
        assertThatThrownBy(() -> gateway.resolve(" ", alertId, "fix", null))
                .isInstanceOf(AuthenticationException.class);
        assertThatThrownBy(() -> gateway.resolve("gone-token", alertId, "fix", null))
                .isInstanceOf(AuthenticationException.class);
    }
}
