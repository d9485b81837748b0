package com.modelsentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metrics of the monitoring operator, exposed through the cluster's
 * configured reporters.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code observations_processed_total}: observations run through the engine</li>
 * <li>{@code observations_rejected_total}: observations the engine refused
 * (unknown model, invalid config, timeout)</li>
 * <li>{@code alerts_created_total}</li>
 * <li>{@code alerts_suppressed_total}: breaches absorbed by a cooldown</li>
 * <li>{@code processing_latency_ms}: histogram of per-observation latency</li>
 * </ul>
 */
public class MonitoringMetrics {

    private final Counter observationsProcessed;
    private final Counter observationsRejected;
    private final Counter alertsCreated;
    private final Counter alertsSuppressed;
    private final Histogram processingLatency;

    public MonitoringMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("model_sentinel");

        this.observationsProcessed = group.counter("observations_processed_total");
        this.observationsRejected = group.counter("observations_rejected_total");
        this.alertsCreated = group.counter("alerts_created_total");
        this.alertsSuppressed = group.counter("alerts_suppressed_total");
        // sliding window of 350 samples
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementObservationsProcessed() {
        observationsProcessed.inc();
    }

    public void incrementObservationsRejected() {
        observationsRejected.inc();
    }

    public void incrementAlertsCreated() {
        alertsCreated.inc();
    }

    public void incrementAlertsSuppressed() {
        alertsSuppressed.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
