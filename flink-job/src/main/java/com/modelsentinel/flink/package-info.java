/**
 * Flink streaming job that feeds model metrics from Kafka through the
 * monitoring engine and publishes alert events back to Kafka.
 *
 * <ul>
 * <li>{@link com.modelsentinel.flink.ModelSentinelJob}: entry point and
 * pipeline assembly</li>
 * <li>{@link com.modelsentinel.flink.MonitoringProcessFunction}: keyed
 * operator hosting the engine</li>
 * <li>{@link com.modelsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.modelsentinel.flink.HealthServer}: liveness and readiness
 * probes</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.modelsentinel.flink;
