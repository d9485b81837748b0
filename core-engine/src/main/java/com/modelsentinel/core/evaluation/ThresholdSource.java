package com.modelsentinel.core.evaluation;

import com.modelsentinel.core.model.MonitoringConfig;

import java.io.Serializable;

/** Reads the threshold a rule compares against from a configuration snapshot. */
@FunctionalInterface
public interface ThresholdSource extends Serializable {

    double thresholdOf(MonitoringConfig config);
}
