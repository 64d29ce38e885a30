package com.gov.kpianalytics.model;

/** Which scorer produced an anomaly record. */
public enum DetectionMethod {
    ZSCORE,
    ISOLATION_FOREST
}
