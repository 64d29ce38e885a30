package com.gov.kpianalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalySeverity {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
