package com.gov.kpianalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyDirection {
    HIGH,
    LOW;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    public String verb() {
        return this == HIGH ? "above" : "below";
    }
}
