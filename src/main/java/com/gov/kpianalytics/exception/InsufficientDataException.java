package com.gov.kpianalytics.exception;

import java.util.Map;

public class InsufficientDataException extends AnalyticsEngineException {

    private final int requiredPoints;
    private final int actualPoints;

    public InsufficientDataException(int requiredPoints, int actualPoints) {
        super(String.format("Need at least %d data points for forecasting, got %d. "
                        + "Cannot build reliable forecast with fewer observations.", requiredPoints, actualPoints),
                "INSUFFICIENT_DATA",
                Map.of("required_points", requiredPoints, "actual_points", actualPoints));
        this.requiredPoints = requiredPoints;
        this.actualPoints = actualPoints;
    }

    public int getRequiredPoints() {
        return requiredPoints;
    }

    public int getActualPoints() {
        return actualPoints;
    }
}
