package com.gov.kpianalytics.exception;

public class ModelNotFittedException extends AnalyticsEngineException {

    public ModelNotFittedException() {
        super("Model must be fitted before prediction. Call fit() first.", "MODEL_NOT_FITTED");
    }
}
