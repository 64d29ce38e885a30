package com.gov.kpianalytics.exception;

/** Series contains values that cannot be trained on (NaN or infinite). */
public class DataException extends AnalyticsEngineException {

    public DataException(String message) {
        super(message, "INVALID_DATA");
    }
}
