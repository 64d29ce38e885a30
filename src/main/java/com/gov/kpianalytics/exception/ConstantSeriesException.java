package com.gov.kpianalytics.exception;

public class ConstantSeriesException extends AnalyticsEngineException {

    public ConstantSeriesException() {
        super("Cannot forecast constant series (zero variance). "
                + "All values are identical, no pattern to learn.", "CONSTANT_SERIES");
    }
}
