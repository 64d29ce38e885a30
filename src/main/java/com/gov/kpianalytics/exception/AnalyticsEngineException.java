package com.gov.kpianalytics.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for failures raised by the forecasting engine. Carries a stable
 * error code and structured details for callers that map errors to responses.
 */
public class AnalyticsEngineException extends RuntimeException {

    private final String code;
    private final Map<String, Object> details;

    public AnalyticsEngineException(String message, String code) {
        this(message, code, Map.of());
    }

    public AnalyticsEngineException(String message, String code, Map<String, Object> details) {
        super(message);
        this.code = code;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
