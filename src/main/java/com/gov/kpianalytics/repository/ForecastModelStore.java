package com.gov.kpianalytics.repository;

import com.gov.kpianalytics.engine.forecast.FittedForecastModel;

import java.util.Optional;

/**
 * Persistence seam for fitted forecast models. Implementations own
 * serialization, versioning and integrity checks; none ships with the engine.
 */
public interface ForecastModelStore {

    void save(String modelId, FittedForecastModel model);

    Optional<FittedForecastModel> load(String modelId);
}
