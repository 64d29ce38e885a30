package com.gov.kpianalytics.repository;

import java.time.Duration;
import java.util.Optional;

/**
 * Memoizes computed forecasts and anomaly lists by input fingerprint.
 * Implementations decide eviction; entries must not outlive their TTL.
 */
public interface AnalyticsResultCache {

    <T> Optional<T> get(String fingerprint, Class<T> type);

    void put(String fingerprint, Object value, Duration ttl);
}
