package com.gov.kpianalytics.service;

import com.gov.kpianalytics.config.AnalyticsEngineConfig;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Answers whether a rise in a KPI is good news. KPI ids listed under
 * {@code analytics.kpi.lower-is-better} are checked once at startup.
 */
@Component
public class KpiPolarityResolver {

    private static final Logger log = LoggerFactory.getLogger(KpiPolarityResolver.class);

    private static final Pattern KPI_ID = Pattern.compile("[a-z][a-z0-9_]*");

    private final AnalyticsEngineConfig config;
    private Set<String> lowerIsBetter = Set.of();

    public KpiPolarityResolver(AnalyticsEngineConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        for (String id : config.getKpi().getLowerIsBetter()) {
            if (id == null || !KPI_ID.matcher(id).matches()) {
                throw new IllegalStateException("Invalid KPI id in analytics.kpi.lower-is-better: '" + id
                        + "'. Expected lower_snake_case.");
            }
        }
        lowerIsBetter = config.getKpi().getLowerIsBetter().stream().collect(Collectors.toUnmodifiableSet());
        log.info("Loaded KPI polarity: {} lower-is-better KPIs {}", lowerIsBetter.size(), lowerIsBetter);
    }

    public boolean higherIsBetter(String kpiId) {
        return !lowerIsBetter.contains(kpiId);
    }
}
