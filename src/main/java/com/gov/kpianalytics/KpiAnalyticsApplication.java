package com.gov.kpianalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KpiAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(KpiAnalyticsApplication.class, args);
    }
}
