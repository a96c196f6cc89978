package com.apimonitor.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the API anomaly detector. Enables:
 * <ul>
 *   <li>Periodic scoring of API telemetry from the Elasticsearch log indices</li>
 *   <li>Isolation forest and local outlier factor models, retrained every few hours</li>
 *   <li>Fixed response-time and error-rate thresholds alongside the models</li>
 *   <li>Anomaly indexing plus webhook and PagerDuty alerts for critical findings</li>
 *   <li>Status REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyDetectionApplication.class, args);
    }
}
