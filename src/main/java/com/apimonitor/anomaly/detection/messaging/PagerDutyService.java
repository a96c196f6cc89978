package com.apimonitor.anomaly.detection.messaging;

import com.apimonitor.anomaly.config.DetectorProperties;
import com.apimonitor.anomaly.detection.domain.Anomaly;
import com.apimonitor.anomaly.detection.domain.AnomalyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Raises PagerDuty incidents for critical anomalies through the Events API v2.
 * PagerDuty acknowledges an accepted event with 202; anything else is a failure.
 */
@Slf4j
@Service
public class PagerDutyService {

    private final RestTemplate restTemplate;
    private final DetectorProperties.Alerting alerting;

    public PagerDutyService(@Qualifier("alertRestTemplate") RestTemplate restTemplate, DetectorProperties properties) {
        this.restTemplate = restTemplate;
        this.alerting = properties.alerting();
    }

    public boolean isEnabled() {
        return alerting.pagerdutyEnabled();
    }

    public boolean trigger(Anomaly anomaly) {
        if (!isEnabled()) {
            return false;
        }
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(alerting.pagerdutyUrl(), event(anomaly), String.class);
            if (response.getStatusCode().value() != HttpStatus.ACCEPTED.value()) {
                log.error("Failed to send PagerDuty alert: {} - {}", response.getStatusCode().value(), response.getBody());
                return false;
            }
            log.info("PagerDuty alert sent for {}", anomaly.key());
            return true;
        } catch (RestClientResponseException e) {
            log.error("Failed to send PagerDuty alert: {} - {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            return false;
        } catch (RestClientException e) {
            log.error("Error sending PagerDuty alert for {}: {}", anomaly.key(), e.getMessage());
            return false;
        }
    }

    Map<String, Object> event(Anomaly anomaly) {
        boolean responseTime = anomaly.getType() == AnomalyType.RESPONSE_TIME;
        String summary = responseTime
                ? String.format(Locale.ROOT, "Critical Response Time: %s/%s - %.2fms", anomaly.getService(), anomaly.getEndpoint(), anomaly.getAvgResponseTime())
                : String.format(Locale.ROOT, "Critical Error Rate: %s/%s - %.2f%%", anomaly.getService(), anomaly.getEndpoint(), anomaly.getErrorRate() * 100);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("service", anomaly.getService());
        details.put("endpoint", anomaly.getEndpoint());
        if (responseTime) {
            details.put("avg_response_time", anomaly.getAvgResponseTime());
            details.put("p95_response_time", anomaly.getP95ResponseTime());
        } else {
            details.put("error_rate", anomaly.getErrorRate());
        }
        details.put("request_count", anomaly.getRequestCount());
        details.put("severity", anomaly.getSeverity().wireName());
        details.put("detector", anomaly.getDetector().wireName());
        details.put("timestamp", String.valueOf(anomaly.getTimestamp()));
        if (anomaly.getBaselineValue() != null && anomaly.getBaselineValue() > 0) {
            double current = responseTime ? anomaly.getAvgResponseTime() : anomaly.getErrorRate();
            details.put(responseTime ? "baseline_avg_response_time" : "baseline_error_rate", anomaly.getBaselineValue());
            details.put("deviation_factor", current / anomaly.getBaselineValue());
        }

        String environment = anomaly.getEnvironment() != null ? anomaly.getEnvironment() : alerting.environment();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("summary", summary);
        payload.put("source", environment + "-monitoring");
        payload.put("severity", "critical");
        payload.put("custom_details", details);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("routing_key", alerting.pagerdutyRoutingKey());
        event.put("event_action", "trigger");
        event.put("payload", payload);
        return event;
    }
}
