package com.apimonitor.anomaly.detection.messaging;

import com.apimonitor.anomaly.config.DetectorProperties;
import com.apimonitor.anomaly.detection.domain.Anomaly;
import com.apimonitor.anomaly.detection.domain.AnomalyType;
import com.apimonitor.anomaly.detection.domain.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Posts critical anomalies to a chat-ops incoming webhook (Slack-style text plus one attachment).
 * Delivery is attempted once; failures are logged and never propagated.
 */
@Slf4j
@Service
public class WebhookService {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final RestTemplate restTemplate;
    private final DetectorProperties.Alerting alerting;
    private final Clock clock;

    public WebhookService(@Qualifier("alertRestTemplate") RestTemplate restTemplate,
                          DetectorProperties properties, Clock clock) {
        this.restTemplate = restTemplate;
        this.alerting = properties.alerting();
        this.clock = clock;
    }

    public boolean isEnabled() {
        return alerting.webhookEnabled();
    }

    /**
     * @return true if the webhook answered with a 2xx status
     */
    public boolean sendAlert(Anomaly anomaly) {
        if (!isEnabled()) {
            return false;
        }
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(alerting.webhookUrl(), payload(anomaly), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                log.error("Failed to send webhook alert: {} - {}", response.getStatusCode().value(), response.getBody());
                return false;
            }
            log.info("Webhook alert sent for {}", anomaly.key());
            return true;
        } catch (RestClientResponseException e) {
            log.error("Failed to send webhook alert: {} - {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            return false;
        } catch (RestClientException e) {
            log.error("Error sending webhook alert for {}: {}", anomaly.key(), e.getMessage());
            return false;
        }
    }

    Map<String, Object> payload(Anomaly anomaly) {
        String title = title(anomaly);
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", anomaly.getSeverity() == Severity.CRITICAL ? "danger" : "warning");
        attachment.put("title", title);
        attachment.put("text", message(anomaly));
        attachment.put("fields", List.of(
                field("Time", LocalDateTime.now(clock).format(TIME_FORMAT)),
                field("Environment", anomaly.getEnvironment() != null ? anomaly.getEnvironment() : alerting.environment())));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", title);
        payload.put("attachments", List.of(attachment));
        return payload;
    }

    private static String title(Anomaly anomaly) {
        String kind = anomaly.getType() == AnomalyType.RESPONSE_TIME ? "High Response Time Alert" : "High Error Rate Alert";
        return kind + ": " + anomaly.getService() + "/" + anomaly.getEndpoint();
    }

    static String message(Anomaly anomaly) {
        StringBuilder text = new StringBuilder();
        text.append('*').append(anomaly.getSeverity().wireName().toUpperCase(Locale.ROOT)).append("* ")
                .append(anomaly.getType() == AnomalyType.RESPONSE_TIME ? "response time" : "error rate")
                .append(" anomaly detected\n");
        text.append("• Service: `").append(anomaly.getService()).append("`\n");
        text.append("• Endpoint: `").append(anomaly.getEndpoint()).append("`\n");
        double current;
        if (anomaly.getType() == AnomalyType.RESPONSE_TIME) {
            current = anomaly.getAvgResponseTime();
            text.append(String.format(Locale.ROOT, "• Avg Response Time: %.2fms\n", anomaly.getAvgResponseTime()));
            text.append(String.format(Locale.ROOT, "• P95 Response Time: %.2fms\n", anomaly.getP95ResponseTime()));
        } else {
            current = anomaly.getErrorRate();
            text.append(String.format(Locale.ROOT, "• Error Rate: %.2f%%\n", anomaly.getErrorRate() * 100));
        }
        text.append("• Request Count: ").append(anomaly.getRequestCount()).append('\n');
        text.append("• Detection Method: ").append(anomaly.getDetector().wireName()).append('\n');
        if (anomaly.getBaselineValue() != null && anomaly.getBaselineValue() > 0) {
            text.append(String.format(Locale.ROOT, "• Deviation from baseline: %.2fx normal\n", current / anomaly.getBaselineValue()));
        }
        return text.toString();
    }

    private static Map<String, Object> field(String title, String value) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", true);
        return field;
    }
}
