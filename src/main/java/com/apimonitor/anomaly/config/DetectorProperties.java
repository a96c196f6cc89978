package com.apimonitor.anomaly.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Detector configuration, bound once at startup from {@code detector.*} and handed to each
 * component through its constructor. See {@code application.yml} for the environment
 * variables each option can be overridden with.
 */
@Validated
@ConfigurationProperties(prefix = "detector")
public record DetectorProperties(
        @Valid @DefaultValue Store store,
        @Valid @DefaultValue Analysis analysis,
        @Valid @DefaultValue Thresholds thresholds,
        @DefaultValue Filters filters,
        @Valid @DefaultValue Alerting alerting) {

    /** Telemetry store (Elasticsearch REST API) connection and index names. */
    public record Store(
            @DefaultValue("http") String scheme,
            @NotBlank @DefaultValue("localhost") String host,
            @Min(1) @DefaultValue("9200") int port,
            String username,
            String password,
            @NotBlank @DefaultValue("api-logs-*") String logsIndex,
            @NotBlank @DefaultValue("api-anomalies") String anomaliesIndex,
            @NotBlank @DefaultValue("api-service-baselines") String baselinesIndex,
            @NotBlank @DefaultValue("latest") String baselineDocumentId,
            @DefaultValue("30s") Duration timeout) {

        public String baseUrl() {
            return scheme + "://" + host + ":" + port;
        }

        public boolean hasCredentials() {
            return username != null && !username.isBlank() && password != null && !password.isBlank();
        }
    }

    public record Analysis(
            @DefaultValue("300s") Duration interval,
            @DefaultValue("24h") Duration historicalWindow,
            @DefaultValue("6m") Duration recentWindow,
            @DefaultValue("6h") Duration retrainInterval,
            @DefaultValue("60s") Duration errorCooldown,
            @Min(1) @DefaultValue("100000") int maxSamples,
            @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("0.5") @DefaultValue("0.01") double contamination,
            @Min(1) @DefaultValue("30") int minDataPoints,
            @Min(1) @DefaultValue("100") int estimators,
            @DefaultValue("42") long randomSeed) {
    }

    public record Thresholds(
            @DecimalMin("0.0") @DefaultValue("3000") double responseTimeMs,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.1") double errorRate) {
    }

    /** Service allow/deny lists. An empty allow-list means every service. */
    public record Filters(
            @DefaultValue List<String> includedServices,
            @DefaultValue List<String> excludedServices) {
    }

    public record Alerting(
            String webhookUrl,
            String pagerdutyRoutingKey,
            @DefaultValue("https://events.pagerduty.com/v2/enqueue") String pagerdutyUrl,
            @DefaultValue("5s") Duration timeout,
            @DefaultValue("production") String environment,
            @DefaultValue("1.0.0") String version,
            @Min(1) @DefaultValue("100") int recentCapacity) {

        public boolean webhookEnabled() {
            return webhookUrl != null && !webhookUrl.isBlank();
        }

        public boolean pagerdutyEnabled() {
            return pagerdutyRoutingKey != null && !pagerdutyRoutingKey.isBlank();
        }
    }
}
