package com.apimonitor.anomaly.detection.messaging;

import com.apimonitor.anomaly.TestProperties;
import com.apimonitor.anomaly.detection.domain.Anomaly;
import com.apimonitor.anomaly.detection.domain.AnomalyType;
import com.apimonitor.anomaly.detection.domain.DetectorKind;
import com.apimonitor.anomaly.detection.domain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Unit tests for WebhookService.
 */
class WebhookServiceTest {

    private static final String URL = "http://hooks.local/alert";

    private MockRestServiceServer server;
    private WebhookService webhookService;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        webhookService = new WebhookService(restTemplate, TestProperties.withAlerting(URL, null),
                Clock.fixed(Instant.parse("2024-05-01T10:06:00Z"), ZoneOffset.UTC));
    }

    private static Anomaly errorRateAnomaly(Double baseline) {
        return Anomaly.builder()
                .type(AnomalyType.ERROR_RATE)
                .service("checkout")
                .endpoint("/pay")
                .errorRate(0.25)
                .errorCount(10)
                .requestCount(40)
                .severity(Severity.CRITICAL)
                .detector(DetectorKind.THRESHOLD)
                .baselineValue(baseline)
                .build();
    }

    @Test
    void postsSlackStylePayload() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.text").value("High Error Rate Alert: checkout//pay"))
                .andExpect(jsonPath("$.attachments[0].color").value("danger"))
                .andExpect(jsonPath("$.attachments[0].fields[0].title").value("Time"))
                .andExpect(jsonPath("$.attachments[0].fields[0].value").value("2024-05-01 10:06:00"))
                .andExpect(jsonPath("$.attachments[0].fields[1].value").value("production"))
                .andRespond(withSuccess());

        assertThat(webhookService.sendAlert(errorRateAnomaly(null))).isTrue();
        server.verify();
    }

    @Test
    void non2xxIsReportedAsFailure() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThat(webhookService.sendAlert(errorRateAnomaly(null))).isFalse();
    }

    @Test
    void disabledWithoutUrl() {
        WebhookService disabled = new WebhookService(new RestTemplate(), TestProperties.defaults(), Clock.systemUTC());

        assertThat(disabled.isEnabled()).isFalse();
        assertThat(disabled.sendAlert(errorRateAnomaly(null))).isFalse();
    }

    @Test
    void messageIncludesDeviationOnlyWithBaseline() {
        assertThat(WebhookService.message(errorRateAnomaly(0.05)))
                .contains("*CRITICAL* error rate anomaly detected")
                .contains("• Error Rate: 25.00%")
                .contains("• Deviation from baseline: 5.00x normal");
        assertThat(WebhookService.message(errorRateAnomaly(null))).doesNotContain("Deviation");
    }
}
