package com.apimonitor.anomaly.detection.messaging;

import com.apimonitor.anomaly.config.DetectorProperties;
import com.apimonitor.anomaly.detection.domain.Anomaly;
import com.apimonitor.anomaly.detection.store.RecentAnomaliesStore;
import com.apimonitor.anomaly.persistence.service.AnomalyPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Sends every anomaly to the anomaly index and the recent-anomalies buffer, and critical
 * ones to the webhook and PagerDuty when those are configured. A failure on one channel or
 * one anomaly does not stop the others.
 */
@Slf4j
@Service
public class AlertDispatcher {

    private final AnomalyPersistenceService persistence;
    private final RecentAnomaliesStore recentAnomalies;
    private final WebhookService webhookService;
    private final PagerDutyService pagerDutyService;
    private final String environment;

    public AlertDispatcher(AnomalyPersistenceService persistence, RecentAnomaliesStore recentAnomalies,
                           WebhookService webhookService, PagerDutyService pagerDutyService,
                           DetectorProperties properties) {
        this.persistence = persistence;
        this.recentAnomalies = recentAnomalies;
        this.webhookService = webhookService;
        this.pagerDutyService = pagerDutyService;
        this.environment = properties.alerting().environment();
    }

    /**
     * @return number of anomalies that were persisted
     */
    public int dispatch(List<Anomaly> anomalies) {
        int persisted = 0;
        for (Anomaly anomaly : anomalies) {
            Anomaly stamped = withEnvironment(anomaly);
            if (persistence.persist(stamped)) {
                persisted++;
            }
            recentAnomalies.add(stamped);
            if (stamped.isCritical()) {
                notifyChannels(stamped);
            }
        }
        if (persisted < anomalies.size()) {
            log.warn("Persisted {} of {} anomalies", persisted, anomalies.size());
        }
        return persisted;
    }

    private void notifyChannels(Anomaly anomaly) {
        try {
            if (webhookService.isEnabled()) {
                webhookService.sendAlert(anomaly);
            }
        } catch (RuntimeException e) {
            log.error("Webhook notification failed for {}", anomaly.key(), e);
        }
        try {
            if (pagerDutyService.isEnabled()) {
                pagerDutyService.trigger(anomaly);
            }
        } catch (RuntimeException e) {
            log.error("PagerDuty notification failed for {}", anomaly.key(), e);
        }
    }

    /** Fills in environment and environment type when the anomaly carries neither. */
    Anomaly withEnvironment(Anomaly anomaly) {
        if (anomaly.getEnvironment() != null || anomaly.getEnvironmentType() != null) {
            return anomaly;
        }
        return anomaly.toBuilder().environment(environment).environmentType(environment).build();
    }
}
