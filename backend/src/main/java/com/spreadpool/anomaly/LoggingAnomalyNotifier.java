package com.spreadpool.anomaly;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Records anomalies in the {@link AnomalyLog} and the application log. Runs on the anomaly
 * executor, so a slow or failing sink never holds up a sync job.
 */
@Component
public class LoggingAnomalyNotifier implements AnomalyNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingAnomalyNotifier.class);

    private final AnomalyLog anomalyLog;

    public LoggingAnomalyNotifier(AnomalyLog anomalyLog) {
        this.anomalyLog = anomalyLog;
    }

    @Override
    @Async("anomalyExecutor")
    public void notify(Anomaly anomaly) {
        try {
            anomalyLog.add(anomaly);
            log.warn("Sync anomaly: {}", anomaly);
        } catch (RuntimeException e) {
            log.error("Failed to record anomaly {}: {}", anomaly, e.getMessage(), e);
        }
    }
}
