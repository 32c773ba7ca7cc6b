package com.spreadpool.anomaly;

/**
 * Sink for suspicious provider responses and failed sync attempts. Implementations must
 * return promptly and never throw into the calling job.
 */
public interface AnomalyNotifier {
    void notify(Anomaly anomaly);
}
