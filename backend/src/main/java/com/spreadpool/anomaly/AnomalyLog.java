package com.spreadpool.anomaly;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/** Recent anomalies, newest first, kept for a day and capped in size. */
@Component
public class AnomalyLog {

    static final int MAX_ENTRIES = 500;
    static final Duration RETENTION = Duration.ofHours(24);

    private final ConcurrentLinkedDeque<Anomaly> entries = new ConcurrentLinkedDeque<>();
    private final Clock clock;

    public AnomalyLog(Clock clock) {
        this.clock = clock;
    }

    public void add(Anomaly anomaly) {
        entries.addFirst(anomaly);
        while (entries.size() > MAX_ENTRIES) {
            entries.pollLast();
        }
    }

    public List<Anomaly> recent(int limit) {
        List<Anomaly> out = new ArrayList<>();
        for (Anomaly a : entries) {
            if (out.size() >= limit) break;
            out.add(a);
        }
        return out;
    }

    public int size() {
        return entries.size();
    }

    @Scheduled(cron = "0 0 * * * *") // hourly cleanup
    public void cleanup() {
        Instant cutoff = Instant.now(clock).minus(RETENTION);
        entries.removeIf(a -> a.getOccurredAt() != null && a.getOccurredAt().isBefore(cutoff));
    }
}
