package com.spreadpool.anomaly;

import com.spreadpool.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AnomalyLogTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-09-07T12:00:00Z"));
    private final AnomalyLog log = new AnomalyLog(clock);

    private Anomaly at(String message, Instant when) {
        return new Anomaly(Anomaly.Kind.EMPTY_RESPONSE, "sync_scores_active_week", "2025-W1", message, when);
    }

    @Test
    void newestFirst() {
        log.add(at("first", clock.instant()));
        log.add(at("second", clock.instant()));

        assertThat(log.recent(10)).extracting(Anomaly::getMessage).containsExactly("second", "first");
        assertThat(log.recent(1)).extracting(Anomaly::getMessage).containsExactly("second");
    }

    @Test
    void cappedAtMaxEntries() {
        for (int i = 0; i < AnomalyLog.MAX_ENTRIES + 25; i++) {
            log.add(at("a" + i, clock.instant()));
        }
        assertThat(log.size()).isEqualTo(AnomalyLog.MAX_ENTRIES);
        assertThat(log.recent(1).get(0).getMessage()).isEqualTo("a" + (AnomalyLog.MAX_ENTRIES + 24));
    }

    @Test
    void cleanupDropsEntriesOlderThanRetention() {
        log.add(at("old", clock.instant()));
        clock.advance(Duration.ofHours(20));
        log.add(at("recent", clock.instant()));
        clock.advance(Duration.ofHours(5));

        log.cleanup();

        assertThat(log.recent(10)).extracting(Anomaly::getMessage).containsExactly("recent");
    }
}
