package com.spreadpool.provider;

import java.util.Collection;
import java.util.List;

/**
 * Schedule, score and odds source. Every call returns a full superseding snapshot for
 * the selector; callers never reconcile partial responses.
 *
 * <p>All methods throw {@link ProviderException}: permanent failures immediately,
 * transient ones only after the configured attempts are spent.</p>
 */
public interface ScoreboardClient {

    List<ScheduleRecord> fetchSchedule(WeekSelector week);

    /** Scores for the given external ids only; ids the provider does not report are omitted. */
    List<ScoreRecord> fetchScores(WeekSelector week, Collection<String> externalIds);

    List<OddsRecord> fetchOdds(WeekSelector week);
}
