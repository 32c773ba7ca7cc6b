package com.spreadpool.support;

import com.spreadpool.provider.*;

import java.util.*;
import java.util.stream.Collectors;

/** Scripted provider: returns whatever the test loaded, or throws the configured failure. */
public class FakeScoreboardClient implements ScoreboardClient {

    private final List<ScheduleRecord> schedule = new ArrayList<>();
    private final Map<String, ScoreRecord> scores = new LinkedHashMap<>();
    private final List<OddsRecord> odds = new ArrayList<>();
    private RuntimeException failure;
    private int calls;
    private final List<WeekSelector> requested = new ArrayList<>();

    public void reset() {
        schedule.clear();
        scores.clear();
        odds.clear();
        failure = null;
        calls = 0;
        requested.clear();
    }

    public FakeScoreboardClient schedule(ScheduleRecord... records) {
        schedule.clear();
        schedule.addAll(Arrays.asList(records));
        return this;
    }

    public FakeScoreboardClient scores(ScoreRecord... records) {
        scores.clear();
        for (ScoreRecord r : records) scores.put(r.externalId(), r);
        return this;
    }

    public FakeScoreboardClient odds(OddsRecord... records) {
        odds.clear();
        odds.addAll(Arrays.asList(records));
        return this;
    }

    public FakeScoreboardClient failWith(RuntimeException e) {
        this.failure = e;
        return this;
    }

    public int getCalls() { return calls; }
    public List<WeekSelector> getRequested() { return requested; }

    private void call(WeekSelector week) {
        calls++;
        requested.add(week);
        if (failure != null) throw failure;
    }

    @Override
    public List<ScheduleRecord> fetchSchedule(WeekSelector week) {
        call(week);
        return new ArrayList<>(schedule);
    }

    @Override
    public List<ScoreRecord> fetchScores(WeekSelector week, Collection<String> externalIds) {
        call(week);
        return scores.values().stream()
                .filter(r -> externalIds.contains(r.externalId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<OddsRecord> fetchOdds(WeekSelector week) {
        call(week);
        return new ArrayList<>(odds);
    }
}
