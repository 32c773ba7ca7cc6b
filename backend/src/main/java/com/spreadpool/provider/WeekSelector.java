package com.spreadpool.provider;

import com.spreadpool.model.PlayoffRound;

/** Identifies one week of a season in the pool's numbering (playoffs continue after week 18). */
public record WeekSelector(int seasonYear, int weekNumber) {

    public static final int REGULAR_SEASON_TYPE = 2;
    public static final int POSTSEASON_TYPE = 3;

    public WeekSelector {
        if (weekNumber < 1 || weekNumber > PlayoffRound.LAST_PLAYOFF_WEEK) {
            throw new IllegalArgumentException("week out of range: " + weekNumber);
        }
    }

    public boolean isPlayoff() {
        return PlayoffRound.isPlayoffWeek(weekNumber);
    }

    public int providerSeasonType() {
        return isPlayoff() ? POSTSEASON_TYPE : REGULAR_SEASON_TYPE;
    }

    public int providerWeek() {
        return isPlayoff() ? weekNumber - (PlayoffRound.FIRST_PLAYOFF_WEEK - 1) : weekNumber;
    }

    @Override
    public String toString() {
        return seasonYear + "-W" + weekNumber;
    }
}
