package com.spreadpool.model;

import java.util.Optional;

public enum PlayoffRound {
    WILD_CARD(19, "Wild Card"),
    DIVISIONAL(20, "Divisional Round"),
    CONFERENCE(21, "Conference Championships"),
    PRO_BOWL(22, "Pro Bowl"),
    SUPER_BOWL(23, "Super Bowl");

    public static final int FIRST_PLAYOFF_WEEK = 19;
    public static final int LAST_PLAYOFF_WEEK = 23;

    private final int weekNumber;
    private final String label;

    PlayoffRound(int weekNumber, String label) {
        this.weekNumber = weekNumber;
        this.label = label;
    }

    public int getWeekNumber() { return weekNumber; }
    public String getLabel() { return label; }

    /** Provider postseason week (1-based) for this round. */
    public int getProviderWeek() {
        return weekNumber - (FIRST_PLAYOFF_WEEK - 1);
    }

    public static boolean isPlayoffWeek(int weekNumber) {
        return weekNumber >= FIRST_PLAYOFF_WEEK && weekNumber <= LAST_PLAYOFF_WEEK;
    }

    public static Optional<PlayoffRound> forWeek(int weekNumber) {
        for (PlayoffRound r : values()) {
            if (r.weekNumber == weekNumber) return Optional.of(r);
        }
        return Optional.empty();
    }
}
