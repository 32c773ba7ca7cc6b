package com.spreadpool.service;

import com.spreadpool.config.PoolSettings;
import com.spreadpool.model.GameStatus;
import com.spreadpool.model.PlayoffRound;
import com.spreadpool.model.Week;
import com.spreadpool.provider.WeekSelector;
import com.spreadpool.repository.GameRepository;
import com.spreadpool.repository.WeekRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/** Decides which week the jobs and queries target, always within the latest stored season. */
@Service
@Transactional(readOnly = true)
public class WeekCalendar {

    private final WeekRepository weekRepository;
    private final GameRepository gameRepository;
    private final PoolSettings settings;

    public WeekCalendar(WeekRepository weekRepository, GameRepository gameRepository, PoolSettings settings) {
        this.weekRepository = weekRepository;
        this.gameRepository = gameRepository;
        this.settings = settings;
    }

    /**
     * Next week of the latest season whose first kickoff is still ahead; otherwise the week after
     * the last stored one (rolling into week 1 of the next season after the final playoff round);
     * week 1 of the configured default season when nothing is stored.
     */
    public WeekSelector upcomingWeek(Instant now) {
        Integer season = weekRepository.findLatestSeasonYear();
        if (season == null) {
            return new WeekSelector(settings.getDefaultSeasonYear(), 1);
        }
        List<Long> future = gameRepository.findWeekIdsStartingAfter(season, now);
        if (!future.isEmpty()) {
            Week week = weekRepository.findById(future.get(0)).orElseThrow();
            return new WeekSelector(week.getSeasonYear(), week.getWeekNumber());
        }
        Integer max = weekRepository.findMaxWeekNumber(season);
        int next = max == null ? 1 : max + 1;
        if (next > PlayoffRound.LAST_PLAYOFF_WEEK) {
            return new WeekSelector(season + 1, 1);
        }
        return new WeekSelector(season, next);
    }

    /**
     * Highest week of the latest season with a game kicked off, in progress or final; otherwise
     * the lowest week still holding an unfinished game. Empty when no season is stored.
     */
    public Optional<Week> activeWeek(Instant now) {
        Integer season = weekRepository.findLatestSeasonYear();
        if (season == null) return Optional.empty();
        List<Integer> progressed = gameRepository.findProgressedWeekNumbers(season,
                EnumSet.of(GameStatus.IN_PROGRESS, GameStatus.FINAL), now);
        if (!progressed.isEmpty()) {
            return weekRepository.findBySeasonYearAndWeekNumber(season, progressed.get(0));
        }
        List<Integer> incomplete = gameRepository.findIncompleteWeekNumbers(season);
        if (!incomplete.isEmpty()) {
            return weekRepository.findBySeasonYearAndWeekNumber(season, incomplete.get(0));
        }
        return Optional.empty();
    }

    public Optional<Week> find(WeekSelector selector) {
        return weekRepository.findBySeasonYearAndWeekNumber(selector.seasonYear(), selector.weekNumber());
    }
}
