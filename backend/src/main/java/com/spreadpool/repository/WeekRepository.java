package com.spreadpool.repository;

import com.spreadpool.model.Week;
import com.spreadpool.model.WeekPhase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface WeekRepository extends JpaRepository<Week, Long> {

    Optional<Week> findBySeasonYearAndWeekNumber(Integer seasonYear, Integer weekNumber);

    List<Week> findBySeasonYearOrderByWeekNumberAsc(Integer seasonYear);

    List<Week> findByPhaseInOrderBySeasonYearAscWeekNumberAsc(Collection<WeekPhase> phases);

    @Query("select max(w.seasonYear) from Week w")
    Integer findLatestSeasonYear();

    @Query("select max(w.weekNumber) from Week w where w.seasonYear = ?1")
    Integer findMaxWeekNumber(Integer seasonYear);
}
