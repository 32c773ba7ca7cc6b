package com.spreadpool.repository;

import com.spreadpool.model.Game;
import com.spreadpool.model.GameStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface GameRepository extends JpaRepository<Game, Long> {

    // Upsert key for provider records
    Optional<Game> findByExternalId(String externalId);

    List<Game> findByWeek_IdOrderByKickoffAsc(Long weekId);

    List<Game> findByWeek_IdAndStatusNotOrderByKickoffAsc(Long weekId, GameStatus status);

    List<Game> findByWeek_IdAndKickoffAfterOrderByKickoffAsc(Long weekId, Instant after);

    long countByWeek_Id(Long weekId);

    long countByWeek_IdAndStatusNot(Long weekId, GameStatus status);

    long countByWeek_IdAndSpreadPtsIsNull(Long weekId);

    @Query("select min(g.kickoff) from Game g where g.week.id = :weekId")
    Instant findFirstKickoff(@Param("weekId") Long weekId);

    // Weeks of a season whose earliest kickoff is still ahead of :now, soonest first
    @Query("select w.id from Game g join g.week w where w.seasonYear = :season group by w.id, w.weekNumber having min(g.kickoff) > :now order by w.weekNumber asc")
    List<Long> findWeekIdsStartingAfter(@Param("season") Integer season, @Param("now") Instant now);

    // Weeks of a season with a game that kicked off, is live or is final, latest first
    @Query("select distinct w.weekNumber from Game g join g.week w where w.seasonYear = :season and (g.status in :progressed or g.kickoff <= :now) order by w.weekNumber desc")
    List<Integer> findProgressedWeekNumbers(@Param("season") Integer season,
                                            @Param("progressed") Collection<GameStatus> progressed,
                                            @Param("now") Instant now);

    @Query("select distinct w.weekNumber from Game g join g.week w where w.seasonYear = :season and g.status <> com.spreadpool.model.GameStatus.FINAL order by w.weekNumber asc")
    List<Integer> findIncompleteWeekNumbers(@Param("season") Integer season);
}
