package com.spreadpool.repository;

import com.spreadpool.model.Pick;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PickRepository extends JpaRepository<Pick, Long> {

    /**
     * Inserts the pick only while the game has not kicked off, both teams are resolved and no
     * pick exists for the pair. Gate and write happen in one statement; returns rows inserted (0 or 1).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query(value = "insert into picks (participant_id, game_id, selected_team, overridden, created_at) " +
            "select :participantId, g.id, :team, false, :now from games g " +
            "where g.id = :gameId and g.kickoff > :now and g.unresolved_team = false " +
            "and not exists (select 1 from picks p where p.participant_id = :participantId and p.game_id = :gameId)",
            nativeQuery = true)
    int insertIfOpen(@Param("participantId") Long participantId,
                     @Param("gameId") Long gameId,
                     @Param("team") String team,
                     @Param("now") Instant now);

    Optional<Pick> findByParticipant_IdAndGame_Id(Long participantId, Long gameId);

    boolean existsByParticipant_IdAndGame_Id(Long participantId, Long gameId);

    long countByGame_Id(Long gameId);

    @Query("select p from Pick p join fetch p.participant where p.game.id = :gameId")
    List<Pick> findByGameIdWithParticipant(@Param("gameId") Long gameId);

    @Query("select p from Pick p join fetch p.game g join fetch p.participant where g.week.id = :weekId")
    List<Pick> findByWeekId(@Param("weekId") Long weekId);

    @Query("select p from Pick p join fetch p.game g join fetch g.week w join fetch p.participant where w.seasonYear = :season")
    List<Pick> findBySeason(@Param("season") Integer season);

    @Query("select p from Pick p where p.game.id = :gameId")
    List<Pick> findByGameId(@Param("gameId") Long gameId);

    @Modifying(flushAutomatically = true)
    @Transactional
    @Query("update Pick p set p.result = null where p.game.id = :gameId")
    int clearResultsForGame(@Param("gameId") Long gameId);
}
