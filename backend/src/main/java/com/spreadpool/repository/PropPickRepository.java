package com.spreadpool.repository;

import com.spreadpool.model.PropPick;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PropPickRepository extends JpaRepository<PropPick, Long> {

    // Same contract as PickRepository.insertIfOpen, gated on the week's picks deadline
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query(value = "insert into prop_picks (participant_id, prop_bet_id, selection, created_at) " +
            "select :participantId, pb.id, :selection, :now from prop_bets pb join weeks w on w.id = pb.week_id " +
            "where pb.id = :propBetId and w.picks_deadline > :now " +
            "and not exists (select 1 from prop_picks pp where pp.participant_id = :participantId and pp.prop_bet_id = :propBetId)",
            nativeQuery = true)
    int insertIfOpen(@Param("participantId") Long participantId,
                     @Param("propBetId") Long propBetId,
                     @Param("selection") String selection,
                     @Param("now") Instant now);

    Optional<PropPick> findByParticipant_IdAndPropBet_Id(Long participantId, Long propBetId);

    @Query("select pp from PropPick pp join fetch pp.propBet pb join fetch pp.participant where pb.week.id = :weekId")
    List<PropPick> findByWeekId(@Param("weekId") Long weekId);

    @Query("select pp from PropPick pp join fetch pp.propBet pb join fetch pb.week w join fetch pp.participant where w.seasonYear = :season")
    List<PropPick> findBySeason(@Param("season") Integer season);

    @Query("select pp from PropPick pp join fetch pp.propBet pb join fetch pp.participant where pb.id in :ids")
    List<PropPick> findByPropBetIds(@Param("ids") Collection<Long> ids);
}
