package com.spreadpool.repository;

import com.spreadpool.model.PropBet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PropBetRepository extends JpaRepository<PropBet, Long> {
    List<PropBet> findByWeek_IdOrderByIdAsc(Long weekId);
    long countByWeek_Id(Long weekId);

    @Query("select pb from PropBet pb join fetch pb.week where pb.id = :id")
    Optional<PropBet> findWithWeekById(@Param("id") Long id);
}
