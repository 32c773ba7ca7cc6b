package com.spreadpool.repository;

import com.spreadpool.model.Reminder;
import com.spreadpool.model.ReminderKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface ReminderRepository extends JpaRepository<Reminder, Long> {

    boolean existsByParticipant_IdAndKindAndTargetKey(Long participantId, ReminderKind kind, String targetKey);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query(value = "insert into reminders (participant_id, kind, target_key, sent_at) " +
            "select p.id, :kind, :targetKey, :now from participants p where p.id = :participantId " +
            "and not exists (select 1 from reminders r where r.participant_id = :participantId and r.kind = :kind and r.target_key = :targetKey)",
            nativeQuery = true)
    int insertIfAbsent(@Param("participantId") Long participantId,
                       @Param("kind") String kind,
                       @Param("targetKey") String targetKey,
                       @Param("now") Instant now);
}
