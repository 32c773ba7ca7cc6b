package com.spreadpool.repository;

import com.spreadpool.model.Participant;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ParticipantRepository extends JpaRepository<Participant, Long> {
    Optional<Participant> findByExternalId(String externalId);
    List<Participant> findAllByOrderByExternalIdAsc();
}
