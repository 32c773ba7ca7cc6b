package com.spreadpool.repository;

import com.spreadpool.model.AdminAudit;
import com.spreadpool.model.AuditTarget;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AdminAuditRepository extends JpaRepository<AdminAudit, Long> {
    List<AdminAudit> findByTargetTypeAndTargetIdOrderByIdAsc(AuditTarget targetType, Long targetId);
}
